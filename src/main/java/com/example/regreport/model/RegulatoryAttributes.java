package com.example.regreport.model;

import lombok.Builder;

/**
 * Descriptive attributes the supervisory lookup tables carry per instrument or account.
 */
@Builder
public record RegulatoryAttributes(
        String fundingSource,
        String employeesInBs,
        String companyType,
        String companySubtype,
        String guarantee,
        String issuerName,
        String issuerNameIfDifferent,
        String sector,
        String ownership,
        String ifrsClassification,
        String valuationMethod,
        String issuerCountry,
        String tradingCountry,
        String regulatedMarket,
        String valuationSource,
        String couponType
) {

    public static final RegulatoryAttributes EMPTY = RegulatoryAttributes.builder().build();

    public boolean hasFundingSource() {
        return fundingSource != null && !fundingSource.isBlank();
    }
}
