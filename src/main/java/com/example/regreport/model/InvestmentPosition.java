package com.example.regreport.model;

import lombok.Builder;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One row of the list of investment positions as of the report date.
 * Amounts suffixed {@code Qc} are in quotation currency, {@code Pc} in portfolio currency.
 */
@Builder
public record InvestmentPosition(
        LocalDate reportDate,
        String securityId,
        String investmentType,
        String ltSt,
        String ifrsGroup,
        String investmentName,
        String isin,
        BigDecimal nominalValueOfLot,
        BigDecimal numberOfLots,
        String quotationCurrency,
        BigDecimal acquisitionValueQc,
        BigDecimal acquisitionValuePc,
        BigDecimal bookValueQc,
        BigDecimal bookValuePc,
        BigDecimal accruedInterestQc,
        BigDecimal accruedInterestPc,
        BigDecimal couponRate,
        BigDecimal effectiveInterestRate,
        BigDecimal couponFrequency,
        LocalDate purchaseDate,
        LocalDate maturityDate,
        String issuerRating,
        String issuerRatingAgency,
        BigDecimal dirtyMarketValueQc,
        BigDecimal dirtyMarketValuePc
) {

    /**
     * Book value plus accrued interest in portfolio currency.
     */
    public BigDecimal accountingValue() {
        return add(bookValuePc, accruedInterestPc);
    }

    public BigDecimal accountingValueInQuotationCurrency() {
        return add(bookValueQc, accruedInterestQc);
    }

    private static BigDecimal add(BigDecimal left, BigDecimal right) {
        if (left == null || right == null) {
            return null;
        }
        return left.add(right);
    }
}
