package com.example.regreport.model;

import lombok.Builder;

/**
 * Security-level mapping row, keyed on security id + security type.
 */
@Builder
public record InvestmentMapping(
        String key,
        String tags,
        String ifrsClassification,
        String valuationMethod,
        String valuationMethodAlt,
        String fundingSource
) {
}
