package com.example.regreport.model;

import lombok.Builder;

/**
 * Descriptive attributes attached to a tag row of the detailed reports.
 */
@Builder
public record TagAttributes(
        String ifrsClassification,
        String valuationMethod,
        String valuationMethodAlt,
        String fundingSource
) {

    public static final TagAttributes EMPTY = TagAttributes.builder().build();

    public static TagAttributes of(InvestmentMapping mapping) {
        if (mapping == null) {
            return EMPTY;
        }
        return new TagAttributes(mapping.ifrsClassification(), mapping.valuationMethod(),
                mapping.valuationMethodAlt(), mapping.fundingSource());
    }
}
