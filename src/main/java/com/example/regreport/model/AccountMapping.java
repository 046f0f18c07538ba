package com.example.regreport.model;

import lombok.Builder;

/**
 * Ledger-account mapping row, keyed on account no + secondary no + account name.
 */
@Builder
public record AccountMapping(
        String key,
        RegulatoryAttributes attributes,
        InstrumentDetails details
) {
}
