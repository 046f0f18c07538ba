package com.example.regreport.model;

import lombok.Builder;

import java.math.BigDecimal;

/**
 * Closing balance of a general-ledger account summed over all postings up to the report date.
 */
@Builder
public record AccountBalance(
        String accountNo,
        String accountNo2,
        String accountName,
        BigDecimal balance
) {
}
