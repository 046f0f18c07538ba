package com.example.regreport.model;

import lombok.Builder;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * General-ledger export row. Amounts are as booked; the balance and delta
 * measures used by the aggregation are derived from them.
 */
@Builder
public record LedgerEntry(
        LocalDate bookingDate,
        String groupAccount,
        String securityType,
        String investments,
        String securityId,
        String ltSt,
        String purpose,
        BigDecimal debitAmountForeign,
        BigDecimal creditAmountForeign,
        BigDecimal debitAmountBase,
        BigDecimal creditAmountBase
) {

    /**
     * Debit minus credit in the original currency.
     */
    public BigDecimal balance() {
        return orZero(debitAmountForeign).subtract(orZero(creditAmountForeign));
    }

    /**
     * Period movement; carries the opposite sign of {@link #balance()}.
     */
    public BigDecimal delta() {
        return balance().negate();
    }

    private static BigDecimal orZero(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }
}
