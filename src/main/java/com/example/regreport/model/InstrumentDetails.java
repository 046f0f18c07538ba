package com.example.regreport.model;

import lombok.Builder;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Instrument facts that positions carry themselves but accounts only get from their mapping row.
 */
@Builder
public record InstrumentDetails(
        String isin,
        BigDecimal quantity,
        BigDecimal accruedInterest,
        BigDecimal amortizedExpenses,
        String currency,
        BigDecimal couponFrequency,
        BigDecimal interestRate,
        BigDecimal effectiveInterestRate,
        LocalDate investmentDate,
        LocalDate maturityDate,
        String rating,
        String ratingAgency
) {

    public static final InstrumentDetails EMPTY = InstrumentDetails.builder().build();
}
