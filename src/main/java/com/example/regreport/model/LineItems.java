package com.example.regreport.model;

import java.math.BigDecimal;

import static com.example.regreport.model.TransactionKind.*;

/**
 * Report line items of one category or tag, all derived from a single {@link WindowedSums}.
 */
public record LineItems(
        BigDecimal accountingValue,
        BigDecimal objectiveValue,
        BigDecimal revaluationEffect,
        BigDecimal revaluationReserve,
        BigDecimal fxDifference,
        BigDecimal amortization
) {

    public static final LineItems ZERO = from(new WindowedSums(null, null));

    public static LineItems from(WindowedSums sums) {
        BigDecimal revaluationEffect = sums.change(REVALUATION_RESERVE).add(sums.change(REVALUATION_EFFECT));

        BigDecimal objectiveValue = sums.status(ACCOUNTING_VALUE)
                .add(sums.change(ACCOUNTING_VALUE))
                .add(revaluationEffect)
                .add(sums.status(FX_DIFFERENCE))
                .add(sums.change(FX_DIFFERENCE))
                .add(sums.status(AMORTIZATION))
                .add(sums.change(AMORTIZATION));

        return new LineItems(
                sums.total(ACCOUNTING_VALUE),
                objectiveValue,
                revaluationEffect,
                sums.total(REVALUATION_RESERVE),
                sums.total(FX_DIFFERENCE),
                sums.total(AMORTIZATION)
        );
    }
}
