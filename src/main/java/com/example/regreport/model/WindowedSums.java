package com.example.regreport.model;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Status and change sums per transaction kind for one category or tag.
 * Every kind is present; a kind without matching rows holds zero.
 */
public record WindowedSums(
        Map<TransactionKind, BigDecimal> status,
        Map<TransactionKind, BigDecimal> change
) {

    public WindowedSums {
        status = complete(status);
        change = complete(change);
    }

    public BigDecimal status(TransactionKind kind) {
        return status.get(kind);
    }

    public BigDecimal change(TransactionKind kind) {
        return change.get(kind);
    }

    public BigDecimal total(TransactionKind kind) {
        return status(kind).add(change(kind));
    }

    private static Map<TransactionKind, BigDecimal> complete(Map<TransactionKind, BigDecimal> source) {
        Map<TransactionKind, BigDecimal> values = new EnumMap<>(TransactionKind.class);
        for (TransactionKind kind : TransactionKind.values()) {
            BigDecimal value = source == null ? null : source.get(kind);
            values.put(kind, value == null ? BigDecimal.ZERO : value);
        }
        return Collections.unmodifiableMap(values);
    }
}
