package com.example.regreport.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Realized-profit classification of a ledger entry, independent of {@link TransactionKind}.
 */
public enum RealizedKind {

    ACCOUNTING_VALUE("Accounting value"),
    REALIZED_PROFIT_LOSS("Realized profit (loss)");

    private final String label;

    RealizedKind(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public static Optional<RealizedKind> fromLabel(String label) {
        if (label == null) {
            return Optional.empty();
        }
        String trimmed = label.trim();
        return Arrays.stream(values())
                .filter(kind -> kind.label.equals(trimmed))
                .findFirst();
    }
}
