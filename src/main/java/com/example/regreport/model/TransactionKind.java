package com.example.regreport.model;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Unrealized-profit transaction kinds a ledger entry can be classified into
 * by the transaction-type mapping table.
 */
public enum TransactionKind {

    ACCOUNTING_VALUE("01 Total acquisition cost/accounting value"),
    REVALUATION_EFFECT("03 Revaluation effect"),
    REVALUATION_RESERVE("04 Revaluation reserve (status)"),
    FX_DIFFERENCE("06 Net exchange rate difference"),
    AMORTIZATION("07 Amortization of discount/premium on fixed-maturity instruments");

    private final String label;

    TransactionKind(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public static List<TransactionKind> ordered() {
        return List.of(values());
    }

    public static Optional<TransactionKind> fromLabel(String label) {
        if (label == null) {
            return Optional.empty();
        }
        String trimmed = label.trim();
        return Arrays.stream(values())
                .filter(kind -> kind.label.equals(trimmed))
                .findFirst();
    }
}
