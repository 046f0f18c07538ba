package com.example.regreport.model;

import lombok.Builder;

import java.util.Optional;

/**
 * Transaction-type mapping row, keyed on group account + security type + investments.
 * Decides whether a ledger entry counts as a status row, a change row, and which kinds it feeds.
 */
@Builder
public record TransactionTypeMapping(
        String key,
        String statusMapping,
        String changeMapping,
        String unrealizedKind,
        String realizedKind
) {

    public static final String STATUS = "Status";
    public static final String CHANGE = "Change";

    public boolean isStatusRow() {
        return statusMapping != null && STATUS.equalsIgnoreCase(statusMapping.trim());
    }

    public boolean isChangeRow() {
        return changeMapping != null && CHANGE.equalsIgnoreCase(changeMapping.trim());
    }

    public Optional<TransactionKind> transactionKind() {
        return TransactionKind.fromLabel(unrealizedKind);
    }

    public Optional<RealizedKind> realized() {
        return RealizedKind.fromLabel(realizedKind);
    }
}
