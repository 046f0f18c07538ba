package com.example.regreport.model;

import lombok.Builder;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Optional;

/**
 * Ledger entry with its derived keys and the mapping rows those keys resolved to.
 * Mapping fields are null when the key is not covered.
 */
@Builder
public record ClassifiedEntry(
        LedgerEntry entry,
        String transactionTypeKey,
        String investmentTypeKey,
        String investmentKey,
        TransactionTypeMapping transactionType,
        InvestmentCategory category,
        InvestmentMapping investment
) {

    public LocalDate bookingDate() {
        return entry.bookingDate();
    }

    public BigDecimal balance() {
        return entry.balance();
    }

    public BigDecimal delta() {
        return entry.delta();
    }

    public String tag() {
        return investment == null ? null : investment.tags();
    }

    public boolean isStatusRow() {
        return transactionType != null && transactionType.isStatusRow();
    }

    public boolean isChangeRow() {
        return transactionType != null && transactionType.isChangeRow();
    }

    public Optional<TransactionKind> transactionKind() {
        return transactionType == null ? Optional.empty() : transactionType.transactionKind();
    }

    public Optional<RealizedKind> realizedKind() {
        return transactionType == null ? Optional.empty() : transactionType.realized();
    }

    public boolean matches(InvestmentCategory expected) {
        return category == expected;
    }
}
