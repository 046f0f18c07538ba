package com.example.regreport.model;

import lombok.Builder;

import java.util.List;

/**
 * Everything one run reads from its sources, frozen at load time.
 */
@Builder
public record SourceSnapshot(
        ReportingPeriod period,
        List<LedgerEntry> ledgerEntries,
        List<Holding> holdings,
        List<InvestmentPosition> positions,
        List<AccountBalance> accountBalances,
        MappingTables mappings
) {

    public SourceSnapshot {
        ledgerEntries = ledgerEntries == null ? List.of() : List.copyOf(ledgerEntries);
        holdings = holdings == null ? List.of() : List.copyOf(holdings);
        positions = positions == null ? List.of() : List.copyOf(positions);
        accountBalances = accountBalances == null ? List.of() : List.copyOf(accountBalances);
        mappings = mappings == null ? MappingTables.builder().build() : mappings;
    }
}
