package com.example.regreport.model;

import lombok.Builder;

import java.util.List;

/**
 * Source snapshot after key derivation and mapping joins; input of reconciliation and aggregation.
 */
@Builder
public record ClassifiedSnapshot(
        ReportingPeriod period,
        List<ClassifiedEntry> entries,
        List<ClassifiedHolding> holdings,
        List<ClassifiedPosition> positions,
        List<ClassifiedAccount> accounts,
        MappingTables mappings
) {

    public ClassifiedSnapshot {
        entries = entries == null ? List.of() : List.copyOf(entries);
        holdings = holdings == null ? List.of() : List.copyOf(holdings);
        positions = positions == null ? List.of() : List.copyOf(positions);
        accounts = accounts == null ? List.of() : List.copyOf(accounts);
        mappings = mappings == null ? MappingTables.builder().build() : mappings;
    }
}
