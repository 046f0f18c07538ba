package com.example.regreport.model;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of checking all key spaces. Passes only when no key space has a gap.
 */
public record ReconciliationResult(List<MappingGap> gaps) {

    public ReconciliationResult {
        gaps = List.copyOf(gaps);
    }

    public boolean passed() {
        return gaps.isEmpty();
    }

    public Optional<MappingGap> gap(KeySpace keySpace) {
        return gaps.stream().filter(gap -> gap.keySpace() == keySpace).findFirst();
    }

    public List<ReportTable> gapTables() {
        return gaps.stream().map(MappingGap::rows).toList();
    }
}
