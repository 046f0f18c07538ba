package com.example.regreport.model;

import java.util.List;
import java.util.Optional;

/**
 * Result of one pipeline run: either the report tables or, when mappings are incomplete, the gap tables.
 */
public record PipelineResult(ReportingPeriod period, Outcome outcome, List<ReportTable> tables) {

    public enum Outcome {
        SUCCESS,
        MAPPING_GAP
    }

    public PipelineResult {
        tables = List.copyOf(tables);
    }

    public static PipelineResult success(ReportingPeriod period, List<ReportTable> reportTables) {
        return new PipelineResult(period, Outcome.SUCCESS, reportTables);
    }

    public static PipelineResult mappingGap(ReportingPeriod period, List<ReportTable> gapTables) {
        return new PipelineResult(period, Outcome.MAPPING_GAP, gapTables);
    }

    public boolean isSuccess() {
        return outcome == Outcome.SUCCESS;
    }

    public Optional<ReportTable> table(String name) {
        return tables.stream().filter(table -> table.getName().equals(name)).findFirst();
    }

    public List<String> tableNames() {
        return tables.stream().map(ReportTable::getName).toList();
    }
}
