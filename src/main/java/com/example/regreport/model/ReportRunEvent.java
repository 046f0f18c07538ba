package com.example.regreport.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Outcome message published once a run has finished
 */
@Builder
public record ReportRunEvent(

        @JsonProperty("run_id")
        String runId,

        @JsonProperty("report_date")
        LocalDate reportDate,

        @JsonProperty("status")
        ReportRun.RunStatus status,

        @JsonProperty("artifact")
        String artifactPath,

        @JsonProperty("tables")
        List<String> tableNames,

        @JsonProperty("missing_keys")
        Map<String, Integer> missingKeyCounts,

        @JsonProperty("error")
        String errorMessage,

        @JsonProperty("completed_at")
        Instant completedAt
) {
}
