package com.example.regreport.model;

import lombok.*;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * Summary of one requested report run, kept in memory for the API
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class ReportRun {

    private String runId;

    private LocalDate reportDate;

    private String source;

    @Builder.Default
    private RunStatus status = RunStatus.RECEIVED;

    private String artifactPath;

    @Builder.Default
    private List<String> tableNames = List.of();

    @Builder.Default
    private Map<String, Integer> missingKeyCounts = Map.of();

    private String errorMessage;

    @Builder.Default
    private LocalDateTime requestedAt = LocalDateTime.now();

    private LocalDateTime completedAt;

    public enum RunStatus {
        RECEIVED,
        RUNNING,
        COMPLETED,
        MAPPING_GAP,
        FAILED
    }
}
