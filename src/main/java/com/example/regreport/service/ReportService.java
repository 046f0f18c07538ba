package com.example.regreport.service;

import com.example.regreport.artifact.WorkbookWriter;
import com.example.regreport.config.ReportProperties;
import com.example.regreport.model.*;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;

import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

import static com.example.regreport.model.MappingColumns.KEY;

/**
 * Drives report runs: runs the pipeline, writes the artifact, keeps run summaries
 * in memory and publishes the outcome of every run.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReportService {

    private final ReportPipeline pipeline;
    private final WorkbookWriter workbookWriter;
    private final ReportEventPublisher eventPublisher;
    private final QuarterEndPolicy quarterEndPolicy;
    private final ReportProperties properties;

    /**
     * In-memory run summaries
     */
    private final Map<String, ReportRun> runStorage = new ConcurrentHashMap<>();

    private final AtomicLong runIdCounter = new AtomicLong(1);

    /**
     * Register a run. A null report date means the default quarter end; anything else must be a quarter end.
     */
    public ReportRun submitRun(LocalDate reportDate, String source) {
        LocalDate date = reportDate != null ? reportDate : quarterEndPolicy.defaultReportDate();
        ReportingPeriod.of(date);

        ReportRun run = ReportRun.builder()
                .runId(generateRunId())
                .reportDate(date)
                .source(source)
                .status(ReportRun.RunStatus.RECEIVED)
                .build();
        runStorage.put(run.getRunId(), run);

        log.info("Registered report run {} for {} from {}", run.getRunId(), date, source);
        return run;
    }

    /**
     * Execute a registered run on the async executor (API and Kafka triggers)
     */
    @Async
    public void executeRunAsync(ReportRun run) {
        execute(run);
    }

    /**
     * Execute a registered run on the calling thread. Failures end up in the run summary and the outcome event.
     */
    public ReportRun execute(ReportRun run) {
        run.setStatus(ReportRun.RunStatus.RUNNING);
        updateRun(run);

        try {
            ReportingPeriod period = ReportingPeriod.of(run.getReportDate());
            PipelineResult result = pipeline.run(period);

            String fileName = result.isSuccess()
                    ? String.format(properties.getOutput().getReportFilePattern(), period.reportDate())
                    : properties.getOutput().getGapFileName();
            Path artifact = workbookWriter.write(fileName, result.tables(), period.reportDate());

            run.setArtifactPath(artifact.toString());
            run.setTableNames(result.tableNames());
            if (result.isSuccess()) {
                run.setStatus(ReportRun.RunStatus.COMPLETED);
            } else {
                run.setStatus(ReportRun.RunStatus.MAPPING_GAP);
                run.setMissingKeyCounts(missingKeyCounts(result.tables()));
            }
            log.info("Report run {} finished with status {}: {}", run.getRunId(), run.getStatus(), artifact);
        } catch (RuntimeException e) {
            log.error("Report run {} for {} failed: {}", run.getRunId(), run.getReportDate(), e.getMessage(), e);
            run.setStatus(ReportRun.RunStatus.FAILED);
            run.setErrorMessage(e.getMessage());
        }

        run.setCompletedAt(LocalDateTime.now());
        updateRun(run);
        publishOutcome(run);
        return run;
    }

    private Map<String, Integer> missingKeyCounts(List<ReportTable> gapTables) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (ReportTable table : gapTables) {
            counts.put(table.getName(), new HashSet<>(table.column(KEY)).size());
        }
        return counts;
    }

    private void publishOutcome(ReportRun run) {
        ReportRunEvent event = ReportRunEvent.builder()
                .runId(run.getRunId())
                .reportDate(run.getReportDate())
                .status(run.getStatus())
                .artifactPath(run.getArtifactPath())
                .tableNames(run.getTableNames())
                .missingKeyCounts(run.getMissingKeyCounts())
                .errorMessage(run.getErrorMessage())
                .completedAt(run.getCompletedAt().atZone(ZoneId.systemDefault()).toInstant())
                .build();

        try {
            eventPublisher.publish(event);
        } catch (RuntimeException e) {
            // the run summary stays available through the API
            log.error("Could not publish outcome of run {}: {}", run.getRunId(), e.getMessage());
        }
    }

    private String generateRunId() {
        return "RUN-" + System.currentTimeMillis() + "-" + runIdCounter.getAndIncrement();
    }

    private void updateRun(ReportRun run) {
        runStorage.put(run.getRunId(), run);
        log.debug("Updated run {} to {}", run.getRunId(), run.getStatus());
    }

    /**
     * Get all runs with optional status filter, most recent request first
     */
    public Flux<ReportRun> getAllRuns(ReportRun.RunStatus status) {
        List<ReportRun> runs = runStorage.values().stream()
                .filter(run -> status == null || run.getStatus() == status)
                .sorted(Comparator.comparing(ReportRun::getRequestedAt).reversed())
                .collect(Collectors.toList());
        return Flux.fromIterable(runs);
    }

    public Optional<ReportRun> getRunById(String runId) {
        return Optional.ofNullable(runStorage.get(runId));
    }

    public void clearAllRuns() {
        runStorage.clear();
        log.info("Cleared all report runs from memory");
    }
}
