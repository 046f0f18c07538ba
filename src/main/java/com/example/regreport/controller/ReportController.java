package com.example.regreport.controller;

import com.example.regreport.model.MappingImportResult;
import com.example.regreport.model.ReportRun;
import com.example.regreport.service.MappingImportService;
import com.example.regreport.service.ReportService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.codec.multipart.FilePart;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.InputStream;
import java.time.LocalDate;
import java.util.Map;

/**
 * REST Controller for report runs and mapping maintenance
 */
@RestController
@RequestMapping("/api/v1/reports")
@Slf4j
@RequiredArgsConstructor
@Validated
@Tag(name = "Regulatory Reports", description = "Quarterly investment report runs and mapping import")
public class ReportController {

    private final ReportService reportService;
    private final MappingImportService mappingImportService;

    /**
     * Request a report run; the run executes in the background
     */
    @PostMapping("/runs")
    @ResponseStatus(HttpStatus.ACCEPTED)
    @Operation(
            summary = "Start a report run",
            description = "Registers a run for the given quarter-end date (default: the last completed quarter) " +
                    "and executes it asynchronously. Poll the run or consume the outcome topic for the result."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "202", description = "Run accepted"),
            @ApiResponse(responseCode = "400", description = "Report date is not a quarter end")
    })
    public Mono<ReportRun> startRun(
            @Parameter(description = "Quarter-end report date, ISO format (optional)")
            @RequestParam(value = "reportDate", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate reportDate) {

        log.info("Received report run request for {}", reportDate != null ? reportDate : "default quarter end");

        return Mono.fromCallable(() -> reportService.submitRun(reportDate, "API"))
                .doOnNext(reportService::executeRunAsync);
    }

    @GetMapping("/runs/{runId}")
    @Operation(summary = "Get run by ID", description = "Retrieve the summary of a report run")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Run found"),
            @ApiResponse(responseCode = "404", description = "Run not found")
    })
    public Mono<ReportRun> getRunById(
            @Parameter(description = "Run ID")
            @PathVariable String runId) {

        log.debug("Getting run by ID: {}", runId);

        return Mono.justOrEmpty(reportService.getRunById(runId))
                .switchIfEmpty(Mono.error(new ResponseStatusException(HttpStatus.NOT_FOUND, "Run not found")));
    }

    /**
     * Streams runs as newline-delimited JSON
     */
    @GetMapping(value = "/runs", produces = MediaType.APPLICATION_NDJSON_VALUE)
    @Operation(summary = "Stream runs with optional status filter", description = "Retrieve all runs as NDJSON stream")
    @ApiResponse(responseCode = "200", description = "Runs streaming successfully")
    public Flux<ReportRun> getAllRuns(
            @Parameter(description = "Filter by run status (optional)")
            @RequestParam(value = "status", required = false) ReportRun.RunStatus status) {

        log.info("Getting all runs with status filter: {}", status);

        return reportService.getAllRuns(status);
    }

    /**
     * Import a filled-in gap workbook into the mapping tables
     */
    @PostMapping(value = "/mappings/import", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(
            summary = "Import completed mapping rows",
            description = "Upload the gap workbook after filling in the attribute columns. " +
                    "Each sheet is appended to the mapping table it was generated for; keys already mapped are skipped."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Workbook imported"),
            @ApiResponse(responseCode = "400", description = "Workbook contains rows without key"),
            @ApiResponse(responseCode = "500", description = "Internal server error")
    })
    public Mono<MappingImportResult> importMappings(
            @Parameter(description = "Completed gap workbook (xlsx)")
            @RequestPart("file") @NotNull Mono<FilePart> filePartMono) {

        return filePartMono.flatMap(filePart -> {
            log.info("Received mapping workbook upload: {}", filePart.filename());

            return DataBufferUtils.join(filePart.content())
                    .flatMap(buffer -> Mono.fromCallable(() -> {
                                try (InputStream input = buffer.asInputStream(true)) {
                                    return mappingImportService.importWorkbook(input);
                                }
                            })
                            .subscribeOn(Schedulers.boundedElastic()))
                    .doOnNext(result -> log.info("Imported {} mapping row(s) from {}",
                            result.totalAppended(), filePart.filename()));
        });
    }

    @GetMapping("/health")
    @Operation(summary = "Health check", description = "Check if the report service is up")
    @ApiResponse(responseCode = "200", description = "Service is healthy")
    public Mono<Map<String, Object>> healthCheck() {
        return Mono.just(Map.of(
                "status", "UP",
                "service", "regulatory-report-service",
                "timestamp", System.currentTimeMillis()
        ));
    }
}
