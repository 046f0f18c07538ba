package com.example.regreport.controller;

import com.example.regreport.model.MappingImportResult;
import com.example.regreport.model.ReportRun;
import com.example.regreport.service.MappingImportService;
import com.example.regreport.service.ReportService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.FilterType;
import org.springframework.context.annotation.Primary;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.test.web.reactive.server.WebTestClient;
import org.springframework.web.reactive.function.BodyInserters;
import reactor.core.publisher.Flux;

import java.io.InputStream;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@WebFluxTest(
    controllers = ReportController.class,
    excludeAutoConfiguration = {
        org.springframework.boot.autoconfigure.security.reactive.ReactiveSecurityAutoConfiguration.class
    },
    excludeFilters = @ComponentScan.Filter(type = FilterType.REGEX, pattern = "com.example.regreport.security.*")
)
@ExtendWith(MockitoExtension.class)
class ReportControllerTest {

    @TestConfiguration
    static class TestConfig {
        @Bean
        @Primary
        public ReportService reportService() {
            return org.mockito.Mockito.mock(ReportService.class);
        }

        @Bean
        @Primary
        public MappingImportService mappingImportService() {
            return org.mockito.Mockito.mock(MappingImportService.class);
        }
    }

    @Autowired
    private WebTestClient webTestClient;

    @Autowired
    private ReportService reportService;

    @Autowired
    private MappingImportService mappingImportService;

    private ReportRun sampleRun;

    @BeforeEach
    void setUp() {
        org.mockito.Mockito.reset(reportService, mappingImportService);

        sampleRun = ReportRun.builder()
                .runId("RUN-1-1")
                .reportDate(LocalDate.of(2025, 9, 30))
                .source("API")
                .requestedAt(LocalDateTime.of(2025, 10, 18, 9, 30))
                .build();
    }

    @Test
    void shouldAcceptRunRequest() {
        when(reportService.submitRun(LocalDate.of(2025, 9, 30), "API")).thenReturn(sampleRun);

        webTestClient.post()
                .uri("/api/v1/reports/runs?reportDate=2025-09-30")
                .exchange()
                .expectStatus().isAccepted()
                .expectBody()
                .jsonPath("$.runId").isEqualTo("RUN-1-1")
                .jsonPath("$.status").isEqualTo("RECEIVED")
                .jsonPath("$.reportDate").isEqualTo("2025-09-30");

        verify(reportService).executeRunAsync(sampleRun);
    }

    @Test
    void shouldUseDefaultDateWhenNoneGiven() {
        when(reportService.submitRun(isNull(), eq("API"))).thenReturn(sampleRun);

        webTestClient.post()
                .uri("/api/v1/reports/runs")
                .exchange()
                .expectStatus().isAccepted();
    }

    @Test
    void shouldRejectNonQuarterEndDate() {
        when(reportService.submitRun(LocalDate.of(2025, 9, 15), "API"))
                .thenThrow(new IllegalArgumentException("Report date must be a quarter end: 2025-09-15"));

        webTestClient.post()
                .uri("/api/v1/reports/runs?reportDate=2025-09-15")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.success").isEqualTo(false)
                .jsonPath("$.errorCode").isEqualTo("VALIDATION_ERROR");

        verify(reportService, never()).executeRunAsync(any());
    }

    @Test
    void shouldGetRunById() {
        when(reportService.getRunById("RUN-1-1")).thenReturn(Optional.of(sampleRun));

        webTestClient.get()
                .uri("/api/v1/reports/runs/RUN-1-1")
                .exchange()
                .expectStatus().isOk()
                .expectBody(ReportRun.class)
                .isEqualTo(sampleRun);
    }

    @Test
    void shouldReturnNotFoundForUnknownRun() {
        when(reportService.getRunById("NON-EXISTENT")).thenReturn(Optional.empty());

        webTestClient.get()
                .uri("/api/v1/reports/runs/NON-EXISTENT")
                .exchange()
                .expectStatus().isNotFound();
    }

    @Test
    void shouldStreamRunsWithStatusFilter() {
        when(reportService.getAllRuns(ReportRun.RunStatus.RECEIVED)).thenReturn(Flux.just(sampleRun));

        webTestClient.get()
                .uri("/api/v1/reports/runs?status=RECEIVED")
                .exchange()
                .expectStatus().isOk()
                .expectHeader().contentTypeCompatibleWith(MediaType.APPLICATION_NDJSON)
                .expectBodyList(ReportRun.class)
                .contains(sampleRun);
    }

    @Test
    void shouldImportMappingWorkbook() {
        when(mappingImportService.importWorkbook(any(InputStream.class)))
                .thenReturn(new MappingImportResult(Map.of("Missing Investment Types", 2), Map.of("Missing Investment Types", 1)));

        MultipartBodyBuilder body = new MultipartBodyBuilder();
        body.part("file", new ByteArrayResource(new byte[]{1, 2, 3}) {
            @Override
            public String getFilename() {
                return "insert_mapping.xlsx";
            }
        });

        webTestClient.post()
                .uri("/api/v1/reports/mappings/import")
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .body(BodyInserters.fromMultipartData(body.build()))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.appended['Missing Investment Types']").isEqualTo(2)
                .jsonPath("$.skipped['Missing Investment Types']").isEqualTo(1);
    }

    @Test
    void shouldRejectWorkbookWithBlankKeys() {
        when(mappingImportService.importWorkbook(any(InputStream.class)))
                .thenThrow(new IllegalArgumentException("Sheet 'Missing Account Mapping' contains a row with a blank KEY"));

        MultipartBodyBuilder body = new MultipartBodyBuilder();
        body.part("file", new ByteArrayResource(new byte[]{1}) {
            @Override
            public String getFilename() {
                return "insert_mapping.xlsx";
            }
        });

        webTestClient.post()
                .uri("/api/v1/reports/mappings/import")
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .body(BodyInserters.fromMultipartData(body.build()))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.errorCode").isEqualTo("VALIDATION_ERROR")
                .jsonPath("$.error").value(org.hamcrest.Matchers.containsString("blank KEY"));
    }

    @Test
    void shouldReturnHealthCheck() {
        webTestClient.get()
                .uri("/api/v1/reports/health")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("UP")
                .jsonPath("$.service").isEqualTo("regulatory-report-service");
    }
}
