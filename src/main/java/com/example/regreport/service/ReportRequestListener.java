package com.example.regreport.service;

import com.example.regreport.model.ReportRun;
import com.example.regreport.model.ReportRunRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.KafkaHeaders;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Service;

import static com.example.regreport.RegulatoryReportApplication.REQUEST_TOPIC;

/**
 * Consumes report run requests from Kafka and hands them to {@link ReportService}
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ReportRequestListener {

    private final ReportService reportService;

    /**
     * Invalid requests are logged and skipped; the offset is committed either way
     */
    @KafkaListener(topics = REQUEST_TOPIC, groupId = "${spring.kafka.consumer.group-id}")
    public void handleRunRequest(
            @Payload(required = false) ReportRunRequest request,
            @Header(KafkaHeaders.RECEIVED_TOPIC) String topic,
            @Header(KafkaHeaders.RECEIVED_PARTITION) int partition,
            @Header(KafkaHeaders.OFFSET) long offset) {

        if (request == null) {
            log.error("Received null run request due to deserialization error - Topic: {}, Partition: {}, Offset: {}",
                    topic, partition, offset);
            return;
        }

        log.info("Received run request from Kafka - Topic: {}, Partition: {}, Offset: {}, Report date: {}, Requested by: {}",
                topic, partition, offset, request.reportDate(), request.requestedBy());

        try {
            ReportRun run = reportService.submitRun(request.reportDate(), "KAFKA");
            reportService.executeRunAsync(run);
        } catch (IllegalArgumentException e) {
            log.error("Rejected run request - Report date: {}, Error: {}", request.reportDate(), e.getMessage());
        }
    }
}
