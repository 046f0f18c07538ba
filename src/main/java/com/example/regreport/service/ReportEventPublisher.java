package com.example.regreport.service;

import com.example.regreport.model.ReportRunEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.common.KafkaException;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;

import static com.example.regreport.RegulatoryReportApplication.OUTCOME_TOPIC;

/**
 * Publishes run outcomes to Kafka, keyed by run id.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ReportEventPublisher {

    private final KafkaTemplate<String, ReportRunEvent> kafkaTemplate;

    /**
     * Publish a run outcome. Send failures raised synchronously are retried.
     */
    @Retryable(retryFor = KafkaException.class, maxAttempts = 3, backoff = @Backoff(delay = 500, multiplier = 2))
    public CompletableFuture<SendResult<String, ReportRunEvent>> publish(ReportRunEvent event) {
        String key = event.runId();

        log.info("Publishing run outcome to Kafka topic: {} with key: {}", OUTCOME_TOPIC, key);

        CompletableFuture<SendResult<String, ReportRunEvent>> future = kafkaTemplate.send(OUTCOME_TOPIC, key, event);

        future.whenComplete((result, ex) -> {
            if (ex != null) {
                log.error("Failed to publish run outcome with key: {} to topic: {}. Error: {}",
                        key, OUTCOME_TOPIC, ex.getMessage());
            } else {
                log.info("Published run outcome with key: {} to topic: {} at offset: {}",
                        key, OUTCOME_TOPIC, result.getRecordMetadata().offset());
            }
        });

        return future;
    }
}
