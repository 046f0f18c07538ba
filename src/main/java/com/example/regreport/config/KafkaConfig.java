package com.example.regreport.config;

import com.example.regreport.model.ReportRunEvent;
import com.example.regreport.model.ReportRunRequest;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.admin.AdminClientConfig;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.ConcurrentKafkaListenerContainerFactory;
import org.springframework.kafka.config.TopicBuilder;
import org.springframework.kafka.core.*;
import org.springframework.kafka.support.serializer.ErrorHandlingDeserializer;
import org.springframework.kafka.support.serializer.JsonDeserializer;
import org.springframework.kafka.support.serializer.JsonSerializer;

import java.util.HashMap;
import java.util.Map;

import static com.example.regreport.RegulatoryReportApplication.OUTCOME_TOPIC;
import static com.example.regreport.RegulatoryReportApplication.REQUEST_TOPIC;

@Slf4j
@Configuration
public class KafkaConfig {

    @Value("${spring.kafka.bootstrap-servers}")
    private String bootstrapServers;

    @Value("${spring.kafka.consumer.group-id}")
    private String groupId;

    @Value("${spring.kafka.consumer.auto-offset-reset:latest}")
    private String autoOffsetReset;

    /**
     * Kafka Admin configuration for topic creation
     */
    @Bean
    public KafkaAdmin kafkaAdmin() {
        Map<String, Object> configs = new HashMap<>();
        configs.put(AdminClientConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);

        return new KafkaAdmin(configs);
    }

    /**
     * Inbound topic carrying report run requests
     */
    @Bean
    public NewTopic requestTopic() {
        return TopicBuilder.name(REQUEST_TOPIC)
                .partitions(1)
                .replicas(1)
                .build();
    }

    /**
     * Outbound topic carrying run outcomes, compacted per run id
     */
    @Bean
    public NewTopic outcomeTopic() {
        return TopicBuilder.name(OUTCOME_TOPIC)
                .partitions(3)
                .replicas(1)
                .compact()
                .build();
    }

    /**
     * Producer factory configured with the application ObjectMapper for ISO date serialization
     */
    @Bean
    public ProducerFactory<String, ReportRunEvent> producerFactory(ObjectMapper objectMapper) {
        Map<String, Object> configProps = new HashMap<>();
        configProps.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);

        JsonSerializer<ReportRunEvent> jsonSerializer = new JsonSerializer<>(objectMapper);
        jsonSerializer.setAddTypeInfo(false);

        return new DefaultKafkaProducerFactory<>(configProps, new StringSerializer(), jsonSerializer);
    }

    @Bean
    public KafkaTemplate<String, ReportRunEvent> kafkaTemplate(ProducerFactory<String, ReportRunEvent> producerFactory) {
        return new KafkaTemplate<>(producerFactory);
    }

    /**
     * Consumer factory for run requests; undecodable payloads arrive as null instead of failing the container
     */
    @Bean
    public ConsumerFactory<String, ReportRunRequest> consumerFactory(ObjectMapper objectMapper) {
        Map<String, Object> configProps = new HashMap<>();
        configProps.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        configProps.put(ConsumerConfig.GROUP_ID_CONFIG, groupId);
        configProps.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, autoOffsetReset);

        JsonDeserializer<ReportRunRequest> jsonDeserializer = new JsonDeserializer<>(ReportRunRequest.class, objectMapper);
        jsonDeserializer.ignoreTypeHeaders();

        return new DefaultKafkaConsumerFactory<>(configProps, new StringDeserializer(),
                new ErrorHandlingDeserializer<>(jsonDeserializer));
    }

    @Bean
    public ConcurrentKafkaListenerContainerFactory<String, ReportRunRequest> kafkaListenerContainerFactory(
            ConsumerFactory<String, ReportRunRequest> consumerFactory) {
        ConcurrentKafkaListenerContainerFactory<String, ReportRunRequest> factory =
                new ConcurrentKafkaListenerContainerFactory<>();
        factory.setConsumerFactory(consumerFactory);

        log.debug("Kafka listener container factory configured for {}", REQUEST_TOPIC);
        return factory;
    }
}
