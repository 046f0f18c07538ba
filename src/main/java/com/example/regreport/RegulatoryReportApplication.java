package com.example.regreport;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.kafka.annotation.EnableKafka;

@SpringBootApplication
@EnableKafka
public class RegulatoryReportApplication {

    public static final String REQUEST_TOPIC = "reports.requests";
    public static final String OUTCOME_TOPIC = "reports.outcomes";

    public static void main(String[] args) {
        SpringApplication.run(RegulatoryReportApplication.class, args);
    }
}
