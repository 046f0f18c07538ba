package com.example.regreport.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(ReportProperties.class)
public class ReportConfig {

    /**
     * Source of "today" for the default report date
     */
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
