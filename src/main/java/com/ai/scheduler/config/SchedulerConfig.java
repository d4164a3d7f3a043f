package com.ai.scheduler.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(BusinessRulesProperties.class)
public class SchedulerConfig {

    @Bean
    public BusinessRules businessRules(BusinessRulesProperties properties) {
        return properties.toBusinessRules();
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
