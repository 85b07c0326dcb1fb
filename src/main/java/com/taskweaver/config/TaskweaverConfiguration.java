package com.taskweaver.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.taskweaver.core.model.DelegationConfig;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the delegation engine into a host application. The host must provide a
 * {@link com.taskweaver.core.host.Host} bean.
 */
@Configuration
@ComponentScan(basePackages = "com.taskweaver.core")
@EnableConfigurationProperties(TaskweaverProperties.class)
public class TaskweaverConfiguration {

    @Bean
    public DelegationConfig delegationConfig(TaskweaverProperties properties) {
        return properties.toDelegationConfig();
    }

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper objectMapper() {
        return new ObjectMapper().registerModule(new JavaTimeModule());
    }

    @Bean
    @ConditionalOnMissingBean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }
}
