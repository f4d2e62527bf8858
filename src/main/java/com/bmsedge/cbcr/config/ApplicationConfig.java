package com.bmsedge.cbcr.config;

import com.bmsedge.cbcr.service.EntityIdentifierGenerator;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.UUID;

@Configuration
@EnableConfigurationProperties(ConverterProperties.class)
public class ApplicationConfig {

    /**
     * Fresh entity identifier per rendered document, never persisted
     */
    @Bean
    public EntityIdentifierGenerator entityIdentifierGenerator() {
        return () -> "entity_" + UUID.randomUUID().toString().replace("-", "").substring(0, 8);
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
