package com.kingsfoil.kingsfoil.ingest;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Enables binding of ingestion configuration properties and supplies the clock used for version timestamps.
 */
@Configuration
@EnableConfigurationProperties(IngestProperties.class)
public class IngestConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
