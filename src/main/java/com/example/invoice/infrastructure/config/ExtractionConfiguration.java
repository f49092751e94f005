package com.example.invoice.infrastructure.config;

import com.example.invoice.domain.matcher.PatternCatalog;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Provides the extraction engine's collaborators: the matcher catalog and the UTC clock stamping each record.
 */
@Configuration
public class ExtractionConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public PatternCatalog patternCatalog() {
        return PatternCatalog.standard();
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
