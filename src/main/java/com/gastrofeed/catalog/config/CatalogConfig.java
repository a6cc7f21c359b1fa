package com.gastrofeed.catalog.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class CatalogConfig {

    /** Source of the {@code lastUpdated} stamps and report timestamps. */
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
