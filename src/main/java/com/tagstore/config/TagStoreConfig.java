package com.tagstore.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Shared beans for the tag store
 */
@Configuration
public class TagStoreConfig {

    /**
     * Clock used to derive the default query window on every call
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
