package com.repclub.importer.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ImportConfig {

    /**
     * Clock used to stamp updated_at on merged records
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
