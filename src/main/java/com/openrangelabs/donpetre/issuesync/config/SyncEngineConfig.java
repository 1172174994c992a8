package com.openrangelabs.donpetre.issuesync.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Core beans of the sync engine
 */
@Configuration
@EnableConfigurationProperties(SyncProperties.class)
public class SyncEngineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
