package com.openrangelabs.donpetre.issuesync.config;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * WebClient used for the Jira search API.
 *
 * <p>Authentication is left to the embedding application, which can register a
 * {@code WebClientCustomizer} adding its credentials filter.
 */
@Configuration
public class JiraClientConfig {

    @Bean
    @Qualifier("jiraWebClient")
    WebClient jiraWebClient(WebClient.Builder builder, SyncProperties properties) {
        int maxBytes = Math.max(1, properties.getJira().getMaxInMemoryMb()) * 1024 * 1024;
        ExchangeStrategies strategies = ExchangeStrategies.builder()
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(maxBytes))
                .build();
        return builder
                .baseUrl(properties.getJira().getBaseUrl())
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .exchangeStrategies(strategies)
                .build();
    }
}
