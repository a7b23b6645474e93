package com.ai.codesearch.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * HTTP client handles for the upstream services. Each handle is built once and
 * shared by every request; per-call timeouts are applied by the adapters.
 */
@Configuration
public class ClientConfig {

    private static final int MAX_IN_MEMORY_BYTES = 16 * 1024 * 1024;

    @Bean
    WebClient embeddingWebClient(CodeSearchProperties properties) {
        return WebClient.builder()
                .baseUrl(properties.getEmbedding().getBaseUrl())
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_BYTES))
                .build();
    }

    @Bean
    WebClient completionWebClient(CodeSearchProperties properties) {
        return WebClient.builder()
                .baseUrl(properties.getCompletion().getBaseUrl())
                .build();
    }

    /**
     * No base URL: raw-content fetches use absolute URLs derived from blob links.
     */
    @Bean
    WebClient rawContentWebClient() {
        return WebClient.builder()
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_BYTES))
                .build();
    }

    @Bean
    RestTemplate archiveRestTemplate(RestTemplateBuilder builder, CodeSearchProperties properties) {
        Duration timeout = properties.getGithub().getArchiveTimeout();
        return builder
                .setConnectTimeout(Duration.ofSeconds(10))
                .setReadTimeout(timeout)
                .build();
    }
}
