package com.ai.codesearch.api;

import com.ai.codesearch.config.CodeSearchProperties;
import com.ai.codesearch.exception.HydrationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Duration;

/**
 * Fetches the full text of a file from its blob link via the raw-content host.
 */
@Component
public class GithubRawContentClient {

    private static final Logger log = LoggerFactory.getLogger(GithubRawContentClient.class);

    private final WebClient webClient;
    private final String rawBaseUrl;
    private final Duration timeout;

    @Autowired
    public GithubRawContentClient(
            @Qualifier("rawContentWebClient") WebClient webClient,
            CodeSearchProperties properties) {
        this(webClient, properties.getGithub().getRawBaseUrl(), properties.getGithub().getRawTimeout());
    }

    GithubRawContentClient(WebClient webClient, String rawBaseUrl, Duration timeout) {
        this.webClient = webClient;
        this.rawBaseUrl = rawBaseUrl;
        this.timeout = timeout;
    }

    /**
     * Emits the raw file text, or a {@link HydrationException} for a non-2xx
     * status, a transport failure or a timeout.
     */
    public Mono<String> fetch(String blobUrl) {
        String rawUrl = GithubUrls.toRawUrl(blobUrl, rawBaseUrl);
        log.debug("[GithubRawContentClient] Fetching raw content from: {}", rawUrl);

        URI uri;
        try {
            // already encoded, must not be expanded as a template
            uri = URI.create(rawUrl);
        } catch (IllegalArgumentException e) {
            return Mono.error(new HydrationException(rawUrl, "Invalid URL " + rawUrl, e));
        }

        return webClient.get()
                .uri(uri)
                .retrieve()
                .bodyToMono(String.class)
                .defaultIfEmpty("")
                .timeout(timeout)
                .onErrorMap(e -> toHydrationException(rawUrl, e));
    }

    private static HydrationException toHydrationException(String rawUrl, Throwable e) {
        if (e instanceof WebClientResponseException responseException) {
            return new HydrationException(rawUrl,
                    "Failed to fetch " + rawUrl + ": " + responseException.getStatusCode().value(), e);
        }
        return new HydrationException(rawUrl, "Error fetching " + rawUrl + ": " + e.getMessage(), e);
    }
}
