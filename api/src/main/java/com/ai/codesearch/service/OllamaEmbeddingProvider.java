package com.ai.codesearch.service;

import com.ai.codesearch.config.CodeSearchProperties;
import com.ai.codesearch.exception.ConfigurationException;
import com.ai.codesearch.exception.UpstreamService;
import com.ai.codesearch.exception.UpstreamUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.List;

/**
 * Embeddings from Ollama's batch {@code /api/embed} endpoint.
 */
@Service
public class OllamaEmbeddingProvider implements EmbeddingProvider {

    private static final Logger log = LoggerFactory.getLogger(OllamaEmbeddingProvider.class);

    private final WebClient webClient;
    private final String model;
    private final int dimension;
    private final Duration timeout;

    @Autowired
    public OllamaEmbeddingProvider(
            @Qualifier("embeddingWebClient") WebClient webClient,
            CodeSearchProperties properties) {
        this(webClient,
                properties.getEmbedding().getModel(),
                properties.getEmbedding().getDimension(),
                properties.getEmbedding().getTimeout());
    }

    OllamaEmbeddingProvider(WebClient webClient, String model, int dimension, Duration timeout) {
        if (model == null || model.isBlank()) {
            throw new ConfigurationException("codesearch.embedding.model must be set");
        }
        this.webClient = webClient;
        this.model = model;
        this.dimension = dimension;
        this.timeout = timeout;
    }

    @Override
    public List<float[]> embed(List<String> texts) {
        if (texts.isEmpty()) {
            return List.of();
        }

        EmbedResponse response;
        try {
            response = webClient.post()
                    .uri("/api/embed")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(new EmbedRequest(model, texts))
                    .retrieve()
                    .bodyToMono(EmbedResponse.class)
                    .timeout(timeout)
                    .block();
        } catch (WebClientRequestException e) {
            log.error("[OllamaEmbeddingProvider] Failed to connect to Ollama: {}", e.getMessage());
            throw new UpstreamUnavailableException(UpstreamService.EMBEDDING,
                    "Embedding service is not running or not accessible at the configured URL", e);
        } catch (WebClientResponseException e) {
            if (e.getStatusCode() == HttpStatus.NOT_FOUND) {
                log.error("[OllamaEmbeddingProvider] Model {} or endpoint not found (404)", model);
            } else {
                log.error("[OllamaEmbeddingProvider] Ollama returned error: status={}, body={}", e.getStatusCode(),
                        e.getResponseBodyAsString());
            }
            throw new UpstreamUnavailableException(UpstreamService.EMBEDDING,
                    "Embedding service returned status " + e.getStatusCode().value(), e);
        } catch (RuntimeException e) {
            log.error("[OllamaEmbeddingProvider] Failed to generate embeddings: {}", e.getMessage());
            throw new UpstreamUnavailableException(UpstreamService.EMBEDDING,
                    "Failed to generate embeddings: " + e.getMessage(), e);
        }

        if (response == null || response.embeddings() == null || response.embeddings().size() != texts.size()) {
            throw new UpstreamUnavailableException(UpstreamService.EMBEDDING,
                    "Embedding service returned " + (response == null || response.embeddings() == null
                            ? 0 : response.embeddings().size()) + " vectors for " + texts.size() + " inputs");
        }
        for (float[] vector : response.embeddings()) {
            if (vector == null || vector.length == 0) {
                throw new UpstreamUnavailableException(UpstreamService.EMBEDDING,
                        "Embedding service returned an empty vector");
            }
        }

        log.debug("[OllamaEmbeddingProvider] Embedded {} texts with {} ({} dimensions)",
                texts.size(), model, response.embeddings().get(0).length);
        return response.embeddings();
    }

    @Override
    public String modelName() {
        return model;
    }

    @Override
    public int dimension() {
        return dimension;
    }

    record EmbedRequest(String model, List<String> input) {
    }

    record EmbedResponse(String model, List<float[]> embeddings) {
    }
}
