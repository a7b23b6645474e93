package com.ai.codesearch.service;

import com.ai.codesearch.config.CodeSearchProperties;
import com.ai.codesearch.exception.UpstreamService;
import com.ai.codesearch.exception.UpstreamUnavailableException;
import com.ai.codesearch.model.ChatMessage;
import com.ai.codesearch.model.CompletionOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Service
public class OllamaCompletionClient implements CompletionClient {

    private static final Logger log = LoggerFactory.getLogger(OllamaCompletionClient.class);

    private final WebClient webClient;
    private final Duration timeout;

    @Autowired
    public OllamaCompletionClient(
            @Qualifier("completionWebClient") WebClient webClient,
            CodeSearchProperties properties) {
        this(webClient, properties.getCompletion().getTimeout());
    }

    OllamaCompletionClient(WebClient webClient, Duration timeout) {
        this.webClient = webClient;
        this.timeout = timeout;
    }

    @Override
    public String complete(String systemPrompt, List<ChatMessage> messages, CompletionOptions options) {
        List<ChatMessage> payload = new ArrayList<>();
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            payload.add(ChatMessage.system(systemPrompt));
        }
        payload.addAll(messages);

        log.info("[OllamaCompletionClient] Completing with model: {}, messages: {}", options.model(), payload.size());

        ChatRequest request = new ChatRequest(
                options.model(),
                payload,
                false,
                new Options(options.temperature(), options.maxTokens()));

        try {
            ChatResponse response = webClient.post()
                    .uri("/api/chat")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(request)
                    .retrieve()
                    .bodyToMono(ChatResponse.class)
                    .timeout(timeout)
                    .block();
            if (response == null || response.message() == null || response.message().content() == null) {
                return "";
            }
            return response.message().content();

        } catch (WebClientRequestException e) {
            log.error("[OllamaCompletionClient] Failed to connect to Ollama: {}", e.getMessage());
            throw new UpstreamUnavailableException(UpstreamService.COMPLETION,
                    "Completion service is not running or not accessible at the configured URL", e);
        } catch (WebClientResponseException e) {
            log.error("Ollama error: status={}, body={}", e.getStatusCode(), e.getResponseBodyAsString());
            throw new UpstreamUnavailableException(UpstreamService.COMPLETION,
                    "Completion service returned status " + e.getStatusCode().value(), e);
        } catch (RuntimeException e) {
            log.error("[OllamaCompletionClient] Completion failed: {}", e.getMessage());
            throw new UpstreamUnavailableException(UpstreamService.COMPLETION,
                    "Completion failed: " + e.getMessage(), e);
        }
    }

    record Options(double temperature, int num_predict) {
    }

    record ChatRequest(String model, List<ChatMessage> messages, boolean stream, Options options) {
    }

    record ChatResponse(String model, ChatMessage message, boolean done) {
    }
}
