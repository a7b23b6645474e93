package com.ai.codesearch.model;

public record CompletionOptions(String model, double temperature, int maxTokens) {
}
