package com.ai.codesearch.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record RagResponse(
        boolean success,
        String response,
        List<SourceDto> sources,
        SearchMetadata metadata,
        String error) {

    public static RagResponse ok(String response, List<SourceDto> sources, SearchMetadata metadata) {
        return new RagResponse(true, response, sources, metadata, null);
    }

    public static RagResponse failure(String error) {
        return new RagResponse(false, null, null, null, error);
    }
}
