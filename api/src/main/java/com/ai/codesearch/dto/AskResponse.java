package com.ai.codesearch.dto;

import com.ai.codesearch.model.AnswerResult;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Locale;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record AskResponse(
        boolean success,
        String kind,
        String response,
        List<SourceDto> sources,
        String error) {

    public static AskResponse from(AnswerResult result) {
        return new AskResponse(
                true,
                result.kind().name().toLowerCase(Locale.ROOT),
                result.text(),
                result.sources().stream().map(SourceDto::from).toList(),
                null);
    }

    public static AskResponse failure(String error) {
        return new AskResponse(false, null, null, null, error);
    }
}
