package com.ai.codesearch.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Request DTO for indexing repository versions. No versions means {@code latest}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record IndexRequest(
        @JsonAlias("repo_url") String repoUrl,
        @JsonAlias("tags") List<String> versions,
        Boolean async) {
    public IndexRequest {
        if (versions == null) {
            versions = List.of();
        }
        if (async == null) {
            async = false;
        }
    }
}
