package com.ai.codesearch.dto;

import com.ai.codesearch.model.MetadataFilter;
import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SearchMetadata(
        @JsonProperty("repo_name") @JsonAlias("repoName") String repoName,
        String version) {

    public boolean isComplete() {
        return repoName != null && !repoName.isBlank() && version != null && !version.isBlank();
    }

    public MetadataFilter toFilter() {
        return new MetadataFilter(repoName.trim(), version.trim());
    }
}
