package com.ai.codesearch.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Exact-match partition filter. Every query is restricted to one repository
 * at one version.
 */
public record MetadataFilter(String repoName, String version) {

    public static final String REPO_NAME = "repo_name";
    public static final String VERSION = "version";

    public MetadataFilter {
        Objects.requireNonNull(repoName, "repoName");
        Objects.requireNonNull(version, "version");
    }

    public Map<String, String> asFieldMap() {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put(REPO_NAME, repoName);
        fields.put(VERSION, version);
        return fields;
    }

    public boolean matches(Map<String, ?> metadata) {
        return metadata != null
                && repoName.equals(metadata.get(REPO_NAME))
                && version.equals(metadata.get(VERSION));
    }
}
