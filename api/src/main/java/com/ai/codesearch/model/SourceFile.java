package com.ai.codesearch.model;

/**
 * Decoded text of one repository file at one version.
 */
public record SourceFile(String repoName, String version, String path, String originalFileUrl, String text) {
}
