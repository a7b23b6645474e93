package com.ai.codesearch.model;

/**
 * One regular file from a repository archive, path relative to the repository root.
 */
public record ArchiveFile(String path, byte[] content) {
}
