package com.ai.codesearch.exception;

/**
 * Another run for the same repository and version has not finished yet.
 */
public class IndexingInProgressException extends RuntimeException {

    private final String repoName;
    private final String version;

    public IndexingInProgressException(String repoName, String version) {
        super("Indexing already in progress for " + repoName + ":" + version);
        this.repoName = repoName;
        this.version = version;
    }

    public String getRepoName() {
        return repoName;
    }

    public String getVersion() {
        return version;
    }
}
