package com.ai.codesearch.entity;

import jakarta.persistence.*;
import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Record of one indexing run for a (repository, version) partition. The
 * embedding model is kept so retrieval can refuse an index built with a
 * different model.
 */
@Entity
@Table(name = "index_run", indexes = @Index(name = "index_run_partition_idx", columnList = "repo_name, repo_version"))
public class IndexRun {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "repo_name", nullable = false)
    private String repoName;

    @Column(name = "repo_url", nullable = false)
    private String repoUrl;

    @Column(name = "repo_version", nullable = false)
    private String version;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private IndexRunStatus status = IndexRunStatus.IN_PROGRESS;

    @Column(name = "embed_model", nullable = false)
    private String embedModel;

    @Column(name = "chunk_size")
    private Integer chunkSize;

    @Column(name = "chunk_overlap")
    private Integer chunkOverlap;

    @Column(name = "files_discovered")
    private Integer filesDiscovered = 0;

    @Column(name = "files_indexed")
    private Integer filesIndexed = 0;

    @Column(name = "files_skipped")
    private Integer filesSkipped = 0;

    @Column(name = "chunks_indexed")
    private Integer chunksIndexed = 0;

    @Column(name = "chunks_failed")
    private Integer chunksFailed = 0;

    @Column(name = "entries_before")
    private Long entriesBefore;

    @Column(name = "entries_after")
    private Long entriesAfter;

    @Column(name = "error_message", length = 4000)
    private String errorMessage;

    @Column(name = "started_at")
    private OffsetDateTime startedAt;

    @Column(name = "completed_at")
    private OffsetDateTime completedAt;

    @Column(name = "created_at")
    private OffsetDateTime createdAt;

    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = OffsetDateTime.now();
        updatedAt = OffsetDateTime.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = OffsetDateTime.now();
    }

    // Getters and setters
    public UUID getId() {
        return id;
    }

    public void setId(UUID id) {
        this.id = id;
    }

    public String getRepoName() {
        return repoName;
    }

    public void setRepoName(String repoName) {
        this.repoName = repoName;
    }

    public String getRepoUrl() {
        return repoUrl;
    }

    public void setRepoUrl(String repoUrl) {
        this.repoUrl = repoUrl;
    }

    public String getVersion() {
        return version;
    }

    public void setVersion(String version) {
        this.version = version;
    }

    public IndexRunStatus getStatus() {
        return status;
    }

    public void setStatus(IndexRunStatus status) {
        this.status = status;
    }

    public String getEmbedModel() {
        return embedModel;
    }

    public void setEmbedModel(String embedModel) {
        this.embedModel = embedModel;
    }

    public Integer getChunkSize() {
        return chunkSize;
    }

    public void setChunkSize(Integer chunkSize) {
        this.chunkSize = chunkSize;
    }

    public Integer getChunkOverlap() {
        return chunkOverlap;
    }

    public void setChunkOverlap(Integer chunkOverlap) {
        this.chunkOverlap = chunkOverlap;
    }

    public Integer getFilesDiscovered() {
        return filesDiscovered;
    }

    public void setFilesDiscovered(Integer filesDiscovered) {
        this.filesDiscovered = filesDiscovered;
    }

    public Integer getFilesIndexed() {
        return filesIndexed;
    }

    public void setFilesIndexed(Integer filesIndexed) {
        this.filesIndexed = filesIndexed;
    }

    public Integer getFilesSkipped() {
        return filesSkipped;
    }

    public void setFilesSkipped(Integer filesSkipped) {
        this.filesSkipped = filesSkipped;
    }

    public Integer getChunksIndexed() {
        return chunksIndexed;
    }

    public void setChunksIndexed(Integer chunksIndexed) {
        this.chunksIndexed = chunksIndexed;
    }

    public Integer getChunksFailed() {
        return chunksFailed;
    }

    public void setChunksFailed(Integer chunksFailed) {
        this.chunksFailed = chunksFailed;
    }

    public Long getEntriesBefore() {
        return entriesBefore;
    }

    public void setEntriesBefore(Long entriesBefore) {
        this.entriesBefore = entriesBefore;
    }

    public Long getEntriesAfter() {
        return entriesAfter;
    }

    public void setEntriesAfter(Long entriesAfter) {
        this.entriesAfter = entriesAfter;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public void setErrorMessage(String errorMessage) {
        this.errorMessage = errorMessage;
    }

    public OffsetDateTime getStartedAt() {
        return startedAt;
    }

    public void setStartedAt(OffsetDateTime startedAt) {
        this.startedAt = startedAt;
    }

    public OffsetDateTime getCompletedAt() {
        return completedAt;
    }

    public void setCompletedAt(OffsetDateTime completedAt) {
        this.completedAt = completedAt;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(OffsetDateTime createdAt) {
        this.createdAt = createdAt;
    }

    public OffsetDateTime getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(OffsetDateTime updatedAt) {
        this.updatedAt = updatedAt;
    }
}
