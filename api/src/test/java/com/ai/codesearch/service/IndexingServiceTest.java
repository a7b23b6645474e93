package com.ai.codesearch.service;

import com.ai.codesearch.api.GithubArchiveClient;
import com.ai.codesearch.config.CodeSearchProperties;
import com.ai.codesearch.entity.IndexRun;
import com.ai.codesearch.entity.IndexRunStatus;
import com.ai.codesearch.exception.IndexingInProgressException;
import com.ai.codesearch.exception.UpstreamService;
import com.ai.codesearch.exception.UpstreamUnavailableException;
import com.ai.codesearch.model.ArchiveFile;
import com.ai.codesearch.model.Chunk;
import com.ai.codesearch.model.IndexEntry;
import com.ai.codesearch.model.IndexReport;
import com.ai.codesearch.model.MetadataFilter;
import com.ai.codesearch.model.SkippedFile;
import com.ai.codesearch.model.SourceFile;
import com.ai.codesearch.repository.IndexRunRepository;
import com.ai.codesearch.service.vector.InMemoryVectorIndex;
import com.ai.codesearch.service.vector.VectorIndex;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.mockito.stubbing.Answer;
import org.springframework.dao.DataAccessResourceFailureException;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

public class IndexingServiceTest {

    private static final String REPO_URL = "https://github.com/modal-labs/modal-client";

    @Mock
    private GithubArchiveClient archiveClient;

    @Mock
    private EmbeddingProvider embeddingProvider;

    @Mock
    private IndexRunRepository indexRunRepository;

    private InMemoryVectorIndex vectorIndex;
    private CodeSearchProperties properties;

    private static final Answer<List<float[]>> FAKE_EMBEDDINGS = invocation -> {
        List<String> texts = invocation.getArgument(0);
        return texts.stream().map(text -> new float[]{text.length(), 1f}).toList();
    };

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        vectorIndex = new InMemoryVectorIndex();
        properties = new CodeSearchProperties();
        properties.getIndexing().setChunkSize(200);
        properties.getIndexing().setChunkOverlap(50);
        properties.getIndexing().setInitialBackoff(Duration.ofMillis(1));
        properties.getIndexing().setMaxBackoff(Duration.ofMillis(5));

        when(embeddingProvider.modelName()).thenReturn("nomic-embed-text");
        when(embeddingProvider.embed(anyList())).thenAnswer(FAKE_EMBEDDINGS);
        when(indexRunRepository.save(any(IndexRun.class))).thenAnswer(invocation -> {
            IndexRun run = invocation.getArgument(0);
            if (run.getId() == null) {
                run.setId(UUID.randomUUID());
            }
            return run;
        });
    }

    private IndexingService service() {
        return new IndexingService(archiveClient, new SourceFileSelector(properties), new CodeChunker(properties),
                embeddingProvider, vectorIndex, indexRunRepository, properties);
    }

    private static ArchiveFile file(String path, String text) {
        return new ArchiveFile(path, text.getBytes(StandardCharsets.UTF_8));
    }

    private static List<ArchiveFile> sampleArchive() {
        return List.of(
                file("modal/app.py", "import modal\n\napp = modal.App()\n\n@app.function()\ndef hello():\n    return 1\n"),
                file("modal/gpu.py", "def gpu_config(name):\n    return {'gpu': name}\n"),
                file("README.md", "# modal-client\n"),
                file("node_modules/dep/index.js", "module.exports = {};\n"));
    }

    @Test
    void testIndexRepository_ReindexSameVersion_NoNetGrowth() {
        // Arrange
        when(archiveClient.download(REPO_URL, "v1.0.3")).thenReturn(sampleArchive());
        IndexingService service = service();

        // Act
        IndexReport first = service.indexRepository(REPO_URL, "v1.0.3");
        IndexReport second = service.indexRepository(REPO_URL, "v1.0.3");

        // Assert
        assertEquals(IndexRunStatus.COMPLETED, first.status());
        assertEquals(2, first.chunksIndexed());
        assertEquals(2, first.netGrowth());
        assertEquals(IndexRunStatus.COMPLETED, second.status());
        assertEquals(first.entriesAfter(), second.entriesAfter());
        assertEquals(0, second.netGrowth());
        assertEquals(2, vectorIndex.count(new MetadataFilter("modal-client", "v1.0.3")));
    }

    @Test
    void testIndexRepository_ReportCountsFiles() {
        // Arrange
        when(archiveClient.download(REPO_URL, "v1.0.3")).thenReturn(sampleArchive());

        // Act
        IndexReport report = service().indexRepository(REPO_URL, "v1.0.3");

        // Assert
        assertEquals("modal-client", report.repoName());
        assertEquals(4, report.filesDiscovered());
        assertEquals(2, report.filesEligible());
        assertEquals(2, report.filesIndexed());
        assertTrue(report.skippedFiles().isEmpty());
        assertTrue(report.failedChunkIds().isEmpty());
        assertNotNull(report.runId());
    }

    @Test
    void testIndexRepository_UndecodableFile_SkippedAndReported() {
        // Arrange
        List<ArchiveFile> files = List.of(
                file("modal/app.py", "print('ok')\n"),
                new ArchiveFile("modal/blob.py", new byte[]{'a', 0, (byte) 0xFF}));
        when(archiveClient.download(REPO_URL, "v1")).thenReturn(files);

        // Act
        IndexReport report = service().indexRepository(REPO_URL, "v1");

        // Assert
        assertEquals(IndexRunStatus.COMPLETED_WITH_ERRORS, report.status());
        assertEquals(1, report.chunksIndexed());
        assertEquals(1, report.skippedFiles().size());
        SkippedFile skipped = report.skippedFiles().get(0);
        assertEquals("modal/blob.py", skipped.path());
        assertEquals(SkippedFile.Reason.UNDECODABLE, skipped.reason());
    }

    @Test
    void testIndexRepository_TransientEmbeddingFailure_Retried() {
        // Arrange
        when(archiveClient.download(REPO_URL, "v1")).thenReturn(sampleArchive());
        when(embeddingProvider.embed(anyList()))
                .thenThrow(new UpstreamUnavailableException(UpstreamService.EMBEDDING, "connection refused"))
                .thenAnswer(FAKE_EMBEDDINGS);

        // Act
        IndexReport report = service().indexRepository(REPO_URL, "v1");

        // Assert
        assertEquals(IndexRunStatus.COMPLETED, report.status());
        assertEquals(2, report.chunksIndexed());
        verify(embeddingProvider, times(2)).embed(anyList());
    }

    @Test
    void testIndexRepository_FailedBatchBudgetExhausted_Aborted() {
        // Arrange
        properties.getIndexing().setBatchSize(1);
        properties.getIndexing().setMaxAttempts(2);
        properties.getIndexing().setMaxFailedBatches(1);
        when(archiveClient.download(REPO_URL, "v1")).thenReturn(List.of(
                file("a.py", "a = 1\n"), file("b.py", "b = 2\n"), file("c.py", "c = 3\n")));
        when(embeddingProvider.embed(anyList()))
                .thenThrow(new UpstreamUnavailableException(UpstreamService.EMBEDDING, "model not loaded"));

        // Act
        IndexReport report = service().indexRepository(REPO_URL, "v1");

        // Assert
        assertEquals(IndexRunStatus.ABORTED, report.status());
        assertEquals(0, report.chunksIndexed());
        assertEquals(List.of("a.py_<chunk>_0", "b.py_<chunk>_0", "c.py_<chunk>_0"), report.failedChunkIds());
        assertEquals(2, report.errors().size());
        verify(embeddingProvider, times(2)).embed(anyList());
    }

    @Test
    void testIndexRepository_OneBatchFails_CompletedWithErrors() {
        // Arrange
        properties.getIndexing().setBatchSize(1);
        properties.getIndexing().setMaxAttempts(1);
        when(archiveClient.download(REPO_URL, "v1")).thenReturn(List.of(
                file("a.py", "a = 1\n"), file("b.py", "b = 2\n")));
        when(embeddingProvider.embed(anyList()))
                .thenThrow(new UpstreamUnavailableException(UpstreamService.EMBEDDING, "timeout"))
                .thenAnswer(FAKE_EMBEDDINGS);

        // Act
        IndexReport report = service().indexRepository(REPO_URL, "v1");

        // Assert
        assertEquals(IndexRunStatus.COMPLETED_WITH_ERRORS, report.status());
        assertEquals(1, report.chunksIndexed());
        assertEquals(List.of("a.py_<chunk>_0"), report.failedChunkIds());
    }

    @Test
    void testIndexRepository_ArchiveUnavailable_RunMarkedFailed() {
        // Arrange
        when(archiveClient.download(REPO_URL, "v9"))
                .thenThrow(new UpstreamUnavailableException(UpstreamService.ARCHIVE, "404 Not Found"));
        ArgumentCaptor<IndexRun> captor = ArgumentCaptor.forClass(IndexRun.class);

        // Act & Assert
        UpstreamUnavailableException ex = assertThrows(UpstreamUnavailableException.class,
                () -> service().indexRepository(REPO_URL, "v9"));
        assertEquals(UpstreamService.ARCHIVE, ex.getService());
        verify(indexRunRepository, atLeastOnce()).save(captor.capture());
        IndexRun run = captor.getValue();
        assertEquals(IndexRunStatus.FAILED, run.getStatus());
        assertNotNull(run.getCompletedAt());
        verify(embeddingProvider, never()).embed(anyList());
    }

    @Test
    void testIndexRepository_NoEligibleFiles_Failed() {
        // Arrange
        when(archiveClient.download(REPO_URL, "v1")).thenReturn(List.of(file("README.md", "# docs\n")));

        // Act
        IndexReport report = service().indexRepository(REPO_URL, "v1");

        // Assert
        assertEquals(IndexRunStatus.FAILED, report.status());
        assertEquals(0, report.chunksIndexed());
        assertFalse(report.errors().isEmpty());
    }

    @Test
    void testIndexRepository_RunInProgress_Conflict() {
        // Arrange
        when(indexRunRepository.existsByRepoNameAndVersionAndStatus("modal-client", "v1", IndexRunStatus.IN_PROGRESS))
                .thenReturn(true);

        // Act & Assert
        assertThrows(IndexingInProgressException.class, () -> service().indexRepository(REPO_URL, "v1"));
        verifyNoInteractions(archiveClient);
    }

    @Test
    void testIndexRepository_SeveralVersions_FailureDoesNotStopOthers() {
        // Arrange
        when(archiveClient.download(REPO_URL, "v1")).thenReturn(sampleArchive());
        when(archiveClient.download(REPO_URL, "v2"))
                .thenThrow(new UpstreamUnavailableException(UpstreamService.ARCHIVE, "404 Not Found"));

        // Act
        List<IndexReport> reports = service().indexRepository(REPO_URL, List.of("v2", "v1"));

        // Assert
        assertEquals(2, reports.size());
        assertEquals(IndexRunStatus.FAILED, reports.get(0).status());
        assertEquals(IndexRunStatus.COMPLETED, reports.get(1).status());
    }

    @Test
    void testIndexRepository_NoVersions_IndexesLatest() {
        // Arrange
        when(archiveClient.download(REPO_URL, "latest")).thenReturn(sampleArchive());

        // Act
        List<IndexReport> reports = service().indexRepository(REPO_URL, List.of());

        // Assert
        assertEquals(1, reports.size());
        assertEquals("latest", reports.get(0).version());
    }

    @Test
    void testIndexRepository_ModelChanged_ClearsPartitionFirst() {
        // Arrange
        vectorIndex.upsert(List.of(IndexEntry.of(
                new Chunk("stale.py_<chunk>_0", "x", "stale.py", "", "modal-client", "v1", 0, 0, 1),
                new float[]{1f, 1f}, "old-model")));
        IndexRun previous = new IndexRun();
        previous.setEmbedModel("old-model");
        previous.setStatus(IndexRunStatus.COMPLETED);
        when(indexRunRepository.findFirstByRepoNameAndVersionAndStatusInOrderByStartedAtDesc(
                eq("modal-client"), eq("v1"), anyCollection())).thenReturn(Optional.of(previous));
        when(archiveClient.download(REPO_URL, "v1")).thenReturn(sampleArchive());

        // Act
        IndexReport report = service().indexRepository(REPO_URL, "v1");

        // Assert
        assertEquals(0, report.entriesBefore());
        assertEquals(2, report.entriesAfter());
    }

    @Test
    void testBeginRuns_DuplicateAndPaddedVersions_OneRunPerVersion() {
        // Act
        List<IndexRun> runs = service().beginRuns(REPO_URL, List.of("v1", " v1", "v1 ", " "));

        // Assert
        assertEquals(List.of("v1", "latest"), runs.stream().map(IndexRun::getVersion).toList());
        verify(indexRunRepository, atLeastOnce())
                .existsByRepoNameAndVersionAndStatus("modal-client", "v1", IndexRunStatus.IN_PROGRESS);
        verify(indexRunRepository, never())
                .existsByRepoNameAndVersionAndStatus("modal-client", " v1", IndexRunStatus.IN_PROGRESS);
    }

    @Test
    void testIndexRepository_DuplicateVersions_SingleReportAndPartitionReleased() {
        // Arrange
        when(archiveClient.download(REPO_URL, "v1")).thenReturn(sampleArchive());
        IndexingService service = service();

        // Act
        List<IndexReport> reports = service.indexRepository(REPO_URL, List.of("v1", " v1"));

        // Assert
        assertEquals(1, reports.size());
        assertEquals(IndexRunStatus.COMPLETED, reports.get(0).status());
        verify(archiveClient, times(1)).download(REPO_URL, "v1");
    }

    @Test
    void testBeginRuns_SaveFailsPartway_EarlierRunsMarkedFailed() {
        // Arrange
        List<IndexRun> saved = new ArrayList<>();
        when(indexRunRepository.save(any(IndexRun.class))).thenAnswer(invocation -> {
            IndexRun run = invocation.getArgument(0);
            if ("v2".equals(run.getVersion())) {
                throw new DataAccessResourceFailureException("connection reset");
            }
            run.setId(UUID.randomUUID());
            saved.add(run);
            return run;
        });

        // Act & Assert
        assertThrows(DataAccessResourceFailureException.class,
                () -> service().beginRuns(REPO_URL, List.of("v1", "v2")));
        IndexRun first = saved.get(0);
        assertEquals("v1", first.getVersion());
        assertEquals(IndexRunStatus.FAILED, first.getStatus());
        assertNotNull(first.getCompletedAt());
        verifyNoInteractions(archiveClient);
    }

    @Test
    void testIndexRepository_UnexpectedFailure_ReportedAndOthersContinue() {
        // Arrange
        when(archiveClient.download(REPO_URL, "v2")).thenThrow(new IllegalStateException("corrupt archive"));
        when(archiveClient.download(REPO_URL, "v1")).thenReturn(sampleArchive());
        ArgumentCaptor<IndexRun> captor = ArgumentCaptor.forClass(IndexRun.class);

        // Act
        List<IndexReport> reports = service().indexRepository(REPO_URL, List.of("v2", "v1"));

        // Assert
        assertEquals(2, reports.size());
        assertEquals(IndexRunStatus.FAILED, reports.get(0).status());
        assertEquals(List.of("corrupt archive"), reports.get(0).errors());
        assertEquals(IndexRunStatus.COMPLETED, reports.get(1).status());
        verify(indexRunRepository, atLeastOnce()).save(captor.capture());
        assertTrue(captor.getAllValues().stream()
                .filter(run -> "v2".equals(run.getVersion()))
                .allMatch(run -> run.getStatus() == IndexRunStatus.FAILED));
    }

    @Test
    void testIndexRunsAsync_UnexpectedFailure_CompletesWithReport() {
        // Arrange
        when(archiveClient.download(REPO_URL, "v1")).thenThrow(new IllegalStateException("zip slip"));
        IndexingService service = service();
        List<IndexRun> runs = service.beginRuns(REPO_URL, List.of("v1"));

        // Act
        List<IndexReport> reports = service.indexRunsAsync(runs).join();

        // Assert
        assertEquals(1, reports.size());
        assertEquals(IndexRunStatus.FAILED, reports.get(0).status());
        assertEquals(IndexRunStatus.FAILED, runs.get(0).getStatus());
    }

    @Test
    void testRecoverInterruptedRuns_InProgressMarkedFailed() {
        // Arrange
        IndexRun stale = new IndexRun();
        stale.setId(UUID.randomUUID());
        stale.setRepoName("modal-client");
        stale.setVersion("v1");
        stale.setStatus(IndexRunStatus.IN_PROGRESS);
        when(indexRunRepository.findAllByStatus(IndexRunStatus.IN_PROGRESS)).thenReturn(List.of(stale));

        // Act
        int recovered = service().recoverInterruptedRuns();

        // Assert
        assertEquals(1, recovered);
        assertEquals(IndexRunStatus.FAILED, stale.getStatus());
        assertEquals("Interrupted by restart", stale.getErrorMessage());
        assertNotNull(stale.getCompletedAt());
        verify(indexRunRepository).save(stale);
    }

    @Test
    void testIndexRepository_CountUnavailable_RunStillCompletes() {
        // Arrange
        VectorIndex flakyCounts = mock(VectorIndex.class);
        when(flakyCounts.count(any(MetadataFilter.class)))
                .thenThrow(new UpstreamUnavailableException(UpstreamService.VECTOR_INDEX,
                        "Pinecone /describe_index_stats failed with status 400"));
        when(archiveClient.download(REPO_URL, "v1")).thenReturn(sampleArchive());
        IndexingService service = new IndexingService(archiveClient, new SourceFileSelector(properties),
                new CodeChunker(properties), embeddingProvider, flakyCounts, indexRunRepository, properties);
        ArgumentCaptor<IndexRun> captor = ArgumentCaptor.forClass(IndexRun.class);

        // Act
        IndexReport report = service.indexRepository(REPO_URL, "v1");

        // Assert
        assertEquals(IndexRunStatus.COMPLETED, report.status());
        assertEquals(2, report.chunksIndexed());
        assertEquals(IndexReport.UNKNOWN_COUNT, report.entriesBefore());
        assertEquals(IndexReport.UNKNOWN_COUNT, report.entriesAfter());
        assertEquals(0, report.netGrowth());
        verify(flakyCounts).upsert(anyList());
        verify(indexRunRepository, atLeastOnce()).save(captor.capture());
        assertNull(captor.getValue().getEntriesAfter());
    }

    @Test
    void testBatch_BoundedByCountAndCharacters() {
        // Arrange
        properties.getIndexing().setBatchSize(3);
        properties.getIndexing().setMaxBatchChars(100);
        IndexingService service = service();
        SourceFile source = new SourceFile("r", "v", "f.py", "", "");
        List<Chunk> chunks = List.of(
                chunk(source, 0, 10), chunk(source, 1, 10), chunk(source, 2, 10), chunk(source, 3, 10),
                chunk(source, 4, 90), chunk(source, 5, 150));

        // Act
        List<List<Chunk>> batches = service.batch(chunks);

        // Assert
        assertEquals(List.of(3, 1, 1, 1), batches.stream().map(List::size).toList());
    }

    private static Chunk chunk(SourceFile source, int index, int length) {
        String text = "x".repeat(length);
        return new Chunk(Chunk.chunkId(source.path(), index), text, source.path(), source.originalFileUrl(),
                source.repoName(), source.version(), index, 0, length);
    }
}
