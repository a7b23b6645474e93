package com.ai.codesearch.repository;

import com.ai.codesearch.entity.IndexRun;
import com.ai.codesearch.entity.IndexRunStatus;
import com.ai.codesearch.service.IndexingService;
import com.ai.codesearch.service.vector.InMemoryVectorIndex;
import com.ai.codesearch.service.vector.VectorIndex;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@Transactional
public class IndexRunRepositoryIntegrationTest {

    @Autowired
    private IndexRunRepository indexRunRepository;

    @Autowired
    private VectorIndex vectorIndex;

    @Autowired
    private IndexingService indexingService;

    private IndexRun save(String version, IndexRunStatus status, String model, OffsetDateTime startedAt) {
        IndexRun run = new IndexRun();
        run.setRepoName("modal-client");
        run.setRepoUrl("https://github.com/modal-labs/modal-client");
        run.setVersion(version);
        run.setStatus(status);
        run.setEmbedModel(model);
        run.setStartedAt(startedAt);
        return indexRunRepository.saveAndFlush(run);
    }

    @Test
    void testDefaultVectorStore_InMemory() {
        assertInstanceOf(InMemoryVectorIndex.class, vectorIndex);
    }

    @Test
    void testLatestCompletedRun_IgnoresFailedAndOtherVersions() {
        // 1) Three runs for v1.0.3, one for another version
        OffsetDateTime now = OffsetDateTime.now();
        save("v1.0.3", IndexRunStatus.COMPLETED, "all-minilm", now.minusDays(2));
        save("v1.0.3", IndexRunStatus.COMPLETED_WITH_ERRORS, "nomic-embed-text", now.minusDays(1));
        save("v1.0.3", IndexRunStatus.FAILED, "nomic-embed-text", now);
        save("v0.77.0", IndexRunStatus.COMPLETED, "nomic-embed-text", now.plusHours(1));

        // 2) Look up the most recent usable run
        Optional<IndexRun> latest = indexRunRepository.findFirstByRepoNameAndVersionAndStatusInOrderByStartedAtDesc(
                "modal-client", "v1.0.3", EnumSet.of(IndexRunStatus.COMPLETED, IndexRunStatus.COMPLETED_WITH_ERRORS));

        // 3) Verify
        assertTrue(latest.isPresent());
        assertEquals(IndexRunStatus.COMPLETED_WITH_ERRORS, latest.get().getStatus());
        assertEquals("nomic-embed-text", latest.get().getEmbedModel());
        assertEquals(IndexRunStatus.FAILED,
                indexRunRepository.findFirstByRepoNameAndVersionOrderByStartedAtDesc("modal-client", "v1.0.3")
                        .orElseThrow().getStatus());
    }

    @Test
    void testInProgressLookupAndDelete() {
        save("v2", IndexRunStatus.IN_PROGRESS, "nomic-embed-text", OffsetDateTime.now());
        save("v2", IndexRunStatus.COMPLETED, "nomic-embed-text", OffsetDateTime.now().minusHours(1));

        assertTrue(indexRunRepository.existsByRepoNameAndVersionAndStatus("modal-client", "v2",
                IndexRunStatus.IN_PROGRESS));
        List<IndexRun> runs = indexRunRepository.findAllByRepoNameAndVersionOrderByStartedAtDesc("modal-client", "v2");
        assertEquals(2, runs.size());
        assertEquals(IndexRunStatus.IN_PROGRESS, runs.get(0).getStatus());

        assertEquals(2, indexRunRepository.deleteByRepoNameAndVersion("modal-client", "v2"));
        assertFalse(indexRunRepository.existsByRepoNameAndVersionAndStatus("modal-client", "v2",
                IndexRunStatus.IN_PROGRESS));
    }

    @Test
    void testRecoverInterruptedRuns_ReleasesPartition() {
        // 1) A run left IN_PROGRESS by a previous process
        IndexRun stale = save("v4", IndexRunStatus.IN_PROGRESS, "nomic-embed-text", OffsetDateTime.now());
        save("v4", IndexRunStatus.COMPLETED, "nomic-embed-text", OffsetDateTime.now().minusHours(1));

        // 2) Startup recovery
        int recovered = indexingService.recoverInterruptedRuns();

        // 3) Verify the partition can be indexed again
        assertEquals(1, recovered);
        assertTrue(indexRunRepository.findAllByStatus(IndexRunStatus.IN_PROGRESS).isEmpty());
        IndexRun reloaded = indexRunRepository.findById(stale.getId()).orElseThrow();
        assertEquals(IndexRunStatus.FAILED, reloaded.getStatus());
        assertEquals("Interrupted by restart", reloaded.getErrorMessage());
        assertFalse(indexRunRepository.existsByRepoNameAndVersionAndStatus("modal-client", "v4",
                IndexRunStatus.IN_PROGRESS));
    }

    @Test
    void testCreatedAtSetOnPersist() {
        IndexRun run = save("v3", IndexRunStatus.IN_PROGRESS, "nomic-embed-text", OffsetDateTime.now());

        assertNotNull(run.getId());
        assertNotNull(run.getCreatedAt());
    }
}
