package com.ai.codesearch.repository;

import com.ai.codesearch.entity.IndexRun;
import com.ai.codesearch.entity.IndexRunStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface IndexRunRepository extends JpaRepository<IndexRun, UUID> {

    Optional<IndexRun> findFirstByRepoNameAndVersionOrderByStartedAtDesc(String repoName, String version);

    Optional<IndexRun> findFirstByRepoNameAndVersionAndStatusInOrderByStartedAtDesc(
            String repoName, String version, Collection<IndexRunStatus> statuses);

    boolean existsByRepoNameAndVersionAndStatus(String repoName, String version, IndexRunStatus status);

    List<IndexRun> findAllByStatus(IndexRunStatus status);

    List<IndexRun> findAllByOrderByStartedAtDesc();

    List<IndexRun> findAllByRepoNameAndVersionOrderByStartedAtDesc(String repoName, String version);

    long deleteByRepoNameAndVersion(String repoName, String version);
}
