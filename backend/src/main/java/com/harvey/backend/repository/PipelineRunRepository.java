package com.harvey.backend.repository;

import com.harvey.backend.model.PipelineRun;
import com.harvey.backend.service.training.RunStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface PipelineRunRepository extends JpaRepository<PipelineRun, Long> {

    List<PipelineRun> findTop20ByOrderByStartedAtDesc();

    Optional<PipelineRun> findFirstByOrderByStartedAtDesc();

    Optional<PipelineRun> findByRunId(String runId);

    long countByStatus(RunStatus status);
}
