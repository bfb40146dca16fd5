package com.harvey.backend.service.training;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.harvey.backend.dto.PipelineRunSummary;
import com.harvey.backend.model.PipelineRun;
import com.harvey.backend.repository.PipelineRunRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Durable history of pipeline runs: one row per run plus the JSON status files.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PipelineRunRecorder {

    private static final TypeReference<List<ModelRunResult>> OUTCOMES_TYPE = new TypeReference<>() {};

    private final PipelineRunRepository repository;
    private final TrainingStatusWriter statusWriter;
    private final ObjectMapper objectMapper;

    public void record(PipelineRunSummary summary) {
        statusWriter.write(summary);
        try {
            repository.save(PipelineRun.builder()
                    .runId(summary.getRunId())
                    .mode(summary.getMode())
                    .forced(summary.isForced())
                    .status(summary.getStatus())
                    .startedAt(summary.getStartedAt())
                    .finishedAt(summary.getFinishedAt())
                    .successRate(summary.getSuccessRate())
                    .modelsTrained(summary.getModelsTrained())
                    .totalModels(summary.getTotalModels())
                    .backupPath(summary.getBackupPath())
                    .restartTriggered(summary.isRestartTriggered())
                    .errorMessage(summary.getErrorMessage())
                    .outcomesPayload(writeOutcomes(summary.getOutcomes()))
                    .build());
        } catch (DataAccessException e) {
            log.error("Failed to persist pipeline run runId={}", summary.getRunId(), e);
        }
    }

    public List<PipelineRunSummary> recentRuns() {
        return repository.findTop20ByOrderByStartedAtDesc().stream()
                .map(this::toSummary)
                .toList();
    }

    PipelineRunSummary toSummary(PipelineRun run) {
        return PipelineRunSummary.builder()
                .runId(run.getRunId())
                .mode(run.getMode())
                .forced(run.isForced())
                .status(run.getStatus())
                .startedAt(run.getStartedAt())
                .finishedAt(run.getFinishedAt())
                .successRate(run.getSuccessRate())
                .modelsTrained(run.getModelsTrained())
                .totalModels(run.getTotalModels())
                .backupPath(run.getBackupPath())
                .restartTriggered(run.isRestartTriggered())
                .errorMessage(run.getErrorMessage())
                .outcomes(readOutcomes(run))
                .build();
    }

    private String writeOutcomes(List<ModelRunResult> outcomes) {
        try {
            return objectMapper.writeValueAsString(outcomes);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize model outcomes", e);
            return "[]";
        }
    }

    private List<ModelRunResult> readOutcomes(PipelineRun run) {
        if (run.getOutcomesPayload() == null || run.getOutcomesPayload().isBlank()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(run.getOutcomesPayload(), OUTCOMES_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("Corrupt outcomes payload runId={}", run.getRunId(), e);
            return List.of();
        }
    }
}
