package com.harvey.backend.dto;

import com.harvey.backend.service.training.ModelOutcome;
import com.harvey.backend.service.training.ModelRunResult;
import com.harvey.backend.service.training.PipelineMode;
import com.harvey.backend.service.training.RunStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder(toBuilder = true)
public class PipelineRunSummary {
    String runId;
    PipelineMode mode;
    boolean forced;
    RunStatus status;
    Instant startedAt;
    Instant finishedAt;
    double successRate;
    int modelsTrained;
    int totalModels;
    String backupPath;
    boolean restartTriggered;
    String errorMessage;
    @Builder.Default
    List<ModelRunResult> outcomes = List.of();

    public long count(ModelOutcome outcome) {
        return outcomes.stream().filter(result -> result.outcome() == outcome).count();
    }
}
