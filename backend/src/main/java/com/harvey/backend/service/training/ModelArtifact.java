package com.harvey.backend.service.training;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;

/**
 * Output of one training job. Validation yields a copy with a new status.
 */
@Value
@Builder(toBuilder = true)
public class ModelArtifact {

    public enum Status { CANDIDATE, VALIDATED, REJECTED }

    String modelName;
    ModelType modelType;
    Instant trainedAt;
    Path storagePath;
    @Builder.Default
    Map<String, Double> metrics = Map.of();
    @Builder.Default
    Status status = Status.CANDIDATE;
}
