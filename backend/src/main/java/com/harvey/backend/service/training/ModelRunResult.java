package com.harvey.backend.service.training;

import java.util.Map;

public record ModelRunResult(String model, ModelOutcome outcome, String error, Double ageDays,
                             Map<String, Double> metrics, String validationReason) {

    public static ModelRunResult skipped(String model, double ageDays, String reason) {
        return new ModelRunResult(model, ModelOutcome.SKIPPED, reason, ageDays, Map.of(), null);
    }

    public static ModelRunResult failed(String model, String error) {
        return new ModelRunResult(model, ModelOutcome.FAILED, error, null, Map.of(), null);
    }

    public static ModelRunResult timedOut(String model, String error) {
        return new ModelRunResult(model, ModelOutcome.TIMEOUT, error, null, Map.of(), null);
    }

    public static ModelRunResult trained(ModelArtifact artifact) {
        return new ModelRunResult(artifact.getModelName(), ModelOutcome.SUCCESS, null, null,
                artifact.getMetrics(), null);
    }

    public ModelRunResult withValidation(ValidationResult validation) {
        if (validation.passed()) {
            return new ModelRunResult(model, outcome, error, ageDays, metrics, validation.reason());
        }
        return new ModelRunResult(model, ModelOutcome.FAILED, "validation failed: " + validation.reason(),
                ageDays, metrics, validation.reason());
    }
}
