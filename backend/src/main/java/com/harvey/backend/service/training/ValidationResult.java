package com.harvey.backend.service.training;

public record ValidationResult(String modelName, ModelArtifact.Status status, String reason,
                               String metric, Double observed) {

    public static ValidationResult rejected(String modelName, String reason) {
        return new ValidationResult(modelName, ModelArtifact.Status.REJECTED, reason, null, null);
    }

    public boolean passed() {
        return status == ModelArtifact.Status.VALIDATED;
    }
}
