package com.harvey.backend.service.training;

import com.harvey.backend.config.TrainingProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Checks a model's primary metric against the threshold configured for its type.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ModelValidator {

    private final TrainingProperties properties;
    private final ModelFiles modelFiles;
    private final ModelMetricsReader metricsReader;

    public ValidationResult validate(ModelArtifact artifact) {
        String name = artifact.getModelName();
        ValidationThreshold threshold = properties.getValidation().forType(artifact.getModelType());
        if (threshold == null || threshold.getMetric() == null) {
            return ValidationResult.rejected(name, "no threshold configured for model type " + artifact.getModelType());
        }
        Double observed = artifact.getMetrics() == null ? null : artifact.getMetrics().get(threshold.getMetric());
        if (observed == null) {
            return ValidationResult.rejected(name, "missing metric " + threshold.getMetric());
        }
        if (threshold.accepts(observed)) {
            log.info("✅ Validated model={} {}={}", name, threshold.getMetric(), observed);
            return new ValidationResult(name, ModelArtifact.Status.VALIDATED,
                    threshold.getMetric() + "=" + observed + " meets " + threshold.describe(),
                    threshold.getMetric(), observed);
        }
        log.warn("❌ Rejected model={} {}={} required {}", name, threshold.getMetric(), observed, threshold.describe());
        return new ValidationResult(name, ModelArtifact.Status.REJECTED,
                threshold.getMetric() + "=" + observed + " fails " + threshold.describe(),
                threshold.getMetric(), observed);
    }

    /**
     * Re-checks every registered model currently in production against its metrics sidecar.
     */
    public List<ValidationResult> validateProduction() {
        Path modelsDir = modelFiles.modelsDir();
        List<ValidationResult> results = new ArrayList<>();
        for (TrainingProperties.Model model : properties.getModels()) {
            Path artifact = modelFiles.artifact(modelsDir, model.getName());
            if (!Files.isRegularFile(artifact)) {
                results.add(ValidationResult.rejected(model.getName(), "artifact missing"));
                continue;
            }
            Path metricsFile = modelFiles.metrics(modelsDir, model.getName());
            Map<String, Double> metrics;
            try {
                metrics = Files.isRegularFile(metricsFile) ? metricsReader.read(metricsFile) : Map.of();
            } catch (IOException e) {
                log.warn("Unreadable metrics model={} file={}", model.getName(), metricsFile, e);
                results.add(ValidationResult.rejected(model.getName(), "metrics unreadable: " + e.getMessage()));
                continue;
            }
            results.add(validate(ModelArtifact.builder()
                    .modelName(model.getName())
                    .modelType(model.getType())
                    .storagePath(artifact)
                    .metrics(metrics)
                    .build()));
        }
        long passed = results.stream().filter(ValidationResult::passed).count();
        log.info("Production validation passed={}/{}", passed, results.size());
        return results;
    }
}
