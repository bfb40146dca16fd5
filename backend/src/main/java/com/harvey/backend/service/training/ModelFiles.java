package com.harvey.backend.service.training;

import com.harvey.backend.config.TrainingProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Naming of model artifacts and their metrics sidecars inside a model directory.
 */
@Component
@RequiredArgsConstructor
public class ModelFiles {

    static final String METRICS_SUFFIX = ".metrics.json";

    private final TrainingProperties properties;
    private final Clock clock;

    public Path modelsDir() {
        return Paths.get(properties.getModelsDir());
    }

    public Path artifact(Path dir, String modelName) {
        return dir.resolve(modelName + properties.getArtifactExtension());
    }

    public Path metrics(Path dir, String modelName) {
        return dir.resolve(modelName + METRICS_SUFFIX);
    }

    public Path productionArtifact(String modelName) {
        return artifact(modelsDir(), modelName);
    }

    public Optional<Instant> lastModified(Path file) throws IOException {
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        return Optional.of(Files.getLastModifiedTime(file).toInstant());
    }

    /**
     * Age in fractional days, empty when the file does not exist.
     */
    public Optional<Double> ageDays(Path file) throws IOException {
        return lastModified(file)
                .map(modified -> Duration.between(modified, clock.instant()).toSeconds() / 86_400.0);
    }
}
