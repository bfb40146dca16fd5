package com.harvey.backend.service.training;

import com.harvey.backend.config.TrainingProperties;
import com.harvey.backend.exception.TrainingJobException;
import com.harvey.backend.util.CommandRunner;
import com.harvey.backend.util.CommandRunner.CommandResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Runs the configured training command for one model. The command is expected to write
 * {@code <model><ext>} and {@code <model>.metrics.json} into the output directory.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProcessTrainingJob implements TrainingJob {

    private final TrainingProperties properties;
    private final CommandRunner commandRunner;
    private final ModelFiles modelFiles;
    private final ModelMetricsReader metricsReader;
    private final Clock clock;

    @Override
    public ModelArtifact train(TrainingProperties.Model model, Path outputDir) {
        List<String> command = properties.getTrainCommand().stream()
                .map(token -> token.replace("{model}", model.getName())
                        .replace("{dir}", outputDir.toAbsolutePath().toString()))
                .toList();
        CommandResult result;
        try {
            result = commandRunner.run(command, Paths.get(properties.getBaseDir()),
                    Duration.ofSeconds(properties.getJobTimeoutSeconds()));
        } catch (IOException e) {
            throw new TrainingJobException("Training command for " + model.getName() + " could not run", e);
        }
        if (result.timedOut()) {
            throw new TrainingJobException("Training " + model.getName() + " timed out after "
                    + properties.getJobTimeoutSeconds() + "s", true);
        }
        if (result.exitCode() != 0) {
            throw new TrainingJobException("Training " + model.getName() + " exited with " + result.exitCode()
                    + ": " + tail(result.stderr()), false);
        }
        Path artifact = modelFiles.artifact(outputDir, model.getName());
        if (!Files.isRegularFile(artifact)) {
            throw new TrainingJobException("Training " + model.getName() + " produced no artifact at " + artifact, false);
        }
        Map<String, Double> metrics = readMetrics(model, outputDir);
        log.info("Trained model={} metrics={}", model.getName(), metrics);
        return ModelArtifact.builder()
                .modelName(model.getName())
                .modelType(model.getType())
                .trainedAt(clock.instant())
                .storagePath(artifact)
                .metrics(metrics)
                .build();
    }

    private Map<String, Double> readMetrics(TrainingProperties.Model model, Path outputDir) {
        Path metricsFile = modelFiles.metrics(outputDir, model.getName());
        if (!Files.isRegularFile(metricsFile)) {
            log.warn("No metrics written model={} expected={}", model.getName(), metricsFile);
            return Map.of();
        }
        try {
            return metricsReader.read(metricsFile);
        } catch (IOException e) {
            throw new TrainingJobException("Metrics of " + model.getName() + " unreadable", e);
        }
    }

    private String tail(String text) {
        String stripped = text == null ? "" : text.strip();
        return stripped.length() <= 500 ? stripped : stripped.substring(stripped.length() - 500);
    }
}
