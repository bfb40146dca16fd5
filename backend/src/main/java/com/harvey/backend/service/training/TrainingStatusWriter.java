package com.harvey.backend.service.training;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.harvey.backend.config.TrainingProperties;
import com.harvey.backend.dto.PipelineRunSummary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Writes the JSON documents read by external monitoring: the full summary of the latest
 * run and a small current-status file.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TrainingStatusWriter {

    private static final TypeReference<LinkedHashMap<String, Object>> STATUS_TYPE = new TypeReference<>() {};

    private final TrainingProperties properties;
    private final ObjectMapper objectMapper;

    public void write(PipelineRunSummary summary) {
        writeJson(Paths.get(properties.getMetricsFile()), summary);
        writeJson(Paths.get(properties.getStatusFile()), statusDocument(summary));
    }

    public Map<String, Object> statusDocument(PipelineRunSummary summary) {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("last_training", summary.getFinishedAt() != null
                ? summary.getFinishedAt().toString() : summary.getStartedAt().toString());
        status.put("models_trained", summary.getModelsTrained());
        status.put("total_models", summary.getTotalModels());
        status.put("status", summary.getStatus().isHealthy() ? "healthy" : "needs_attention");
        status.put("run_status", summary.getStatus().name());
        status.put("success_rate", summary.getSuccessRate());
        return status;
    }

    public Optional<Map<String, Object>> readStatus() {
        Path file = Paths.get(properties.getStatusFile());
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(file.toFile(), STATUS_TYPE));
        } catch (IOException e) {
            log.warn("Unreadable training status file={}", file, e);
            return Optional.empty();
        }
    }

    private void writeJson(Path file, Object document) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), document);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            log.error("Failed to write training status file={}", file, e);
        }
    }
}
