package com.harvey.backend.service.training;

import com.harvey.backend.config.TrainingProperties;
import com.harvey.backend.dto.ModelStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class ModelInventoryService {

    private final TrainingProperties properties;
    private final ModelFiles modelFiles;

    public List<ModelStatus> inventory() {
        List<ModelStatus> statuses = new ArrayList<>();
        for (TrainingProperties.Model model : properties.getModels()) {
            statuses.add(status(model));
        }
        return statuses;
    }

    private ModelStatus status(TrainingProperties.Model model) {
        Path artifact = modelFiles.productionArtifact(model.getName());
        ModelStatus.ModelStatusBuilder builder = ModelStatus.builder()
                .name(model.getName())
                .type(model.getType());
        try {
            Optional<Double> age = modelFiles.ageDays(artifact);
            if (age.isEmpty()) {
                return builder.exists(false).health(ModelHealth.MISSING).build();
            }
            double ageDays = Math.round(age.get() * 10.0) / 10.0;
            return builder.exists(true)
                    .sizeMb(Math.round(Files.size(artifact) / 1024.0 / 1024.0 * 100.0) / 100.0)
                    .modifiedAt(Files.getLastModifiedTime(artifact).toInstant())
                    .ageDays(ageDays)
                    .health(ModelHealth.forAge(age.get()))
                    .build();
        } catch (IOException e) {
            log.warn("Cannot stat model={} path={}", model.getName(), artifact, e);
            return builder.exists(false).health(ModelHealth.MISSING).build();
        }
    }
}
