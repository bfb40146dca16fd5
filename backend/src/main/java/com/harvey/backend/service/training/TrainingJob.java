package com.harvey.backend.service.training;

import com.harvey.backend.config.TrainingProperties;

import java.nio.file.Path;

public interface TrainingJob {

    /**
     * Trains one model into {@code outputDir}.
     *
     * @throws com.harvey.backend.exception.TrainingJobException when the job fails or exceeds its time limit
     */
    ModelArtifact train(TrainingProperties.Model model, Path outputDir);
}
