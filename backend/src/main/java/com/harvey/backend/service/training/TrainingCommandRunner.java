package com.harvey.backend.service.training;

import com.harvey.backend.config.TrainingProperties;
import com.harvey.backend.dto.PipelineRunSummary;
import com.harvey.backend.exception.RollbackFailureException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Command-line entry: {@code --harvey.training.mode=once|incremental|scheduled} and
 * {@code --harvey.training.force=true}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TrainingCommandRunner implements ApplicationRunner {

    static final int EXIT_OK = 0;
    static final int EXIT_NEEDS_ATTENTION = 1;
    static final int EXIT_ROLLBACK_FAILED = 2;

    private final TrainingProperties properties;
    private final TrainingPipeline trainingPipeline;
    private final ConfigurableApplicationContext context;

    @Override
    public void run(ApplicationArguments args) {
        TrainingProperties.Mode mode = properties.getMode();
        switch (mode) {
            case ONCE -> finish(execute(() -> trainingPipeline.runFull(properties.isForce())));
            case INCREMENTAL -> finish(execute(trainingPipeline::runIncremental));
            case SCHEDULED -> log.info("⏰ Training scheduler active full={} incremental={} validation={}",
                    properties.getSchedule().getFullCron(), properties.getSchedule().getIncrementalCron(),
                    properties.getSchedule().getValidationCron());
            default -> log.debug("Training runner idle in mode={}", mode);
        }
    }

    int execute(Supplier<PipelineRunSummary> run) {
        try {
            PipelineRunSummary summary = run.get();
            log.info("Training run finished status={} trained={}/{}", summary.getStatus(),
                    summary.getModelsTrained(), summary.getTotalModels());
            return summary.getStatus().isHealthy() ? EXIT_OK : EXIT_NEEDS_ATTENTION;
        } catch (RollbackFailureException e) {
            log.error("Training run failed, rollback failed", e);
            return EXIT_ROLLBACK_FAILED;
        }
    }

    private void finish(int exitCode) {
        if (properties.isExitAfterRun()) {
            System.exit(SpringApplication.exit(context, () -> exitCode));
        }
    }
}
