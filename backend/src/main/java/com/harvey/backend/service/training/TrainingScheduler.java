package com.harvey.backend.service.training;

import com.harvey.backend.exception.ConflictException;
import com.harvey.backend.service.ScheduledTaskGuard;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnExpression("${harvey.training.scheduler-enabled:false} or '${harvey.training.mode:server}'.equalsIgnoreCase('scheduled')")
public class TrainingScheduler {

    private final TrainingPipeline trainingPipeline;
    private final ScheduledTaskGuard scheduledTaskGuard;

    @Scheduled(cron = "${harvey.training.schedule.full-cron:0 0 2 * * *}")
    public void fullTraining() {
        scheduledTaskGuard.run("training-full", () -> runIfIdle(() -> trainingPipeline.runFull(false)));
    }

    @Scheduled(cron = "${harvey.training.schedule.incremental-cron:0 0 */6 * * *}")
    public void incrementalTraining() {
        scheduledTaskGuard.run("training-incremental", () -> runIfIdle(trainingPipeline::runIncremental));
    }

    @Scheduled(cron = "${harvey.training.schedule.validation-cron:0 0 */12 * * *}")
    public void validationSweep() {
        scheduledTaskGuard.run("training-validation", trainingPipeline::validateProduction);
    }

    private void runIfIdle(Runnable run) {
        try {
            run.run();
        } catch (ConflictException e) {
            log.info("Scheduled training skipped: {}", e.getMessage());
        }
    }
}
