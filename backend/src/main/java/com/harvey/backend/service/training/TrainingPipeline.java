package com.harvey.backend.service.training;

import com.harvey.backend.config.HealingProperties;
import com.harvey.backend.config.TrainingProperties;
import com.harvey.backend.dto.PipelineRunSummary;
import com.harvey.backend.exception.ConflictException;
import com.harvey.backend.exception.RollbackFailureException;
import com.harvey.backend.exception.TrainingJobException;
import com.harvey.backend.service.NotificationService;
import com.harvey.backend.service.healing.SelfHealingManager;
import com.harvey.backend.service.healing.ServiceLocks;
import com.harvey.backend.service.healing.SettleDelay;
import io.github.resilience4j.timelimiter.TimeLimiter;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Backup, retrain every registered model, validate, then promote or roll back and
 * restart the inference service. One run at a time; steps are strictly sequential.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TrainingPipeline {

    private static final DateTimeFormatter STAGING_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final TrainingProperties properties;
    private final HealingProperties healingProperties;
    private final BackupStore backupStore;
    private final ModelValidator validator;
    private final TrainingJob trainingJob;
    private final ModelFiles modelFiles;
    private final SelfHealingManager selfHealingManager;
    private final ServiceLocks serviceLocks;
    private final SettleDelay settleDelay;
    private final NotificationService notificationService;
    private final PipelineRunRecorder runRecorder;
    @Qualifier("trainingTimeLimiter")
    private final TimeLimiter trainingTimeLimiter;
    @Qualifier("trainingExecutor")
    private final ThreadPoolTaskExecutor trainingExecutor;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile boolean shuttingDown = false;
    private volatile PipelineState state = PipelineState.IDLE;

    private record Decision(RunStatus status, boolean restartTriggered, String error) {}

    public PipelineRunSummary runFull(boolean force) {
        return run(PipelineMode.FULL, force);
    }

    public PipelineRunSummary runIncremental() {
        return run(PipelineMode.INCREMENTAL, false);
    }

    /**
     * @throws ConflictException when another run is in progress
     * @throws RollbackFailureException when restoring the backup failed
     */
    public PipelineRunSummary run(PipelineMode mode, boolean force) {
        if (!running.compareAndSet(false, true)) {
            throw new ConflictException("Training pipeline already running (state " + state + ")");
        }
        try {
            return execute(mode, force);
        } finally {
            state = PipelineState.DONE;
            running.set(false);
        }
    }

    /**
     * Re-validates the models currently in production.
     */
    public List<ValidationResult> validateProduction() {
        List<ValidationResult> results = validator.validateProduction();
        List<String> rejected = results.stream()
                .filter(result -> !result.passed())
                .map(result -> result.modelName() + " (" + result.reason() + ")")
                .toList();
        if (!rejected.isEmpty()) {
            notificationService.notify("Model validation failed: " + String.join(", ", rejected), false);
        }
        return results;
    }

    public PipelineState getState() {
        return state;
    }

    public boolean isRunning() {
        return running.get();
    }

    @PreDestroy
    public void shutdown() {
        shuttingDown = true;
    }

    private PipelineRunSummary execute(PipelineMode mode, boolean force) {
        String runId = UUID.randomUUID().toString();
        List<TrainingProperties.Model> models = properties.getModels();
        PipelineRunSummary.PipelineRunSummaryBuilder summary = PipelineRunSummary.builder()
                .runId(runId)
                .mode(mode)
                .forced(force)
                .startedAt(clock.instant())
                .totalModels(models.size());
        log.info("🚀 Training pipeline started runId={} mode={} force={} models={}", runId, mode, force, models.size());
        notificationService.notify("Training started (" + mode.name().toLowerCase() + (force ? ", forced" : "") + ")", true);

        Path baseDir = Paths.get(properties.getBaseDir());
        if (!Files.isDirectory(baseDir)) {
            return finishEarly(summary, RunStatus.PREREQUISITES_FAILED, "Training directory missing: " + baseDir);
        }

        state = PipelineState.BACKING_UP;
        Path modelsDir = modelFiles.modelsDir();
        BackupSnapshot snapshot = takeBackup(modelsDir);
        summary.backupPath(snapshot == null ? null : snapshot.path().toString());

        state = PipelineState.TRAINING;
        Path stagingDir = createStagingDir(runId);
        List<ModelRunResult> results = new ArrayList<>();
        Map<String, ModelArtifact> candidates = new LinkedHashMap<>();
        trainAll(mode, force, models, stagingDir, results, candidates);

        state = PipelineState.VALIDATING;
        List<ModelArtifact> validated = validate(results, candidates);

        long trained = results.stream().filter(result -> result.outcome() == ModelOutcome.SUCCESS).count();
        long counted = results.stream().filter(result -> result.outcome().countsAsSuccess()).count();
        double successRate = models.isEmpty() ? 0.0 : (double) counted / models.size();
        boolean healthy = successRate >= properties.getHealthySuccessRate();
        summary.outcomes(List.copyOf(results))
                .successRate(successRate)
                .modelsTrained((int) trained);
        log.info("Training results runId={} trained={} skipped={} failed={} successRate={}", runId, trained,
                counted - trained, models.size() - counted, String.format("%.3f", successRate));

        Decision decision;
        try {
            decision = serviceLocks.withLock(properties.getInferenceService(),
                            Duration.ofSeconds(healingProperties.getLockWaitSeconds()),
                            () -> promoteOrRollback(healthy, trained > 0, successRate, validated, snapshot, modelsDir))
                    .orElseGet(() -> new Decision(RunStatus.NEEDS_ATTENTION, false,
                            "inference service busy, production models left unchanged"));
        } catch (RollbackFailureException e) {
            PipelineRunSummary failed = summary.status(RunStatus.ROLLBACK_FAILED)
                    .finishedAt(clock.instant())
                    .errorMessage(e.getMessage())
                    .build();
            runRecorder.record(failed);
            selfHealingManager.recordFailure(properties.getTrainingService(), "rollback failed: " + e.getMessage());
            notificationService.critical("ROLLBACK FAILED: " + e.getMessage() + ". Manual intervention required.");
            cleanupStaging(stagingDir);
            throw e;
        }

        PipelineRunSummary result = summary.status(decision.status())
                .restartTriggered(decision.restartTriggered())
                .errorMessage(decision.error())
                .finishedAt(clock.instant())
                .build();
        reportOutcome(result);
        runRecorder.record(result);
        cleanupStaging(stagingDir);
        pruneBackups();
        notificationService.notify(String.format("Training %s: %d/%d trained, success rate %.0f%%",
                result.getStatus().isHealthy() ? "completed" : "needs attention (" + result.getStatus() + ")",
                result.getModelsTrained(), result.getTotalModels(), successRate * 100), result.getStatus().isHealthy());
        log.info("🏁 Training pipeline finished runId={} status={} restart={}", runId, result.getStatus(),
                result.isRestartTriggered());
        return result;
    }

    private PipelineRunSummary finishEarly(PipelineRunSummary.PipelineRunSummaryBuilder summary, RunStatus status,
                                           String error) {
        log.error("Training pipeline aborted status={} error={}", status, error);
        PipelineRunSummary result = summary.status(status)
                .finishedAt(clock.instant())
                .errorMessage(error)
                .build();
        runRecorder.record(result);
        selfHealingManager.recordFailure(properties.getTrainingService(), error);
        notificationService.notify("Training aborted: " + error, false);
        return result;
    }

    private BackupSnapshot takeBackup(Path modelsDir) {
        try {
            return backupStore.backup(modelsDir);
        } catch (UncheckedIOException e) {
            log.error("Backup failed, continuing without a rollback point", e);
            return null;
        }
    }

    private Path createStagingDir(String runId) {
        String stamp = STAGING_FORMAT.format(LocalDateTime.ofInstant(clock.instant(), ZoneOffset.UTC));
        Path dir = Paths.get(properties.getStagingDir()).resolve("run_" + stamp + "_" + runId.substring(0, 8));
        try {
            return Files.createDirectories(dir);
        } catch (IOException e) {
            log.error("Cannot create staging directory {}", dir, e);
            return null;
        }
    }

    private void trainAll(PipelineMode mode, boolean force, List<TrainingProperties.Model> models, Path stagingDir,
                          List<ModelRunResult> results, Map<String, ModelArtifact> candidates) {
        boolean first = true;
        boolean interrupted = false;
        for (TrainingProperties.Model model : models) {
            if (shuttingDown) {
                results.add(ModelRunResult.failed(model.getName(), "cancelled: application shutting down"));
                continue;
            }
            if (interrupted) {
                results.add(ModelRunResult.failed(model.getName(), "cancelled: interrupted"));
                continue;
            }
            Optional<ModelRunResult> skipped = skipDecision(mode, force, model);
            if (skipped.isPresent()) {
                log.info("⏭️ Skipping model={} reason={}", model.getName(), skipped.get().error());
                results.add(skipped.get());
                continue;
            }
            if (!first && !settleDelay.await(Duration.ofSeconds(properties.getInterModelDelaySeconds()))) {
                log.warn("Inter-model delay interrupted, cancelling remaining models from {}", model.getName());
                interrupted = true;
                results.add(ModelRunResult.failed(model.getName(), "cancelled: interrupted"));
                continue;
            }
            first = false;
            if (stagingDir == null) {
                results.add(ModelRunResult.failed(model.getName(), "staging directory unavailable"));
                continue;
            }
            results.add(trainOne(model, stagingDir, candidates));
        }
    }

    private Optional<ModelRunResult> skipDecision(PipelineMode mode, boolean force, TrainingProperties.Model model) {
        Optional<Double> age;
        try {
            age = modelFiles.ageDays(modelFiles.productionArtifact(model.getName()));
        } catch (IOException e) {
            log.warn("Cannot read age of model={}", model.getName(), e);
            age = Optional.empty();
        }
        if (mode == PipelineMode.INCREMENTAL) {
            if (age.isEmpty()) {
                return Optional.of(new ModelRunResult(model.getName(), ModelOutcome.SKIPPED,
                        "no production artifact", null, Map.of(), null));
            }
            if (!force && age.get() < properties.getIncrementalAgeDays()) {
                return Optional.of(ModelRunResult.skipped(model.getName(), age.get(),
                        String.format("updated %.1f days ago", age.get())));
            }
            return Optional.empty();
        }
        if (!force && age.isPresent() && age.get() < properties.getFreshnessDays()) {
            return Optional.of(ModelRunResult.skipped(model.getName(), age.get(),
                    String.format("fresh, trained %.1f days ago", age.get())));
        }
        return Optional.empty();
    }

    private ModelRunResult trainOne(TrainingProperties.Model model, Path stagingDir,
                                    Map<String, ModelArtifact> candidates) {
        String name = model.getName();
        log.info("🔄 Training model={}", name);
        try {
            ModelArtifact artifact = trainingTimeLimiter.executeFutureSupplier(
                    () -> trainingExecutor.submit(() -> trainingJob.train(model, stagingDir)));
            candidates.put(name, artifact);
            return ModelRunResult.trained(artifact);
        } catch (TimeoutException e) {
            Duration limit = trainingTimeLimiter.getTimeLimiterConfig().getTimeoutDuration();
            log.error("⏰ Training timed out model={} limit={}s", name, limit.toSeconds());
            return ModelRunResult.timedOut(name, "timed out after " + limit.toSeconds() + "s");
        } catch (TrainingJobException e) {
            log.error("❌ Training failed model={} error={}", name, e.getMessage());
            return e.isTimedOut() ? ModelRunResult.timedOut(name, e.getMessage())
                    : ModelRunResult.failed(name, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ModelRunResult.failed(name, "interrupted");
        } catch (Exception e) {
            log.error("❌ Training failed model={}", name, e);
            return ModelRunResult.failed(name, e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        }
    }

    private List<ModelArtifact> validate(List<ModelRunResult> results, Map<String, ModelArtifact> candidates) {
        List<ModelArtifact> validated = new ArrayList<>();
        for (int i = 0; i < results.size(); i++) {
            ModelRunResult result = results.get(i);
            if (result.outcome() != ModelOutcome.SUCCESS) {
                continue;
            }
            ModelArtifact artifact = candidates.get(result.model());
            ValidationResult validation = validator.validate(artifact);
            results.set(i, result.withValidation(validation));
            if (validation.passed()) {
                validated.add(artifact.toBuilder().status(ModelArtifact.Status.VALIDATED).build());
            }
        }
        return validated;
    }

    private Decision promoteOrRollback(boolean healthy, boolean trainedAny, double successRate,
                                       List<ModelArtifact> validated, BackupSnapshot snapshot, Path modelsDir) {
        String reason;
        if (healthy) {
            state = PipelineState.PROMOTING;
            try {
                promote(validated, modelsDir);
                if (trainedAny) {
                    restartInference();
                }
                return new Decision(RunStatus.HEALTHY, trainedAny, null);
            } catch (IOException e) {
                log.error("Promotion failed, rolling back", e);
                reason = "promotion failed: " + e.getMessage();
            }
        } else {
            reason = String.format("success rate %.2f below %.2f", successRate, properties.getHealthySuccessRate());
        }

        state = PipelineState.ROLLING_BACK;
        if (snapshot == null) {
            log.warn("⚠️ No backup snapshot to restore reason={}", reason);
            return new Decision(RunStatus.NEEDS_ATTENTION, false, reason + "; no backup to restore");
        }
        log.warn("Rolling back to snapshot={} reason={}", snapshot.name(), reason);
        backupStore.restore(snapshot, modelsDir);
        restartInference();
        notificationService.notify("Training rolled back to " + snapshot.name() + ": " + reason, false);
        return new Decision(RunStatus.ROLLED_BACK, true, reason);
    }

    private void promote(List<ModelArtifact> artifacts, Path modelsDir) throws IOException {
        Files.createDirectories(modelsDir);
        for (ModelArtifact artifact : artifacts) {
            Path source = artifact.getStoragePath();
            Files.copy(source, modelsDir.resolve(source.getFileName()), StandardCopyOption.REPLACE_EXISTING);
            Path metrics = modelFiles.metrics(source.getParent(), artifact.getModelName());
            if (Files.isRegularFile(metrics)) {
                Files.copy(metrics, modelFiles.metrics(modelsDir, artifact.getModelName()),
                        StandardCopyOption.REPLACE_EXISTING);
            }
            log.info("📦 Promoted model={}", artifact.getModelName());
        }
    }

    private void restartInference() {
        String service = properties.getInferenceService();
        boolean restarted = selfHealingManager.attemptRecovery(service);
        if (restarted) {
            log.info("Restarted service={} to load models", service);
        } else {
            log.error("Restart failed service={}", service);
        }
    }

    private void reportOutcome(PipelineRunSummary result) {
        if (result.getStatus().isHealthy()) {
            selfHealingManager.recordSuccess(properties.getTrainingService());
        } else {
            selfHealingManager.recordFailure(properties.getTrainingService(),
                    "training run " + result.getStatus() + ": " + result.getErrorMessage());
        }
    }

    private void pruneBackups() {
        try {
            int removed = backupStore.prune(properties.getBackupRetention());
            if (removed > 0) {
                log.info("Pruned backups removed={} keep={}", removed, properties.getBackupRetention());
            }
        } catch (UncheckedIOException e) {
            log.warn("Backup pruning failed", e);
        }
    }

    private void cleanupStaging(Path stagingDir) {
        if (stagingDir == null) {
            return;
        }
        try {
            FileSystemUtils.deleteRecursively(stagingDir);
        } catch (IOException e) {
            log.warn("Could not remove staging directory {}", stagingDir, e);
        }
    }
}
