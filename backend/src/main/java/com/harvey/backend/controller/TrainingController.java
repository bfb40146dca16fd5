package com.harvey.backend.controller;

import com.harvey.backend.dto.ModelStatus;
import com.harvey.backend.dto.PipelineRunSummary;
import com.harvey.backend.service.training.BackupSnapshot;
import com.harvey.backend.service.training.BackupStore;
import com.harvey.backend.service.training.ModelInventoryService;
import com.harvey.backend.service.training.PipelineRunRecorder;
import com.harvey.backend.service.training.PipelineState;
import com.harvey.backend.service.training.TrainingPipeline;
import com.harvey.backend.service.training.TrainingStatusWriter;
import com.harvey.backend.service.training.ValidationResult;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/training")
@RequiredArgsConstructor
public class TrainingController {

    private final TrainingPipeline trainingPipeline;
    private final PipelineRunRecorder runRecorder;
    private final TrainingStatusWriter statusWriter;
    private final ModelInventoryService inventoryService;
    private final BackupStore backupStore;
    private final AdminTokenGuard adminTokenGuard;

    @PostMapping("/runs")
    public ResponseEntity<PipelineRunSummary> run(@RequestHeader(value = AdminTokenGuard.HEADER, required = false) String token,
                                                  @RequestParam(defaultValue = "false") boolean force) {
        adminTokenGuard.requireAdmin(token);
        return ResponseEntity.ok(trainingPipeline.runFull(force));
    }

    @PostMapping("/runs/incremental")
    public ResponseEntity<PipelineRunSummary> runIncremental(
            @RequestHeader(value = AdminTokenGuard.HEADER, required = false) String token) {
        adminTokenGuard.requireAdmin(token);
        return ResponseEntity.ok(trainingPipeline.runIncremental());
    }

    @PostMapping("/validate")
    public ResponseEntity<List<ValidationResult>> validate(
            @RequestHeader(value = AdminTokenGuard.HEADER, required = false) String token) {
        adminTokenGuard.requireAdmin(token);
        return ResponseEntity.ok(trainingPipeline.validateProduction());
    }

    @GetMapping("/status")
    public ResponseEntity<TrainingStatusResponse> status() {
        return ResponseEntity.ok(new TrainingStatusResponse(
                trainingPipeline.getState(),
                trainingPipeline.isRunning(),
                statusWriter.readStatus().orElse(Map.of()),
                backupStore.latestSnapshot().map(BackupSnapshot::name).orElse(null)));
    }

    @GetMapping("/runs")
    public ResponseEntity<List<PipelineRunSummary>> runs() {
        return ResponseEntity.ok(runRecorder.recentRuns());
    }

    @GetMapping("/models")
    public ResponseEntity<List<ModelStatus>> models() {
        return ResponseEntity.ok(inventoryService.inventory());
    }

    public record TrainingStatusResponse(PipelineState state, boolean running, Map<String, Object> lastStatus,
                                         String latestBackup) {}
}
