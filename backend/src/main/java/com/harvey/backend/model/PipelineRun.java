package com.harvey.backend.model;

import com.harvey.backend.service.training.PipelineMode;
import com.harvey.backend.service.training.RunStatus;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "pipeline_runs")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PipelineRun {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 36)
    private String runId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private PipelineMode mode;

    private boolean forced;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    private RunStatus status;

    @Column(nullable = false)
    private Instant startedAt;

    private Instant finishedAt;

    private double successRate;
    private int modelsTrained;
    private int totalModels;
    private String backupPath;
    private boolean restartTriggered;

    @Column(columnDefinition = "TEXT")
    private String errorMessage;

    // per-model outcomes as a JSON array
    @Column(columnDefinition = "TEXT")
    private String outcomesPayload;
}
