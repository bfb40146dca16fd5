package com.harvey.backend.service.training;

public enum PipelineMode {
    FULL,
    /** Retrains only models that already have a production artifact. */
    INCREMENTAL
}
