package com.harvey.backend.service.training;

public enum PipelineState {
    IDLE,
    BACKING_UP,
    TRAINING,
    VALIDATING,
    PROMOTING,
    ROLLING_BACK,
    DONE
}
