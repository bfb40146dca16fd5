package com.harvey.backend.service.training;

public enum ModelType {
    REGRESSION,
    CLASSIFICATION,
    CLUSTERING,
    ANOMALY_DETECTION
}
