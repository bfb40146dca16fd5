package com.harvey.backend.dto;

import com.harvey.backend.service.training.ModelHealth;
import com.harvey.backend.service.training.ModelType;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class ModelStatus {
    String name;
    ModelType type;
    boolean exists;
    Double sizeMb;
    Instant modifiedAt;
    Double ageDays;
    ModelHealth health;
}
