package com.harvey.backend.service.training;

import java.nio.file.Path;
import java.time.Instant;

public record BackupSnapshot(String name, Instant createdAt, Path path) {}
