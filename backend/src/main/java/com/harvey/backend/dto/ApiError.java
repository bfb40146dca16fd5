package com.harvey.backend.dto;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Error body returned by every endpoint. {@code requestId} matches the X-Request-Id header.
 */
@Value
@Builder
public class ApiError {
    Instant timestamp;
    String path;
    int status;
    String error;
    String message;
    String requestId;
    @Builder.Default
    List<FieldIssue> details = List.of();

    public record FieldIssue(String field, String issue) {}
}
