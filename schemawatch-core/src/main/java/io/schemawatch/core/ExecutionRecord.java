package io.schemawatch.core;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * One run of a job. Created as {@link ExecutionStatus#RUNNING} and closed exactly once.
 */
public record ExecutionRecord(
        long id,
        String jobId,
        String jobName,
        Instant startedAt,
        Instant completedAt,
        ExecutionStatus status,
        JsonNode result,
        String errorMessage
) {
}
