package io.schemawatch.spi;

import com.fasterxml.jackson.databind.JsonNode;
import io.schemawatch.core.ExecutionRecord;
import io.schemawatch.core.ExecutionStatus;
import io.schemawatch.core.JobDefinition;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable job definitions and execution history.
 *
 * <p>Every method is one self-contained transaction. Failures surface as
 * {@link io.schemawatch.core.JobStoreException}.
 */
public interface JobRepository {

    void insert(JobDefinition job);

    Optional<JobDefinition> findById(String jobId);

    /**
     * All jobs ordered by name.
     */
    List<JobDefinition> findAll();

    List<JobDefinition> findEnabled();

    boolean setEnabled(String jobId, boolean enabled);

    /**
     * Delete the job and its execution history.
     */
    boolean delete(String jobId);

    /**
     * Set last-run and next-run and increment the run count.
     */
    void recordRun(String jobId, Instant lastRunAt, Instant nextRunAt);

    void updateNextRun(String jobId, Instant nextRunAt);

    /**
     * Insert a {@link ExecutionStatus#RUNNING} history record.
     *
     * @return the generated record id
     */
    long openExecution(String jobId, Instant startedAt);

    /**
     * Close a running record with a terminal status. Records that are already closed are left as is.
     *
     * @return true if the record was closed by this call
     */
    boolean closeExecution(long executionId, Instant completedAt, ExecutionStatus status, JsonNode result,
                           String errorMessage);

    Optional<ExecutionRecord> findExecution(long executionId);

    /**
     * Newest first.
     *
     * @param jobId null for all jobs
     */
    List<ExecutionRecord> findHistory(String jobId, int limit);
}
