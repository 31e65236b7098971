package io.schemawatch;

import io.schemawatch.core.ExecutionRecord;
import io.schemawatch.core.JobDefinition;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Main scheduler API.
 *
 * <p>Typical usage:
 * <pre>{@code
 * scheduler.registerJobType("generate-docs", config -> docs.generate(config));
 * String id = scheduler.addJob("nightly docs", "generate-docs", "02:30", Map.of("database", "sales"));
 * scheduler.start();
 * ...
 * scheduler.stop();
 * }</pre>
 *
 * <p>Schedule specs: {@code daily}, {@code weekly}, {@code hourly}, {@code every_<N>_minutes},
 * {@code every_<N>_hours} and {@code HH:MM}.
 */
public interface JobScheduler {

    /**
     * Start the scheduler loop. Loads enabled jobs from the store and schedules them. Idempotent.
     */
    void start();

    /**
     * Stop ticking and clear all scheduled jobs. An execution already in progress runs to completion.
     */
    void stop();

    boolean isRunning();

    /**
     * Register a handler under its own {@link JobHandler#type()}. Re-registration overwrites.
     */
    void registerJobType(JobHandler<?> handler);

    /**
     * Register a handler under the given type name. Re-registration overwrites.
     */
    void registerJobType(String type, JobHandler<?> handler);

    void registerJobType(String type, JobFunction function);

    /**
     * Persist a new job definition.
     *
     * @return the new job id
     * @throws io.schemawatch.core.JobConfigurationException if the type is not registered or the
     *                                                      schedule spec is malformed
     */
    String addJob(String name, String type, String scheduleSpec, Map<String, Object> config);

    Optional<JobDefinition> findJob(String jobId);

    /**
     * All job definitions ordered by name.
     */
    List<JobDefinition> listJobs();

    boolean setEnabled(String jobId, boolean enabled);

    boolean deleteJob(String jobId);

    /**
     * Mark a scheduled job as due so the next tick runs it.
     *
     * @return false if the job is not currently scheduled
     */
    boolean triggerNow(String jobId);

    /**
     * Execution history, newest first.
     *
     * @param jobId job filter; null means all jobs
     */
    List<ExecutionRecord> history(String jobId, int limit);

    /**
     * Process one tick: run every job that is due now.
     *
     * @return number of executions
     */
    int runPending();
}
