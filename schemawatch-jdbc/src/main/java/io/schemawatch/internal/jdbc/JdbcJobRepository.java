package io.schemawatch.internal.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.schemawatch.core.ExecutionRecord;
import io.schemawatch.core.ExecutionStatus;
import io.schemawatch.core.JobDefinition;
import io.schemawatch.core.JobStoreException;
import io.schemawatch.spi.JobRepository;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import static io.schemawatch.internal.jdbc.JdbcSchemaInitializer.HISTORY_TABLE;
import static io.schemawatch.internal.jdbc.JdbcSchemaInitializer.JOBS_TABLE;
import static io.schemawatch.internal.jdbc.JdbcSupport.getInstant;
import static io.schemawatch.internal.jdbc.JdbcSupport.setInstant;

/**
 * JDBC persistence for job definitions and execution history.
 *
 * <p>Config and result payloads are stored as JSON text. Each method borrows one pooled
 * connection and commits before returning.
 */
public class JdbcJobRepository implements JobRepository {

    private static final TypeReference<Map<String, Object>> CONFIG_TYPE = new TypeReference<>() {
    };

    private static final String JOB_COLUMNS =
            "id, name, job_type, schedule_spec, config_json, enabled, created_at, last_run_at, next_run_at, run_count";

    private static final String HISTORY_SELECT =
            "SELECT h.id, h.job_id, j.name AS job_name, h.started_at, h.completed_at, h.status,"
                    + " h.result_json, h.error_message"
                    + " FROM " + HISTORY_TABLE + " h LEFT JOIN " + JOBS_TABLE + " j ON j.id = h.job_id";

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;

    public JdbcJobRepository(DataSource dataSource, ObjectMapper objectMapper) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    @Override
    public void insert(JobDefinition job) {
        Objects.requireNonNull(job, "job must not be null");
        String sql = "INSERT INTO " + JOBS_TABLE + " (" + JOB_COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, job.id());
            ps.setString(2, job.name());
            ps.setString(3, job.jobType());
            ps.setString(4, job.scheduleSpec());
            ps.setString(5, writeJson(job.config()));
            ps.setBoolean(6, job.enabled());
            setInstant(ps, 7, job.createdAt());
            setInstant(ps, 8, job.lastRunAt());
            setInstant(ps, 9, job.nextRunAt());
            ps.setLong(10, job.runCount());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new JobStoreException("Failed to insert job id=" + job.id(), e);
        }
    }

    @Override
    public Optional<JobDefinition> findById(String jobId) {
        if (jobId == null) {
            return Optional.empty();
        }
        List<JobDefinition> found = queryJobs("SELECT " + JOB_COLUMNS + " FROM " + JOBS_TABLE + " WHERE id = ?", jobId);
        return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
    }

    @Override
    public List<JobDefinition> findAll() {
        return queryJobs("SELECT " + JOB_COLUMNS + " FROM " + JOBS_TABLE + " ORDER BY name, created_at");
    }

    @Override
    public List<JobDefinition> findEnabled() {
        return queryJobs("SELECT " + JOB_COLUMNS + " FROM " + JOBS_TABLE
                + " WHERE enabled = TRUE ORDER BY created_at, name");
    }

    @Override
    public boolean setEnabled(String jobId, boolean enabled) {
        return update("UPDATE " + JOBS_TABLE + " SET enabled = ? WHERE id = ?", "set enabled on job id=" + jobId,
                ps -> {
                    ps.setBoolean(1, enabled);
                    ps.setString(2, jobId);
                }) > 0;
    }

    @Override
    public boolean delete(String jobId) {
        return JdbcSupport.inTransaction(dataSource, "delete job id=" + jobId, conn -> {
            try (PreparedStatement history = conn.prepareStatement("DELETE FROM " + HISTORY_TABLE + " WHERE job_id = ?");
                 PreparedStatement job = conn.prepareStatement("DELETE FROM " + JOBS_TABLE + " WHERE id = ?")) {
                history.setString(1, jobId);
                history.executeUpdate();
                job.setString(1, jobId);
                return job.executeUpdate() > 0;
            }
        });
    }

    @Override
    public void recordRun(String jobId, Instant lastRunAt, Instant nextRunAt) {
        update("UPDATE " + JOBS_TABLE + " SET last_run_at = ?, next_run_at = ?, run_count = run_count + 1 WHERE id = ?",
                "record run of job id=" + jobId,
                ps -> {
                    setInstant(ps, 1, lastRunAt);
                    setInstant(ps, 2, nextRunAt);
                    ps.setString(3, jobId);
                });
    }

    @Override
    public void updateNextRun(String jobId, Instant nextRunAt) {
        update("UPDATE " + JOBS_TABLE + " SET next_run_at = ? WHERE id = ?", "update next run of job id=" + jobId,
                ps -> {
                    setInstant(ps, 1, nextRunAt);
                    ps.setString(2, jobId);
                });
    }

    @Override
    public long openExecution(String jobId, Instant startedAt) {
        String sql = "INSERT INTO " + HISTORY_TABLE + " (job_id, started_at, status) VALUES (?, ?, ?)";
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
            ps.setString(1, jobId);
            setInstant(ps, 2, startedAt);
            ps.setString(3, ExecutionStatus.RUNNING.code());
            ps.executeUpdate();

            try (ResultSet keys = ps.getGeneratedKeys()) {
                if (!keys.next()) {
                    throw new SQLException("No generated key returned for execution record");
                }
                return keys.getLong(1);
            }
        } catch (SQLException e) {
            throw new JobStoreException("Failed to open execution record for job id=" + jobId, e);
        }
    }

    @Override
    public boolean closeExecution(long executionId, Instant completedAt, ExecutionStatus status, JsonNode result,
                                  String errorMessage) {
        Objects.requireNonNull(status, "status must not be null");
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("status must be terminal: " + status);
        }
        String resultJson = (result == null || result.isNull()) ? null : writeJson(result);

        return update("UPDATE " + HISTORY_TABLE + " SET completed_at = ?, status = ?, result_json = ?, error_message = ?"
                        + " WHERE id = ? AND status = ?",
                "close execution record id=" + executionId,
                ps -> {
                    setInstant(ps, 1, completedAt);
                    ps.setString(2, status.code());
                    ps.setString(3, resultJson);
                    ps.setString(4, errorMessage);
                    ps.setLong(5, executionId);
                    ps.setString(6, ExecutionStatus.RUNNING.code());
                }) > 0;
    }

    @Override
    public Optional<ExecutionRecord> findExecution(long executionId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(HISTORY_SELECT + " WHERE h.id = ?")) {
            ps.setLong(1, executionId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapExecution(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new JobStoreException("Failed to load execution record id=" + executionId, e);
        }
    }

    @Override
    public List<ExecutionRecord> findHistory(String jobId, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be a positive number");
        }
        String sql = HISTORY_SELECT
                + (jobId == null ? "" : " WHERE h.job_id = ?")
                + " ORDER BY h.started_at DESC, h.id DESC FETCH FIRST ? ROWS ONLY";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            int i = 1;
            if (jobId != null) {
                ps.setString(i++, jobId);
            }
            ps.setInt(i, limit);

            List<ExecutionRecord> out = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(mapExecution(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new JobStoreException("Failed to load execution history jobId=" + jobId, e);
        }
    }

    @FunctionalInterface
    private interface Binder {
        void bind(PreparedStatement ps) throws SQLException;
    }

    private int update(String sql, String operation, Binder binder) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            binder.bind(ps);
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new JobStoreException("Failed to " + operation, e);
        }
    }

    private List<JobDefinition> queryJobs(String sql, String... params) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            for (int i = 0; i < params.length; i++) {
                ps.setString(i + 1, params[i]);
            }
            List<JobDefinition> out = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(mapJob(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new JobStoreException("Failed to load jobs", e);
        }
    }

    private JobDefinition mapJob(ResultSet rs) throws SQLException {
        String configJson = rs.getString("config_json");
        Map<String, Object> config;
        try {
            config = configJson == null ? Map.of() : objectMapper.readValue(configJson, CONFIG_TYPE);
        } catch (JsonProcessingException e) {
            throw new JobStoreException("Stored config is not valid JSON for job id=" + rs.getString("id"), e);
        }

        return new JobDefinition(
                rs.getString("id"),
                rs.getString("name"),
                rs.getString("job_type"),
                rs.getString("schedule_spec"),
                rs.getBoolean("enabled"),
                config,
                getInstant(rs, "created_at"),
                getInstant(rs, "last_run_at"),
                getInstant(rs, "next_run_at"),
                rs.getLong("run_count")
        );
    }

    private ExecutionRecord mapExecution(ResultSet rs) throws SQLException {
        String resultJson = rs.getString("result_json");
        JsonNode result;
        try {
            result = resultJson == null ? null : objectMapper.readTree(resultJson);
        } catch (JsonProcessingException e) {
            throw new JobStoreException("Stored result is not valid JSON for execution id=" + rs.getLong("id"), e);
        }

        return new ExecutionRecord(
                rs.getLong("id"),
                rs.getString("job_id"),
                rs.getString("job_name"),
                getInstant(rs, "started_at"),
                getInstant(rs, "completed_at"),
                ExecutionStatus.fromCode(rs.getString("status")),
                result,
                rs.getString("error_message")
        );
    }

    private String writeJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new JobStoreException("Failed to serialize value to JSON", e);
        }
    }
}
