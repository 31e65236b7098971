package io.schemawatch.internal.jdbc;

import io.schemawatch.core.JobStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.Objects;

/**
 * Table and index definitions for the local store.
 *
 * <h3>Tables</h3>
 * <ul>
 *   <li><b>sw_jobs</b>: one row per job definition, keyed by the derived job id.</li>
 *   <li><b>sw_job_history</b>: one row per execution, foreign key to {@code sw_jobs.id}.
 *       <br/>{@code idx_sw_history_job} serves per-job history listing.</li>
 *   <li><b>sw_monitoring_snapshots</b>: one row per schema check.
 *       <br/>{@code idx_sw_snapshots_conn} serves latest-snapshot lookup and pruning.</li>
 * </ul>
 *
 * <p>Every statement is {@code IF NOT EXISTS}, so {@link #ensureSchema()} can run on every startup.
 */
public class JdbcSchemaInitializer {
    private static final Logger log = LoggerFactory.getLogger(JdbcSchemaInitializer.class);

    public static final String JOBS_TABLE = "sw_jobs";
    public static final String HISTORY_TABLE = "sw_job_history";
    public static final String SNAPSHOTS_TABLE = "sw_monitoring_snapshots";

    static final List<String> DDL = List.of(
            "CREATE TABLE IF NOT EXISTS " + JOBS_TABLE + " ("
                    + " id VARCHAR(64) PRIMARY KEY,"
                    + " name VARCHAR(255) NOT NULL,"
                    + " job_type VARCHAR(255) NOT NULL,"
                    + " schedule_spec VARCHAR(64) NOT NULL,"
                    + " config_json CLOB,"
                    + " enabled BOOLEAN DEFAULT TRUE NOT NULL,"
                    + " created_at TIMESTAMP(9) WITH TIME ZONE NOT NULL,"
                    + " last_run_at TIMESTAMP(9) WITH TIME ZONE,"
                    + " next_run_at TIMESTAMP(9) WITH TIME ZONE,"
                    + " run_count BIGINT DEFAULT 0 NOT NULL"
                    + ")",
            "CREATE TABLE IF NOT EXISTS " + HISTORY_TABLE + " ("
                    + " id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,"
                    + " job_id VARCHAR(64) NOT NULL,"
                    + " started_at TIMESTAMP(9) WITH TIME ZONE NOT NULL,"
                    + " completed_at TIMESTAMP(9) WITH TIME ZONE,"
                    + " status VARCHAR(16) NOT NULL,"
                    + " result_json CLOB,"
                    + " error_message CLOB,"
                    + " CONSTRAINT fk_sw_history_job FOREIGN KEY (job_id) REFERENCES " + JOBS_TABLE + "(id)"
                    + " ON DELETE CASCADE"
                    + ")",
            "CREATE INDEX IF NOT EXISTS idx_sw_history_job ON " + HISTORY_TABLE + " (job_id, started_at)",
            "CREATE TABLE IF NOT EXISTS " + SNAPSHOTS_TABLE + " ("
                    + " id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,"
                    + " database_name VARCHAR(255) NOT NULL,"
                    + " connection_id VARCHAR(255) NOT NULL,"
                    + " taken_at TIMESTAMP(9) WITH TIME ZONE NOT NULL,"
                    + " fingerprint VARCHAR(64) NOT NULL,"
                    + " object_counts_json VARCHAR(1024) NOT NULL,"
                    + " change_detected BOOLEAN DEFAULT FALSE NOT NULL,"
                    + " change_summary VARCHAR(4096)"
                    + ")",
            "CREATE INDEX IF NOT EXISTS idx_sw_snapshots_conn ON " + SNAPSHOTS_TABLE
                    + " (database_name, connection_id, taken_at)"
    );

    private final DataSource dataSource;

    public JdbcSchemaInitializer(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource must not be null");
    }

    public void ensureSchema() {
        try (Connection conn = dataSource.getConnection();
             Statement st = conn.createStatement()) {
            for (String ddl : DDL) {
                st.execute(ddl);
            }
        } catch (SQLException e) {
            throw new JobStoreException("Failed to create schemawatch tables", e);
        }
        log.info("schemawatch tables ready: {}, {}, {}", JOBS_TABLE, HISTORY_TABLE, SNAPSHOTS_TABLE);
    }
}
