package io.schemawatch;

import io.schemawatch.core.MonitoredDatabase;
import io.schemawatch.core.MonitoringSnapshot;

import java.util.List;

/**
 * Periodically fingerprints the schema of every monitored database and records drift.
 */
public interface SchemaMonitor {

    void start();

    /**
     * Stop ticking. A check already in progress runs to completion.
     */
    void stop();

    boolean isRunning();

    void addDatabase(MonitoredDatabase database);

    boolean removeDatabase(String databaseName, String connectionId);

    List<MonitoredDatabase> databases();

    /**
     * Check every monitored database once. Failures are logged per database.
     */
    void checkAll();

    /**
     * Check one database now and persist the snapshot.
     *
     * @throws Exception when connecting or extracting the schema fails
     */
    MonitoringSnapshot check(MonitoredDatabase database) throws Exception;

    /**
     * Stored snapshots for a database connection, newest first.
     */
    List<MonitoringSnapshot> snapshots(String databaseName, String connectionId, int limit);
}
