package io.schemawatch.spi;

import io.schemawatch.core.MonitoringSnapshot;

import java.util.List;
import java.util.Optional;

/**
 * Durable monitoring snapshots keyed by (database name, connection id).
 */
public interface SnapshotRepository {

    Optional<MonitoringSnapshot> findLatest(String databaseName, String connectionId);

    /**
     * Insert the snapshot and, in the same transaction, delete everything beyond the newest
     * {@code retention} snapshots of the same database connection.
     *
     * @return the stored snapshot with its generated id
     */
    MonitoringSnapshot insertAndPrune(MonitoringSnapshot snapshot, int retention);

    /**
     * Newest first.
     */
    List<MonitoringSnapshot> findRecent(String databaseName, String connectionId, int limit);

    long count(String databaseName, String connectionId);
}
