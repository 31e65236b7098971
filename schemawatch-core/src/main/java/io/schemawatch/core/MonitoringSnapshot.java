package io.schemawatch.core;

import java.time.Instant;

/**
 * One fingerprint observation of a monitored database. Immutable once stored.
 *
 * @param id 0 until persisted
 */
public record MonitoringSnapshot(
        long id,
        String databaseName,
        String connectionId,
        Instant takenAt,
        String fingerprint,
        ObjectCounts objectCounts,
        boolean changeDetected,
        String changeSummary
) {
    public static final String FIRST_SNAPSHOT = "first snapshot";
    public static final String NO_CHANGES = "no changes detected";
    public static final String STRUCTURE_MODIFIED = "structure modified";

    public MonitoringSnapshot withId(long newId) {
        return new MonitoringSnapshot(newId, databaseName, connectionId, takenAt, fingerprint,
                objectCounts, changeDetected, changeSummary);
    }
}
