package io.schemawatch.schema;

import io.schemawatch.core.MonitoringSnapshot;
import io.schemawatch.core.ObjectCounts;

/**
 * Outcome of comparing a fresh fingerprint with the latest stored snapshot.
 */
public record SchemaDrift(boolean changeDetected, String summary) {

    /**
     * @param previous latest stored snapshot for the same database connection, or null
     */
    public static SchemaDrift compare(MonitoringSnapshot previous, String fingerprint, ObjectCounts counts) {
        if (previous == null) {
            return new SchemaDrift(false, MonitoringSnapshot.FIRST_SNAPSHOT);
        }
        if (previous.fingerprint().equals(fingerprint)) {
            return new SchemaDrift(false, MonitoringSnapshot.NO_CHANGES);
        }

        var deltas = counts.deltasSince(previous.objectCounts());
        String summary = deltas.isEmpty() ? MonitoringSnapshot.STRUCTURE_MODIFIED : String.join(", ", deltas);
        return new SchemaDrift(true, summary);
    }

    /**
     * Used when the previous snapshot could not be read; never reported as a change.
     */
    public static SchemaDrift unknown(Exception cause) {
        return new SchemaDrift(false, "error checking changes: " + cause.getMessage());
    }
}
