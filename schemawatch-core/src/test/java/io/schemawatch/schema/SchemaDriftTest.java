package io.schemawatch.schema;

import io.schemawatch.core.MonitoringSnapshot;
import io.schemawatch.core.ObjectCounts;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class SchemaDriftTest {

    private static MonitoringSnapshot previous(String fingerprint, ObjectCounts counts) {
        return new MonitoringSnapshot(1, "sales", "default", Instant.parse("2026-01-01T00:00:00Z"),
                fingerprint, counts, false, MonitoringSnapshot.FIRST_SNAPSHOT);
    }

    @Test
    void firstObservationIsNotAChange() {
        SchemaDrift drift = SchemaDrift.compare(null, "abc", new ObjectCounts(3, 0, 0, 0));

        assertThat(drift.changeDetected()).isFalse();
        assertThat(drift.summary()).isEqualTo("first snapshot");
    }

    @Test
    void equalFingerprintIsNotAChange() {
        SchemaDrift drift = SchemaDrift.compare(previous("abc", new ObjectCounts(3, 0, 0, 0)),
                "abc", new ObjectCounts(3, 0, 0, 0));

        assertThat(drift.changeDetected()).isFalse();
        assertThat(drift.summary()).isEqualTo("no changes detected");
    }

    @Test
    void countDeltasShouldBeSummarized() {
        SchemaDrift drift = SchemaDrift.compare(previous("abc", new ObjectCounts(10, 3, 0, 0)),
                "def", new ObjectCounts(12, 2, 0, 0));

        assertThat(drift.changeDetected()).isTrue();
        assertThat(drift.summary()).isEqualTo("tables: +2, views: -1");
    }

    @Test
    void changeWithEqualCountsIsAStructureModification() {
        SchemaDrift drift = SchemaDrift.compare(previous("abc", new ObjectCounts(3, 1, 0, 0)),
                "def", new ObjectCounts(3, 1, 0, 0));

        assertThat(drift.changeDetected()).isTrue();
        assertThat(drift.summary()).isEqualTo("structure modified");
    }

    @Test
    void unreadableHistoryIsNotAChange() {
        SchemaDrift drift = SchemaDrift.unknown(new IllegalStateException("store offline"));

        assertThat(drift.changeDetected()).isFalse();
        assertThat(drift.summary()).isEqualTo("error checking changes: store offline");
    }
}
