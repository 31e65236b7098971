package io.schemawatch.utils;

import io.schemawatch.core.JobConfigurationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

class ScheduleSpecTest {

    private static final ZoneId UTC = ZoneOffset.UTC;

    @ParameterizedTest
    @ValueSource(strings = {"daily", "weekly", "hourly", "every_15_minutes", "every_1_minutes", "every_2_hours",
            "08:30", "00:00", "23:59"})
    void validSpecsShouldParse(String spec) {
        ScheduleSpec parsed = ScheduleSpec.parse(spec);
        assertEquals(spec, parsed.spec());
    }

    @ParameterizedTest
    @ValueSource(strings = {"bogus", "every_x_minutes", "25:00", "every_0_minutes", "Daily", "8:30", "08:60",
            "every_5_days", "every__minutes", " daily", "0 8 * * 1"})
    void invalidSpecsShouldBeRejected(String spec) {
        assertThatThrownBy(() -> ScheduleSpec.parse(spec))
                .isInstanceOf(JobConfigurationException.class)
                .hasMessageContaining("Invalid schedule specification");
    }

    @Test
    void emptySpecShouldBeRejected() {
        assertThatThrownBy(() -> ScheduleSpec.parse(""))
                .isInstanceOf(JobConfigurationException.class);
        assertThatThrownBy(() -> ScheduleSpec.parse(null))
                .isInstanceOf(JobConfigurationException.class);
    }

    @Test
    void fixedPeriodsShouldAddToReference() {
        Instant ref = Instant.parse("2026-01-01T10:15:00Z");

        assertEquals(ref.plus(Duration.ofDays(1)), ScheduleSpec.parse("daily").nextDueAfter(ref, UTC));
        assertEquals(ref.plus(Duration.ofDays(7)), ScheduleSpec.parse("weekly").nextDueAfter(ref, UTC));
        assertEquals(ref.plus(Duration.ofHours(1)), ScheduleSpec.parse("hourly").nextDueAfter(ref, UTC));
        assertEquals(ref.plus(Duration.ofMinutes(15)), ScheduleSpec.parse("every_15_minutes").nextDueAfter(ref, UTC));
        assertEquals(ref.plus(Duration.ofHours(3)), ScheduleSpec.parse("every_3_hours").nextDueAfter(ref, UTC));
    }

    @Test
    void timeOfDayShouldRunLaterTodayOrTomorrow() {
        ScheduleSpec spec = ScheduleSpec.parse("08:30");

        assertEquals(Instant.parse("2026-01-01T08:30:00Z"),
                spec.nextDueAfter(Instant.parse("2026-01-01T07:00:00Z"), UTC));
        assertEquals(Instant.parse("2026-01-02T08:30:00Z"),
                spec.nextDueAfter(Instant.parse("2026-01-01T08:30:00Z"), UTC));
        assertEquals(Instant.parse("2026-01-02T08:30:00Z"),
                spec.nextDueAfter(Instant.parse("2026-01-01T09:00:00Z"), UTC));
    }

    @Test
    void timeOfDayShouldUseGivenZone() {
        ScheduleSpec spec = ScheduleSpec.parse("10:00");
        Instant next = spec.nextDueAfter(Instant.parse("2026-01-01T00:00:00Z"), ZoneId.of("Asia/Taipei"));

        assertEquals(Instant.parse("2026-01-01T02:00:00Z"), next);
    }

    @ParameterizedTest
    @ValueSource(strings = {"daily", "weekly", "hourly", "every_15_minutes", "every_4_hours", "08:30"})
    void nextDueShouldBeDeterministic(String spec) {
        Instant ref = Instant.parse("2026-03-29T00:59:30Z");
        ScheduleSpec parsed = ScheduleSpec.parse(spec);

        Instant first = parsed.nextDueAfter(ref, ZoneId.of("Europe/Berlin"));
        Instant second = parsed.nextDueAfter(ref, ZoneId.of("Europe/Berlin"));

        assertEquals(first, second);
        assertThat(first).isAfter(ref);
    }

    @Test
    void isValidShouldNotThrow() {
        assertThat(ScheduleSpec.isValid("every_30_minutes")).isTrue();
        assertThat(ScheduleSpec.isValid("every_30_seconds")).isFalse();
    }
}
