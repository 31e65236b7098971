package io.schemawatch.utils;

import io.schemawatch.core.JobConfigurationException;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsed schedule spec and its next-due-time rule.
 * <p>
 * Supported formats (case-sensitive):
 * <ul>
 *   <li>{@code daily}, {@code weekly}, {@code hourly}: fixed period from the reference time</li>
 *   <li>{@code every_<N>_minutes}, {@code every_<N>_hours}: fixed period, N a positive integer</li>
 *   <li>{@code HH:MM}: once a day at that wall-clock time (24-hour, zero-padded)</li>
 * </ul>
 * <p>
 * {@link #nextDueAfter(Instant, ZoneId)} is a pure function of its arguments.
 */
public sealed interface ScheduleSpec permits ScheduleSpec.Every, ScheduleSpec.DailyAt {

    Pattern EVERY = Pattern.compile("^every_(\\d+)_(minutes|hours)$");
    Pattern TIME_OF_DAY = Pattern.compile("^([01]\\d|2[0-3]):([0-5]\\d)$");

    /**
     * The spec string as written by the caller.
     */
    String spec();

    /**
     * Next due time strictly after {@code reference}.
     *
     * @param zone zone used by wall-clock specs; fixed periods ignore it
     */
    Instant nextDueAfter(Instant reference, ZoneId zone);

    /**
     * Fixed period.
     */
    record Every(String spec, Duration period) implements ScheduleSpec {
        public Every {
            if (period == null || period.isZero() || period.isNegative()) {
                throw new IllegalArgumentException("period must be a positive duration");
            }
        }

        @Override
        public Instant nextDueAfter(Instant reference, ZoneId zone) {
            if (reference == null) {
                throw new IllegalArgumentException("reference must not be null");
            }
            return reference.plus(period);
        }
    }

    /**
     * Once a day at a fixed local time.
     */
    record DailyAt(String spec, LocalTime time) implements ScheduleSpec {
        @Override
        public Instant nextDueAfter(Instant reference, ZoneId zone) {
            if (reference == null) {
                throw new IllegalArgumentException("reference must not be null");
            }
            ZoneId z = zone != null ? zone : ZoneId.systemDefault();

            ZonedDateTime base = ZonedDateTime.ofInstant(reference, z);
            ZonedDateTime candidate = base.with(time);
            if (!candidate.isAfter(base)) {
                candidate = base.plusDays(1).with(time);
            }
            return candidate.toInstant();
        }
    }

    /**
     * Parse a schedule spec.
     *
     * @throws JobConfigurationException if the spec matches none of the supported formats
     */
    static ScheduleSpec parse(String spec) {
        if (spec == null || spec.isEmpty()) {
            throw new JobConfigurationException("Invalid schedule specification: spec must not be empty");
        }

        switch (spec) {
            case "daily":
                return new Every(spec, Duration.ofDays(1));
            case "weekly":
                return new Every(spec, Duration.ofDays(7));
            case "hourly":
                return new Every(spec, Duration.ofHours(1));
            default:
                break;
        }

        Matcher every = EVERY.matcher(spec);
        if (every.matches()) {
            long n;
            try {
                n = Long.parseLong(every.group(1));
            } catch (NumberFormatException e) {
                throw new JobConfigurationException("Invalid schedule specification: interval out of range: " + spec, e);
            }
            if (n <= 0) {
                throw new JobConfigurationException("Invalid schedule specification: interval must be positive: " + spec);
            }
            try {
                Duration period = "minutes".equals(every.group(2)) ? Duration.ofMinutes(n) : Duration.ofHours(n);
                return new Every(spec, period);
            } catch (ArithmeticException e) {
                throw new JobConfigurationException("Invalid schedule specification: interval out of range: " + spec, e);
            }
        }

        Matcher time = TIME_OF_DAY.matcher(spec);
        if (time.matches()) {
            int hour = Integer.parseInt(time.group(1));
            int minute = Integer.parseInt(time.group(2));
            return new DailyAt(spec, LocalTime.of(hour, minute));
        }

        throw new JobConfigurationException("Invalid schedule specification: '" + spec
                + "' (expected daily, weekly, hourly, every_<N>_minutes, every_<N>_hours or HH:MM)");
    }

    static boolean isValid(String spec) {
        try {
            parse(spec);
            return true;
        } catch (JobConfigurationException e) {
            return false;
        }
    }
}
