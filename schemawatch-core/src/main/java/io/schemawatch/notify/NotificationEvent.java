package io.schemawatch.notify;

import java.time.Instant;
import java.util.Locale;
import java.util.Objects;

/**
 * Outcome of a job execution or a monitor check.
 *
 * @param source  job name or monitored database name
 * @param status  e.g. {@code success}, {@code error}, {@code changed}
 * @param payload job result, error message or drift details; may be null
 */
public record NotificationEvent(String source, String status, Instant timestamp, Object payload) {

    public NotificationEvent {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(status, "status must not be null");
        timestamp = timestamp == null ? Instant.now() : timestamp;
    }

    /**
     * Status with an upper-case first letter, as shown in mail subjects.
     */
    public String statusTitle() {
        if (status.isEmpty()) {
            return status;
        }
        return status.substring(0, 1).toUpperCase(Locale.ROOT) + status.substring(1);
    }
}
