package io.schemawatch.core;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Persisted job definition.
 *
 * <p>{@code nextRunAt} is advisory only: it is recomputed from {@code scheduleSpec} whenever the
 * scheduler starts.
 */
public record JobDefinition(

        // identity
        String id,
        String name,
        String jobType,

        // scheduling
        String scheduleSpec,
        boolean enabled,

        // payload
        Map<String, Object> config,

        // bookkeeping
        Instant createdAt,
        Instant lastRunAt,
        Instant nextRunAt,
        long runCount
) {
    public JobDefinition {
        // JSON configs may carry null values, which Map.copyOf rejects
        config = config == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(config));
    }
}
