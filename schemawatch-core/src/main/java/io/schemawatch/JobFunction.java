package io.schemawatch;

import java.util.Map;

/**
 * Lambda form of a {@link JobHandler} that works on the raw config map.
 */
@FunctionalInterface
public interface JobFunction {
    Object apply(Map<String, Object> config) throws Exception;
}
