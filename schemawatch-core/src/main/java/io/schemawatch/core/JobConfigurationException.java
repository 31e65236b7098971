package io.schemawatch.core;

/**
 * A job cannot be added as described: unknown job type, malformed schedule spec or missing name.
 */
public class JobConfigurationException extends IllegalArgumentException {

    public JobConfigurationException(String message) {
        super(message);
    }

    public JobConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
