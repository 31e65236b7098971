package io.schemawatch.core;

/**
 * The persistent store could not complete an operation.
 */
public class JobStoreException extends RuntimeException {

    public JobStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
