package io.schemawatch;

/**
 * Handler for one job type.
 *
 * <p>The persisted job config is converted into {@link #configClass()} before {@link #execute(Object)}
 * is called. Whatever {@code execute} returns is stored as the execution result; a thrown exception
 * marks the execution as failed.
 */
public interface JobHandler<T> {
    String type();

    Class<T> configClass();

    Object execute(T config) throws Exception;
}
