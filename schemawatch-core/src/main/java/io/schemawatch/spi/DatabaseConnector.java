package io.schemawatch.spi;

import io.schemawatch.core.MonitoredDatabase;

/**
 * Opens sessions against monitored databases.
 */
public interface DatabaseConnector {

    /**
     * @throws Exception when the database cannot be reached or authentication fails
     */
    DatabaseSession connect(MonitoredDatabase database) throws Exception;
}
