package io.schemawatch.spi;

import java.sql.Connection;

/**
 * An open connection to a monitored database, held for a single check.
 */
public interface DatabaseSession extends AutoCloseable {

    Connection connection();

    @Override
    void close() throws Exception;
}
