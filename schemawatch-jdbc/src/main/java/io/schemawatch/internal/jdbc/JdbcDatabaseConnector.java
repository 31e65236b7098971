package io.schemawatch.internal.jdbc;

import io.schemawatch.core.MonitoredDatabase;
import io.schemawatch.spi.DatabaseConnector;
import io.schemawatch.spi.DatabaseSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Objects;
import java.util.Properties;

/**
 * Opens one unpooled JDBC connection per check through {@link DriverManager}.
 *
 * <p>Azure AD and service principal logins are passed to the driver through its
 * {@code authentication} property, the way the Microsoft SQL Server driver expects them.
 * {@code tenantId} is not passed on; custom connectors can use it. The driver itself must be on
 * the classpath of the application.
 */
public class JdbcDatabaseConnector implements DatabaseConnector {
    private static final Logger log = LoggerFactory.getLogger(JdbcDatabaseConnector.class);

    static final String AZURE_AD_PASSWORD = "ActiveDirectoryPassword";
    static final String AZURE_AD_SERVICE_PRINCIPAL = "ActiveDirectoryServicePrincipal";

    @Override
    public DatabaseSession connect(MonitoredDatabase database) throws SQLException {
        Objects.requireNonNull(database, "database must not be null");
        if (database.url() == null || database.url().isBlank()) {
            throw new IllegalArgumentException("No JDBC url configured for database=" + database.databaseName()
                    + " connection=" + database.connectionId());
        }

        Properties info = connectionProperties(database);
        log.debug("Opening monitored connection database={} connection={} method={}",
                database.databaseName(), database.connectionId(), database.method());
        return new JdbcSession(DriverManager.getConnection(database.url(), info));
    }

    static Properties connectionProperties(MonitoredDatabase database) {
        Properties info = new Properties();
        switch (database.method()) {
            case CREDENTIALS -> {
                putIfPresent(info, "user", database.username());
                putIfPresent(info, "password", database.password());
            }
            case AZURE_AD -> {
                info.setProperty("authentication", AZURE_AD_PASSWORD);
                putIfPresent(info, "user", database.username());
                putIfPresent(info, "password", database.password());
            }
            case SERVICE_PRINCIPAL -> {
                if (isBlank(database.clientId()) || isBlank(database.clientSecret())) {
                    throw new IllegalArgumentException("service_principal requires clientId and clientSecret database="
                            + database.databaseName());
                }
                info.setProperty("authentication", AZURE_AD_SERVICE_PRINCIPAL);
                info.setProperty("user", database.clientId());
                info.setProperty("password", database.clientSecret());
            }
        }
        return info;
    }

    private static void putIfPresent(Properties info, String key, String value) {
        if (!isBlank(value)) {
            info.setProperty(key, value);
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    record JdbcSession(Connection connection) implements DatabaseSession {
        @Override
        public void close() throws SQLException {
            connection.close();
        }
    }
}
