package io.schemawatch.core;

import java.util.Objects;

/**
 * A database connection watched by the schema monitor.
 *
 * <p>{@code connectionId} distinguishes several connections to the same database name;
 * it defaults to {@value #DEFAULT_CONNECTION_ID}.
 */
public record MonitoredDatabase(
        String databaseName,
        String connectionId,
        ConnectionMethod method,
        String url,
        String username,
        String password,
        String clientId,
        String clientSecret,
        String tenantId
) {
    public static final String DEFAULT_CONNECTION_ID = "default";

    public MonitoredDatabase {
        Objects.requireNonNull(databaseName, "databaseName must not be null");
        if (databaseName.isBlank()) {
            throw new IllegalArgumentException("databaseName must not be blank");
        }
        connectionId = (connectionId == null || connectionId.isBlank()) ? DEFAULT_CONNECTION_ID : connectionId;
        method = method == null ? ConnectionMethod.CREDENTIALS : method;
    }

    public static MonitoredDatabase withCredentials(String databaseName, String url, String username, String password) {
        return new MonitoredDatabase(databaseName, null, ConnectionMethod.CREDENTIALS, url, username, password,
                null, null, null);
    }

    public boolean sameConnection(String otherDatabaseName, String otherConnectionId) {
        String otherId = (otherConnectionId == null || otherConnectionId.isBlank())
                ? DEFAULT_CONNECTION_ID
                : otherConnectionId;
        return databaseName.equals(otherDatabaseName) && connectionId.equals(otherId);
    }

    @Override
    public String toString() {
        // keep secrets out of logs
        return "MonitoredDatabase[databaseName=" + databaseName + ", connectionId=" + connectionId
                + ", method=" + method + ", url=" + url + "]";
    }
}
