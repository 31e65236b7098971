package io.schemawatch.internal.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.schemawatch.config.SchemaWatchProperties;

import javax.sql.DataSource;
import java.util.Objects;

/**
 * Connection pool over the local store. Kept apart from any application {@link DataSource}.
 */
public final class JdbcStore implements AutoCloseable {

    private final HikariDataSource dataSource;

    private JdbcStore(HikariDataSource dataSource) {
        this.dataSource = dataSource;
    }

    public static JdbcStore open(SchemaWatchProperties props) {
        Objects.requireNonNull(props, "props must not be null");
        if (props.getJdbcUrl() == null || props.getJdbcUrl().isBlank()) {
            throw new IllegalArgumentException("schemawatch.jdbcUrl must not be blank");
        }

        HikariConfig config = new HikariConfig();
        config.setPoolName("schemawatch");
        config.setJdbcUrl(props.getJdbcUrl());
        config.setUsername(props.getUsername());
        config.setPassword(props.getPassword());
        config.setMaximumPoolSize(Math.max(1, props.getMaxPoolSize()));
        config.setMinimumIdle(1);
        config.setAutoCommit(true);
        return new JdbcStore(new HikariDataSource(config));
    }

    public DataSource dataSource() {
        return dataSource;
    }

    @Override
    public void close() {
        dataSource.close();
    }
}
