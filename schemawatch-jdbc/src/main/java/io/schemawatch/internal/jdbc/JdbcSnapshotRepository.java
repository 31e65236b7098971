package io.schemawatch.internal.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.schemawatch.core.JobStoreException;
import io.schemawatch.core.MonitoringSnapshot;
import io.schemawatch.core.ObjectCounts;
import io.schemawatch.spi.SnapshotRepository;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import static io.schemawatch.internal.jdbc.JdbcSchemaInitializer.SNAPSHOTS_TABLE;
import static io.schemawatch.internal.jdbc.JdbcSupport.getInstant;
import static io.schemawatch.internal.jdbc.JdbcSupport.setInstant;

/**
 * JDBC persistence for monitoring snapshots, bounded per database connection.
 */
public class JdbcSnapshotRepository implements SnapshotRepository {

    private static final String COLUMNS =
            "id, database_name, connection_id, taken_at, fingerprint, object_counts_json, change_detected, change_summary";

    private static final String NEWEST_FIRST = " ORDER BY taken_at DESC, id DESC";

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;

    public JdbcSnapshotRepository(DataSource dataSource, ObjectMapper objectMapper) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    @Override
    public Optional<MonitoringSnapshot> findLatest(String databaseName, String connectionId) {
        List<MonitoringSnapshot> latest = findRecent(databaseName, connectionId, 1);
        return latest.isEmpty() ? Optional.empty() : Optional.of(latest.get(0));
    }

    @Override
    public MonitoringSnapshot insertAndPrune(MonitoringSnapshot snapshot, int retention) {
        Objects.requireNonNull(snapshot, "snapshot must not be null");
        if (retention <= 0) {
            throw new IllegalArgumentException("retention must be a positive number");
        }
        String countsJson = writeCounts(snapshot.objectCounts());

        return JdbcSupport.inTransaction(dataSource,
                "store snapshot database=" + snapshot.databaseName() + " connection=" + snapshot.connectionId(),
                conn -> {
                    long id = insert(conn, snapshot, countsJson);
                    prune(conn, snapshot.databaseName(), snapshot.connectionId(), retention);
                    return snapshot.withId(id);
                });
    }

    @Override
    public List<MonitoringSnapshot> findRecent(String databaseName, String connectionId, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be a positive number");
        }
        String sql = "SELECT " + COLUMNS + " FROM " + SNAPSHOTS_TABLE
                + " WHERE database_name = ? AND connection_id = ?" + NEWEST_FIRST + " FETCH FIRST ? ROWS ONLY";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, databaseName);
            ps.setString(2, connectionId);
            ps.setInt(3, limit);

            List<MonitoringSnapshot> out = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(map(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new JobStoreException("Failed to load snapshots database=" + databaseName
                    + " connection=" + connectionId, e);
        }
    }

    @Override
    public long count(String databaseName, String connectionId) {
        String sql = "SELECT COUNT(*) FROM " + SNAPSHOTS_TABLE + " WHERE database_name = ? AND connection_id = ?";
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, databaseName);
            ps.setString(2, connectionId);
            try (ResultSet rs = ps.executeQuery()) {
                rs.next();
                return rs.getLong(1);
            }
        } catch (SQLException e) {
            throw new JobStoreException("Failed to count snapshots database=" + databaseName, e);
        }
    }

    private long insert(Connection conn, MonitoringSnapshot s, String countsJson) throws SQLException {
        String sql = "INSERT INTO " + SNAPSHOTS_TABLE + " (database_name, connection_id, taken_at, fingerprint,"
                + " object_counts_json, change_detected, change_summary) VALUES (?, ?, ?, ?, ?, ?, ?)";
        try (PreparedStatement ps = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
            ps.setString(1, s.databaseName());
            ps.setString(2, s.connectionId());
            setInstant(ps, 3, s.takenAt());
            ps.setString(4, s.fingerprint());
            ps.setString(5, countsJson);
            ps.setBoolean(6, s.changeDetected());
            ps.setString(7, s.changeSummary());
            ps.executeUpdate();

            try (ResultSet keys = ps.getGeneratedKeys()) {
                if (!keys.next()) {
                    throw new SQLException("No generated key returned for snapshot");
                }
                return keys.getLong(1);
            }
        }
    }

    // Keeps the newest `retention` rows of one database connection.
    private void prune(Connection conn, String databaseName, String connectionId, int retention) throws SQLException {
        List<Long> stale = new ArrayList<>();
        String select = "SELECT id FROM " + SNAPSHOTS_TABLE + " WHERE database_name = ? AND connection_id = ?"
                + NEWEST_FIRST + " OFFSET ? ROWS";
        try (PreparedStatement ps = conn.prepareStatement(select)) {
            ps.setString(1, databaseName);
            ps.setString(2, connectionId);
            ps.setInt(3, retention);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    stale.add(rs.getLong(1));
                }
            }
        }
        if (stale.isEmpty()) {
            return;
        }

        try (PreparedStatement ps = conn.prepareStatement("DELETE FROM " + SNAPSHOTS_TABLE + " WHERE id = ?")) {
            for (Long id : stale) {
                ps.setLong(1, id);
                ps.addBatch();
            }
            ps.executeBatch();
        }
    }

    private MonitoringSnapshot map(ResultSet rs) throws SQLException {
        return new MonitoringSnapshot(
                rs.getLong("id"),
                rs.getString("database_name"),
                rs.getString("connection_id"),
                getInstant(rs, "taken_at"),
                rs.getString("fingerprint"),
                readCounts(rs.getString("object_counts_json")),
                rs.getBoolean("change_detected"),
                rs.getString("change_summary")
        );
    }

    private String writeCounts(ObjectCounts counts) {
        try {
            return objectMapper.writeValueAsString((counts == null ? ObjectCounts.empty() : counts).asMap());
        } catch (JsonProcessingException e) {
            throw new JobStoreException("Failed to serialize object counts", e);
        }
    }

    private ObjectCounts readCounts(String json) {
        if (json == null) {
            return ObjectCounts.empty();
        }
        try {
            JsonNode node = objectMapper.readTree(json);
            return new ObjectCounts(
                    node.path("tables").asInt(),
                    node.path("views").asInt(),
                    node.path("procedures").asInt(),
                    node.path("functions").asInt());
        } catch (JsonProcessingException e) {
            throw new JobStoreException("Stored object counts are not valid JSON", e);
        }
    }
}
