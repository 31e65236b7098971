package io.schemawatch.internal;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.schemawatch.config.SchemaWatchProperties;
import io.schemawatch.core.JobStoreException;
import io.schemawatch.core.MonitoredDatabase;
import io.schemawatch.core.MonitoringSnapshot;
import io.schemawatch.internal.jdbc.H2TestDatabase;
import io.schemawatch.internal.jdbc.JdbcDatabaseConnector;
import io.schemawatch.internal.jdbc.JdbcMetadataSchemaExtractor;
import io.schemawatch.internal.jdbc.JdbcSnapshotRepository;
import io.schemawatch.notify.NotificationChannel;
import io.schemawatch.notify.NotificationDispatcher;
import io.schemawatch.notify.NotificationEvent;
import io.schemawatch.schema.ColumnMetadata;
import io.schemawatch.schema.SchemaFingerprinter;
import io.schemawatch.schema.SchemaMetadata;
import io.schemawatch.schema.TableMetadata;
import io.schemawatch.spi.DatabaseConnector;
import io.schemawatch.spi.DatabaseSession;
import io.schemawatch.spi.SchemaExtractor;
import io.schemawatch.spi.SnapshotRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.Statement;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class PollingSchemaMonitorTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    private final List<NotificationEvent> notified = new CopyOnWriteArrayList<>();
    private final Map<String, SchemaMetadata> schemas = new ConcurrentHashMap<>();
    private final Set<String> crashingExtracts = ConcurrentHashMap.newKeySet();
    private final SchemaFingerprinter fingerprinter = new SchemaFingerprinter(new ObjectMapper());

    private H2TestDatabase db;
    private JdbcSnapshotRepository snapshots;
    private MutableClock clock;
    private SchemaWatchProperties props;

    @BeforeEach
    void setUp() {
        db = H2TestDatabase.create();
        snapshots = new JdbcSnapshotRepository(db.dataSource(), new ObjectMapper());
        clock = new MutableClock(T0);
        props = new SchemaWatchProperties();
    }

    @AfterEach
    void tearDown() throws Exception {
        db.close();
    }

    @Test
    void firstCheckShouldStoreBaselineWithoutNotifying() throws Exception {
        schemas.put("sales", schema("dbo.Customers"));
        PollingSchemaMonitor monitor = newMonitor(new FakeConnector(), snapshots);

        MonitoringSnapshot first = monitor.check(MonitoredDatabase.withCredentials("sales", "fake", null, null));

        assertTrue(first.id() > 0);
        assertFalse(first.changeDetected());
        assertEquals("first snapshot", first.changeSummary());
        assertEquals(fingerprinter.fingerprint(schemas.get("sales")), first.fingerprint());
        assertThat(notified).isEmpty();
    }

    @Test
    void unchangedSchemaShouldNotBeReported() throws Exception {
        schemas.put("sales", schema("dbo.Customers"));
        PollingSchemaMonitor monitor = newMonitor(new FakeConnector(), snapshots);
        MonitoredDatabase sales = MonitoredDatabase.withCredentials("sales", "fake", null, null);

        monitor.check(sales);
        clock.advance(Duration.ofMinutes(30));
        MonitoringSnapshot second = monitor.check(sales);

        assertFalse(second.changeDetected());
        assertEquals("no changes detected", second.changeSummary());
        assertThat(notified).isEmpty();
    }

    @Test
    void addedTableShouldBeReportedWithCountDelta() throws Exception {
        schemas.put("sales", schema("dbo.Customers"));
        PollingSchemaMonitor monitor = newMonitor(new FakeConnector(), snapshots);
        MonitoredDatabase sales = MonitoredDatabase.withCredentials("sales", "fake", null, null);
        monitor.check(sales);

        schemas.put("sales", schema("dbo.Customers", "dbo.Orders"));
        clock.advance(Duration.ofMinutes(30));
        MonitoringSnapshot changed = monitor.check(sales);

        assertTrue(changed.changeDetected());
        assertEquals("tables: +1", changed.changeSummary());

        assertThat(notified).singleElement().satisfies(e -> {
            assertEquals("sales", e.source());
            assertEquals("changed", e.status());
            @SuppressWarnings("unchecked")
            Map<String, Object> payload = (Map<String, Object>) e.payload();
            assertEquals("default", payload.get("connectionId"));
            assertEquals(changed.fingerprint(), payload.get("fingerprint"));
            assertEquals("tables: +1", payload.get("summary"));
        });

        assertThat(monitor.snapshots("sales", null, 10))
                .extracting(MonitoringSnapshot::changeSummary)
                .containsExactly("tables: +1", "first snapshot");
    }

    @Test
    void renamedColumnShouldBeAStructureModification() throws Exception {
        schemas.put("sales", new SchemaMetadata(List.of(new TableMetadata("dbo.Customers",
                List.of(new ColumnMetadata("Name", "nvarchar")), 0)), null, null, null));
        PollingSchemaMonitor monitor = newMonitor(new FakeConnector(), snapshots);
        MonitoredDatabase sales = MonitoredDatabase.withCredentials("sales", "fake", null, null);
        monitor.check(sales);

        schemas.put("sales", new SchemaMetadata(List.of(new TableMetadata("dbo.Customers",
                List.of(new ColumnMetadata("FullName", "nvarchar")), 0)), null, null, null));
        MonitoringSnapshot changed = monitor.check(sales);

        assertTrue(changed.changeDetected());
        assertEquals("structure modified", changed.changeSummary());
    }

    @Test
    void failingDatabaseShouldNotStopOthers() {
        schemas.put("hr", schema("dbo.Employees"));
        PollingSchemaMonitor monitor = newMonitor(new FakeConnector(), snapshots);
        monitor.addDatabase(MonitoredDatabase.withCredentials("broken", "fake", null, null));
        monitor.addDatabase(MonitoredDatabase.withCredentials("hr", "fake", null, null));

        monitor.checkAll();

        assertEquals(0, snapshots.count("broken", "default"));
        assertEquals(1, snapshots.count("hr", "default"));
        assertThat(notified).singleElement().satisfies(e -> {
            assertEquals("broken", e.source());
            assertEquals("error", e.status());
        });
    }

    @Test
    void errorFromExtractorShouldBeReportedLikeAnyFailure() {
        schemas.put("legacy", schema("dbo.Accounts"));
        schemas.put("hr", schema("dbo.Employees"));
        crashingExtracts.add("legacy");
        PollingSchemaMonitor monitor = newMonitor(new FakeConnector(), snapshots);
        monitor.addDatabase(MonitoredDatabase.withCredentials("legacy", "fake", null, null));
        monitor.addDatabase(MonitoredDatabase.withCredentials("hr", "fake", null, null));

        monitor.checkAll();

        assertEquals(0, snapshots.count("legacy", "default"));
        assertEquals(1, snapshots.count("hr", "default"));
        assertThat(notified).singleElement().satisfies(e -> {
            assertEquals("legacy", e.source());
            assertEquals("error", e.status());
        });
    }

    @Test
    void errorNotificationsCanBeSwitchedOff() {
        props.getMonitor().setNotifyOnError(false);
        PollingSchemaMonitor monitor = newMonitor(new FakeConnector(), snapshots);
        monitor.addDatabase(MonitoredDatabase.withCredentials("broken", "fake", null, null));

        monitor.checkAll();

        assertThat(notified).isEmpty();
    }

    @Test
    void unreadableHistoryShouldStillStoreSnapshot() throws Exception {
        schemas.put("sales", schema("dbo.Customers"));
        SnapshotRepository flaky = mock(SnapshotRepository.class);
        when(flaky.findLatest("sales", "default"))
                .thenThrow(new JobStoreException("store offline", null));
        when(flaky.insertAndPrune(any(MonitoringSnapshot.class), anyInt()))
                .thenAnswer(inv -> ((MonitoringSnapshot) inv.getArgument(0)).withId(7));

        PollingSchemaMonitor monitor = newMonitor(new FakeConnector(), flaky);
        MonitoringSnapshot stored = monitor.check(MonitoredDatabase.withCredentials("sales", "fake", null, null));

        assertEquals(7, stored.id());
        assertFalse(stored.changeDetected());
        assertEquals("error checking changes: store offline", stored.changeSummary());
    }

    @Test
    void checkShouldPropagateConnectFailure() {
        PollingSchemaMonitor monitor = newMonitor(new FakeConnector(), snapshots);

        assertThatThrownBy(() -> monitor.check(MonitoredDatabase.withCredentials("broken", "fake", null, null)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("broken");
    }

    @Test
    void databasesShouldBeKeyedByNameAndConnection() {
        PollingSchemaMonitor monitor = newMonitor(new FakeConnector(), snapshots);
        monitor.addDatabase(MonitoredDatabase.withCredentials("sales", "url-1", null, null));
        monitor.addDatabase(MonitoredDatabase.withCredentials("sales", "url-2", null, null));
        monitor.addDatabase(new MonitoredDatabase("sales", "replica", null, "url-3", null, null, null, null, null));

        assertThat(monitor.databases()).extracting(MonitoredDatabase::url).containsExactly("url-2", "url-3");
        assertTrue(monitor.removeDatabase("sales", "replica"));
        assertFalse(monitor.removeDatabase("sales", "replica"));
        assertThat(monitor.databases()).hasSize(1);
    }

    @Test
    void liveDatabaseShouldBeFingerprintedOnStart() throws Exception {
        String url = "jdbc:h2:mem:live-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1";
        try (Connection keepAlive = DriverManager.getConnection(url, "sa", "");
             Statement st = keepAlive.createStatement()) {
            st.execute("CREATE TABLE customers (id INT PRIMARY KEY, name VARCHAR(100))");

            props.getMonitor().setInterval(Duration.ofMinutes(30));
            PollingSchemaMonitor monitor = new PollingSchemaMonitor(props, snapshots, new JdbcDatabaseConnector(),
                    new JdbcMetadataSchemaExtractor(), fingerprinter, recordingDispatcher(), clock);
            monitor.addDatabase(MonitoredDatabase.withCredentials("live", url, "sa", ""));

            monitor.start();
            try {
                assertTrue(waitUntil(5, TimeUnit.SECONDS, () -> snapshots.count("live", "default") == 1));
            } finally {
                monitor.stop();
            }

            st.execute("CREATE TABLE orders (id INT PRIMARY KEY)");
            MonitoringSnapshot changed = monitor.check(monitor.databases().get(0));
            assertTrue(changed.changeDetected());
            assertEquals("tables: +1", changed.changeSummary());
        }
    }

    private PollingSchemaMonitor newMonitor(DatabaseConnector connector, SnapshotRepository repository) {
        return new PollingSchemaMonitor(props, repository, connector, new FakeExtractor(), fingerprinter,
                recordingDispatcher(), clock);
    }

    private NotificationDispatcher recordingDispatcher() {
        return new NotificationDispatcher(List.of(new NotificationChannel() {
            @Override
            public String name() {
                return "recorder";
            }

            @Override
            public boolean isEnabled() {
                return true;
            }

            @Override
            public void deliver(NotificationEvent event) {
                notified.add(event);
            }
        }));
    }

    private static SchemaMetadata schema(String... tables) {
        List<TableMetadata> list = new ArrayList<>();
        for (String t : tables) {
            list.add(new TableMetadata(t, List.of(new ColumnMetadata("Id", "int")), 1));
        }
        return new SchemaMetadata(list, List.of(), List.of(), List.of());
    }

    private static boolean waitUntil(long timeout, TimeUnit unit, BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        while (System.nanoTime() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }
            Thread.sleep(50);
        }
        return false;
    }

    private record FakeSession(String databaseName) implements DatabaseSession {
        @Override
        public Connection connection() {
            throw new UnsupportedOperationException();
        }

        @Override
        public void close() {
        }
    }

    private class FakeConnector implements DatabaseConnector {
        @Override
        public DatabaseSession connect(MonitoredDatabase database) {
            if (!schemas.containsKey(database.databaseName())) {
                throw new IllegalStateException("cannot reach " + database.databaseName());
            }
            return new FakeSession(database.databaseName());
        }
    }

    private class FakeExtractor implements SchemaExtractor {
        @Override
        public SchemaMetadata extract(DatabaseSession session) {
            String name = ((FakeSession) session).databaseName();
            if (crashingExtracts.contains(name)) {
                throw new AssertionError("metadata walk broke on " + name);
            }
            return schemas.get(name);
        }
    }
}
