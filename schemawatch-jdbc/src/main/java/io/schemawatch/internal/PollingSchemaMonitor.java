package io.schemawatch.internal;

import io.schemawatch.SchemaMonitor;
import io.schemawatch.config.SchemaWatchProperties;
import io.schemawatch.core.JobStoreException;
import io.schemawatch.core.MonitoredDatabase;
import io.schemawatch.core.MonitoringSnapshot;
import io.schemawatch.core.ObjectCounts;
import io.schemawatch.notify.NotificationDispatcher;
import io.schemawatch.notify.NotificationEvent;
import io.schemawatch.schema.SchemaDrift;
import io.schemawatch.schema.SchemaFingerprinter;
import io.schemawatch.schema.SchemaMetadata;
import io.schemawatch.spi.DatabaseConnector;
import io.schemawatch.spi.DatabaseSession;
import io.schemawatch.spi.SchemaExtractor;
import io.schemawatch.spi.SnapshotRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Periodically fingerprints every monitored database and stores a snapshot per check.
 *
 * <p>The first pass runs as soon as the monitor starts, then once per configured interval.
 * A failing database is logged and reported; the others are still checked.
 */
public class PollingSchemaMonitor implements SchemaMonitor {
    private static final Logger log = LoggerFactory.getLogger(PollingSchemaMonitor.class);

    public static final String STATUS_CHANGED = "changed";
    public static final String STATUS_ERROR = "error";

    private final SchemaWatchProperties props;
    private final SnapshotRepository snapshotRepository;
    private final DatabaseConnector connector;
    private final SchemaExtractor extractor;
    private final SchemaFingerprinter fingerprinter;
    private final NotificationDispatcher dispatcher;
    private final Clock clock;

    private final List<MonitoredDatabase> databases = new CopyOnWriteArrayList<>();

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final Semaphore wakeSignal = new Semaphore(0);
    private final ReentrantLock checkLock = new ReentrantLock();

    private volatile Thread loopThread;

    public PollingSchemaMonitor(SchemaWatchProperties props,
                                SnapshotRepository snapshotRepository,
                                DatabaseConnector connector,
                                SchemaExtractor extractor,
                                SchemaFingerprinter fingerprinter,
                                NotificationDispatcher dispatcher) {
        this(props, snapshotRepository, connector, extractor, fingerprinter, dispatcher, Clock.systemUTC());
    }

    public PollingSchemaMonitor(SchemaWatchProperties props,
                                SnapshotRepository snapshotRepository,
                                DatabaseConnector connector,
                                SchemaExtractor extractor,
                                SchemaFingerprinter fingerprinter,
                                NotificationDispatcher dispatcher,
                                Clock clock) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.snapshotRepository = Objects.requireNonNull(snapshotRepository, "snapshotRepository must not be null");
        this.connector = Objects.requireNonNull(connector, "connector must not be null");
        this.extractor = Objects.requireNonNull(extractor, "extractor must not be null");
        this.fingerprinter = Objects.requireNonNull(fingerprinter, "fingerprinter must not be null");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");

        if (props.getMonitor().getRetention() <= 0) {
            throw new IllegalArgumentException("schemawatch.monitor.retention must be a positive number");
        }
    }

    @Override
    public void start() {
        Duration interval = Objects.requireNonNull(props.getMonitor().getInterval(),
                "schemawatch.monitor.interval must not be null");
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("schemawatch.monitor.interval must be a positive duration");
        }

        if (!started.compareAndSet(false, true)) {
            return;
        }

        log.info("Schema monitor starting with interval={}, retention={}, databases={}",
                interval, props.getMonitor().getRetention(), databases.size());

        wakeSignal.drainPermits();
        Thread t = new Thread(this::monitorLoop);
        t.setName("schemawatch.monitor");
        t.setDaemon(true);
        loopThread = t;
        t.start();
    }

    @Override
    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }

        log.info("Schema monitor stopping...");
        loopThread = null;
        wakeSignal.release();
        log.info("Schema monitor stopped successfully.");
    }

    @Override
    public boolean isRunning() {
        return started.get();
    }

    /**
     * Add a database, replacing any entry with the same database name and connection id.
     */
    @Override
    public void addDatabase(MonitoredDatabase database) {
        Objects.requireNonNull(database, "database must not be null");
        databases.removeIf(d -> d.sameConnection(database.databaseName(), database.connectionId()));
        databases.add(database);
        log.info("Monitoring database={} connection={}", database.databaseName(), database.connectionId());
    }

    @Override
    public boolean removeDatabase(String databaseName, String connectionId) {
        boolean removed = databases.removeIf(d -> d.sameConnection(databaseName, connectionId));
        if (removed) {
            log.info("Stopped monitoring database={} connection={}", databaseName, connectionId);
        }
        return removed;
    }

    @Override
    public List<MonitoredDatabase> databases() {
        return List.copyOf(databases);
    }

    /**
     * One pass over all monitored databases.
     */
    @Override
    public void checkAll() {
        checkLock.lock();
        try {
            for (MonitoredDatabase db : databases) {
                try {
                    check(db);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("Schema check interrupted database={} connection={}", db.databaseName(), db.connectionId());
                    return;
                } catch (VirtualMachineError e) {
                    throw e;
                } catch (Throwable e) {
                    log.error("Schema check failed database={} connection={} msg={}",
                            db.databaseName(), db.connectionId(), e.getMessage(), e);
                    if (props.getMonitor().isNotifyOnError()) {
                        Map<String, Object> payload = new LinkedHashMap<>();
                        payload.put("connectionId", db.connectionId());
                        payload.put("error", String.valueOf(e.getMessage()));
                        dispatcher.dispatch(new NotificationEvent(db.databaseName(), STATUS_ERROR, clock.instant(), payload));
                    }
                }
            }
        } finally {
            checkLock.unlock();
        }
    }

    /**
     * Fingerprint one database and store the snapshot.
     *
     * @throws Exception when connecting or extracting fails; nothing is stored then
     */
    @Override
    public MonitoringSnapshot check(MonitoredDatabase db) throws Exception {
        Objects.requireNonNull(db, "db must not be null");

        SchemaMetadata schema;
        try (DatabaseSession session = connector.connect(db)) {
            schema = extractor.extract(session);
        }

        String fingerprint = fingerprinter.fingerprint(schema);
        ObjectCounts counts = schema.counts();

        SchemaDrift drift;
        try {
            MonitoringSnapshot previous = snapshotRepository
                    .findLatest(db.databaseName(), db.connectionId())
                    .orElse(null);
            drift = SchemaDrift.compare(previous, fingerprint, counts);
        } catch (JobStoreException e) {
            log.warn("Could not load previous snapshot database={} connection={} msg={}",
                    db.databaseName(), db.connectionId(), e.getMessage());
            drift = SchemaDrift.unknown(e);
        }

        Instant takenAt = clock.instant();
        MonitoringSnapshot stored = snapshotRepository.insertAndPrune(
                new MonitoringSnapshot(0, db.databaseName(), db.connectionId(), takenAt, fingerprint, counts,
                        drift.changeDetected(), drift.summary()),
                props.getMonitor().getRetention());

        log.info("Schema checked database={} connection={} changed={} summary={}",
                db.databaseName(), db.connectionId(), stored.changeDetected(), stored.changeSummary());

        if (stored.changeDetected()) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("connectionId", stored.connectionId());
            payload.put("fingerprint", stored.fingerprint());
            payload.put("objectCounts", stored.objectCounts().asMap());
            payload.put("summary", stored.changeSummary());
            dispatcher.dispatch(new NotificationEvent(stored.databaseName(), STATUS_CHANGED, takenAt, payload));
        }
        return stored;
    }

    @Override
    public List<MonitoringSnapshot> snapshots(String databaseName, String connectionId, int limit) {
        String connId = (connectionId == null || connectionId.isBlank())
                ? MonitoredDatabase.DEFAULT_CONNECTION_ID
                : connectionId;
        int effective = limit > 0 ? limit : props.getMonitor().getRetention();
        return snapshotRepository.findRecent(databaseName, connId, effective);
    }

    private void monitorLoop() {
        Duration interval = props.getMonitor().getInterval();
        while (isCurrentLoop()) {
            try {
                checkAll();
            } catch (Throwable e) {
                log.error("schema monitor pass failed msg={}", e.getMessage(), e);
            }

            if (Thread.currentThread().isInterrupted()) {
                break;
            }
            try {
                wakeSignal.tryAcquire(interval.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
    }

    private boolean isCurrentLoop() {
        return started.get() && Thread.currentThread() == loopThread;
    }
}
