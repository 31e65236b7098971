package io.schemawatch.internal;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.schemawatch.JobFunction;
import io.schemawatch.JobHandler;
import io.schemawatch.JobScheduler;
import io.schemawatch.config.SchemaWatchProperties;
import io.schemawatch.core.ExecutionRecord;
import io.schemawatch.core.ExecutionStatus;
import io.schemawatch.core.JobConfigurationException;
import io.schemawatch.core.JobDefinition;
import io.schemawatch.core.JobHandlerRegistry;
import io.schemawatch.core.JobStoreException;
import io.schemawatch.notify.NotificationDispatcher;
import io.schemawatch.notify.NotificationEvent;
import io.schemawatch.spi.JobRepository;
import io.schemawatch.utils.JobIds;
import io.schemawatch.utils.ScheduleSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Scheduler backed by a {@link JobRepository}, ticking on a single daemon thread.
 *
 * <p>Each tick runs every due job sequentially on the loop thread. An execution opens a
 * {@code running} history record, invokes the handler, closes the record, updates the job's
 * run bookkeeping and dispatches a notification. Failures of one job never affect another.
 */
public class PollingJobScheduler implements JobScheduler {
    private static final Logger log = LoggerFactory.getLogger(PollingJobScheduler.class);

    private static final TypeReference<Map<String, Object>> CONFIG_TYPE = new TypeReference<>() {
    };

    private final SchemaWatchProperties props;
    private final JobRepository jobRepository;
    private final JobHandlerRegistry jobRegistry;
    private final NotificationDispatcher dispatcher;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final ZoneId zone;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final Semaphore tickSignal = new Semaphore(0);
    private final ReentrantLock tickLock = new ReentrantLock();

    // guarded by itself; insertion order is discovery order
    private final Map<String, ScheduledEntry> entries = new LinkedHashMap<>();

    private volatile Thread loopThread;

    private static final class ScheduledEntry {
        private final String jobId;
        private final JobDefinition job;
        private final ScheduleSpec spec;
        private Instant nextDue;

        private ScheduledEntry(JobDefinition job, ScheduleSpec spec, Instant nextDue) {
            this.jobId = job.id();
            this.job = job;
            this.spec = spec;
            this.nextDue = nextDue;
        }
    }

    public PollingJobScheduler(SchemaWatchProperties props,
                               JobRepository jobRepository,
                               JobHandlerRegistry jobRegistry,
                               NotificationDispatcher dispatcher,
                               ObjectMapper objectMapper) {
        this(props, jobRepository, jobRegistry, dispatcher, objectMapper, Clock.systemDefaultZone());
    }

    public PollingJobScheduler(SchemaWatchProperties props,
                               JobRepository jobRepository,
                               JobHandlerRegistry jobRegistry,
                               NotificationDispatcher dispatcher,
                               ObjectMapper objectMapper,
                               Clock clock) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.jobRepository = Objects.requireNonNull(jobRepository, "jobRepository must not be null");
        this.jobRegistry = Objects.requireNonNull(jobRegistry, "jobRegistry must not be null");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        ZoneId configured = props.resolveZone();
        this.zone = configured != null ? configured : clock.getZone();
    }

    /**
     * Load enabled jobs and start ticking. Idempotent.
     */
    @Override
    public void start() {
        Duration tick = Objects.requireNonNull(props.getScheduler().getTickInterval(),
                "schemawatch.scheduler.tickInterval must not be null");
        if (tick.isZero() || tick.isNegative()) {
            throw new IllegalArgumentException("schemawatch.scheduler.tickInterval must be a positive duration");
        }

        if (!started.compareAndSet(false, true)) {
            return;
        }

        log.info("Scheduler starting with tickInterval={}, zone={}", tick, zone);

        Instant now = clock.instant();
        List<JobDefinition> enabled;
        try {
            enabled = jobRepository.findEnabled();
        } catch (JobStoreException e) {
            log.error("scheduler could not load jobs; starting empty msg={}", e.getMessage(), e);
            enabled = List.of();
        }
        for (JobDefinition job : enabled) {
            schedule(job, now);
        }

        tickSignal.drainPermits();
        Thread t = new Thread(this::tickLoop);
        t.setName("schemawatch.scheduler");
        t.setDaemon(true);
        loopThread = t;
        t.start();

        log.info("Scheduler started successfully. jobs={}", scheduledCount());
    }

    /**
     * Stop ticking and forget scheduled entries. An execution in flight is allowed to finish.
     * Idempotent.
     */
    @Override
    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }

        log.info("Scheduler stopping...");
        loopThread = null;
        synchronized (entries) {
            entries.clear();
        }
        tickSignal.release();
        log.info("Scheduler stopped successfully.");
    }

    @Override
    public boolean isRunning() {
        return started.get();
    }

    @Override
    public void registerJobType(JobHandler<?> handler) {
        jobRegistry.register(handler);
    }

    @Override
    public void registerJobType(String type, JobHandler<?> handler) {
        jobRegistry.register(type, handler);
    }

    @Override
    public void registerJobType(String type, JobFunction function) {
        jobRegistry.register(type, function);
    }

    @Override
    public String addJob(String name, String type, String scheduleSpec, Map<String, Object> config) {
        if (name == null || name.isBlank()) {
            throw new JobConfigurationException("Job name must not be blank");
        }
        if (!jobRegistry.isRegistered(type)) {
            throw new JobConfigurationException("Unknown job type: " + type);
        }
        ScheduleSpec spec = ScheduleSpec.parse(scheduleSpec);

        Map<String, Object> normalized;
        try {
            normalized = config == null ? Map.of() : objectMapper.convertValue(config, CONFIG_TYPE);
        } catch (IllegalArgumentException e) {
            throw new JobConfigurationException("Job config is not JSON-serializable: " + e.getMessage(), e);
        }

        Instant createdAt = clock.instant();
        Instant nextDue = spec.nextDueAfter(createdAt, zone);
        JobDefinition job = new JobDefinition(JobIds.derive(name, createdAt), name, type, scheduleSpec, true,
                normalized, createdAt, null, nextDue, 0);

        jobRepository.insert(job);
        log.info("Job added name={} id={} type={} schedule={}", name, job.id(), type, scheduleSpec);

        if (started.get()) {
            synchronized (entries) {
                entries.put(job.id(), new ScheduledEntry(job, spec, nextDue));
            }
        }
        return job.id();
    }

    @Override
    public Optional<JobDefinition> findJob(String jobId) {
        return jobRepository.findById(jobId);
    }

    @Override
    public List<JobDefinition> listJobs() {
        return jobRepository.findAll();
    }

    @Override
    public boolean setEnabled(String jobId, boolean enabled) {
        if (!jobRepository.setEnabled(jobId, enabled)) {
            return false;
        }
        if (!enabled) {
            unschedule(jobId);
        } else if (started.get()) {
            jobRepository.findById(jobId).ifPresent(job -> schedule(job, clock.instant()));
        }
        log.info("Job {} id={}", enabled ? "enabled" : "disabled", jobId);
        return true;
    }

    @Override
    public boolean deleteJob(String jobId) {
        unschedule(jobId);
        boolean deleted = jobRepository.delete(jobId);
        if (deleted) {
            log.info("Job deleted id={}", jobId);
        }
        return deleted;
    }

    @Override
    public boolean triggerNow(String jobId) {
        synchronized (entries) {
            ScheduledEntry entry = entries.get(jobId);
            if (entry == null) {
                return false;
            }
            entry.nextDue = clock.instant();
        }
        log.info("Job triggered id={}", jobId);
        return true;
    }

    @Override
    public List<ExecutionRecord> history(String jobId, int limit) {
        int effective = limit > 0 ? limit : props.getHistoryLimit();
        return jobRepository.findHistory(jobId, effective);
    }

    /**
     * Run every entry due at the clock's current time.
     *
     * @return number of executions performed
     */
    @Override
    public int runPending() {
        tickLock.lock();
        try {
            Instant now = clock.instant();
            List<ScheduledEntry> due = new ArrayList<>();
            synchronized (entries) {
                for (ScheduledEntry e : entries.values()) {
                    if (!e.nextDue.isAfter(now)) {
                        due.add(e);
                    }
                }
            }

            int executed = 0;
            for (ScheduledEntry entry : due) {
                if (!isStillScheduled(entry)) {
                    continue;
                }
                JobDefinition job = refresh(entry);
                if (job == null) {
                    unschedule(entry.jobId);
                    continue;
                }

                Instant nextDue = entry.spec.nextDueAfter(now, zone);
                synchronized (entries) {
                    entry.nextDue = nextDue;
                }
                execute(job, nextDue);
                executed++;
            }
            if (executed > 0) {
                log.debug("Scheduler tick executed={} at={}", executed, now);
            }
            return executed;
        } finally {
            tickLock.unlock();
        }
    }

    int scheduledCount() {
        synchronized (entries) {
            return entries.size();
        }
    }

    private void tickLoop() {
        Duration tick = props.getScheduler().getTickInterval();
        while (isCurrentLoop()) {
            try {
                tickSignal.tryAcquire(tick.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (!isCurrentLoop()) {
                break;
            }

            try {
                runPending();
            } catch (Throwable e) {
                log.error("scheduler tick failed msg={}", e.getMessage(), e);
            }
        }
    }

    private boolean isCurrentLoop() {
        return started.get() && Thread.currentThread() == loopThread;
    }

    private void schedule(JobDefinition job, Instant reference) {
        ScheduleSpec spec;
        try {
            spec = ScheduleSpec.parse(job.scheduleSpec());
        } catch (JobConfigurationException e) {
            log.warn("Skipping job with invalid schedule name={} id={} schedule={} msg={}",
                    job.name(), job.id(), job.scheduleSpec(), e.getMessage());
            return;
        }

        Instant nextDue = spec.nextDueAfter(reference, zone);
        synchronized (entries) {
            entries.put(job.id(), new ScheduledEntry(job, spec, nextDue));
        }
        try {
            jobRepository.updateNextRun(job.id(), nextDue);
        } catch (JobStoreException e) {
            log.warn("Could not store next run name={} id={} msg={}", job.name(), job.id(), e.getMessage());
        }
    }

    private void unschedule(String jobId) {
        synchronized (entries) {
            entries.remove(jobId);
        }
    }

    private boolean isStillScheduled(ScheduledEntry entry) {
        synchronized (entries) {
            return entries.get(entry.jobId) == entry;
        }
    }

    // Current definition, or null if the job was deleted or disabled meanwhile.
    private JobDefinition refresh(ScheduledEntry entry) {
        try {
            Optional<JobDefinition> current = jobRepository.findById(entry.jobId);
            if (current.isEmpty()) {
                log.info("Job no longer exists; unscheduling id={}", entry.jobId);
                return null;
            }
            if (!current.get().enabled()) {
                log.info("Job disabled; unscheduling name={} id={}", current.get().name(), entry.jobId);
                return null;
            }
            return current.get();
        } catch (JobStoreException e) {
            log.warn("Could not reload job; using cached definition id={} msg={}", entry.jobId, e.getMessage());
            return entry.job;
        }
    }

    private void execute(JobDefinition job, Instant nextDue) {
        Instant startedAt = clock.instant();
        log.debug("Job started name={} id={} at={}", job.name(), job.id(), startedAt);

        Long executionId = null;
        try {
            executionId = jobRepository.openExecution(job.id(), startedAt);
        } catch (JobStoreException e) {
            log.error("Could not open execution record name={} id={} msg={}", job.name(), job.id(), e.getMessage(), e);
        }

        ExecutionStatus status;
        JsonNode result = null;
        String errorMessage = null;
        VirtualMachineError fatal = null;
        try {
            JobHandler<?> handler = jobRegistry.getRequired(job.jobType());
            Object output = executeHandler(handler, job.config());
            result = objectMapper.valueToTree(output);
            status = ExecutionStatus.SUCCESS;
        } catch (Throwable e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            if (e instanceof VirtualMachineError) {
                fatal = (VirtualMachineError) e;
            }
            status = ExecutionStatus.ERROR;
            errorMessage = errorMessage(e);
            log.error("Job failed name={} id={} msg={}", job.name(), job.id(), errorMessage, e);
        }

        Instant completedAt = clock.instant();
        if (executionId != null) {
            try {
                jobRepository.closeExecution(executionId, completedAt, status, result, errorMessage);
            } catch (JobStoreException e) {
                log.error("Could not close execution record name={} id={} executionId={} msg={}",
                        job.name(), job.id(), executionId, e.getMessage(), e);
            }
        }
        try {
            jobRepository.recordRun(job.id(), completedAt, nextDue);
        } catch (JobStoreException e) {
            log.error("Could not record run name={} id={} msg={}", job.name(), job.id(), e.getMessage(), e);
        }

        if (status == ExecutionStatus.SUCCESS) {
            log.info("Job succeeded name={} id={} at={}", job.name(), job.id(), completedAt);
        }
        dispatcher.dispatch(new NotificationEvent(job.name(), status.code(), completedAt,
                status == ExecutionStatus.SUCCESS ? result : errorMessage));
        // recorded as error above; the VM is not in a state to keep running handlers
        if (fatal != null) {
            throw fatal;
        }
    }

    @SuppressWarnings("unchecked")
    private <T> Object executeHandler(JobHandler<?> handler, Map<String, Object> rawConfig) throws Exception {
        var h = (JobHandler<T>) handler;
        T config = objectMapper.convertValue(rawConfig, h.configClass());
        return h.execute(config);
    }

    private static String errorMessage(Throwable e) {
        String msg = e.getMessage();
        return (msg == null || msg.isBlank()) ? e.getClass().getName() : msg;
    }
}
