package io.schemawatch.config;

import org.springframework.context.SmartLifecycle;

import java.util.Objects;

/**
 * Bridges a background loop's start/stop with the Spring container lifecycle.
 *
 * <p>Lower phases start first and stop last: the monitor starts before the scheduler, and the
 * scheduler stops first so no job runs while the monitor is shutting down.
 */
public class LoopLifecycle implements SmartLifecycle {
    public static final int SCHEDULER_PHASE = Integer.MAX_VALUE;
    public static final int MONITOR_PHASE = Integer.MAX_VALUE - 1;

    private final String name;
    private final Runnable startAction;
    private final Runnable stopAction;
    private final int phase;
    private volatile boolean running = false;

    public LoopLifecycle(String name, Runnable startAction, Runnable stopAction, int phase) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.startAction = Objects.requireNonNull(startAction, "startAction must not be null");
        this.stopAction = Objects.requireNonNull(stopAction, "stopAction must not be null");
        this.phase = phase;
    }

    public String name() {
        return name;
    }

    @Override
    public void start() {
        startAction.run();
        running = true;
    }

    @Override
    public void stop() {
        stopAction.run();
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return phase;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }
}
