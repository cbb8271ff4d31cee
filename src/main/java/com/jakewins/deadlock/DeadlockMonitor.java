package com.jakewins.deadlock;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Polls a {@link ResourceGraph} for deadlocks on a background thread and tells a {@link Listener} about them.
 * <p>
 * Each deadlock is reported once when first seen; as long as the same cycle stays in the graph it is not
 * reported again. The monitor only reports: what to do about a deadlock is up to the listener.
 */
public class DeadlockMonitor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DeadlockMonitor.class);

    /** System property overriding the poll interval used by {@link #create(ResourceGraph, Listener)} */
    public static final String POLL_INTERVAL_SETTING = "deadlock.monitor.poll_interval_ms";

    static final long DEFAULT_POLL_INTERVAL_MS = 500;

    public interface Listener {
        /** Called on the monitor thread, once per newly observed deadlock. */
        void deadlockDetected(DeadlockDescription deadlock);
    }

    private final ResourceGraph graph;
    private final long pollInterval;
    private final TimeUnit unit;
    private final Listener listener;

    private ScheduledExecutorService scheduler;

    /** Last deadlock handed to the listener, guarded by this */
    private DeadlockDescription lastReported = DeadlockDescription.NONE;

    public DeadlockMonitor(ResourceGraph graph, long pollInterval, TimeUnit unit, Listener listener) {
        if(pollInterval <= 0) {
            throw new IllegalArgumentException("Poll interval must be positive, got " + pollInterval);
        }
        this.graph = graph;
        this.pollInterval = pollInterval;
        this.unit = unit;
        this.listener = listener;
    }

    /** A monitor polling every 500ms, or as many milliseconds as the {@value #POLL_INTERVAL_SETTING} property says. */
    public static DeadlockMonitor create(ResourceGraph graph, Listener listener) {
        return new DeadlockMonitor(graph, pollIntervalSetting(), TimeUnit.MILLISECONDS, listener);
    }

    static long pollIntervalSetting() {
        return Long.getLong(POLL_INTERVAL_SETTING, DEFAULT_POLL_INTERVAL_MS);
    }

    /** Start polling in the background. */
    public synchronized DeadlockMonitor start() {
        if(scheduler != null) {
            throw new IllegalStateException("Deadlock monitor already started.");
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "deadlock-monitor");
            thread.setDaemon(true);
            return thread;
        });
        scheduler.scheduleWithFixedDelay(this::pollSafely, pollInterval, pollInterval, unit);
        log.debug("Polling {} for deadlocks every {} {}", graph, pollInterval, unit);
        return this;
    }

    /**
     * Check the graph once, right now, on the calling thread.
     * @return the deadlock currently in the graph, or {@link DeadlockDescription#NONE}
     */
    public DeadlockDescription poll() {
        DeadlockDescription deadlock = graph.detectDeadlock();

        synchronized (this) {
            if(deadlock == DeadlockDescription.NONE) {
                if(lastReported != DeadlockDescription.NONE) {
                    log.info("Deadlock no longer present: {}", lastReported);
                    lastReported = DeadlockDescription.NONE;
                }
                return deadlock;
            }

            if(deadlock.equals(lastReported)) {
                return deadlock;
            }
            lastReported = deadlock;
        }

        log.warn("Deadlock detected: {}", deadlock);
        listener.deadlockDetected(deadlock);
        return deadlock;
    }

    @Override
    public synchronized void close() {
        if(scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
        }
    }

    private void pollSafely() {
        try {
            poll();
        } catch (RuntimeException e) {
            // An exception escaping here would cancel every future poll
            log.error("Deadlock listener failed, will keep polling", e);
        }
    }
}
