package org.iceforge.filedrop.cleanup;

import org.iceforge.filedrop.store.ObjectKeys;
import org.iceforge.filedrop.store.ObjectStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Periodically removes objects nobody has read for longer than the inactivity period.
 *
 * <p>Lifecycle: {@link #initialize(ObjectStore)} runs one cycle right away and then one every
 * {@code cleanupInterval} on a dedicated daemon thread; {@link #stop()} prevents further cycles
 * and waits, bounded, for a running one to finish. Deletions go through {@link ObjectStore#delete(String)}, the
 * same path callers use.
 */
public class InactiveObjectCleaner {
    private static final Logger log = LoggerFactory.getLogger(InactiveObjectCleaner.class);

    static final Duration STOP_TIMEOUT = Duration.ofSeconds(30);

    private final Duration inactivityPeriod;
    private final Duration cleanupInterval;
    private final Clock clock;

    private final Object lifecycleLock = new Object();
    private volatile ObjectStore store;
    private ScheduledExecutorService executor;
    private ScheduledFuture<?> task;

    public InactiveObjectCleaner(Duration inactivityPeriod, Duration cleanupInterval, Clock clock) {
        this.inactivityPeriod = requirePositive(inactivityPeriod, "inactivityPeriod");
        this.cleanupInterval = requirePositive(cleanupInterval, "cleanupInterval");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public void initialize(ObjectStore store) {
        Objects.requireNonNull(store, "Object store is required for the cleanup job");
        synchronized (lifecycleLock) {
            if (task != null) {
                throw new IllegalStateException("Cleanup job is already running");
            }
            this.store = store;
            this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "filedrop-cleanup");
                t.setDaemon(true);
                return t;
            });
            this.task = executor.scheduleAtFixedRate(this::runScheduledCycle,
                    0, cleanupInterval.toMillis(), TimeUnit.MILLISECONDS);
        }
        log.info("Cleanup job initialized for {}. Runs every {} h, removes objects inactive for more than {} days",
                store.describe(), cleanupInterval.toHours(), inactivityPeriod.toDays());
    }

    /**
     * One pass: list objects inactive since {@code now - inactivityPeriod} and delete each.
     *
     * @return number of objects actually deleted
     */
    public int runCleanupCycle() {
        ObjectStore s = this.store;
        if (s == null) {
            log.error("Cleanup job: object store not initialized");
            return 0;
        }

        Instant cutoff = clock.instant().minus(inactivityPeriod);
        List<String> candidates;
        try {
            log.info("Cleanup job: starting cleanup for objects inactive since {}", cutoff);
            candidates = s.listInactiveSince(cutoff);
        } catch (RuntimeException e) {
            log.error("Cleanup job: failed to list inactive objects", e);
            return 0;
        }
        log.info("Cleanup job: found {} inactive object(s)", candidates.size());

        int deleted = 0;
        for (String privateKey : candidates) {
            try {
                if (s.delete(privateKey)) {
                    deleted++;
                    log.debug("Cleanup job: deleted object {}", ObjectKeys.abbreviate(privateKey));
                }
            } catch (RuntimeException e) {
                log.error("Cleanup job: error deleting object {}", ObjectKeys.abbreviate(privateKey), e);
            }
        }
        log.info("Cleanup job: completed, deleted {} object(s)", deleted);
        return deleted;
    }

    /**
     * Cancels future cycles and waits up to {@link #STOP_TIMEOUT} for one already in progress.
     */
    public void stop() {
        ScheduledExecutorService ex;
        synchronized (lifecycleLock) {
            if (task == null) {
                return;
            }
            task.cancel(false);
            ex = executor;
            ex.shutdown();
            task = null;
            executor = null;
        }
        try {
            if (!ex.awaitTermination(STOP_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Cleanup job still running after {}, leaving it to finish", STOP_TIMEOUT);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Cleanup job stopped");
    }

    public boolean isRunning() {
        synchronized (lifecycleLock) {
            return task != null;
        }
    }

    public Duration inactivityPeriod() {
        return inactivityPeriod;
    }

    private void runScheduledCycle() {
        // An exception escaping here would silently cancel the schedule.
        try {
            runCleanupCycle();
        } catch (RuntimeException e) {
            log.error("Cleanup job: unexpected failure", e);
        }
    }

    private static Duration requirePositive(Duration d, String name) {
        Objects.requireNonNull(d, name);
        if (d.isNegative() || d.isZero()) {
            throw new IllegalArgumentException(name + " must be positive, was " + d);
        }
        return d;
    }
}
