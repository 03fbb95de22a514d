package org.iceforge.filedrop.traffic;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.Iterator;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.LongAdder;

/**
 * Per-origin, per-calendar-day byte counters with daily upload and download ceilings.
 *
 * <p>In memory only; a restart forgets everything. The day is the clock's local date, so two
 * requests either side of midnight land in different counters.
 *
 * <p>Admission is checked before a transfer's size is known. A request that starts below the
 * ceiling is admitted even if it ends above it; only the next one is refused.
 */
public class TrafficLedger implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(TrafficLedger.class);

    static final String UNKNOWN_ORIGIN = "unknown";

    public record Admission(boolean allowed, long used, long limit) {}

    public record Usage(long uploaded, long downloaded, long uploadLimit, long downloadLimit) {}

    record OriginDay(String origin, LocalDate day) {}

    static final class Counter {
        final LongAdder uploaded = new LongAdder();
        final LongAdder downloaded = new LongAdder();
    }

    private final ConcurrentHashMap<OriginDay, Counter> counters = new ConcurrentHashMap<>();
    private final long uploadLimit;
    private final long downloadLimit;
    private final Clock clock;

    private final Object lifecycleLock = new Object();
    private ScheduledExecutorService reclaimer;

    public TrafficLedger(long uploadLimit, long downloadLimit, Clock clock) {
        if (uploadLimit <= 0) throw new IllegalArgumentException("uploadLimit must be positive, was " + uploadLimit);
        if (downloadLimit <= 0) throw new IllegalArgumentException("downloadLimit must be positive, was " + downloadLimit);
        this.uploadLimit = uploadLimit;
        this.downloadLimit = downloadLimit;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public Admission checkUploadAdmission(String origin) {
        long used = sum(origin, true);
        return new Admission(used < uploadLimit, used, uploadLimit);
    }

    public Admission checkDownloadAdmission(String origin) {
        long used = sum(origin, false);
        return new Admission(used < downloadLimit, used, downloadLimit);
    }

    public void recordUpload(String origin, long bytes) {
        counterFor(origin, bytes).uploaded.add(bytes);
    }

    public void recordDownload(String origin, long bytes) {
        counterFor(origin, bytes).downloaded.add(bytes);
    }

    public Usage currentUsage(String origin) {
        Counter c = counters.get(key(origin));
        if (c == null) {
            return new Usage(0, 0, uploadLimit, downloadLimit);
        }
        return new Usage(c.uploaded.sum(), c.downloaded.sum(), uploadLimit, downloadLimit);
    }

    /**
     * Drops every counter whose day is not today.
     *
     * @return number of counters dropped
     */
    public int reclaimStaleCounters() {
        LocalDate today = LocalDate.now(clock);
        int removed = 0;
        for (Iterator<OriginDay> it = counters.keySet().iterator(); it.hasNext(); ) {
            if (!it.next().day().equals(today)) {
                it.remove();
                removed++;
            }
        }
        if (removed > 0) {
            log.debug("Reclaimed {} stale traffic counter(s)", removed);
        }
        return removed;
    }

    /**
     * Starts the periodic sweep on its own thread. Calling it again while running is a no-op.
     */
    public void startReclamation(Duration period) {
        Objects.requireNonNull(period, "period");
        if (period.isNegative() || period.isZero()) {
            throw new IllegalArgumentException("period must be positive, was " + period);
        }
        synchronized (lifecycleLock) {
            if (reclaimer != null) return;
            reclaimer = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "filedrop-traffic-reclaim");
                t.setDaemon(true);
                return t;
            });
            reclaimer.scheduleAtFixedRate(this::runScheduledSweep,
                    period.toMillis(), period.toMillis(), TimeUnit.MILLISECONDS);
        }
        log.info("Traffic counter reclamation every {}; upload limit {} B/day, download limit {} B/day",
                period, uploadLimit, downloadLimit);
    }

    public boolean isReclaiming() {
        synchronized (lifecycleLock) {
            return reclaimer != null;
        }
    }

    @Override
    public void close() {
        synchronized (lifecycleLock) {
            if (reclaimer == null) return;
            reclaimer.shutdownNow();
            reclaimer = null;
        }
        log.info("Traffic counter reclamation stopped");
    }

    int counterCount() {
        return counters.size();
    }

    private void runScheduledSweep() {
        try {
            reclaimStaleCounters();
        } catch (RuntimeException e) {
            log.error("Traffic counter reclamation failed", e);
        }
    }

    private long sum(String origin, boolean upload) {
        Counter c = counters.get(key(origin));
        if (c == null) return 0;
        return upload ? c.uploaded.sum() : c.downloaded.sum();
    }

    private Counter counterFor(String origin, long bytes) {
        if (bytes < 0) throw new IllegalArgumentException("bytes must not be negative, was " + bytes);
        return counters.computeIfAbsent(key(origin), k -> new Counter());
    }

    private OriginDay key(String origin) {
        String o = (origin == null || origin.isBlank()) ? UNKNOWN_ORIGIN : origin;
        return new OriginDay(o, LocalDate.now(clock));
    }
}
