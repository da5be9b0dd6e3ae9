package org.onionscout;

import org.onionscout.db.ProgressDAO;
import org.onionscout.util.NamedThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Periodically snapshots the crawl progress counters so the dashboard can chart them.
 */
public class ProgressTracker implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ProgressTracker.class);
    static final Duration DEFAULT_INTERVAL = Duration.ofMinutes(1);
    private final ProgressDAO dao;
    private final Duration interval;
    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(
            new NamedThreadFactory("progress"));
    private ScheduledFuture<?> snapshotTask;

    public ProgressTracker(ProgressDAO dao) {
        this(dao, DEFAULT_INTERVAL);
    }

    public ProgressTracker(ProgressDAO dao, Duration interval) {
        this.dao = dao;
        this.interval = interval;
    }

    public synchronized void startSession() {
        if (snapshotTask != null) return;
        long millis = interval.toMillis();
        snapshotTask = scheduler.scheduleAtFixedRate(this::snapshot, millis, millis, TimeUnit.MILLISECONDS);
    }

    /**
     * Stops periodic snapshots and takes a final one.
     */
    public synchronized void stopSession() {
        if (snapshotTask == null) return;
        snapshotTask.cancel(false);
        snapshotTask = null;
        snapshot();
    }

    private void snapshot() {
        try {
            dao.createSnapshot(Instant.now());
        } catch (RuntimeException e) {
            log.warn("Failed to snapshot progress", e);
        }
    }

    @Override
    public void close() {
        stopSession();
        scheduler.shutdownNow();
    }
}
