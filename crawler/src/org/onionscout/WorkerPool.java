package org.onionscout;

import org.jetbrains.annotations.Nullable;
import org.onionscout.analysis.ContentAnalyzer;
import org.onionscout.config.CrawlConfig;
import org.onionscout.transport.ProxyTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Runs a fixed number of workers over a frontier until it is exhausted, the page budget is spent or a stop is
 * requested. Stopping only prevents further dequeues: in-flight fetches run to completion and are committed.
 */
public class WorkerPool {
    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);
    private final Frontier frontier;
    private final ProxyTransport transport;
    private final ContentAnalyzer analyzer;
    private final CrawlConfig config;
    private final List<Worker> workers = new ArrayList<>();
    private final AtomicLong remainingBudget = new AtomicLong(Long.MAX_VALUE);
    private final AtomicInteger consecutivePersistenceFailures = new AtomicInteger();
    private final AtomicInteger consecutiveProxyFailures = new AtomicInteger();
    private volatile @Nullable String stopReason;
    private volatile Consumer<String> drainListener = reason -> {
    };

    public WorkerPool(Frontier frontier, ProxyTransport transport, ContentAnalyzer analyzer, CrawlConfig config) {
        this.frontier = frontier;
        this.transport = transport;
        this.analyzer = analyzer;
        this.config = config;
    }

    /**
     * Called once, with the reason, when the pool stops taking new work.
     */
    public void setDrainListener(Consumer<String> drainListener) {
        this.drainListener = drainListener;
    }

    /**
     * Starts the workers.
     *
     * @param pageBudget fetch cycles this run may dispatch, or null for no limit
     */
    public synchronized void start(@Nullable Long pageBudget) {
        if (!workers.isEmpty()) throw new IllegalStateException("Worker pool already started");
        remainingBudget.set(pageBudget == null ? Long.MAX_VALUE : Math.max(0, pageBudget));
        log.atInfo().addKeyValue("workers", config.workers()).addKeyValue("budget", pageBudget)
                .log("Starting worker pool");
        for (int i = 0; i < config.workers(); i++) {
            var worker = new Worker(String.valueOf(i), this, frontier, transport, analyzer, config);
            workers.add(worker);
            worker.start();
        }
    }

    /**
     * Runs the pool to completion.
     */
    public void run(@Nullable Long pageBudget) throws InterruptedException {
        start(pageBudget);
        join();
    }

    /**
     * Requests that workers take no further entries. Returns immediately.
     */
    public void stop(String reason) {
        drain(reason);
    }

    public void join() throws InterruptedException {
        for (Worker worker : workersSnapshot()) {
            worker.join();
        }
    }

    /**
     * @return true if all workers finished within the timeout
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        for (Worker worker : workersSnapshot()) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0 || !worker.join(TimeUnit.NANOSECONDS.toMillis(remaining) + 1)) return false;
        }
        return true;
    }

    public boolean isTerminated() {
        for (Worker worker : workersSnapshot()) {
            if (worker.isAlive()) return false;
        }
        return true;
    }

    public List<Worker.Info> workerInfo() {
        return workersSnapshot().stream().map(Worker::info).toList();
    }

    public @Nullable String stopReason() {
        return stopReason;
    }

    private synchronized List<Worker> workersSnapshot() {
        return List.copyOf(workers);
    }

    boolean isStopping() {
        return stopReason != null;
    }

    /**
     * Reserves one fetch cycle from the page budget.
     *
     * @return false if the budget is spent
     */
    boolean tryReserve() {
        while (true) {
            long remaining = remainingBudget.get();
            if (remaining <= 0) return false;
            if (remaining == Long.MAX_VALUE || remainingBudget.compareAndSet(remaining, remaining - 1)) return true;
        }
    }

    void unreserve() {
        remainingBudget.getAndUpdate(remaining -> remaining == Long.MAX_VALUE ? remaining : remaining + 1);
    }

    void drain(String reason) {
        synchronized (this) {
            if (stopReason != null) return;
            stopReason = reason;
        }
        log.info("Worker pool draining: {}", reason);
        frontier.wakeAll();
        drainListener.accept(reason);
    }

    void recordPersistenceFailure() {
        int failures = consecutivePersistenceFailures.incrementAndGet();
        if (failures >= config.maxConsecutiveFailures()) {
            drain(failures + " consecutive persistence failures");
        }
    }

    void recordPersistenceSuccess() {
        consecutivePersistenceFailures.set(0);
    }

    void recordProxyFailure() {
        int failures = consecutiveProxyFailures.incrementAndGet();
        if (failures >= config.maxConsecutiveFailures()) {
            drain("proxy unavailable for " + failures + " consecutive fetches");
        }
    }

    void recordProxySuccess() {
        consecutiveProxyFailures.set(0);
    }
}
