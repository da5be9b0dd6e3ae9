package org.onionscout;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Live crawl counters shared by the frontier, the workers and the dashboard. Mirrors the persisted progress row:
 * the counters are loaded from it at startup and updated alongside each committed write.
 */
public class CrawlState {
    private final AtomicLong discovered = new AtomicLong();
    private final AtomicLong pending = new AtomicLong();
    private final AtomicLong fetched = new AtomicLong();
    private final AtomicLong succeeded = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong findings = new AtomicLong();

    public synchronized void load(Progress progress) {
        discovered.set(progress.discovered());
        pending.set(progress.pending());
        fetched.set(progress.fetched());
        succeeded.set(progress.succeeded());
        failed.set(progress.failed());
        findings.set(progress.findings());
    }

    void addDiscovered(int count) {
        discovered.addAndGet(count);
        pending.addAndGet(count);
    }

    void recordCycle(FetchCycle cycle, CycleResult result) {
        fetched.incrementAndGet();
        if (cycle.outcome() == Page.Outcome.OK) succeeded.incrementAndGet();
        if (result.entry().state() == FrontierEntry.State.FAILED) failed.incrementAndGet();
        if (result.entry().state() != FrontierEntry.State.PENDING) pending.decrementAndGet();
        findings.addAndGet(result.findingsInserted());
        addDiscovered(result.discovered().size());
    }

    void recordFailure() {
        pending.decrementAndGet();
        failed.incrementAndGet();
    }

    public long fetched() {
        return fetched.get();
    }

    public long pending() {
        return pending.get();
    }

    public long findings() {
        return findings.get();
    }

    public synchronized Progress snapshot() {
        return new Progress(0, Instant.now(), discovered.get(), pending.get(), fetched.get(), succeeded.get(),
                failed.get(), findings.get());
    }
}
