package org.onionscout;

import java.time.Duration;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.function.LongSupplier;

/**
 * Per-host politeness. A host has at most one fetch in flight, and two dispatches to the same host are at least
 * the courtesy interval apart. Dispatches to different hosts are not limited.
 */
public class HostCourtesy {
    private static final int PRUNE_THRESHOLD = 10_000;
    private final long intervalNanos;
    private final LongSupplier nanoClock;
    private final Map<String, Long> lastDispatch = new HashMap<>();
    private final Set<String> busy = new HashSet<>();

    public HostCourtesy(Duration interval) {
        this(interval, System::nanoTime);
    }

    HostCourtesy(Duration interval, LongSupplier nanoClock) {
        if (interval.isNegative()) throw new IllegalArgumentException("courtesy interval must not be negative");
        this.intervalNanos = interval.toNanos();
        this.nanoClock = nanoClock;
    }

    /**
     * Claims a host for one dispatch if it is idle and its interval has elapsed.
     *
     * @return true if the caller may dispatch to the host and must later {@link #release} it
     */
    public synchronized boolean tryAcquire(String host) {
        if (busy.contains(host)) return false;
        long now = nanoClock.getAsLong();
        Long last = lastDispatch.get(host);
        if (last != null && now - last < intervalNanos) return false;
        if (lastDispatch.size() >= PRUNE_THRESHOLD) prune(now);
        busy.add(host);
        lastDispatch.put(host, now);
        return true;
    }

    public synchronized void release(String host) {
        busy.remove(host);
    }

    public synchronized boolean isBusy(String host) {
        return busy.contains(host);
    }

    public synchronized int busyCount() {
        return busy.size();
    }

    private void prune(long now) {
        lastDispatch.entrySet().removeIf(e -> !busy.contains(e.getKey()) && now - e.getValue() >= intervalNanos);
    }
}
