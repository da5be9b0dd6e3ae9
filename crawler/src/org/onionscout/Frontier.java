package org.onionscout;

import org.jdbi.v3.core.JdbiException;
import org.jetbrains.annotations.Nullable;
import org.onionscout.util.Address;
import org.onionscout.util.MustUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.*;
import java.util.function.Predicate;

import static org.onionscout.FrontierEntry.State.IN_FLIGHT;
import static org.onionscout.FrontierEntry.State.PENDING;

/**
 * The deduplicated work queue. The database is the source of truth; this class keeps an in-memory view of the
 * pending and in-flight entries, ordered by queue position, which {@link #load()} rebuilds from the database.
 * <p>
 * The in-memory view is guarded by this object's monitor. Code holding the monitor may use the database, but
 * never the other way round, and no network call is made while holding it.
 */
public class Frontier {
    private static final Logger log = LoggerFactory.getLogger(Frontier.class);
    private final Database db;
    private final TrustScorer trustScorer;
    private final int retryLimit;
    private final HostCourtesy courtesy;
    private final CrawlState crawlState;
    private final TreeMap<Long, FrontierEntry> pending = new TreeMap<>();
    private final Map<Long, FrontierEntry> inFlight = new HashMap<>();
    private boolean closed;

    public Frontier(Database db, TrustScorer trustScorer, int retryLimit, HostCourtesy courtesy,
                    CrawlState crawlState) {
        this.db = db;
        this.trustScorer = trustScorer;
        this.retryLimit = retryLimit;
        this.courtesy = courtesy;
        this.crawlState = crawlState;
    }

    /**
     * Rebuilds the in-memory view from the database. Entries left in flight by a previous process go back to
     * pending at their old queue position.
     */
    public synchronized void load() {
        int reverted = db.frontier().revertInFlight();
        if (reverted > 0) log.info("Reverted {} in-flight frontier entries to pending", reverted);
        pending.clear();
        inFlight.clear();
        closed = false;
        for (FrontierEntry entry : db.loadFrontierSnapshot()) {
            pending.put(entry.queuePosition(), entry);
        }
        crawlState.load(db.progress().current());
        log.info("Loaded frontier with {} pending entries", pending.size());
    }

    /**
     * @return true if the address had never been seen before and was added
     */
    public boolean enqueue(Address address) {
        return enqueue(List.of(address), 0, null) == 1;
    }

    /**
     * Adds the addresses that have never been seen before, in the given order.
     *
     * @return the number of addresses added
     * @throws ClosedException if the frontier was closed by {@link #closeIfExhausted()}
     */
    public int enqueue(Collection<Address> addresses, int depth, @Nullable Address via) {
        if (addresses.isEmpty()) return 0;
        List<FrontierEntry> inserted;
        synchronized (this) {
            if (closed) throw new ClosedException("Frontier was exhausted and closed");
            inserted = db.enqueue(addresses, depth, via);
            for (FrontierEntry entry : inserted) {
                pending.put(entry.queuePosition(), entry);
            }
            if (!inserted.isEmpty()) notifyAll();
        }
        if (!inserted.isEmpty()) crawlState.addDiscovered(inserted.size());
        return inserted.size();
    }

    /**
     * Takes the oldest pending entry whose host is currently allowed a dispatch and marks it in flight.
     *
     * @return the entry, or null if no pending entry is eligible right now
     */
    public @Nullable FrontierEntry dequeue() {
        return dequeue(host -> true);
    }

    /**
     * Like {@link #dequeue()} but also skips entries whose host the filter rejects. Entries that are skipped keep
     * their place in the queue.
     */
    public synchronized @Nullable FrontierEntry dequeue(Predicate<String> hostFilter) {
        for (var iterator = pending.values().iterator(); iterator.hasNext(); ) {
            FrontierEntry entry = iterator.next();
            if (!hostFilter.test(entry.host())) continue;
            if (!courtesy.tryAcquire(entry.host())) continue;
            try {
                db.frontier().transition(entry.id(), PENDING, IN_FLIGHT);
            } catch (JdbiException | MustUpdate.Exception e) {
                courtesy.release(entry.host());
                throw new PersistenceException("Failed to dequeue " + entry.address(), e);
            }
            iterator.remove();
            FrontierEntry taken = entry.withState(IN_FLIGHT);
            inFlight.put(taken.id(), taken);
            return taken;
        }
        return null;
    }

    /**
     * Commits a fetch cycle for an in-flight entry and moves the entry and any newly discovered addresses into the
     * in-memory view. If the commit fails the entry stays in flight and the caller must {@link #fail} it.
     *
     * @throws PersistenceException if the cycle couldn't be committed
     */
    public CycleResult complete(FrontierEntry entry, FetchCycle cycle) {
        CycleResult result = db.commitCycle(cycle, trustScorer, retryLimit);
        crawlState.recordCycle(cycle, result);
        synchronized (this) {
            inFlight.remove(entry.id());
            if (result.entry().state() == PENDING) {
                pending.put(result.entry().queuePosition(), result.entry());
            }
            for (FrontierEntry discovered : result.discovered()) {
                pending.put(discovered.queuePosition(), discovered);
            }
            notifyAll();
        }
        courtesy.release(entry.host());
        return result;
    }

    /**
     * Terminally fails an in-flight entry whose fetch cycle couldn't be committed. The entry leaves the in-memory
     * view even if the database write fails too, in which case the next {@link #load()} returns it to pending.
     */
    public void fail(FrontierEntry entry, String reason) {
        log.atWarn().addKeyValue("url", entry.address()).log("Failing frontier entry: {}", reason);
        try {
            db.failEntry(entry);
            crawlState.recordFailure();
        } finally {
            synchronized (this) {
                inFlight.remove(entry.id());
                notifyAll();
            }
            courtesy.release(entry.host());
        }
    }

    /**
     * Returns an in-flight entry to pending at its original position without recording a fetch, used when a
     * fetch was abandoned.
     */
    public void release(FrontierEntry entry) {
        try {
            synchronized (this) {
                db.frontier().transition(entry.id(), IN_FLIGHT, PENDING);
                inFlight.remove(entry.id());
                pending.put(entry.queuePosition(), entry.withState(PENDING));
                notifyAll();
            }
        } catch (JdbiException | MustUpdate.Exception e) {
            synchronized (this) {
                inFlight.remove(entry.id());
                notifyAll();
            }
            throw new PersistenceException("Failed to release " + entry.address(), e);
        } finally {
            courtesy.release(entry.host());
        }
    }

    /**
     * Waits until the frontier changes or the timeout elapses.
     */
    public synchronized void awaitChange(Duration timeout) throws InterruptedException {
        long millis = Math.max(1, timeout.toMillis());
        wait(millis);
    }

    /**
     * Wakes every thread waiting in {@link #awaitChange}.
     */
    public synchronized void wakeAll() {
        notifyAll();
    }

    /**
     * @return pending plus in-flight entries
     */
    public synchronized int size() {
        return pending.size() + inFlight.size();
    }

    public synchronized int pendingCount() {
        return pending.size();
    }

    public synchronized int inFlightCount() {
        return inFlight.size();
    }

    /**
     * @return true if nothing is pending and nothing is in flight, so no further work can appear from the crawl
     */
    public synchronized boolean isExhausted() {
        return pending.isEmpty() && inFlight.isEmpty();
    }

    /**
     * Closes the frontier if it is exhausted. Once closed it accepts no new addresses until the next
     * {@link #load()}, so a worker that stops on exhaustion can't strand an address enqueued after it looked.
     *
     * @return true if the frontier is closed
     */
    public synchronized boolean closeIfExhausted() {
        if (!closed && isExhausted()) {
            closed = true;
            notifyAll();
        }
        return closed;
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    public synchronized List<FrontierEntry> inFlightEntries() {
        return List.copyOf(inFlight.values());
    }

    public CrawlState crawlState() {
        return crawlState;
    }

    public static class ClosedException extends IllegalStateException {
        public ClosedException(String message) {
            super(message);
        }
    }
}
