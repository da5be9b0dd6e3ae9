package org.onionscout;

import org.jetbrains.annotations.Nullable;
import org.onionscout.util.Address;

import java.time.Instant;

/**
 * An address in the frontier.
 *
 * @param host          authority of the address, the key for per-host courtesy
 * @param attempts      number of failed fetches so far
 * @param queuePosition FIFO order among pending entries; a retry is given a new position at the back
 */
public record FrontierEntry(
        long id,
        Address address,
        long hostId,
        String host,
        int depth,
        @Nullable Address via,
        Instant timeAdded,
        State state,
        int attempts,
        long queuePosition) {

    public enum State {
        PENDING, IN_FLIGHT, DONE, FAILED
    }

    /**
     * What the worker decided should happen to an entry after fetching it.
     */
    public enum Disposition {
        /** Fetched, nothing more to do. */
        DONE,
        /** Failed in a way that may succeed later. */
        RETRY,
        /** Failed in a way that won't change on retry. */
        FAIL
    }

    /**
     * Applies a disposition to an in-flight entry. Retries go back to pending until the attempt count exceeds
     * the retry limit, after which the entry is terminally failed.
     */
    public FrontierEntry next(Disposition disposition, int retryLimit) {
        if (state != State.IN_FLIGHT) throw new IllegalStateException("Entry " + id + " is " + state + ", not IN_FLIGHT");
        return switch (disposition) {
            case DONE -> withState(State.DONE, attempts);
            case FAIL -> withState(State.FAILED, attempts + 1);
            case RETRY -> withState(attempts + 1 <= retryLimit ? State.PENDING : State.FAILED, attempts + 1);
        };
    }

    public FrontierEntry withState(State state) {
        return withState(state, attempts);
    }

    private FrontierEntry withState(State state, int attempts) {
        return new FrontierEntry(id, address, hostId, host, depth, via, timeAdded, state, attempts, queuePosition);
    }

    public FrontierEntry withQueuePosition(long queuePosition) {
        return new FrontierEntry(id, address, hostId, host, depth, via, timeAdded, state, attempts, queuePosition);
    }
}
