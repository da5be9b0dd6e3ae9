package org.onionscout;

import org.jetbrains.annotations.Nullable;
import org.onionscout.util.Address;

import java.time.Instant;

/**
 * One fetch of one address. Never updated after insertion; a refetch creates a new page.
 *
 * @param status      HTTP status, or 0 when no response was received
 * @param contentHash digest of the body, null when there was no body
 */
public record Page(
        @Nullable Long id,
        long frontierId,
        Address address,
        long hostId,
        Instant date,
        int status,
        Outcome outcome,
        @Nullable String contentHash,
        long size,
        long fetchTimeMs,
        @Nullable String contentType,
        @Nullable String title,
        @Nullable String error) {

    public enum Outcome {
        OK, TIMEOUT, REFUSED, ERROR
    }
}
