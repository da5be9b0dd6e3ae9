package org.onionscout;

import org.jetbrains.annotations.Nullable;

import java.time.Instant;

/**
 * Crawl counters. Row 0 holds the live values, later rows are periodic snapshots.
 *
 * @param pending addresses waiting to be fetched or in flight
 */
public record Progress(int id, @Nullable Instant date, long discovered, long pending, long fetched, long succeeded,
                       long failed, long findings) {
}
