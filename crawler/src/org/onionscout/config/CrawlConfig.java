package org.onionscout.config;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.jetbrains.annotations.Nullable;
import org.onionscout.util.DurationDeserializer;

import java.time.Duration;
import java.util.List;

/**
 * Configuration for how the crawl should behave.
 *
 * @param workers                       number of concurrent fetch workers
 * @param timeout                       per-request connect and read timeout
 * @param pageBudget                    total pages to fetch across all runs of this database, null for unlimited
 * @param retryLimit                    times a failed address is re-queued before it is terminally failed
 * @param courtesyInterval              minimum time between two dispatches to the same host
 * @param idlePoll                      how long an idle worker waits before looking for work again
 * @param maxConsecutiveFailures        persistence or proxy failures in a row before the crawl drains
 * @param networkSuffixes               host suffixes that are reachable through the proxy
 * @param ignoredExtensions             file extensions never enqueued
 */
public record CrawlConfig(
        int workers,
        @JsonDeserialize(using = DurationDeserializer.class) Duration timeout,
        @Nullable Long pageBudget,
        int retryLimit,
        @JsonDeserialize(using = DurationDeserializer.class) Duration courtesyInterval,
        @JsonDeserialize(using = DurationDeserializer.class) Duration idlePoll,
        int maxConsecutiveFailures,
        List<String> networkSuffixes,
        List<String> ignoredExtensions) {

    public CrawlConfig {
        if (workers < 1) throw new IllegalArgumentException("workers must be at least 1");
        if (retryLimit < 0) throw new IllegalArgumentException("retryLimit must not be negative");
        if (timeout == null) timeout = Duration.ofSeconds(30);
        if (courtesyInterval == null) courtesyInterval = Duration.ZERO;
        if (idlePoll == null) idlePoll = Duration.ofMillis(250);
        if (maxConsecutiveFailures < 1) maxConsecutiveFailures = 10;
        if (networkSuffixes == null) networkSuffixes = List.of(".onion");
        if (ignoredExtensions == null) ignoredExtensions = List.of();
    }
}
