package org.onionscout;

import org.jetbrains.annotations.Nullable;
import org.onionscout.util.Address;

import java.time.Instant;
import java.util.List;

/**
 * Everything learned from fetching one frontier entry, committed to the database as one unit.
 *
 * @param disposition what should happen to the frontier entry
 * @param links       same-network addresses discovered on the page
 * @param extracts    comments and embedded JSON kept from the page
 */
public record FetchCycle(
        FrontierEntry entry,
        Instant date,
        int status,
        Page.Outcome outcome,
        FrontierEntry.Disposition disposition,
        @Nullable String contentHash,
        long size,
        long fetchTimeMs,
        @Nullable String contentType,
        @Nullable String title,
        @Nullable String error,
        List<Finding> findings,
        List<Address> links,
        List<Extract> extracts) {

    public FetchCycle {
        findings = List.copyOf(findings);
        links = List.copyOf(links);
        extracts = List.copyOf(extracts);
    }

    public FetchCycle(FrontierEntry entry, Instant date, int status, Page.Outcome outcome,
                      FrontierEntry.Disposition disposition, @Nullable String contentHash, long size, long fetchTimeMs,
                      @Nullable String contentType, @Nullable String title, @Nullable String error,
                      List<Finding> findings, List<Address> links) {
        this(entry, date, status, outcome, disposition, contentHash, size, fetchTimeMs, contentType, title, error,
                findings, links, List.of());
    }

    /**
     * A fetch that produced no usable response.
     */
    public static FetchCycle failed(FrontierEntry entry, Instant date, Page.Outcome outcome, long fetchTimeMs,
                                    String error) {
        return new FetchCycle(entry, date, 0, outcome, FrontierEntry.Disposition.RETRY, null, 0, fetchTimeMs,
                null, null, error, List.of(), List.of());
    }

    public Page toPage() {
        return new Page(null, entry.id(), entry.address(), entry.hostId(), date, status, outcome, contentHash, size,
                fetchTimeMs, contentType, title, error);
    }
}
