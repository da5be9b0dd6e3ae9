package org.onionscout;

import java.util.Collection;

/**
 * Number of findings of each kind, as added to a host's aggregates.
 */
public record FindingCounts(long secrets, long cryptoAddresses, long socialHandles, long emails, long leakedIps,
                            long techFingerprints) {

    public static FindingCounts of(Collection<Finding> findings) {
        long[] counts = new long[Finding.Kind.values().length];
        for (Finding finding : findings) {
            counts[finding.kind().ordinal()]++;
        }
        return new FindingCounts(counts[0], counts[1], counts[2], counts[3], counts[4], counts[5]);
    }
}
