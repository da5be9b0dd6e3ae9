package org.onionscout;

import java.time.Instant;

/**
 * A hidden service, identified by the authority part of its addresses, with the aggregates its trust score is
 * computed from.
 */
public record Host(
        long id,
        String name,
        double trustScore,
        Instant firstSeen,
        Instant lastSeen,
        long attempts,
        long successes,
        long secrets,
        long cryptoAddresses,
        long socialHandles,
        long emails,
        long leakedIps,
        long techFingerprints) {

    public long findings(Finding.Kind kind) {
        return switch (kind) {
            case SECRET -> secrets;
            case CRYPTO_ADDRESS -> cryptoAddresses;
            case SOCIAL_HANDLE -> socialHandles;
            case EMAIL -> emails;
            case LEAKED_IP -> leakedIps;
            case TECH_FINGERPRINT -> techFingerprints;
        };
    }

    public long totalFindings() {
        return secrets + cryptoAddresses + socialHandles + emails + leakedIps + techFingerprints;
    }
}
