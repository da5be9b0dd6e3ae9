package org.onionscout;

import java.time.Duration;
import java.time.Instant;

/**
 * Computes a host's reputation in [0, 1] from its stored aggregates alone.
 * <p>
 * The score blends fetch reliability, a smoothed success ratio, with finding yield, a saturating function of
 * weighted finding counts. The result then decays exponentially toward the neutral {@value #NEUTRAL} as the time
 * since the host was last fetched grows, halving the distance every half-life.
 */
public class TrustScorer {
    static final double NEUTRAL = 0.5;
    static final double RELIABILITY_WEIGHT = 0.6;
    static final double YIELD_WEIGHT = 0.4;
    static final double YIELD_SCALE = 10.0;

    private final Duration halfLife;

    public TrustScorer(Duration halfLife) {
        if (halfLife.isNegative() || halfLife.isZero()) throw new IllegalArgumentException("halfLife must be positive");
        this.halfLife = halfLife;
    }

    public double score(Host host, Instant now) {
        double raw = RELIABILITY_WEIGHT * reliability(host) + YIELD_WEIGHT * findingYield(host);
        return clamp(decay(raw, host.lastSeen(), now));
    }

    static double reliability(Host host) {
        long attempts = Math.max(host.attempts(), host.successes());
        return (host.successes() + 1.0) / (attempts + 2.0);
    }

    static double findingYield(Host host) {
        return 1.0 - Math.exp(-weightedFindings(host) / YIELD_SCALE);
    }

    static double weightedFindings(Host host) {
        double total = 0;
        for (Finding.Kind kind : Finding.Kind.values()) {
            total += weight(kind) * host.findings(kind);
        }
        return total;
    }

    static double weight(Finding.Kind kind) {
        return switch (kind) {
            case SECRET -> 3.0;
            case CRYPTO_ADDRESS -> 2.0;
            case LEAKED_IP -> 1.5;
            case SOCIAL_HANDLE, EMAIL -> 1.0;
            case TECH_FINGERPRINT -> 0.25;
        };
    }

    private double decay(double raw, Instant lastSeen, Instant now) {
        if (lastSeen == null || !now.isAfter(lastSeen)) return raw;
        double age = Duration.between(lastSeen, now).toMillis();
        double factor = Math.pow(0.5, age / halfLife.toMillis());
        return NEUTRAL + (raw - NEUTRAL) * factor;
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) return NEUTRAL;
        return Math.max(0.0, Math.min(1.0, value));
    }
}
