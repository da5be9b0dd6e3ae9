package org.onionscout;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class TrustScorerTest {
    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");
    private final TrustScorer scorer = new TrustScorer(Duration.ofDays(7));

    private static Host host(long attempts, long successes, long secrets, long emails, Instant lastSeen) {
        return new Host(1, "h.onion", 0.5, lastSeen, lastSeen, attempts, successes, secrets, 0, 0, emails, 0, 0);
    }

    @Test
    void testScoreIsBounded() {
        assertBetween(scorer.score(host(0, 0, 0, 0, NOW), NOW));
        assertBetween(scorer.score(host(1000, 1000, 1000, 1000, NOW), NOW));
        assertBetween(scorer.score(host(1000, 0, 0, 0, NOW), NOW));
        // inconsistent aggregates still give a valid score
        assertBetween(scorer.score(host(1, 5, 0, 0, NOW), NOW));
    }

    @Test
    void testReliabilityAndYieldRaiseScore() {
        double unreliable = scorer.score(host(10, 0, 0, 0, NOW), NOW);
        double reliable = scorer.score(host(10, 10, 0, 0, NOW), NOW);
        double productive = scorer.score(host(10, 10, 2, 5, NOW), NOW);
        assertTrue(unreliable < reliable);
        assertTrue(reliable < productive);
    }

    @Test
    void testUnfetchedHostScoresNeutralBlend() {
        // smoothed reliability of 1/2 and no findings
        assertEquals(TrustScorer.RELIABILITY_WEIGHT * 0.5, scorer.score(host(0, 0, 0, 0, NOW), NOW), 1e-9);
    }

    @Test
    void testDecaysTowardNeutral() {
        Host good = host(20, 20, 5, 5, NOW);
        double fresh = scorer.score(good, NOW);
        double oneHalfLife = scorer.score(good, NOW.plus(Duration.ofDays(7)));
        double longIdle = scorer.score(good, NOW.plus(Duration.ofDays(365)));

        assertEquals(TrustScorer.NEUTRAL + (fresh - TrustScorer.NEUTRAL) / 2, oneHalfLife, 1e-9);
        assertEquals(TrustScorer.NEUTRAL, longIdle, 1e-6);

        Host bad = host(20, 0, 0, 0, NOW);
        assertTrue(scorer.score(bad, NOW) < scorer.score(bad, NOW.plus(Duration.ofDays(7))));
    }

    @Test
    void testScoreIsAFunctionOfAggregatesOnly() {
        Host host = host(7, 3, 1, 2, NOW.minusSeconds(3600));
        assertEquals(scorer.score(host, NOW), scorer.score(host, NOW));
        assertEquals(scorer.score(host, NOW), new TrustScorer(Duration.ofDays(7)).score(host, NOW));
    }

    @Test
    void testRejectsNonPositiveHalfLife() {
        assertThrows(IllegalArgumentException.class, () -> new TrustScorer(Duration.ZERO));
    }

    private static void assertBetween(double score) {
        assertTrue(score >= 0.0 && score <= 1.0, "score out of range: " + score);
    }
}
