package org.onionscout.config;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.onionscout.util.DurationDeserializer;

import java.time.Duration;

/**
 * @param halfLife       time since a host was last fetched after which its score has moved halfway to neutral
 * @param refreshInterval how often all scores are recomputed so idle hosts decay
 */
public record TrustConfig(
        @JsonDeserialize(using = DurationDeserializer.class) Duration halfLife,
        @JsonDeserialize(using = DurationDeserializer.class) Duration refreshInterval) {

    public TrustConfig {
        if (halfLife == null || halfLife.isNegative() || halfLife.isZero()) halfLife = Duration.ofDays(7);
        if (refreshInterval == null) refreshInterval = Duration.ofMinutes(10);
    }
}
