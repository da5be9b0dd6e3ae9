package org.onionscout.config;

import java.util.List;

/**
 * Root configuration for a crawl run. Loaded once at startup and treated as immutable afterwards.
 *
 * @param seeds    addresses to start crawling from
 * @param crawl    how to crawl (workers, timeouts, budget, retries, courtesy)
 * @param proxy    how to reach the anonymizing network
 * @param storage  where state and exports are written
 * @param web      the dashboard API server
 * @param trust    host reputation scoring
 * @param analysis content extraction limits
 */
public record ScoutConfig(
        List<String> seeds,
        CrawlConfig crawl,
        ProxyConfig proxy,
        StorageConfig storage,
        WebConfig web,
        TrustConfig trust,
        AnalysisConfig analysis
) {
    public ScoutConfig {
        if (seeds == null) seeds = List.of();
    }
}
