package org.onionscout.config;

import org.jetbrains.annotations.Nullable;

import java.nio.file.Path;

/**
 * @param database SQLite database file
 * @param export   JSON export written when the crawl stops, or null for none
 * @param reset    discard all previous crawl state before starting
 */
public record StorageConfig(
        Path database,
        @Nullable Path export,
        boolean reset
) {
}
