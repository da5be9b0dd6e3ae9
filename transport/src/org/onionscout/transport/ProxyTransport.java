package org.onionscout.transport;

import org.onionscout.util.Address;

import java.time.Duration;

/**
 * Performs single fetches through the anonymizing proxy.
 * <p>
 * Implementations must be safe for use by many threads at once.
 */
public interface ProxyTransport extends AutoCloseable {
    /**
     * Fetches an address, waiting at most {@code timeout} for the connection and for each read.
     *
     * @return the response for any HTTP status
     * @throws TransportException if no response was obtained
     */
    FetchResponse fetch(Address address, Duration timeout) throws TransportException, InterruptedException;

    @Override
    default void close() {
    }
}
