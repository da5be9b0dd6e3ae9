package org.onionscout.transport;

/**
 * A fetch that produced no HTTP response.
 */
public class TransportException extends Exception {
    private final Kind kind;

    public TransportException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public TransportException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind kind() {
        return kind;
    }

    public enum Kind {
        /** Connecting or reading took longer than the request timeout. */
        TIMEOUT,
        /** The destination refused or could not be reached through the proxy. */
        REFUSED,
        /** The proxy itself could not be reached. */
        PROXY_UNAVAILABLE,
        ERROR
    }
}
