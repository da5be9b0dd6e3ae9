package org.onionscout;

/**
 * The database schema couldn't be brought up to date. The crawler refuses to start.
 */
public class MigrationException extends RuntimeException {
    public MigrationException(String message) {
        super(message);
    }

    public MigrationException(String message, Throwable cause) {
        super(message, cause);
    }
}
