package org.onionscout;

/**
 * A write to the database failed. Fatal to the one work item being committed.
 */
public class PersistenceException extends RuntimeException {
    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
