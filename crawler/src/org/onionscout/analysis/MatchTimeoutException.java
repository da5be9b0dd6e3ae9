package org.onionscout.analysis;

public class MatchTimeoutException extends RuntimeException {
    public MatchTimeoutException(String message) {
        super(message);
    }
}
