package org.onionscout.config;

/**
 * Invalid run configuration. Always fatal at startup, before any worker starts.
 */
public class ConfigurationException extends Exception {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
