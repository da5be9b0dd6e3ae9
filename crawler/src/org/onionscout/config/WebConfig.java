package org.onionscout.config;

public record WebConfig(boolean enabled, String host, int port) {
}
