package org.onionscout.config;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.jetbrains.annotations.Nullable;
import org.onionscout.transport.ProxySettings;
import org.onionscout.util.ByteSizeDeserializer;

import java.util.List;

/**
 * @param host         SOCKS proxy host, or null to connect directly (testing only)
 * @param port         SOCKS proxy port
 * @param fallbackPort port tried when the primary port fails the startup check
 * @param verify       check at startup that the proxy really exits through Tor
 * @param userAgents   User-Agent strings, one picked at random per request
 * @param maxBodySize  response bodies are truncated to this many bytes
 */
public record ProxyConfig(
        @Nullable String host,
        int port,
        @Nullable Integer fallbackPort,
        boolean verify,
        List<String> userAgents,
        @JsonDeserialize(using = ByteSizeDeserializer.class) Long maxBodySize) {

    public ProxySettings toSettings() {
        return new ProxySettings(host, port, fallbackPort, userAgents, maxBodySize == null ? 0 : maxBodySize);
    }
}
