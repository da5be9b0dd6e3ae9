package org.onionscout.transport;

import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Settings for {@link SocksProxyTransport}.
 *
 * @param host         SOCKS proxy host, or null to connect directly
 * @param port         SOCKS proxy port
 * @param fallbackPort port tried when the primary port doesn't answer (e.g. the Tor Browser's 9150)
 * @param userAgents   User-Agent values, one is picked per request
 * @param maxBodySize  bodies longer than this are truncated
 */
public record ProxySettings(
        @Nullable String host,
        int port,
        @Nullable Integer fallbackPort,
        List<String> userAgents,
        long maxBodySize) {

    public static final long DEFAULT_MAX_BODY_SIZE = 10 * 1024 * 1024;

    public ProxySettings {
        if (userAgents == null || userAgents.isEmpty()) userAgents = List.of("Mozilla/5.0");
        if (maxBodySize <= 0) maxBodySize = DEFAULT_MAX_BODY_SIZE;
    }

    public static ProxySettings direct() {
        return new ProxySettings(null, 0, null, null, DEFAULT_MAX_BODY_SIZE);
    }

    public ProxySettings withPort(int port) {
        return new ProxySettings(host, port, fallbackPort, userAgents, maxBodySize);
    }

    public boolean isDirect() {
        return host == null;
    }
}
