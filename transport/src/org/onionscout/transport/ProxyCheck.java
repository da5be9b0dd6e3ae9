package org.onionscout.transport;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.onionscout.util.Address;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.Optional;

/**
 * Checks that a transport really exits through the Tor network by asking the Tor Project's check service.
 */
public class ProxyCheck {
    private static final Logger log = LoggerFactory.getLogger(ProxyCheck.class);
    static final Address CHECK_ADDRESS = Address.fromNormalized("https://check.torproject.org/api/ip");
    private static final ObjectMapper JSON = new ObjectMapper();
    private final Duration timeout;

    public ProxyCheck(Duration timeout) {
        this.timeout = timeout;
    }

    /**
     * @return the exit address reported by the check service, or empty if the transport failed or isn't using Tor
     */
    public Optional<String> check(ProxyTransport transport) throws InterruptedException {
        FetchResponse response;
        try {
            response = transport.fetch(CHECK_ADDRESS, timeout);
        } catch (TransportException e) {
            log.atWarn().addKeyValue("kind", e.kind()).log("Proxy check failed: {}", e.getMessage());
            return Optional.empty();
        }
        if (!response.isSuccess()) {
            log.warn("Proxy check returned HTTP {}", response.status());
            return Optional.empty();
        }
        try {
            JsonNode node = JSON.readTree(response.body());
            if (!node.path("IsTor").asBoolean(false)) {
                log.warn("Proxy check says the connection is not using Tor");
                return Optional.empty();
            }
            return Optional.of(node.path("IP").asText("unknown"));
        } catch (IOException e) {
            log.warn("Unparseable proxy check response", e);
            return Optional.empty();
        }
    }

    /**
     * Tries the configured port and then the fallback port, returning settings for whichever answered first.
     */
    public Optional<ProxySettings> selectPort(ProxySettings settings) throws InterruptedException {
        try (var transport = new SocksProxyTransport(settings)) {
            var ip = check(transport);
            if (ip.isPresent()) {
                log.info("Proxy OK on port {}, exit address {}", settings.port(), ip.get());
                return Optional.of(settings);
            }
        }
        Integer fallback = settings.fallbackPort();
        if (fallback == null || fallback == settings.port()) return Optional.empty();
        log.warn("Proxy port {} failed, trying fallback port {}", settings.port(), fallback);
        var fallbackSettings = settings.withPort(fallback);
        try (var transport = new SocksProxyTransport(fallbackSettings)) {
            var ip = check(transport);
            if (ip.isPresent()) {
                log.info("Proxy OK on fallback port {}, exit address {}", fallback, ip.get());
                return Optional.of(fallbackSettings);
            }
        }
        return Optional.empty();
    }
}
