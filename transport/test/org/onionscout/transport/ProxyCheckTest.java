package org.onionscout.transport;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.jupiter.api.Assertions.assertEquals;

class ProxyCheckTest {
    private final ProxyCheck check = new ProxyCheck(Duration.ofSeconds(1));

    private static ProxyTransport respondingWith(int status, String body) {
        return (address, timeout) -> new FetchResponse(address, status,
                Map.of("Content-Type", List.of("application/json")), body.getBytes(UTF_8), 1);
    }

    @Test
    void testTorExit() throws InterruptedException {
        var result = check.check(respondingWith(200, "{\"IsTor\":true,\"IP\":\"185.220.101.4\"}"));
        assertEquals(Optional.of("185.220.101.4"), result);
    }

    @Test
    void testNotTor() throws InterruptedException {
        assertEquals(Optional.empty(), check.check(respondingWith(200, "{\"IsTor\":false,\"IP\":\"203.0.113.9\"}")));
    }

    @Test
    void testGarbageAndErrors() throws InterruptedException {
        assertEquals(Optional.empty(), check.check(respondingWith(200, "<html>")));
        assertEquals(Optional.empty(), check.check(respondingWith(503, "")));
        assertEquals(Optional.empty(), check.check((address, timeout) -> {
            throw new TransportException(TransportException.Kind.PROXY_UNAVAILABLE, "down");
        }));
    }
}
