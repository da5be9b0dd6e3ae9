package org.onionscout.transport;

import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.onionscout.util.Address;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executors;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.jupiter.api.Assertions.*;

class SocksProxyTransportTest {
    private static HttpServer httpServer;
    private static String origin;

    @BeforeAll
    static void startServer() throws IOException {
        httpServer = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        httpServer.createContext("/", exchange -> {
            switch (exchange.getRequestURI().getPath()) {
                case "/page/" -> {
                    byte[] body = "<html><title>hi</title></html>".getBytes(UTF_8);
                    exchange.getResponseHeaders().add("Content-Type", "text/html; charset=utf-8");
                    exchange.getResponseHeaders().add("Server", "nginx");
                    exchange.sendResponseHeaders(200, body.length);
                    exchange.getResponseBody().write(body);
                }
                case "/moved/" -> {
                    exchange.getResponseHeaders().add("Location", "/page/");
                    exchange.sendResponseHeaders(301, -1);
                }
                case "/slow/" -> {
                    try {
                        Thread.sleep(2000);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    exchange.sendResponseHeaders(200, -1);
                }
                default -> {
                    byte[] body = "gone".getBytes(UTF_8);
                    exchange.sendResponseHeaders(404, body.length);
                    exchange.getResponseBody().write(body);
                }
            }
            exchange.close();
        });
        httpServer.setExecutor(Executors.newCachedThreadPool());
        httpServer.start();
        origin = "http://127.0.0.1:" + httpServer.getAddress().getPort();
    }

    @AfterAll
    static void stopServer() {
        httpServer.stop(0);
    }

    @Test
    void testFetchOk() throws Exception {
        try (var transport = new SocksProxyTransport(ProxySettings.direct())) {
            var response = transport.fetch(Address.parse(origin + "/page/"), Duration.ofSeconds(5));
            assertEquals(200, response.status());
            assertTrue(response.isSuccess());
            assertEquals("text/html", response.contentType().value());
            assertEquals(UTF_8, response.charset());
            assertEquals("nginx", response.header("server"));
            assertEquals("<html><title>hi</title></html>", new String(response.body(), UTF_8));
        }
    }

    @Test
    void testRedirectIsNotFollowed() throws Exception {
        try (var transport = new SocksProxyTransport(ProxySettings.direct())) {
            var response = transport.fetch(Address.parse(origin + "/moved/"), Duration.ofSeconds(5));
            assertEquals(301, response.status());
            assertTrue(response.isRedirect());
            assertEquals("/page/", response.header("Location"));
        }
    }

    @Test
    void testErrorStatusStillReturnsBody() throws Exception {
        try (var transport = new SocksProxyTransport(ProxySettings.direct())) {
            var response = transport.fetch(Address.parse(origin + "/missing/"), Duration.ofSeconds(5));
            assertEquals(404, response.status());
            assertFalse(response.isRetryable());
            assertEquals("gone", new String(response.body(), UTF_8));
        }
    }

    @Test
    void testBodyIsTruncated() throws Exception {
        var settings = new ProxySettings(null, 0, null, List.of("test"), 6);
        try (var transport = new SocksProxyTransport(settings)) {
            var response = transport.fetch(Address.parse(origin + "/page/"), Duration.ofSeconds(5));
            assertEquals("<html>", new String(response.body(), UTF_8));
        }
    }

    @Test
    void testTimeout() throws Exception {
        try (var transport = new SocksProxyTransport(ProxySettings.direct())) {
            var e = assertThrows(TransportException.class,
                    () -> transport.fetch(Address.parse(origin + "/slow/"), Duration.ofMillis(200)));
            assertEquals(TransportException.Kind.TIMEOUT, e.kind());
        }
    }

    @Test
    void testRefused() throws Exception {
        int closedPort;
        try (var socket = new ServerSocket(0)) {
            closedPort = socket.getLocalPort();
        }
        try (var transport = new SocksProxyTransport(ProxySettings.direct())) {
            var e = assertThrows(TransportException.class,
                    () -> transport.fetch(Address.parse("http://127.0.0.1:" + closedPort + "/"), Duration.ofSeconds(2)));
            assertEquals(TransportException.Kind.REFUSED, e.kind());
        }
    }

    @Test
    void testClassifiesProxyFailures() throws Exception {
        var settings = new ProxySettings("127.0.0.1", 9050, null, null, 0);
        var transport = new SocksProxyTransport(settings);
        var address = Address.parse("http://abc.onion/");
        assertEquals(TransportException.Kind.REFUSED,
                transport.classify(address, new SocketException("SOCKS: Host unreachable")).kind());
        assertEquals(TransportException.Kind.TIMEOUT,
                transport.classify(address, new SocketException("SOCKS: TTL expired")).kind());
        assertEquals(TransportException.Kind.PROXY_UNAVAILABLE,
                transport.classify(address, new java.net.ConnectException("Connection refused")).kind());
        assertEquals(TransportException.Kind.TIMEOUT,
                transport.classify(address, new SocketTimeoutException("Read timed out")).kind());
        assertEquals(TransportException.Kind.ERROR,
                transport.classify(address, new IOException("Premature EOF")).kind());
    }
}
