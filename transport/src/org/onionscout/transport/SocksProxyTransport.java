package org.onionscout.transport;

import org.onionscout.util.Address;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.*;
import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

import static org.onionscout.transport.TransportException.Kind.*;

/**
 * Fetches through a SOCKS5 proxy such as Tor's SocksPort. Hostnames are passed to the proxy unresolved so
 * hidden service addresses are resolved inside the anonymizing network.
 */
public class SocksProxyTransport implements ProxyTransport {
    private static final Logger log = LoggerFactory.getLogger(SocksProxyTransport.class);
    private final ProxySettings settings;
    private final Proxy proxy;

    public SocksProxyTransport(ProxySettings settings) {
        this.settings = settings;
        if (settings.isDirect()) {
            this.proxy = Proxy.NO_PROXY;
        } else {
            this.proxy = new Proxy(Proxy.Type.SOCKS, new InetSocketAddress(settings.host(), settings.port()));
        }
    }

    public ProxySettings settings() {
        return settings;
    }

    @Override
    public FetchResponse fetch(Address address, Duration timeout) throws TransportException, InterruptedException {
        if (Thread.interrupted()) throw new InterruptedException();
        long start = System.nanoTime();
        HttpURLConnection connection;
        try {
            connection = (HttpURLConnection) address.toURI().toURL().openConnection(proxy);
        } catch (IOException | IllegalArgumentException e) {
            throw new TransportException(ERROR, "Unable to open connection to " + address, e);
        }
        int timeoutMillis = (int) Math.min(Integer.MAX_VALUE, timeout.toMillis());
        connection.setConnectTimeout(timeoutMillis);
        connection.setReadTimeout(timeoutMillis);
        connection.setInstanceFollowRedirects(false);
        connection.setUseCaches(false);
        connection.setRequestProperty("User-Agent", pickUserAgent());
        connection.setRequestProperty("Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8");
        connection.setRequestProperty("Accept-Language", "en-US,en;q=0.9");
        try {
            int status = connection.getResponseCode();
            if (status == -1) throw new TransportException(ERROR, "Invalid HTTP response from " + address);
            byte[] body;
            try (InputStream stream = status >= 400 ? connection.getErrorStream() : connection.getInputStream()) {
                body = stream == null ? new byte[0] : stream.readNBytes((int) Math.min(Integer.MAX_VALUE - 8,
                        settings.maxBodySize()));
            }
            long fetchTimeMs = (System.nanoTime() - start) / 1_000_000;
            log.atDebug().addKeyValue("url", address).addKeyValue("status", status)
                    .addKeyValue("bytes", body.length).addKeyValue("ms", fetchTimeMs).log("Fetched");
            return new FetchResponse(address, status, connection.getHeaderFields(), body, fetchTimeMs);
        } catch (IOException e) {
            throw classify(address, e);
        } finally {
            connection.disconnect();
        }
    }

    /**
     * Maps low-level socket failures onto the transport failure kinds. The JDK's SOCKS client reports proxy
     * replies as exceptions whose message starts with "SOCKS".
     */
    TransportException classify(Address address, IOException e) {
        String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
        if (e instanceof SocketTimeoutException) {
            return new TransportException(TIMEOUT, "Timed out fetching " + address, e);
        }
        if (message.startsWith("SOCKS")) {
            if (message.contains("TTL expired")) {
                return new TransportException(TIMEOUT, "Proxy gave up reaching " + address + ": " + message, e);
            }
            return new TransportException(REFUSED, "Proxy could not reach " + address + ": " + message, e);
        }
        if (e instanceof ConnectException || e instanceof NoRouteToHostException) {
            if (proxy == Proxy.NO_PROXY) {
                return new TransportException(REFUSED, "Connection refused by " + address.authority(), e);
            }
            return new TransportException(PROXY_UNAVAILABLE, "Proxy " + proxy.address() + " unavailable: " + message, e);
        }
        if (e instanceof UnknownHostException) {
            return new TransportException(REFUSED, "Unknown host " + address.authority(), e);
        }
        return new TransportException(ERROR, "Error fetching " + address + ": " + message, e);
    }

    private String pickUserAgent() {
        var userAgents = settings.userAgents();
        return userAgents.get(ThreadLocalRandom.current().nextInt(userAgents.size()));
    }
}
