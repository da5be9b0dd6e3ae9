package org.onionscout.util;

import com.fasterxml.jackson.annotation.JsonValue;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * A normalized resource locator. Two addresses are equal if and only if their normalized string forms are equal,
 * so the string form doubles as the deduplication key for the frontier.
 * <p>
 * Normalization drops the fragment, defaults a missing scheme to http, lower-cases the scheme and host, drops
 * default ports, removes dot segments, appends a trailing slash to a final path segment without an extension
 * and drops overlong or empty queries. Normalizing an already normalized address returns an equal address.
 */
public final class Address implements Comparable<Address> {
    static final int MAX_QUERY_LENGTH = 100;
    private static final Pattern SCHEME_PREFIX = Pattern.compile("^([a-zA-Z][a-zA-Z0-9+.-]*):(.*)$", Pattern.DOTALL);
    private static final Pattern PORT_AND_PATH = Pattern.compile("^\\d+(?:[/?].*)?$", Pattern.DOTALL);
    private final String scheme;
    private final String host;
    private final int port;
    private final String path;
    private final @Nullable String query;
    private final String value;

    private Address(String scheme, String host, int port, String path, @Nullable String query) {
        this.scheme = scheme;
        this.host = host;
        this.port = port;
        this.path = path;
        this.query = query;
        this.value = scheme + "://" + authority() + path + (query == null ? "" : "?" + query);
    }

    /**
     * Parses and normalizes an address.
     *
     * @throws InvalidAddressException if the string is not an http(s) locator with a host
     */
    public static Address parse(String raw) throws InvalidAddressException {
        if (raw == null) throw new InvalidAddressException(null, "address is missing");
        String s = raw.strip();
        if (s.isEmpty()) throw new InvalidAddressException(raw, "address is empty");
        int hash = s.indexOf('#');
        if (hash >= 0) s = s.substring(0, hash);
        if (!hasScheme(s)) s = "http://" + s;

        URI uri;
        try {
            uri = new URI(s);
        } catch (URISyntaxException e) {
            throw new InvalidAddressException(raw, e.getReason());
        }
        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) {
            throw new InvalidAddressException(raw, "unsupported scheme '" + scheme + "'");
        }
        String host = uri.getHost();
        if (host == null || host.isEmpty()) {
            throw new InvalidAddressException(raw, "missing or malformed host");
        }
        host = host.toLowerCase(Locale.ROOT);
        if (host.endsWith(".")) host = host.substring(0, host.length() - 1);
        if (host.isEmpty()) throw new InvalidAddressException(raw, "missing or malformed host");

        int port = uri.getPort();
        if (port == defaultPort(scheme)) port = -1;

        String path = uri.getRawPath();
        if (path == null || path.isEmpty()) path = "/";
        path = removeDotSegments(path);
        String lastSegment = path.substring(path.lastIndexOf('/') + 1);
        if (!lastSegment.isEmpty() && lastSegment.indexOf('.') == -1) {
            path = path + "/";
        }

        String query = uri.getRawQuery();
        if (query != null && (query.isEmpty() || query.length() > MAX_QUERY_LENGTH)) query = null;

        return new Address(scheme, host, port, path, query);
    }

    /**
     * "host.onion:8080/" is a host and port, not a scheme named "host.onion".
     */
    private static boolean hasScheme(String s) {
        var matcher = SCHEME_PREFIX.matcher(s);
        if (!matcher.matches()) return false;
        String rest = matcher.group(2);
        if (rest.startsWith("//")) return true;
        return matcher.group(1).indexOf('.') == -1 && !PORT_AND_PATH.matcher(rest).matches();
    }

    /**
     * Returns the address, or null if it fails normalization.
     */
    public static @Nullable Address orNull(String raw) {
        try {
            return parse(raw);
        } catch (InvalidAddressException e) {
            return null;
        }
    }

    /**
     * Re-parses a value that was normalized before it was stored.
     *
     * @throws IllegalStateException if the stored value no longer parses
     */
    public static Address fromNormalized(String value) {
        try {
            return parse(value);
        } catch (InvalidAddressException e) {
            throw new IllegalStateException("Stored address is not valid: " + value, e);
        }
    }

    private static int defaultPort(String scheme) {
        return scheme.equals("https") ? 443 : 80;
    }

    static String removeDotSegments(String path) {
        Deque<String> output = new ArrayDeque<>();
        String[] segments = path.split("/", -1);
        for (int i = 1; i < segments.length; i++) {
            String segment = segments[i];
            boolean last = i == segments.length - 1;
            if (segment.equals(".")) {
                if (last) output.addLast("");
            } else if (segment.equals("..")) {
                output.pollLast();
                if (last) output.addLast("");
            } else {
                output.addLast(segment);
            }
        }
        return "/" + String.join("/", output);
    }

    public String scheme() {
        return scheme;
    }

    public String host() {
        return host;
    }

    public int port() {
        return port;
    }

    /**
     * Host plus the port when it isn't the scheme's default. This is the key {@code Host} records are stored under.
     */
    public String authority() {
        return port == -1 ? host : host + ":" + port;
    }

    public String path() {
        return path;
    }

    public @Nullable String query() {
        return query;
    }

    public boolean hasHostSuffix(String suffix) {
        return host.endsWith(suffix.toLowerCase(Locale.ROOT));
    }

    /**
     * The lower-cased extension of the final path segment including the dot (e.g. ".png"), or "" if there is none.
     */
    public String extension() {
        String lastSegment = path.substring(path.lastIndexOf('/') + 1);
        int dot = lastSegment.lastIndexOf('.');
        return dot == -1 ? "" : lastSegment.substring(dot).toLowerCase(Locale.ROOT);
    }

    public URI toURI() {
        return URI.create(value);
    }

    @JsonValue
    @Override
    public String toString() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return value.equals(((Address) o).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public int compareTo(@NotNull Address o) {
        return value.compareTo(o.value);
    }
}
