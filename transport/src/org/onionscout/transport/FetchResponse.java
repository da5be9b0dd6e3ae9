package org.onionscout.transport;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.onionscout.util.Address;
import org.onionscout.util.BareMediaType;

import java.nio.charset.Charset;
import java.util.*;

/**
 * The HTTP response to one fetch.
 *
 * @param address     the address that was requested
 * @param status      HTTP status code
 * @param headers     response headers, keyed case-insensitively
 * @param body        response body, possibly truncated to the transport's size limit
 * @param fetchTimeMs time from issuing the request to reading the last body byte
 */
public record FetchResponse(
        @NotNull Address address,
        int status,
        @NotNull Map<String, List<String>> headers,
        byte[] body,
        long fetchTimeMs) {

    public FetchResponse {
        var sorted = new TreeMap<String, List<String>>(String.CASE_INSENSITIVE_ORDER);
        headers.forEach((name, values) -> {
            if (name != null) sorted.put(name, List.copyOf(values));
        });
        headers = Collections.unmodifiableMap(sorted);
    }

    public @Nullable String header(String name) {
        List<String> values = headers.get(name);
        if (values == null || values.isEmpty()) return null;
        return values.get(0);
    }

    public List<String> headers(String name) {
        return headers.getOrDefault(name, List.of());
    }

    public @Nullable BareMediaType contentType() {
        return BareMediaType.of(header("Content-Type"));
    }

    public @Nullable Charset charset() {
        return BareMediaType.charsetOf(header("Content-Type"));
    }

    public boolean isSuccess() {
        return status >= 200 && status < 300;
    }

    public boolean isRedirect() {
        return status >= 300 && status < 400 && header("Location") != null;
    }

    /**
     * Whether the server signalled a condition that may clear up on a later attempt.
     */
    public boolean isRetryable() {
        return status == 429 || status >= 500;
    }
}
