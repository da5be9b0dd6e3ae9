package org.onionscout.analysis;

import org.jetbrains.annotations.Nullable;
import org.onionscout.util.BareMediaType;

import java.nio.charset.Charset;
import java.util.*;

import static java.nio.charset.StandardCharsets.ISO_8859_1;

/**
 * A response body prepared for analysis. Pattern matchers search a Latin-1 decoding of the raw bytes, which maps
 * every byte to exactly one char, so a match's char index is also its byte offset in the body.
 */
public final class PageContent {
    static final long MIN_MATCH_BUDGET = 100_000;
    private final byte[] body;
    private final @Nullable String contentType;
    private final Map<String, List<String>> headers;
    private final String latin1;
    private final long matchBudget;

    public PageContent(byte[] body, @Nullable String contentType, Map<String, List<String>> headers,
                       long maxAnalyzedBytes, int matchStepsPerChar) {
        this.body = body;
        this.contentType = contentType;
        var map = new TreeMap<String, List<String>>(String.CASE_INSENSITIVE_ORDER);
        headers.forEach((name, values) -> {
            if (name != null) map.put(name, List.copyOf(values));
        });
        this.headers = Collections.unmodifiableMap(map);
        int length = (int) Math.min(body.length, maxAnalyzedBytes);
        this.latin1 = new String(body, 0, length, ISO_8859_1);
        this.matchBudget = Math.max(MIN_MATCH_BUDGET, (long) length * matchStepsPerChar);
    }

    public static PageContent of(byte[] body) {
        return new PageContent(body, null, Map.of(), Long.MAX_VALUE, 1000);
    }

    public byte[] body() {
        return body;
    }

    public @Nullable String contentType() {
        return contentType;
    }

    /**
     * @return the charset declared in the Content-Type header, or null if absent or unsupported
     */
    public @Nullable Charset declaredCharset() {
        return contentType == null ? null : BareMediaType.charsetOf(contentType);
    }

    public boolean isHtml() {
        return contentType == null || BareMediaType.of(contentType).isHtml();
    }

    public List<String> headers(String name) {
        return headers.getOrDefault(name, List.of());
    }

    public String latin1() {
        return latin1;
    }

    /**
     * Returns the text for pattern matching, which aborts with {@link MatchTimeoutException} once a single matcher
     * has read more characters than the budget allows for this body.
     */
    public CharSequence searchable() {
        return new BudgetedCharSequence(latin1, matchBudget);
    }
}
