package org.onionscout.util;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.UnsupportedCharsetException;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A media type without parameters, e.g. "text/html".
 */
public record BareMediaType(@JsonValue String value) {
    private static final Pattern CHARSET_PARAM = Pattern.compile("(?i);\\s*charset\\s*=\\s*\"?([^\";\\s]+)");

    @JsonCreator
    public BareMediaType {
        assert value.indexOf(';') == -1;
    }

    public static BareMediaType of(String value) {
        if (value == null) return null;
        var semicolon = value.indexOf(';');
        if (semicolon >= 0) {
            value = value.substring(0, semicolon);
        }
        return new BareMediaType(value.strip().toLowerCase(Locale.ROOT));
    }

    /**
     * Extracts the charset parameter of a Content-Type header value.
     *
     * @return the charset or null if it is absent or unknown to this JVM
     */
    public static Charset charsetOf(String contentType) {
        if (contentType == null) return null;
        Matcher matcher = CHARSET_PARAM.matcher(contentType);
        if (!matcher.find()) return null;
        try {
            return Charset.forName(matcher.group(1));
        } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
            return null;
        }
    }

    public boolean isHtml() {
        return value.equals("text/html") || value.equals("application/xhtml+xml");
    }

    public boolean isText() {
        return value.startsWith("text/") || isHtml() || value.equals("application/json")
               || value.equals("application/javascript") || value.endsWith("+xml");
    }
}
