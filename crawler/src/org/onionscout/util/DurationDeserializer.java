package org.onionscout.util;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;

import java.io.IOException;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;

/**
 * Reads durations written as plain milliseconds or as "30s", "5m", "1h30m".
 */
public class DurationDeserializer extends JsonDeserializer<Duration> {
    @Override
    public Duration deserialize(JsonParser jsonParser, DeserializationContext deserializationContext) throws IOException {
        if (jsonParser.currentToken().isNumeric()) return Duration.ofMillis(jsonParser.getLongValue());
        return parse(jsonParser.getText());
    }

    public static Duration parse(String text) {
        String value = text.strip().toUpperCase(Locale.ROOT);
        if (value.startsWith("P")) return Duration.parse(value);
        if (value.endsWith("MS")) return Duration.ofMillis(Long.parseLong(value.substring(0, value.length() - 2)));
        try {
            return Duration.parse("PT" + value);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid duration: " + text, e);
        }
    }
}
