package org.onionscout;

import org.jetbrains.annotations.Nullable;

/**
 * A fact extracted from a page.
 *
 * @param label      sub-type within the kind, e.g. "AWS_KEY", "BTC" or "Telegram"
 * @param value      the matched text
 * @param byteOffset position of the match in the body, or -1 when it came from the response headers
 */
public record Finding(
        @Nullable Long id,
        @Nullable Long pageId,
        Kind kind,
        String label,
        String value,
        long byteOffset) {

    public static Finding of(Kind kind, String label, String value, long byteOffset) {
        return new Finding(null, null, kind, label, value, byteOffset);
    }

    public enum Kind {
        SECRET, CRYPTO_ADDRESS, SOCIAL_HANDLE, EMAIL, LEAKED_IP, TECH_FINGERPRINT
    }
}
