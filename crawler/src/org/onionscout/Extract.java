package org.onionscout;

import org.jetbrains.annotations.Nullable;

/**
 * A fragment of a page's markup kept verbatim: an HTML comment or a block of embedded JSON.
 */
public record Extract(@Nullable Long id, long pageId, Kind kind, String content) {
    public enum Kind {
        COMMENT,
        EMBEDDED_JSON
    }

    public static Extract of(Kind kind, String content) {
        return new Extract(null, 0, kind, content);
    }
}
