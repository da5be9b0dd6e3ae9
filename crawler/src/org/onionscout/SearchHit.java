package org.onionscout;

import org.jetbrains.annotations.Nullable;
import org.onionscout.util.Address;

import java.time.Instant;

/**
 * A search match together with the page and host it was found on. Either a finding whose value matched, or a page
 * whose content hash, title, address or host name matched, in which case the finding columns are null and
 * {@code label} names the matched field.
 */
public record SearchHit(
        @Nullable Long findingId,
        long pageId,
        @Nullable Finding.Kind kind,
        String label,
        String value,
        @Nullable Long byteOffset,
        Address address,
        @Nullable String contentHash,
        Instant date,
        String host) {

    public boolean isFinding() {
        return findingId != null;
    }
}
