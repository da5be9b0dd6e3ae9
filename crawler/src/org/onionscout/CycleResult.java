package org.onionscout;

import java.util.List;

/**
 * What a committed fetch cycle changed.
 *
 * @param entry      the frontier entry in its new state
 * @param discovered entries newly added to the frontier from the page's links
 */
public record CycleResult(long pageId, FrontierEntry entry, List<FrontierEntry> discovered, int findingsInserted,
                          double trustScore) {
}
