package org.onionscout.analysis;

import org.onionscout.Finding;

import java.util.List;

/**
 * Extracts one kind of finding from page content. Implementations must be deterministic and thread-safe.
 */
public interface Matcher {
    String name();

    List<Finding> match(PageContent content);
}
