package org.onionscout.analysis;

import org.jetbrains.annotations.Nullable;
import org.onionscout.Extract;
import org.onionscout.Finding;
import org.onionscout.util.Address;

import java.util.List;

/**
 * What was learned from one response body.
 *
 * @param findings deduplicated by kind and value, in matcher order
 * @param links    in-scope addresses in document order, without duplicates
 * @param extracts HTML comments and embedded JSON blocks, in document order
 * @param errors   one message per matcher or parse step that failed; the rest of the analysis still ran
 */
public record Analysis(List<Finding> findings, List<Address> links, @Nullable String title, List<Extract> extracts,
                       List<String> errors) {
    public Analysis {
        findings = List.copyOf(findings);
        links = List.copyOf(links);
        extracts = List.copyOf(extracts);
        errors = List.copyOf(errors);
    }

    public static Analysis empty() {
        return new Analysis(List.of(), List.of(), null, List.of(), List.of());
    }
}
