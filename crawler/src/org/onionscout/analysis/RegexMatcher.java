package org.onionscout.analysis;

import org.onionscout.Finding;

import java.util.*;
import java.util.regex.Pattern;

/**
 * Base for matchers driven by a set of labelled patterns. If a pattern has a capturing group, the first group is
 * the finding's value, otherwise the whole match is. Each label yields at most {@code maxPerLabel} distinct values.
 */
public abstract class RegexMatcher implements Matcher {
    private final Finding.Kind kind;
    private final int maxPerLabel;
    private final Map<String, Pattern> patterns;

    protected RegexMatcher(Finding.Kind kind, int maxPerLabel, Map<String, Pattern> patterns) {
        this.kind = kind;
        this.maxPerLabel = maxPerLabel;
        this.patterns = patterns;
    }

    /**
     * Builds an ordered label to pattern map from alternating label and regex arguments.
     */
    protected static Map<String, Pattern> patterns(String... labelsAndRegexes) {
        var map = new LinkedHashMap<String, Pattern>();
        for (int i = 0; i < labelsAndRegexes.length; i += 2) {
            map.put(labelsAndRegexes[i], Pattern.compile(labelsAndRegexes[i + 1]));
        }
        return Collections.unmodifiableMap(map);
    }

    @Override
    public String name() {
        return getClass().getSimpleName();
    }

    /**
     * Filters out false positives.
     */
    protected boolean accept(String label, String value) {
        return true;
    }

    @Override
    public List<Finding> match(PageContent content) {
        CharSequence text = content.searchable();
        var findings = new ArrayList<Finding>();
        patterns.forEach((label, pattern) -> {
            var matcher = pattern.matcher(text);
            int group = matcher.groupCount() > 0 ? 1 : 0;
            var seen = new HashSet<String>();
            while (seen.size() < maxPerLabel && matcher.find()) {
                String value = matcher.group(group);
                if (value == null || value.isEmpty()) continue;
                if (!accept(label, value) || !seen.add(value)) continue;
                findings.add(Finding.of(kind, label, value, matcher.start(group)));
            }
        });
        return findings;
    }
}
