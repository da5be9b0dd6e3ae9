package org.onionscout.analysis;

import org.onionscout.Finding;

import java.util.List;
import java.util.Locale;

public class EmailMatcher extends RegexMatcher {
    // asset names like "logo@2x.png" look like addresses
    private static final List<String> ASSET_SUFFIXES = List.of(".png", ".jpg", ".jpeg", ".gif", ".svg", ".webp",
            ".css", ".js");

    public EmailMatcher() {
        super(Finding.Kind.EMAIL, 50, patterns(
                "EMAIL", "(?<![a-zA-Z0-9._%+-])[a-zA-Z0-9._%+-]++@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}"));
    }

    @Override
    protected boolean accept(String label, String value) {
        String lower = value.toLowerCase(Locale.ROOT);
        for (String suffix : ASSET_SUFFIXES) {
            if (lower.endsWith(suffix)) return false;
        }
        return true;
    }
}
