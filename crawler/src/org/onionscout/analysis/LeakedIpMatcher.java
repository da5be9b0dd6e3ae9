package org.onionscout.analysis;

import org.onionscout.Finding;

import java.util.ArrayList;
import java.util.List;

/**
 * Public IPv4 addresses, which on a hidden service usually point at the real server or an operator.
 */
public class LeakedIpMatcher extends RegexMatcher {
    private static final List<String> NON_PUBLIC_PREFIXES = nonPublicPrefixes();

    public LeakedIpMatcher() {
        super(Finding.Kind.LEAKED_IP, 20, patterns(
                "IPV4", "\\b(?:(?:25[0-5]|2[0-4][0-9]|[01]?[0-9][0-9]?)\\.){3}(?:25[0-5]|2[0-4][0-9]|[01]?[0-9][0-9]?)\\b"));
    }

    private static List<String> nonPublicPrefixes() {
        var prefixes = new ArrayList<>(List.of("127.", "0.", "10.", "192.168.", "169.254."));
        for (int i = 16; i <= 31; i++) {
            prefixes.add("172." + i + ".");
        }
        return List.copyOf(prefixes);
    }

    @Override
    protected boolean accept(String label, String value) {
        for (String prefix : NON_PUBLIC_PREFIXES) {
            if (value.startsWith(prefix)) return false;
        }
        return true;
    }
}
