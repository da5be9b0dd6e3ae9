package org.onionscout.analysis;

import org.onionscout.Finding;

/**
 * Contact handles on messaging networks. For link-style handles the value is the handle itself.
 */
public class SocialHandleMatcher extends RegexMatcher {
    public SocialHandleMatcher() {
        super(Finding.Kind.SOCIAL_HANDLE, 10, patterns(
                "Telegram", "(?:https?://)?(?:t\\.me|telegram\\.me)/([a-zA-Z0-9_]{5,})",
                "Discord", "(?:https?://)?(?:discord\\.gg|discordapp\\.com/invite)/([a-zA-Z0-9]+)",
                "Jabber", "(?<![a-zA-Z0-9._%+-])[a-zA-Z0-9._%+-]++@(?:jabber|xmpp)\\.[a-z]{2,}",
                "Session", "\\b05[a-fA-F0-9]{64}\\b",
                "Wickr", "(?i)wickr\\s*:\\s*([a-zA-Z0-9_]+)"));
    }
}
