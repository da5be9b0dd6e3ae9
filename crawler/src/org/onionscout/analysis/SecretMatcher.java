package org.onionscout.analysis;

import org.onionscout.Finding;

/**
 * Credentials and key material accidentally published: cloud keys, private keys, API tokens, connection strings.
 */
public class SecretMatcher extends RegexMatcher {
    public SecretMatcher() {
        super(Finding.Kind.SECRET, 10, patterns(
                "AWS_KEY", "AKIA[0-9A-Z]{16}",
                "AWS_SECRET", "(?i)aws[_-]?secret[_-]?access[_-]?key\\s*[:=]\\s*['\"]?([A-Za-z0-9/+=]{40})['\"]?",
                "PRIVATE_KEY", "-----BEGIN\\s+(?:RSA|DSA|EC|OPENSSH)?\\s*PRIVATE\\sKEY-----",
                "GOOGLE_API", "AIza[0-9A-Za-z_-]{35}",
                "GITHUB_TOKEN", "gh[pousr]_[A-Za-z0-9_]{36,}",
                "GENERIC_API_KEY", "(?i)(?:api[_-]?key|access[_-]?token|secret[_-]?key|auth[_-]?token)\\s*[:=]\\s*['\"]([a-zA-Z0-9_-]{32,})['\"]",
                "DB_CONNECTION", "(?:mysql|postgres|mongodb|redis)://[^\\s<>\"']+",
                "JWT_TOKEN", "eyJ[A-Za-z0-9_-]+\\.eyJ[A-Za-z0-9_-]+\\.[A-Za-z0-9_-]+"));
    }
}
