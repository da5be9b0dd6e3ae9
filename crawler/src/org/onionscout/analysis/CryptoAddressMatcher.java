package org.onionscout.analysis;

import org.onionscout.Finding;

public class CryptoAddressMatcher extends RegexMatcher {
    public CryptoAddressMatcher() {
        super(Finding.Kind.CRYPTO_ADDRESS, 20, patterns(
                "BTC", "\\b(bc1[a-zA-HJ-NP-Z0-9]{39,59}|[13][a-km-zA-HJ-NP-Z1-9]{25,34})\\b",
                "ETH", "\\b0x[a-fA-F0-9]{40}\\b",
                "XMR", "\\b4[0-9AB][1-9A-HJ-NP-Za-km-z]{93}\\b",
                "LTC", "\\b[LM][a-km-zA-HJ-NP-Z1-9]{26,33}\\b"));
    }
}
