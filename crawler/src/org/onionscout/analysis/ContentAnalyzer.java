package org.onionscout.analysis;

import org.jetbrains.annotations.Nullable;
import org.onionscout.Extract;
import org.onionscout.Finding;
import org.onionscout.config.AnalysisConfig;
import org.onionscout.util.Address;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.util.*;

/**
 * Runs every matcher over a response body and extracts in-scope links along with comment and JSON fragments.
 * Analysis is a pure function of its input: the same bytes always produce the same findings in the same order. A
 * failing matcher is logged and recorded in {@link Analysis#errors()} without affecting the others.
 */
public class ContentAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(ContentAnalyzer.class);
    private final List<Matcher> matchers;
    private final NetworkScope scope;
    private final AnalysisConfig config;
    private final HtmlExtractor htmlExtractor = new HtmlExtractor();

    public ContentAnalyzer(NetworkScope scope, AnalysisConfig config) {
        this(defaultMatchers(), scope, config);
    }

    public ContentAnalyzer(List<Matcher> matchers, NetworkScope scope, AnalysisConfig config) {
        this.matchers = List.copyOf(matchers);
        this.scope = scope;
        this.config = config;
    }

    public static List<Matcher> defaultMatchers() {
        return List.of(new SecretMatcher(), new CryptoAddressMatcher(), new SocialHandleMatcher(),
                new EmailMatcher(), new LeakedIpMatcher(), new TechFingerprintMatcher());
    }

    public NetworkScope scope() {
        return scope;
    }

    public Analysis analyze(byte[] body, Address source) {
        return analyze(body, null, Map.of(), source);
    }

    public Analysis analyze(byte[] body, @Nullable String contentType, Map<String, List<String>> headers,
                            Address source) {
        return analyze(new PageContent(body, contentType, headers, config.maxAnalyzedBytes(),
                config.matchStepsPerChar()), source);
    }

    public Analysis analyze(PageContent content, Address source) {
        var errors = new ArrayList<String>();
        var findings = new ArrayList<Finding>();
        var seen = new HashSet<String>();
        for (Matcher matcher : matchers) {
            List<Finding> matched;
            try {
                matched = matcher.match(content);
            } catch (RuntimeException e) {
                log.atWarn().addKeyValue("url", source).addKeyValue("matcher", matcher.name())
                        .log("Matcher failed: {}", e.toString());
                errors.add(matcher.name() + ": " + e);
                continue;
            }
            for (Finding finding : matched) {
                if (seen.add(finding.kind() + "\0" + finding.value())) {
                    findings.add(finding);
                }
            }
        }

        var links = new LinkedHashSet<Address>();
        String title = null;
        List<Extract> extracts = List.of();
        if (content.isHtml() && content.body().length > 0) {
            try {
                var extraction = htmlExtractor.extract(content, source);
                title = extraction.title();
                extracts = extraction.extracts();
                for (String href : extraction.hrefs()) {
                    Address address = Address.orNull(href);
                    if (address != null && scope.test(address) && !address.equals(source)) {
                        links.add(address);
                    }
                }
            } catch (IOException | RuntimeException e) {
                log.atWarn().addKeyValue("url", source).log("Link extraction failed: {}", e.toString());
                errors.add("links: " + e);
            }
        }
        return new Analysis(findings, new ArrayList<>(links), title, extracts, errors);
    }

    /**
     * Resolves a single link, such as a redirect's Location header, against the page it appeared on.
     *
     * @return the address if it is valid and in scope
     */
    public Optional<Address> resolveLink(Address source, @Nullable String href) {
        if (href == null) return Optional.empty();
        String trimmed = href.strip();
        if (HtmlExtractor.isSkipped(trimmed)) return Optional.empty();
        URI resolved;
        try {
            resolved = source.toURI().resolve(trimmed);
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
        Address address = Address.orNull(resolved.toString());
        if (address == null || !scope.test(address)) return Optional.empty();
        return Optional.of(address);
    }
}
