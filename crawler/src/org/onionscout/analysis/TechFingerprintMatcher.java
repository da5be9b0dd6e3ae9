package org.onionscout.analysis;

import org.onionscout.Finding;

import java.util.*;
import java.util.regex.Pattern;

/**
 * Identifies server software from response headers, session cookie names and the HTML generator meta tag.
 * Header-derived findings have no position in the body and get offset -1.
 */
public class TechFingerprintMatcher implements Matcher {
    private static final Map<String, String> HEADERS = new LinkedHashMap<>();
    private static final Map<String, String> SESSION_COOKIES = new LinkedHashMap<>();
    private static final Pattern META_GENERATOR = Pattern.compile(
            "(?i)<meta\\b[^>]{0,200}?\\bname\\s*=\\s*[\"']?generator\\b[^>]{0,500}>");
    private static final Pattern CONTENT_ATTRIBUTE = Pattern.compile("(?i)\\bcontent\\s*=\\s*[\"']([^\"'>]{1,200})[\"']");

    static {
        HEADERS.put("Server", "Server");
        HEADERS.put("X-Powered-By", "PoweredBy");
        HEADERS.put("X-AspNet-Version", "ASP.NET");
        HEADERS.put("X-Generator", "Generator");

        SESSION_COOKIES.put("PHPSESSID", "PHP");
        SESSION_COOKIES.put("JSESSIONID", "Java");
        SESSION_COOKIES.put("csrftoken", "Django");
        SESSION_COOKIES.put("laravel_session", "Laravel");
        SESSION_COOKIES.put("rack.session", "Ruby");
        SESSION_COOKIES.put("connect.sid", "Node.js");
        SESSION_COOKIES.put("ASP.NET_SessionId", "ASP.NET");
    }

    @Override
    public String name() {
        return "TechFingerprintMatcher";
    }

    @Override
    public List<Finding> match(PageContent content) {
        var findings = new ArrayList<Finding>();
        var seen = new HashSet<String>();
        HEADERS.forEach((header, prefix) -> {
            for (String value : content.headers(header)) {
                if (value.isBlank()) continue;
                String fingerprint = prefix + ":" + value.strip();
                if (seen.add(fingerprint)) {
                    findings.add(Finding.of(Finding.Kind.TECH_FINGERPRINT, header, fingerprint, -1));
                }
            }
        });

        String cookies = String.join("\n", content.headers("Set-Cookie"));
        SESSION_COOKIES.forEach((cookie, tech) -> {
            if (cookies.contains(cookie) && seen.add(tech)) {
                findings.add(Finding.of(Finding.Kind.TECH_FINGERPRINT, "Cookie", tech, -1));
            }
        });

        if (content.isHtml()) {
            var meta = META_GENERATOR.matcher(content.searchable());
            if (meta.find()) {
                var attribute = CONTENT_ATTRIBUTE.matcher(meta.group());
                if (attribute.find()) {
                    String fingerprint = "Generator:" + attribute.group(1).strip();
                    if (seen.add(fingerprint)) {
                        findings.add(Finding.of(Finding.Kind.TECH_FINGERPRINT, "Meta", fingerprint,
                                meta.start() + attribute.start(1)));
                    }
                }
            }
        }
        return findings;
    }
}
