package org.onionscout.analysis;

import org.jetbrains.annotations.Nullable;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Comment;
import org.jsoup.nodes.DataNode;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.select.NodeTraversor;
import org.onionscout.Extract;
import org.onionscout.util.Address;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Parses HTML with jsoup and pulls out the page title, absolute link targets in document order, and the HTML
 * comments and embedded JSON blocks worth keeping.
 */
public class HtmlExtractor {
    static final int MAX_TITLE_LENGTH = 500;
    static final int MAX_COMMENTS = 20;
    static final int MAX_JSON_BLOCKS = 5;
    private static final List<String> SKIPPED_PREFIXES = List.of("#", "javascript:", "mailto:", "tel:", "data:");

    public record Extraction(List<String> hrefs, @Nullable String title, List<Extract> extracts) {
    }

    public Extraction extract(PageContent content, Address base) throws IOException {
        Charset charset = content.declaredCharset();
        var document = Jsoup.parse(new ByteArrayInputStream(content.body()),
                charset == null ? null : charset.name(), base.toString());
        var hrefs = new ArrayList<String>();
        for (Element element : document.select("a[href], link[href]")) {
            String raw = element.attr("href").strip();
            if (isSkipped(raw)) continue;
            String absolute = element.attr("abs:href");
            if (!absolute.isEmpty()) hrefs.add(absolute);
        }
        String title = document.title().strip();
        if (title.isEmpty()) {
            title = null;
        } else if (title.length() > MAX_TITLE_LENGTH) {
            title = title.substring(0, MAX_TITLE_LENGTH);
        }

        var extracts = new ArrayList<Extract>();
        var comments = new ArrayList<String>();
        NodeTraversor.traverse((Node node, int depth) -> {
            if (node instanceof Comment comment && comments.size() < MAX_COMMENTS) {
                String text = comment.getData().strip();
                if (text.length() > 10 && text.length() < 500) comments.add(text);
            }
        }, document);
        comments.forEach(text -> extracts.add(Extract.of(Extract.Kind.COMMENT, text)));

        int jsonBlocks = 0;
        for (Element script : document.select("script[type]")) {
            if (jsonBlocks >= MAX_JSON_BLOCKS) break;
            if (!script.attr("type").strip().equalsIgnoreCase("application/json")) continue;
            String json = scriptData(script).strip();
            if (json.length() > 10 && json.length() < 5000) {
                extracts.add(Extract.of(Extract.Kind.EMBEDDED_JSON, json));
                jsonBlocks++;
            }
        }
        return new Extraction(hrefs, title, extracts);
    }

    private static String scriptData(Element script) {
        var data = new StringBuilder();
        for (DataNode node : script.dataNodes()) {
            data.append(node.getWholeData());
        }
        return data.toString();
    }

    static boolean isSkipped(String href) {
        if (href.isEmpty()) return true;
        String lower = href.toLowerCase(Locale.ROOT);
        for (String prefix : SKIPPED_PREFIXES) {
            if (lower.startsWith(prefix)) return true;
        }
        return false;
    }
}
