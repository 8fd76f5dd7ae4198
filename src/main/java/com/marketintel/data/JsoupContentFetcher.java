package com.marketintel.data;

import com.marketintel.config.Config;
import com.marketintel.data.http.HttpClientEx;
import com.marketintel.model.CollectedDocument;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;

import java.net.URI;

/**
 * Downloads a page with {@link HttpClientEx} and extracts its title and readable text with Jsoup.
 */
public final class JsoupContentFetcher implements ContentFetcher {
    private final HttpClientEx http;
    private final int summaryChars;

    public JsoupContentFetcher(Config config, HttpClientEx http) {
        this.http = http;
        this.summaryChars = Math.max(1, config.getInt("collect.summary_chars", 1000));
    }

    @Override
    public CollectedDocument fetchContent(String url) throws Exception {
        Document doc = Jsoup.parse(http.getText(url), url);
        doc.select("script, style, noscript, nav, footer, header").remove();
        String raw = doc.body() == null ? doc.text() : doc.body().wholeText();
        String text = cleanText(raw);
        String title = doc.title() == null ? "" : doc.title().trim();
        if (title.isEmpty()) {
            title = baseName(url);
        }
        if (title.isEmpty()) {
            title = "Untitled Document";
        }
        return CollectedDocument.builder()
                .source(url)
                .title(title)
                .summary(text.length() <= summaryChars ? text : text.substring(0, summaryChars))
                .fullText(text)
                .url(url)
                .build();
    }

    static String cleanText(String raw) {
        if (raw == null) {
            return "";
        }
        return raw.replace("\r", "")
                .replaceAll("[ \\t\\x0B\\f]+", " ")
                .replaceAll("\\n\\s*\\n", "\n\n")
                .trim();
    }

    /**
     * Last path segment of {@code url}, or an empty string.
     */
    public static String baseName(String url) {
        try {
            String path = URI.create(url).getPath();
            if (path == null) {
                return "";
            }
            String trimmed = path.endsWith("/") ? path.substring(0, path.length() - 1) : path;
            int slash = trimmed.lastIndexOf('/');
            return slash >= 0 ? trimmed.substring(slash + 1) : trimmed;
        } catch (IllegalArgumentException e) {
            return "";
        }
    }
}
