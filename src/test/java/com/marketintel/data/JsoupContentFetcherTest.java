package com.marketintel.data;

import com.marketintel.config.Config;
import com.marketintel.model.CollectedDocument;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsoupContentFetcherTest {

    @Test
    void fetchContent_shouldDropBoilerplateAndTruncateSummary() throws Exception {
        Config config = Config.fromConfigurationProperties(Path.of("."), Map.of("collect", Map.of("summary_chars", "12")));
        String html = "<html><head><title> Chip Outlook </title><script>var x=1;</script></head>"
                + "<body><nav>Home | About</nav><p>Foundry capacity   grows.</p><footer>(c) site</footer></body></html>";
        JsoupContentFetcher fetcher = new JsoupContentFetcher(config, new CannedHttpClient(config, html));

        CollectedDocument doc = fetcher.fetchContent("https://a.example/outlook");

        assertEquals("Chip Outlook", doc.title);
        assertEquals("Foundry capacity grows.", doc.fullText);
        assertEquals("Foundry capa", doc.summary);
        assertFalse(doc.fullText.contains("Home"));
        assertEquals("https://a.example/outlook", doc.url);
    }

    @Test
    void fetchContent_shouldUsePathAsTitleWhenPageHasNone() throws Exception {
        Config config = Config.fromConfigurationProperties(Path.of("."), Map.of());
        JsoupContentFetcher fetcher = new JsoupContentFetcher(config, new CannedHttpClient(config, "<p>text</p>"));

        assertEquals("q3-update.html", fetcher.fetchContent("https://a.example/reports/q3-update.html").title);
    }

    @Test
    void cleanText_shouldCollapseBlankLines() {
        assertEquals("a b\n\nc", JsoupContentFetcher.cleanText("a \t b\r\n\n \n\nc  "));
        assertTrue(JsoupContentFetcher.baseName("https://a.example/").isEmpty());
    }
}
