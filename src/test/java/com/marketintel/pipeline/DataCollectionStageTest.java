package com.marketintel.pipeline;

import com.marketintel.config.Config;
import com.marketintel.core.MissingCredentialException;
import com.marketintel.core.ResilientCaller;
import com.marketintel.core.StageResult;
import com.marketintel.core.StageStatus;
import com.marketintel.data.ContentFetcher;
import com.marketintel.data.DataSource;
import com.marketintel.data.DataSourceRole;
import com.marketintel.model.CollectedDocument;
import com.marketintel.model.RunState;
import com.marketintel.output.ArtifactWriter;
import com.marketintel.pipeline.PipelineFixtures.FailingFetcher;
import com.marketintel.pipeline.PipelineFixtures.FakeSource;
import com.marketintel.pipeline.PipelineFixtures.PageFetcher;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DataCollectionStageTest {

    @TempDir
    Path tempDir;

    @Test
    void run_shouldDeduplicateDocumentsByUrlAcrossProviders() throws Exception {
        Config config = PipelineFixtures.config(tempDir);
        FakeSource primary = FakeSource.primarySearch(List.of("https://a.example/1", "https://b.example/2"));
        FakeSource secondary = FakeSource.search("secondary", List.of("https://b.example/2/", "https://c.example/3"));
        CollectedDocument direct = new CollectedDocument(
                "news", "Direct story", "direct summary", "direct body", "https://c.example/3");
        FakeSource news = FakeSource.direct("news", List.of(direct));
        PageFetcher fetcher = new PageFetcher();

        RunState state = newState();
        StageResult result = stage(config, List.of(primary, secondary, news), fetcher).run(state);

        assertEquals(StageStatus.SUCCESS, result.status());
        List<CollectedDocument> docs = state.collectedDocuments();
        assertEquals(3, docs.size());
        Set<String> urls = new HashSet<>();
        for (CollectedDocument doc : docs) {
            assertTrue(urls.add(doc.url.replaceAll("/+$", "")), "duplicate url " + doc.url);
        }
        // The direct document wins; its url is never fetched again.
        assertTrue(docs.stream().anyMatch(d -> "Direct story".equals(d.title)));
        assertEquals(2, fetcher.fetched.size());
        assertTrue(state.dataFiles().stream().anyMatch(f -> f.endsWith(".csv")));
        for (String file : state.dataFiles()) {
            assertTrue(Files.exists(state.outputDir().resolve(file)), file);
        }
    }

    @Test
    void run_shouldCapFetchedUrlsPerQueryVariant() throws Exception {
        Config config = PipelineFixtures.config(tempDir);
        List<String> newsHits = new ArrayList<>();
        List<String> competitorHits = new ArrayList<>();
        for (int i = 0; i < 7; i++) {
            newsHits.add("https://a.example/" + i);
            competitorHits.add("https://z.example/" + i);
        }
        FakeSource primary = FakeSource.primarySearchBy(q -> q.contains("competitor") ? competitorHits : newsHits);
        PageFetcher fetcher = new PageFetcher();

        RunState state = newState();
        stage(config, List.of(primary), fetcher).run(state);

        assertEquals(10, fetcher.fetched.size());
        assertEquals(5, fetcher.fetched.stream().filter(u -> u.startsWith("https://a.example/")).count());
        assertEquals(5, fetcher.fetched.stream().filter(u -> u.startsWith("https://z.example/")).count());
        // Hits are taken in the order the provider returned them.
        assertTrue(fetcher.fetched.contains("https://z.example/0"));
        assertFalse(fetcher.fetched.contains("https://z.example/6"));
    }

    @Test
    void run_shouldDropDirectDocumentsWithoutUrl() throws Exception {
        Config config = PipelineFixtures.config(tempDir);
        FakeSource primary = FakeSource.primarySearch(List.of("https://a.example/1"));
        CollectedDocument noUrl = new CollectedDocument("news", "Untitled wire", "summary", "body", " ");
        FakeSource news = FakeSource.direct("news", List.of(noUrl));

        RunState state = newState();
        stage(config, List.of(primary, news), new PageFetcher()).run(state);

        assertEquals(1, state.collectedDocuments().size());
        assertEquals("https://a.example/1", state.collectedDocuments().get(0).url);
    }

    @Test
    void run_shouldKeepGoingWhenOneProviderFails() throws Exception {
        Config config = PipelineFixtures.config(tempDir);
        FakeSource primary = FakeSource.primarySearch(List.of("https://a.example/1"));
        FakeSource broken = FakeSource.failing("broken", DataSourceRole.DIRECT, false);

        RunState state = newState();
        StageResult result = stage(config, List.of(primary, broken), new PageFetcher()).run(state);

        assertEquals(StageStatus.SUCCESS, result.status());
        assertEquals(1, state.collectedDocuments().size());
        assertEquals(1, result.evidence().get("failed_tasks"));
    }

    @Test
    void run_shouldRecordPlaceholderWhenPageCannotBeLoaded() throws Exception {
        Config config = PipelineFixtures.config(tempDir);
        FakeSource primary = FakeSource.primarySearch(List.of("https://a.example/reports/chips.html"));

        RunState state = newState();
        stage(config, List.of(primary), new FailingFetcher()).run(state);

        CollectedDocument doc = state.collectedDocuments().get(0);
        assertEquals("Failed to Load: chips.html", doc.title);
        assertEquals("", doc.fullText);
    }

    @Test
    void run_shouldReportDegradedWhenNothingIsCollected() throws Exception {
        Config config = PipelineFixtures.config(tempDir);
        RunState state = newState();
        StageResult result = stage(config, List.of(FakeSource.primarySearch(List.of())), new PageFetcher()).run(state);

        assertEquals(StageStatus.DEGRADED, result.status());
        assertTrue(state.collectedDocuments().isEmpty());
    }

    @Test
    void run_shouldFailWhenPrimaryCredentialIsMissing() {
        Config config = PipelineFixtures.config(tempDir);
        DataCollectionStage stage = stage(config, List.of(FakeSource.unconfiguredPrimary()), new PageFetcher());
        MissingCredentialException ex = assertThrows(MissingCredentialException.class, () -> stage.run(newState()));
        assertTrue(ex.getMessage().contains("PRIMARY_API_KEY"));
    }

    @Test
    void queryVariants_shouldUseDomainWhenQueryIsBlank() {
        List<String> variants = DataCollectionStage.queryVariants("Technology", "");
        assertEquals(2, variants.size());
        assertTrue(variants.get(0).startsWith("Technology Technology news"));
        assertTrue(DataCollectionStage.queryVariants("Energy", "solar panels").get(1).startsWith("solar panels Energy"));
    }

    @Test
    void symbolHint_shouldPickFirstTickerLikeToken() {
        assertEquals("NVDA", DataCollectionStage.symbolHint("outlook for NVDA and AMD"));
        assertEquals("", DataCollectionStage.symbolHint("lower case only"));
        assertEquals("", DataCollectionStage.symbolHint(null));
    }

    private RunState newState() {
        RunState state = RunState.create("Technology", "AI chips", "");
        state.setOutputDir(tempDir.resolve("runs").resolve("technology_run"));
        return state;
    }

    private static DataCollectionStage stage(Config config, List<? extends DataSource> sources, ContentFetcher fetcher) {
        return new DataCollectionStage(config, List.<DataSource>copyOf(sources), fetcher, new ResilientCaller(config), new ArtifactWriter());
    }
}
