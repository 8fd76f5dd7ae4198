package com.marketintel.pipeline;

import com.marketintel.config.Config;
import com.marketintel.core.ResilientCaller;
import com.marketintel.data.ContentFetcher;
import com.marketintel.data.DataSource;
import com.marketintel.data.DataSourceRole;
import com.marketintel.llm.TextGenerator;
import com.marketintel.model.RunOutcome;
import com.marketintel.model.RunState;
import com.marketintel.pipeline.PipelineFixtures.EchoIndex;
import com.marketintel.pipeline.PipelineFixtures.FailingFetcher;
import com.marketintel.pipeline.PipelineFixtures.FailingGenerator;
import com.marketintel.pipeline.PipelineFixtures.FailingIndex;
import com.marketintel.pipeline.PipelineFixtures.FakeSource;
import com.marketintel.pipeline.PipelineFixtures.InMemoryStore;
import com.marketintel.pipeline.PipelineFixtures.PageFetcher;
import com.marketintel.pipeline.PipelineFixtures.ScriptedGenerator;
import com.marketintel.retrieval.RetrievalIndex;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PipelineOrchestratorTest {

    @TempDir
    Path tempDir;

    @Test
    void run_shouldReachReportWhenEveryDependencyFails() throws Exception {
        InMemoryStore store = new InMemoryStore();
        PipelineOrchestrator orchestrator = orchestrator(
                store,
                List.of(FakeSource.failing("primary", DataSourceRole.SEARCH, true)),
                new FailingFetcher(),
                new FailingGenerator(),
                new FailingIndex()
        );

        RunOutcome outcome = orchestrator.run("Technology", "AI regulation", "");

        assertTrue(outcome.success, String.valueOf(outcome.error));
        String report = Files.readString(outcome.outputDir.resolve(outcome.reportFile), StandardCharsets.UTF_8);
        assertFalse(report.isBlank());
        assertTrue(report.contains("Default Trend"));
        assertNull(outcome.answer);
        assertEquals(ReportStage.README_FILE, outcome.readmeFile);

        RunState checkpoint = store.get(outcome.runId).orElseThrow();
        assertEquals("Technology", checkpoint.domain());
        assertEquals(outcome.reportFile, checkpoint.reportFile().orElse(null));
        assertTrue(store.puts.get() >= 8);
    }

    @Test
    void run_shouldSkipRetrievalWhenQuestionHasNoIndex() {
        PipelineOrchestrator orchestrator = orchestrator(
                new InMemoryStore(),
                List.of(FakeSource.primarySearch(List.of())),
                new PageFetcher(),
                new FailingGenerator(),
                new FailingIndex()
        );

        RunOutcome outcome = orchestrator.run("Technology", "", "Who leads the market?");

        assertTrue(outcome.success);
        assertNull(outcome.answer);
        assertNull(outcome.ragLogFile);
        assertTrue(outcome.telemetrySummary.contains("RETRIEVAL_ANSWER"));
    }

    @Test
    void run_shouldAnswerQuestionFromIndexedContent() {
        ScriptedGenerator generator = new ScriptedGenerator("")
                .on(Prompts.RETRIEVAL_ANSWER, "Foundries lead the market.");
        PipelineOrchestrator orchestrator = orchestrator(
                new InMemoryStore(),
                List.of(FakeSource.primarySearch(List.of("https://a.example/foundry"))),
                new PageFetcher(),
                generator,
                new EchoIndex()
        );

        RunOutcome outcome = orchestrator.run("Semiconductors", "", "Who leads the market?");

        assertTrue(outcome.success);
        assertEquals("Foundries lead the market.", outcome.answer);
        assertNotNull(outcome.ragLogFile);
        assertTrue(Files.exists(outcome.outputDir.resolve(outcome.ragLogFile)));
        assertTrue(outcome.dataFiles.contains("semiconductors_data_sources.csv"));
    }

    @Test
    void run_shouldFailBeforeStartWhenPrimaryCredentialIsMissing() {
        InMemoryStore store = new InMemoryStore();
        PipelineOrchestrator orchestrator = orchestrator(
                store,
                List.of(FakeSource.unconfiguredPrimary()),
                new PageFetcher(),
                new FailingGenerator(),
                new EchoIndex()
        );

        RunOutcome outcome = orchestrator.run("Technology", "", "");

        assertFalse(outcome.success);
        assertFalse(outcome.runId.isEmpty());
        assertTrue(outcome.error.contains("PRIMARY_API_KEY"));
        assertEquals(0, store.puts.get());
    }

    @Test
    void run_shouldRejectInvalidDomainWithoutRunId() {
        PipelineOrchestrator orchestrator = orchestrator(
                new InMemoryStore(),
                List.of(FakeSource.primarySearch(List.of())),
                new PageFetcher(),
                new FailingGenerator(),
                new EchoIndex()
        );

        RunOutcome outcome = orchestrator.run("Tech; DROP TABLE", "", "");

        assertFalse(outcome.success);
        assertEquals("", outcome.runId);
        assertTrue(outcome.error.startsWith("invalid input"));
    }

    @Test
    void run_shouldKeepRunsIsolatedInSeparateWorkspaces() {
        PipelineOrchestrator orchestrator = orchestrator(
                new InMemoryStore(),
                List.of(FakeSource.primarySearch(List.of())),
                new PageFetcher(),
                new FailingGenerator(),
                new FailingIndex()
        );

        RunOutcome first = orchestrator.run("Technology", "", "");
        RunOutcome second = orchestrator.run("Technology", "", "");

        assertFalse(first.runId.equals(second.runId));
        assertFalse(first.outputDir.equals(second.outputDir));
    }

    private PipelineOrchestrator orchestrator(
            InMemoryStore store,
            List<? extends DataSource> sources,
            ContentFetcher fetcher,
            TextGenerator generator,
            RetrievalIndex index
    ) {
        Config config = PipelineFixtures.config(tempDir);
        return new PipelineOrchestrator(
                config,
                store,
                new ResilientCaller(config),
                List.<DataSource>copyOf(sources),
                fetcher,
                generator,
                index
        );
    }
}
