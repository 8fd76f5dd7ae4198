package com.marketintel.pipeline;

import com.marketintel.config.Config;
import com.marketintel.core.MissingCredentialException;
import com.marketintel.core.ResilientCaller;
import com.marketintel.core.RunTelemetry;
import com.marketintel.core.StageResult;
import com.marketintel.data.ApiKeys;
import com.marketintel.data.ContentFetcher;
import com.marketintel.data.DataSource;
import com.marketintel.data.DataSources;
import com.marketintel.data.JsoupContentFetcher;
import com.marketintel.data.http.HttpClientEx;
import com.marketintel.extract.StructuredOutputExtractor;
import com.marketintel.llm.LangChainTextGenerator;
import com.marketintel.llm.TextGenerator;
import com.marketintel.model.RunOutcome;
import com.marketintel.model.RunState;
import com.marketintel.output.ArtifactWriter;
import com.marketintel.output.ReportRenderer;
import com.marketintel.retrieval.EmbeddingRetrievalIndex;
import com.marketintel.retrieval.RetrievalIndex;
import com.marketintel.retrieval.TextChunker;
import com.marketintel.store.RunStateStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Drives one run through the stage state machine.
 * <p>
 * Structural pre-flight checks (input validation, primary search credential, writable workspace)
 * run before the machine starts; a failure there is the only way a run ends without a report.
 * Inside the machine a stage failure never stops the run: the state is checkpointed after every
 * stage, the next step is chosen by {@link PipelineStep#next(RunState)}, and {@code REPORT}
 * always runs.
 */
public final class PipelineOrchestrator {
    private static final Logger LOG = LogManager.getLogger(PipelineOrchestrator.class);

    private final RunStateStore store;
    private final List<DataSource> sources;
    private final ArtifactWriter artifactWriter;
    private final RetrievalIndex index;
    private final Path runsDir;
    private final Map<PipelineStep, Stage> stages = new EnumMap<>(PipelineStep.class);

    public PipelineOrchestrator(
            Config config,
            RunStateStore store,
            ResilientCaller caller,
            List<DataSource> sources,
            ContentFetcher contentFetcher,
            TextGenerator generator,
            RetrievalIndex index
    ) {
        this.store = store;
        this.sources = List.copyOf(sources);
        this.artifactWriter = new ArtifactWriter();
        this.index = index;
        this.runsDir = config.getPath("runs.dir");

        StructuredOutputExtractor extractor = new StructuredOutputExtractor();
        int sampleSize = Math.max(1, config.getInt("synthesis.sample_size", 5));
        register(new DataCollectionStage(config, this.sources, contentFetcher, caller, artifactWriter));
        register(new TrendAnalysisStage(generator, extractor, sampleSize));
        register(new OpportunityStage(generator, extractor, sampleSize));
        register(new StrategyStage(generator, extractor, sampleSize));
        register(new TemplateStage(generator, extractor, sampleSize));
        register(new IndexingStage(index, new TextChunker(
                config.getInt("index.chunk_size", 1000),
                config.getInt("index.chunk_overlap", 150)
        )));
        register(new RetrievalAnswerStage(
                index,
                generator,
                artifactWriter,
                config.getInt("retrieval.top_k", 4),
                config.getDouble("retrieval.min_score", 0.6)
        ));
        register(new ReportStage(generator, new ReportRenderer(), artifactWriter));
    }

    /**
     * Wires the built-in providers, the Ollama-backed generator and the in-memory embedding index.
     */
    public static PipelineOrchestrator create(Config config, RunStateStore store, ResilientCaller caller) {
        HttpClientEx http = new HttpClientEx(config);
        ApiKeys apiKeys = new ApiKeys(config);
        return new PipelineOrchestrator(
                config,
                store,
                caller,
                DataSources.defaults(config, apiKeys, http),
                new JsoupContentFetcher(config, http),
                new LangChainTextGenerator(config),
                new EmbeddingRetrievalIndex(config)
        );
    }

    private void register(Stage stage) {
        stages.put(stage.step(), stage);
    }

    public RunOutcome run(String domain, String query, String question) {
        RunState state;
        try {
            state = RunState.create(domain, query, question);
        } catch (IllegalArgumentException e) {
            LOG.warn("run rejected: {}", e.getMessage());
            return RunOutcome.failure("", "invalid input: " + e.getMessage());
        }

        try {
            DataCollectionStage.requirePrimaryCredential(sources);
        } catch (MissingCredentialException e) {
            LOG.error("run {} aborted before start: {}", state.runId(), e.getMessage());
            return RunOutcome.failure(state.runId(), e.getMessage());
        }

        try {
            state.setOutputDir(artifactWriter.prepareWorkspace(runsDir, state.domain(), state.runId()));
        } catch (IOException | RuntimeException e) {
            LOG.error("run {} aborted before start, workspace not writable under {}: {}",
                    state.runId(), runsDir, e.getMessage(), e);
            return RunOutcome.failure(state.runId(), "cannot create output workspace: " + e.getMessage());
        }

        RunTelemetry telemetry = new RunTelemetry(state.runId(), "analyze", Instant.now());
        LOG.info("run {} started domain={} query={} question={} dir={}",
                state.runId(), state.domain(), state.query(), state.hasQuestion(), state.outputDir());
        checkpoint(state, telemetry);

        PipelineStep step = PipelineStep.COLLECT;
        while (!step.isTerminal()) {
            execute(step, state, telemetry);
            checkpoint(state, telemetry);
            PipelineStep next = step.next(state);
            if (step == PipelineStep.INDEX && next == PipelineStep.REPORT && state.hasQuestion()) {
                telemetry.startStep(PipelineStep.RETRIEVAL_ANSWER.name());
                telemetry.endStep(PipelineStep.RETRIEVAL_ANSWER.name(), StageResult.skipped("no retrieval index"));
                LOG.info("run {} has a question but no index, skipping retrieval", state.runId());
            }
            step = next;
        }
        telemetry.finish();
        state.indexHandle().ifPresent(index::release);
        return toOutcome(state, telemetry);
    }

    private void execute(PipelineStep step, RunState state, RunTelemetry telemetry) {
        Stage stage = stages.get(step);
        String name = step.name();
        long startedNanos = System.nanoTime();
        telemetry.startStep(name);
        LOG.info("run {} stage {} start", state.runId(), name);
        StageResult result;
        try {
            result = stage.run(state);
        } catch (Exception e) {
            LOG.error("run {} stage {} failed: {}", state.runId(), name, e.getMessage(), e);
            result = StageResult.failed(e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        }
        telemetry.endStep(name, result);
        LOG.info("run {} stage {} finished status={} elapsed_ms={} note={}",
                state.runId(), name, result.status(), (System.nanoTime() - startedNanos) / 1_000_000L, result.reason());
    }

    private void checkpoint(RunState state, RunTelemetry telemetry) {
        if (!store.checkpointPut(state)) {
            telemetry.recordCheckpointFailure();
        }
    }

    private RunOutcome toOutcome(RunState state, RunTelemetry telemetry) {
        Path dir = state.outputDir();
        boolean reportWritten = state.reportFile()
                .map(f -> dir.resolve(f))
                .map(PipelineOrchestrator::nonEmpty)
                .orElse(false);
        Path readme = dir.resolve(ReportStage.README_FILE);
        Path indexDir = dir.resolve(IndexingStage.INDEX_DIR);
        RunOutcome outcome = RunOutcome.builder()
                .success(reportWritten)
                .runId(state.runId())
                .answer(state.answer().orElse(null))
                .outputDir(dir)
                .reportFile(state.reportFile().orElse(null))
                .chartRefs(state.chartRefs())
                .dataFiles(state.dataFiles())
                .readmeFile(Files.exists(readme) ? ReportStage.README_FILE : null)
                .ragLogFile(state.ragLogFile().orElse(null))
                .indexDir(Files.isDirectory(indexDir) ? indexDir.toString() : null)
                .error(reportWritten ? null : "report was not written")
                .telemetrySummary(telemetry.getSummary())
                .build();
        LOG.info("run {} done success={} errors={} checkpoint_failures={}",
                state.runId(), outcome.success, telemetry.errorsTotal(), telemetry.checkpointFailures());
        return outcome;
    }

    private static boolean nonEmpty(Path file) {
        try {
            return Files.isRegularFile(file) && Files.size(file) > 0;
        } catch (IOException e) {
            LOG.warn("cannot stat {}: {}", file, e.getMessage());
            return false;
        }
    }
}
