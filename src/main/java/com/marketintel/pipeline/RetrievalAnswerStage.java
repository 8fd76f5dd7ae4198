package com.marketintel.pipeline;

import com.marketintel.core.StageResult;
import com.marketintel.llm.TextGenerator;
import com.marketintel.model.RunState;
import com.marketintel.output.ArtifactWriter;
import com.marketintel.retrieval.IndexHandle;
import com.marketintel.retrieval.RetrievalIndex;
import com.marketintel.retrieval.RetrievedPassage;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Answers the run's question from the retrieval index. Always leaves an answer on the state:
 * a grounded reply, the no-answer sentence, or an error description.
 */
public final class RetrievalAnswerStage implements Stage {
    private static final Logger LOG = LogManager.getLogger(RetrievalAnswerStage.class);
    public static final String NO_ANSWER = "The provided information does not contain an answer to this question.";

    private final RetrievalIndex index;
    private final TextGenerator generator;
    private final ArtifactWriter artifactWriter;
    private final int topK;
    private final double minScore;

    public RetrievalAnswerStage(
            RetrievalIndex index,
            TextGenerator generator,
            ArtifactWriter artifactWriter,
            int topK,
            double minScore
    ) {
        this.index = index;
        this.generator = generator;
        this.artifactWriter = artifactWriter;
        this.topK = Math.max(1, topK);
        this.minScore = minScore;
    }

    @Override
    public PipelineStep step() {
        return PipelineStep.RETRIEVAL_ANSWER;
    }

    @Override
    public StageResult run(RunState state) {
        String question = state.question();
        String answer;
        List<String> sources = new ArrayList<>();
        StageResult result;
        try {
            IndexHandle handle = state.indexHandle()
                    .orElseThrow(() -> new IllegalStateException("no retrieval index for this run"));
            List<RetrievedPassage> passages = index.query(handle, question, topK, minScore);
            if (passages == null || passages.isEmpty()) {
                answer = NO_ANSWER;
                result = StageResult.success("no passages above threshold");
            } else {
                answer = generator.complete(Prompts.RETRIEVAL_ANSWER, userContent(question, passages));
                if (answer == null || answer.isBlank()) {
                    answer = NO_ANSWER;
                }
                answer = answer.trim();
                sources.addAll(sourcesOf(passages));
                result = StageResult.success("passages=" + passages.size());
            }
        } catch (Exception e) {
            LOG.warn("retrieval answer failed for run {}: {}", state.runId(), e.getMessage());
            answer = "Error during retrieval query: " + e.getMessage();
            result = StageResult.degraded(answer);
        }
        state.setAnswer(answer);
        appendLog(state, question, answer, sources);
        return result;
    }

    private void appendLog(RunState state, String question, String answer, List<String> sources) {
        if (state.outputDir() == null) {
            return;
        }
        String fileName = "rag_responses_" + state.shortId(4) + ".log";
        String record = "[" + Instant.now() + "] Q: " + question + "\n"
                + "A: " + answer + "\n"
                + "Sources: " + String.join(", ", sources) + "\n"
                + "---\n";
        try {
            artifactWriter.appendText(state.outputDir(), fileName, record);
            state.setRagLogFile(fileName);
        } catch (IOException e) {
            LOG.warn("failed to append retrieval log {}: {}", fileName, e.getMessage());
        }
    }

    static String userContent(String question, List<RetrievedPassage> passages) {
        StringBuilder sb = new StringBuilder("Context:\n");
        for (int i = 0; i < passages.size(); i++) {
            RetrievedPassage p = passages.get(i);
            sb.append("[").append(i + 1).append("] (").append(p.citation()).append(")\n")
                    .append(p.text()).append("\n\n");
        }
        sb.append("Question: ").append(question);
        return sb.toString();
    }

    private static Set<String> sourcesOf(List<RetrievedPassage> passages) {
        Set<String> out = new LinkedHashSet<>();
        for (RetrievedPassage p : passages) {
            String url = p.metadata().get("url");
            out.add(url == null || url.isBlank() ? p.citation() : url);
        }
        return out;
    }
}
