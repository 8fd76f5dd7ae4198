package com.marketintel.model;

import com.marketintel.retrieval.IndexHandle;
import lombok.EqualsAndHashCode;
import lombok.ToString;
import org.json.JSONArray;
import org.json.JSONObject;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * The mutable record threaded through one pipeline run.
 * <p>
 * {@code runId} is fixed at creation. Sequence fields are never null; every setter copies its
 * argument so a stage publishes its output in a single assignment. Instances are confined to the
 * thread driving the run.
 */
@EqualsAndHashCode
@ToString(exclude = {"collectedDocuments", "reportTemplate"})
public final class RunState {
    private static final Pattern DOMAIN_PATTERN = Pattern.compile("[A-Za-z0-9 -]+");
    private static final int MIN_TEXT_LENGTH = 3;

    private final String runId;
    private final String domain;
    private final String query;
    private final String question;
    private final Instant createdAt;

    private List<CollectedDocument> collectedDocuments = List.of();
    private List<FinancialItem> financialItems = List.of();
    private List<Trend> trends = List.of();
    private List<Opportunity> opportunities = List.of();
    private List<Recommendation> recommendations = List.of();
    private String reportTemplate;
    private IndexHandle indexHandle;
    private String answer;
    private Path outputDir;
    private List<String> chartRefs = List.of();
    private List<String> dataFiles = List.of();
    private String reportFile;
    private String ragLogFile;

    private RunState(String runId, String domain, String query, String question, Instant createdAt) {
        this.runId = runId;
        this.domain = domain;
        this.query = query;
        this.question = question;
        this.createdAt = createdAt;
    }

    /**
     * Validates and normalizes the inputs and assigns a fresh run id.
     *
     * @throws IllegalArgumentException if the domain is empty or has characters outside
     *                                  letters, digits, spaces and hyphens, or if a non-blank
     *                                  query or question is shorter than three characters
     */
    public static RunState create(String domain, String query, String question) {
        return new RunState(
                UUID.randomUUID().toString(),
                normalizeDomain(domain),
                normalizeOptional("query", query),
                normalizeOptional("question", question),
                Instant.now()
        );
    }

    public static String normalizeDomain(String raw) {
        String value = raw == null ? "" : raw.trim().replaceAll("\\s+", " ");
        if (value.isEmpty()) {
            throw new IllegalArgumentException("market domain must not be empty");
        }
        if (!DOMAIN_PATTERN.matcher(value).matches()) {
            throw new IllegalArgumentException("market domain may only contain letters, digits, spaces and hyphens: " + raw);
        }
        return value;
    }

    static String normalizeOptional(String field, String raw) {
        String value = raw == null ? "" : raw.trim();
        if (!value.isEmpty() && value.length() < MIN_TEXT_LENGTH) {
            throw new IllegalArgumentException(field + " must be at least " + MIN_TEXT_LENGTH + " characters");
        }
        return value;
    }

    public String runId() {
        return runId;
    }

    public String shortId(int length) {
        return runId.substring(0, Math.min(length, runId.length()));
    }

    public String domain() {
        return domain;
    }

    public String query() {
        return query;
    }

    public String question() {
        return question;
    }

    public boolean hasQuestion() {
        return !question.isBlank();
    }

    public Instant createdAt() {
        return createdAt;
    }

    public List<CollectedDocument> collectedDocuments() {
        return collectedDocuments;
    }

    public void setCollectedDocuments(Collection<CollectedDocument> value) {
        this.collectedDocuments = copy(value);
    }

    public List<FinancialItem> financialItems() {
        return financialItems;
    }

    public void setFinancialItems(Collection<FinancialItem> value) {
        this.financialItems = copy(value);
    }

    public List<Trend> trends() {
        return trends;
    }

    public void setTrends(Collection<Trend> value) {
        this.trends = copy(value);
    }

    public List<Opportunity> opportunities() {
        return opportunities;
    }

    public void setOpportunities(Collection<Opportunity> value) {
        this.opportunities = copy(value);
    }

    public List<Recommendation> recommendations() {
        return recommendations;
    }

    public void setRecommendations(Collection<Recommendation> value) {
        this.recommendations = copy(value);
    }

    public Optional<String> reportTemplate() {
        return Optional.ofNullable(reportTemplate);
    }

    public void setReportTemplate(String reportTemplate) {
        this.reportTemplate = reportTemplate;
    }

    public Optional<IndexHandle> indexHandle() {
        return Optional.ofNullable(indexHandle);
    }

    public void setIndexHandle(IndexHandle indexHandle) {
        this.indexHandle = indexHandle;
    }

    public Optional<String> answer() {
        return Optional.ofNullable(answer);
    }

    public void setAnswer(String answer) {
        this.answer = answer;
    }

    public Path outputDir() {
        return outputDir;
    }

    public void setOutputDir(Path outputDir) {
        this.outputDir = outputDir;
    }

    public List<String> chartRefs() {
        return chartRefs;
    }

    public void setChartRefs(Collection<String> value) {
        this.chartRefs = copy(value);
    }

    public List<String> dataFiles() {
        return dataFiles;
    }

    public void setDataFiles(Collection<String> value) {
        this.dataFiles = copy(value);
    }

    public Optional<String> reportFile() {
        return Optional.ofNullable(reportFile);
    }

    public void setReportFile(String reportFile) {
        this.reportFile = reportFile;
    }

    public Optional<String> ragLogFile() {
        return Optional.ofNullable(ragLogFile);
    }

    public void setRagLogFile(String ragLogFile) {
        this.ragLogFile = ragLogFile;
    }

    public JSONObject toJson() {
        JSONObject o = new JSONObject();
        o.put("run_id", runId);
        o.put("market_domain", domain);
        o.put("query", query);
        o.put("question", question);
        o.put("created_at", createdAt.toString());
        o.put("collected_documents", toArray(collectedDocuments, CollectedDocument::toJson));
        o.put("financial_items", toArray(financialItems, FinancialItem::toJson));
        o.put("market_trends", toArray(trends, Trend::toJson));
        o.put("opportunities", toArray(opportunities, Opportunity::toJson));
        o.put("strategic_recommendations", toArray(recommendations, Recommendation::toJson));
        o.put("chart_refs", new JSONArray(chartRefs));
        o.put("data_files", new JSONArray(dataFiles));
        putOptional(o, "report_template", reportTemplate);
        putOptional(o, "answer", answer);
        putOptional(o, "report_file", reportFile);
        putOptional(o, "rag_log_file", ragLogFile);
        if (outputDir != null) {
            o.put("output_dir", outputDir.toString());
        }
        if (indexHandle != null) {
            o.put("index_handle", new JSONObject()
                    .put("id", indexHandle.id())
                    .put("passage_count", indexHandle.passageCount()));
        }
        return o;
    }

    public static RunState fromJson(JSONObject o) {
        RunState state = new RunState(
                o.getString("run_id"),
                o.optString("market_domain", ""),
                o.optString("query", ""),
                o.optString("question", ""),
                Instant.parse(o.getString("created_at"))
        );
        state.setCollectedDocuments(fromArray(o.optJSONArray("collected_documents"), CollectedDocument::fromJson));
        state.setFinancialItems(fromArray(o.optJSONArray("financial_items"), FinancialItem::fromJson));
        state.setTrends(fromArray(o.optJSONArray("market_trends"), Trend::fromJson));
        state.setOpportunities(fromArray(o.optJSONArray("opportunities"), Opportunity::fromJson));
        state.setRecommendations(fromArray(o.optJSONArray("strategic_recommendations"), Recommendation::fromJson));
        state.setChartRefs(stringList(o.optJSONArray("chart_refs")));
        state.setDataFiles(stringList(o.optJSONArray("data_files")));
        state.reportTemplate = o.has("report_template") ? o.getString("report_template") : null;
        state.answer = o.has("answer") ? o.getString("answer") : null;
        state.reportFile = o.has("report_file") ? o.getString("report_file") : null;
        state.ragLogFile = o.has("rag_log_file") ? o.getString("rag_log_file") : null;
        state.outputDir = o.has("output_dir") ? Path.of(o.getString("output_dir")) : null;
        JSONObject handle = o.optJSONObject("index_handle");
        if (handle != null) {
            state.indexHandle = new IndexHandle(handle.getString("id"), handle.optInt("passage_count", 0));
        }
        return state;
    }

    private static <T> List<T> copy(Collection<T> value) {
        if (value == null || value.isEmpty()) {
            return List.of();
        }
        return List.copyOf(value);
    }

    private static <T> JSONArray toArray(List<T> items, Function<T, JSONObject> mapper) {
        JSONArray out = new JSONArray();
        for (T item : items) {
            out.put(mapper.apply(item));
        }
        return out;
    }

    private static <T> List<T> fromArray(JSONArray array, Function<JSONObject, T> mapper) {
        List<T> out = new ArrayList<>();
        if (array == null) {
            return out;
        }
        for (int i = 0; i < array.length(); i++) {
            JSONObject item = array.optJSONObject(i);
            if (item != null) {
                out.add(mapper.apply(item));
            }
        }
        return out;
    }

    private static List<String> stringList(JSONArray array) {
        List<String> out = new ArrayList<>();
        if (array == null) {
            return out;
        }
        for (int i = 0; i < array.length(); i++) {
            out.add(array.optString(i, ""));
        }
        return out;
    }

    private static void putOptional(JSONObject o, String key, String value) {
        if (value != null) {
            o.put(key, value);
        }
    }
}
