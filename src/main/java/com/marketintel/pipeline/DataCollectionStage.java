package com.marketintel.pipeline;

import com.marketintel.config.Config;
import com.marketintel.core.MissingCredentialException;
import com.marketintel.core.ResilientCaller;
import com.marketintel.core.StageResult;
import com.marketintel.core.StageStatus;
import com.marketintel.data.ContentFetcher;
import com.marketintel.data.DataSource;
import com.marketintel.data.DataSourceRole;
import com.marketintel.data.JsoupContentFetcher;
import com.marketintel.model.CollectedDocument;
import com.marketintel.model.FinancialItem;
import com.marketintel.model.RunState;
import com.marketintel.output.ArtifactWriter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fans out to the configured data sources, merges the results by URL and fetches the content of
 * every search hit that no direct provider already returned.
 */
public final class DataCollectionStage implements Stage {
    private static final Logger LOG = LogManager.getLogger(DataCollectionStage.class);
    private static final Pattern SYMBOL_HINT = Pattern.compile("\\b([A-Z]{1,5})\\b");

    private final List<DataSource> sources;
    private final ContentFetcher contentFetcher;
    private final ResilientCaller caller;
    private final ArtifactWriter artifactWriter;
    private final int threads;
    private final long taskTimeoutSec;
    private final int maxResultsPerQuery;

    public DataCollectionStage(
            Config config,
            List<DataSource> sources,
            ContentFetcher contentFetcher,
            ResilientCaller caller,
            ArtifactWriter artifactWriter
    ) {
        this.sources = List.copyOf(sources);
        this.contentFetcher = contentFetcher;
        this.caller = caller;
        this.artifactWriter = artifactWriter;
        this.threads = Math.max(1, config.getInt("collect.threads", 4));
        this.taskTimeoutSec = Math.max(1L, config.getLong("collect.task_timeout_sec", 90L));
        this.maxResultsPerQuery = Math.max(1, config.getInt("collect.max_results_per_query", 5));
    }

    @Override
    public PipelineStep step() {
        return PipelineStep.COLLECT;
    }

    /**
     * @throws MissingCredentialException if the primary search provider has no credential
     */
    public static void requirePrimaryCredential(List<DataSource> sources) {
        DataSource primary = null;
        for (DataSource source : sources) {
            if (source.isPrimary()) {
                primary = source;
                break;
            }
        }
        if (primary == null) {
            throw new MissingCredentialException("primary search", "a primary search provider");
        }
        if (!primary.isConfigured()) {
            throw new MissingCredentialException(primary.name(), primary.credentialEnv());
        }
    }

    public static List<String> queryVariants(String domain, String query) {
        String q = query == null || query.isBlank() ? domain : query;
        List<String> variants = new ArrayList<>();
        variants.add(q + " " + domain + " news trends developments emerging technologies");
        variants.add(q + " " + domain + " competitor landscape key players market share");
        return variants;
    }

    /**
     * First run of one to five capital letters in {@code text}, or an empty string.
     */
    public static String symbolHint(String text) {
        if (text == null) {
            return "";
        }
        Matcher m = SYMBOL_HINT.matcher(text);
        return m.find() ? m.group(1) : "";
    }

    @Override
    public StageResult run(RunState state) throws Exception {
        requirePrimaryCredential(sources);
        Files.createDirectories(state.outputDir());

        String baseQuery = state.query().isBlank() ? state.domain() : state.query();
        List<String> variants = queryVariants(state.domain(), state.query());
        String symbol = symbolHint(baseQuery);

        List<Callable<Batch>> tasks = new ArrayList<>();
        for (DataSource source : sources) {
            if (!source.isConfigured()) {
                LOG.info("data source skipped, no credential: {}", source.name());
                continue;
            }
            if (source.role() == DataSourceRole.SEARCH) {
                for (int v = 0; v < variants.size(); v++) {
                    String variant = variants.get(v);
                    int variantIndex = v;
                    String signature = source.name() + "_search_" + variant;
                    tasks.add(() -> Batch.urls(variantIndex, caller.call(signature, () -> source.search(variant))));
                }
            } else if (source.role() == DataSourceRole.DIRECT) {
                String signature = source.name() + "_direct_" + baseQuery;
                tasks.add(() -> Batch.documents(caller.call(signature, () -> source.fetchDirect(baseQuery))));
            } else if (source.role() == DataSourceRole.FINANCIAL) {
                if (symbol.isEmpty()) {
                    LOG.info("financial source skipped, no symbol hint: {}", source.name());
                    continue;
                }
                String signature = source.name() + "_financial_" + symbol;
                tasks.add(() -> Batch.financial(caller.call(signature, () -> source.fetchFinancial(symbol))));
            }
        }

        TreeMap<String, CollectedDocument> byUrl = new TreeMap<>();
        List<Map<String, String>> hitsByVariant = new ArrayList<>();
        for (int v = 0; v < variants.size(); v++) {
            hitsByVariant.add(new LinkedHashMap<>());
        }
        List<FinancialItem> financial = new ArrayList<>();
        int failedTasks = 0;
        for (Batch batch : runAll(tasks)) {
            if (batch == null) {
                failedTasks++;
                continue;
            }
            for (CollectedDocument doc : batch.documents) {
                String key = urlKey(doc.url);
                if (key.isEmpty()) {
                    LOG.warn("collected document dropped, no url: source={} title={}", doc.source, doc.title);
                    continue;
                }
                byUrl.putIfAbsent(key, doc);
            }
            for (String url : batch.urls) {
                String key = urlKey(url);
                if (!key.isEmpty()) {
                    hitsByVariant.get(batch.variant).putIfAbsent(key, url.trim());
                }
            }
            financial.addAll(batch.financial);
        }

        // Each variant fetches up to maxResultsPerQuery new urls, in the order its providers returned them.
        List<Callable<Batch>> fetches = new ArrayList<>();
        Set<String> queued = new HashSet<>();
        for (Map<String, String> hits : hitsByVariant) {
            int taken = 0;
            for (Map.Entry<String, String> hit : hits.entrySet()) {
                if (taken >= maxResultsPerQuery) {
                    break;
                }
                if (byUrl.containsKey(hit.getKey()) || !queued.add(hit.getKey())) {
                    continue;
                }
                String url = hit.getValue();
                fetches.add(() -> Batch.documents(List.of(fetchOne(url))));
                taken++;
            }
        }
        for (Batch batch : runAll(fetches)) {
            if (batch == null) {
                failedTasks++;
                continue;
            }
            for (CollectedDocument doc : batch.documents) {
                byUrl.putIfAbsent(urlKey(doc.url), doc);
            }
        }

        List<CollectedDocument> documents = new ArrayList<>(byUrl.values());
        state.setCollectedDocuments(documents);
        state.setFinancialItems(financial);

        List<String> dataFiles = new ArrayList<>(artifactWriter.writeDataSources(state.outputDir(), state.domain(), documents));
        String financialFile = artifactWriter.writeFinancialData(state.outputDir(), state.domain(), financial);
        if (financialFile != null) {
            dataFiles.add(financialFile);
        }
        state.setDataFiles(dataFiles);

        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put("documents", documents.size());
        evidence.put("financial_items", financial.size());
        evidence.put("failed_tasks", failedTasks);
        String reason = "documents=" + documents.size() + " financial_items=" + financial.size();
        if (documents.isEmpty() && financial.isEmpty()) {
            return new StageResult(StageStatus.DEGRADED, "no data collected", evidence);
        }
        return StageResult.success(reason, evidence);
    }

    private CollectedDocument fetchOne(String url) {
        try {
            return caller.call("fetch_" + url, () -> contentFetcher.fetchContent(url));
        } catch (RuntimeException e) {
            LOG.warn("content fetch failed url={} err={}", url, e.getMessage());
            String base = JsoupContentFetcher.baseName(url);
            return CollectedDocument.builder()
                    .source(url)
                    .title("Failed to Load: " + (base.isEmpty() ? url : base))
                    .summary(e.getCause() == null ? String.valueOf(e.getMessage()) : String.valueOf(e.getCause().getMessage()))
                    .fullText("")
                    .url(url)
                    .build();
        }
    }

    /**
     * Runs the tasks on a bounded pool and returns their results in submission order.
     * A failed or timed-out task contributes {@code null}.
     */
    private List<Batch> runAll(List<Callable<Batch>> tasks) {
        Batch[] results = new Batch[tasks.size()];
        if (tasks.isEmpty()) {
            return new ArrayList<>();
        }
        int poolSize = Math.max(1, Math.min(threads, tasks.size()));
        ExecutorService pool = Executors.newFixedThreadPool(poolSize);
        CompletionService<Batch> completion = new ExecutorCompletionService<>(pool);
        Map<Future<Batch>, Integer> positions = new IdentityHashMap<>();
        try {
            for (int i = 0; i < tasks.size(); i++) {
                positions.put(completion.submit(tasks.get(i)), i);
            }
            for (int i = 0; i < tasks.size(); i++) {
                Future<Batch> future = completion.poll(taskTimeoutSec, TimeUnit.SECONDS);
                if (future == null) {
                    LOG.warn("collection tasks timed out after {}s, pending={}", taskTimeoutSec, tasks.size() - i);
                    break;
                }
                Integer position = positions.get(future);
                try {
                    Batch batch = future.get();
                    if (position != null) {
                        results[position] = batch;
                    }
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() == null ? e : e.getCause();
                    LOG.warn("collection task failed err={}", cause.getMessage());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("collection interrupted");
        } finally {
            pool.shutdownNow();
        }
        return Arrays.asList(results);
    }

    static String urlKey(String url) {
        if (url == null) {
            return "";
        }
        String key = url.trim();
        while (key.endsWith("/")) {
            key = key.substring(0, key.length() - 1);
        }
        return key;
    }

    private static final class Batch {
        private final int variant;
        private final List<String> urls;
        private final List<CollectedDocument> documents;
        private final List<FinancialItem> financial;

        private Batch(int variant, List<String> urls, List<CollectedDocument> documents, List<FinancialItem> financial) {
            this.variant = variant;
            this.urls = urls == null ? List.of() : urls;
            this.documents = documents == null ? List.of() : documents;
            this.financial = financial == null ? List.of() : financial;
        }

        static Batch urls(int variant, List<String> urls) {
            return new Batch(variant, urls, null, null);
        }

        static Batch documents(List<CollectedDocument> documents) {
            return new Batch(-1, null, documents, null);
        }

        static Batch financial(List<FinancialItem> financial) {
            return new Batch(-1, null, null, financial);
        }
    }
}
