package com.marketintel.output;

import com.marketintel.model.CollectedDocument;
import com.marketintel.model.FinancialItem;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Writes a run's raw data and text artifacts into its workspace directory.
 */
public final class ArtifactWriter {
    private static final Logger LOG = LogManager.getLogger(ArtifactWriter.class);
    private static final String[] CSV_HEADER = {"title", "summary", "url", "source", "full_content"};
    private static final String PROBE_FILE = ".write_probe";

    public static String domainSlug(String domain) {
        String value = domain == null ? "" : domain.trim().toLowerCase(Locale.ROOT);
        value = value.replaceAll("\\s+", "_");
        return value.isEmpty() ? "market" : value;
    }

    /**
     * Creates {@code runsDir/{domain_slug}_{runId[:8]}} and proves it writable with a probe file.
     *
     * @throws IOException if the directory cannot be created or written
     */
    public Path prepareWorkspace(Path runsDir, String domain, String runId) throws IOException {
        String shortId = runId.substring(0, Math.min(8, runId.length()));
        Path dir = runsDir.resolve(domainSlug(domain) + "_" + shortId).toAbsolutePath().normalize();
        Files.createDirectories(dir);
        Path probe = dir.resolve(PROBE_FILE);
        Files.writeString(probe, "ok", StandardCharsets.UTF_8);
        Files.delete(probe);
        return dir;
    }

    /**
     * Writes {@code {slug}_data_sources.json} and {@code {slug}_data_sources.csv}.
     *
     * @return the written file names, relative to {@code dir}
     */
    public List<String> writeDataSources(Path dir, String domain, List<CollectedDocument> documents) throws IOException {
        String slug = domainSlug(domain);
        List<String> written = new ArrayList<>();

        JSONArray array = new JSONArray();
        for (CollectedDocument doc : documents) {
            array.put(doc.toJson());
        }
        String jsonName = slug + "_data_sources.json";
        Files.writeString(dir.resolve(jsonName), array.toString(2), StandardCharsets.UTF_8);
        written.add(jsonName);

        String csvName = slug + "_data_sources.csv";
        CSVFormat format = CSVFormat.DEFAULT.builder().setHeader(CSV_HEADER).build();
        try (Writer out = Files.newBufferedWriter(dir.resolve(csvName), StandardCharsets.UTF_8);
             CSVPrinter printer = new CSVPrinter(out, format)) {
            for (CollectedDocument doc : documents) {
                printer.printRecord(doc.title, doc.summary, doc.url, doc.source, doc.fullText);
            }
        }
        written.add(csvName);
        LOG.info("data sources written dir={} documents={}", dir, documents.size());
        return written;
    }

    /**
     * Writes {@code {slug}_financial_data.json}; returns null when there is nothing to write.
     */
    public String writeFinancialData(Path dir, String domain, List<FinancialItem> items) throws IOException {
        if (items == null || items.isEmpty()) {
            return null;
        }
        JSONArray array = new JSONArray();
        for (FinancialItem item : items) {
            array.put(item.toJson());
        }
        String name = domainSlug(domain) + "_financial_data.json";
        Files.writeString(dir.resolve(name), array.toString(2), StandardCharsets.UTF_8);
        return name;
    }

    public Path writeText(Path dir, String fileName, String content) throws IOException {
        Path file = dir.resolve(fileName);
        Files.writeString(file, content == null ? "" : content, StandardCharsets.UTF_8);
        return file;
    }

    public Path appendText(Path dir, String fileName, String content) throws IOException {
        Path file = dir.resolve(fileName);
        Files.writeString(
                file,
                content == null ? "" : content,
                StandardCharsets.UTF_8,
                StandardOpenOption.CREATE,
                StandardOpenOption.APPEND
        );
        return file;
    }
}
