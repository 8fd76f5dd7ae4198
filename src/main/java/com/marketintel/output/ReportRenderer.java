package com.marketintel.output;

import com.marketintel.model.CollectedDocument;
import com.marketintel.model.RunState;
import com.marketintel.model.SynthesisItem;
import org.thymeleaf.TemplateEngine;
import org.thymeleaf.context.Context;
import org.thymeleaf.templatemode.TemplateMode;
import org.thymeleaf.templateresolver.ClassLoaderTemplateResolver;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Renders the Markdown report and the workspace README from classpath Thymeleaf TEXT templates.
 */
public class ReportRenderer {
    private final TemplateEngine templateEngine;

    public ReportRenderer() {
        ClassLoaderTemplateResolver resolver = new ClassLoaderTemplateResolver();
        resolver.setPrefix("templates/");
        resolver.setSuffix(".txt");
        resolver.setTemplateMode(TemplateMode.TEXT);
        resolver.setCharacterEncoding("UTF-8");
        resolver.setCacheable(false);

        this.templateEngine = new TemplateEngine();
        this.templateEngine.setTemplateResolver(resolver);
    }

    /**
     * Deterministic report built from the run state alone, default placeholders included.
     */
    public String renderReport(RunState state) {
        Context context = new Context(Locale.ROOT);
        context.setVariable("domain", state.domain());
        context.setVariable("query", state.query());
        context.setVariable("hasQuery", !state.query().isBlank());
        context.setVariable("question", state.question());
        context.setVariable("answer", state.answer().orElse(""));
        context.setVariable("hasAnswer", state.hasQuestion() && state.answer().isPresent());
        context.setVariable("runId", state.runId());
        context.setVariable("generatedAt", Instant.now().toString());
        context.setVariable("documentCount", state.collectedDocuments().size());
        context.setVariable("financialCount", state.financialItems().size());
        context.setVariable("trends", sections(state.trends()));
        context.setVariable("opportunities", sections(state.opportunities()));
        context.setVariable("recommendations", sections(state.recommendations()));
        context.setVariable("sources", sources(state.collectedDocuments()));
        context.setVariable("hasSources", !state.collectedDocuments().isEmpty());
        return templateEngine.process("report", context);
    }

    /**
     * @param files file name to one-line description, in display order
     */
    public String renderReadme(RunState state, Map<String, String> files) {
        List<Map<String, String>> rows = new ArrayList<>();
        files.forEach((name, description) -> {
            Map<String, String> row = new LinkedHashMap<>();
            row.put("name", name);
            row.put("description", description);
            rows.add(row);
        });
        Context context = new Context(Locale.ROOT);
        context.setVariable("domain", state.domain());
        context.setVariable("query", state.query());
        context.setVariable("hasQuery", !state.query().isBlank());
        context.setVariable("runId", state.runId());
        context.setVariable("createdAt", state.createdAt().toString());
        context.setVariable("files", rows);
        return templateEngine.process("readme", context);
    }

    private static List<Map<String, Object>> sections(List<? extends SynthesisItem> items) {
        List<Map<String, Object>> out = new ArrayList<>();
        for (SynthesisItem item : items) {
            List<String> details = new ArrayList<>();
            item.extras().forEach((key, value) -> details.add(label(key) + ": " + display(value)));
            Map<String, Object> section = new LinkedHashMap<>();
            section.put("name", item.name());
            section.put("description", item.description());
            section.put("details", details);
            out.add(section);
        }
        return out;
    }

    private static List<Map<String, String>> sources(List<CollectedDocument> documents) {
        List<Map<String, String>> out = new ArrayList<>();
        for (CollectedDocument doc : documents) {
            Map<String, String> row = new LinkedHashMap<>();
            row.put("title", doc.title == null || doc.title.isBlank() ? "Untitled Document" : doc.title);
            row.put("url", doc.url == null ? "" : doc.url);
            out.add(row);
        }
        return out;
    }

    private static String label(String key) {
        String spaced = key.replace('_', ' ').trim();
        if (spaced.isEmpty()) {
            return key;
        }
        return Character.toUpperCase(spaced.charAt(0)) + spaced.substring(1);
    }

    private static String display(Object value) {
        if (value instanceof Collection<?> list) {
            List<String> parts = new ArrayList<>();
            for (Object part : list) {
                parts.add(String.valueOf(part));
            }
            return String.join("; ", parts);
        }
        return String.valueOf(value);
    }
}
