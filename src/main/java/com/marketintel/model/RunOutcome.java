package com.marketintel.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.nio.file.Path;
import java.util.List;

/**
 * Structured summary of one pipeline run, returned to the caller instead of raw exceptions.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class RunOutcome {
    public final boolean success;
    public final String runId;
    public final String answer;
    public final Path outputDir;
    public final String reportFile;
    @Singular
    public final List<String> chartRefs;
    @Singular
    public final List<String> dataFiles;
    public final String readmeFile;
    public final String ragLogFile;
    public final String indexDir;
    public final String error;
    public final String telemetrySummary;

    public static RunOutcome failure(String runId, String error) {
        return RunOutcome.builder()
                .success(false)
                .runId(runId == null ? "" : runId)
                .error(error == null ? "unknown error" : error)
                .build();
    }
}
