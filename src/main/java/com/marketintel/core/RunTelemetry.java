package com.marketintel.core;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Captures a single pipeline run's per-step telemetry and summary.
 */
public final class RunTelemetry {
    private static final DateTimeFormatter ISO = DateTimeFormatter.ISO_INSTANT;

    private final String runId;
    private final String trigger;
    private final Instant startedAt;
    private Instant finishedAt;
    private int errorsTotal;
    private int checkpointFailures;

    private final Map<String, StepStat> steps = new LinkedHashMap<>();
    private final Map<String, Long> stepStartsNanos = new HashMap<>();

    public RunTelemetry(String runId, String trigger, Instant startedAt) {
        this.runId = blankTo(runId, "unknown");
        this.trigger = blankTo(trigger, "manual");
        this.startedAt = startedAt == null ? Instant.now() : startedAt;
    }

    public synchronized String runId() {
        return runId;
    }

    public synchronized void startStep(String name) {
        String key = sanitizeStepName(name);
        steps.putIfAbsent(key, new StepStat(key));
        stepStartsNanos.put(key, System.nanoTime());
    }

    public synchronized void endStep(String name, StageResult result) {
        String key = sanitizeStepName(name);
        StepStat stat = steps.computeIfAbsent(key, StepStat::new);
        Long startedNanos = stepStartsNanos.remove(key);
        long elapsedMs = startedNanos == null
                ? 0L
                : Math.max(0L, (System.nanoTime() - startedNanos) / 1_000_000L);
        StageResult safe = result == null ? StageResult.failed("no result") : result;
        stat.elapsedMs += elapsedMs;
        stat.status = safe.status();
        stat.note = safe.reason();
        if (safe.status() == StageStatus.FAILED) {
            errorsTotal++;
        }
    }

    public synchronized void recordCheckpointFailure() {
        checkpointFailures++;
    }

    public synchronized int checkpointFailures() {
        return checkpointFailures;
    }

    public synchronized int errorsTotal() {
        return errorsTotal;
    }

    public synchronized void finish() {
        if (finishedAt == null) {
            finishedAt = Instant.now();
        }
    }

    public synchronized List<StepRecord> stepRecords() {
        List<StepRecord> out = new ArrayList<>();
        for (StepStat stat : steps.values()) {
            out.add(new StepRecord(stat.name, stat.status, stat.elapsedMs, stat.note));
        }
        return out;
    }

    public synchronized String getSummary() {
        Instant end = finishedAt == null ? Instant.now() : finishedAt;
        StringBuilder sb = new StringBuilder();
        sb.append("run_id=").append(runId).append('\n');
        sb.append("trigger=").append(trigger).append('\n');
        sb.append("started_at=").append(ISO.format(startedAt)).append('\n');
        sb.append("finished_at=").append(ISO.format(end)).append('\n');
        sb.append("total_elapsed_ms=").append(Math.max(0L, Duration.between(startedAt, end).toMillis())).append('\n');
        sb.append("errors_total=").append(errorsTotal).append('\n');
        sb.append("checkpoint_failures=").append(checkpointFailures).append('\n');
        sb.append("steps:\n");
        for (StepStat stat : steps.values()) {
            sb.append(String.format(
                    Locale.US,
                    "  %s status=%s elapsed_ms=%d",
                    stat.name,
                    stat.status == null ? "RUNNING" : stat.status.name(),
                    stat.elapsedMs
            ));
            if (stat.note != null && !stat.note.isBlank()) {
                sb.append(" note=").append(stat.note.trim());
            }
            sb.append('\n');
        }
        return sb.toString().trim();
    }

    private String sanitizeStepName(String name) {
        String step = name == null ? "" : name.trim();
        return step.isEmpty() ? "UNKNOWN_STEP" : step.toUpperCase(Locale.ROOT);
    }

    private static String blankTo(String value, String fallback) {
        String text = value == null ? "" : value.trim();
        return text.isEmpty() ? fallback : text;
    }

    private static final class StepStat {
        private final String name;
        private long elapsedMs;
        private StageStatus status;
        private String note = "";

        private StepStat(String name) {
            this.name = name;
        }
    }

    public record StepRecord(
            String name,
            StageStatus status,
            long elapsedMs,
            String note
    ) {
    }
}
