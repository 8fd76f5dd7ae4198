package com.marketintel.core;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RunTelemetryTest {

    @Test
    void summaryShouldContainRequiredFields() {
        RunTelemetry telemetry = new RunTelemetry("run-123", "analyze", Instant.parse("2026-02-23T00:00:00Z"));
        telemetry.startStep("COLLECT");
        telemetry.endStep("COLLECT", StageResult.success("documents=7"));
        telemetry.startStep("REPORT");
        telemetry.endStep("REPORT", StageResult.degraded("fallback report"));
        telemetry.finish();

        String summary = telemetry.getSummary();

        assertTrue(summary.contains("run_id=run-123"));
        assertTrue(summary.contains("trigger=analyze"));
        assertTrue(summary.contains("total_elapsed_ms="));
        assertTrue(summary.contains("steps:"));
        assertTrue(summary.contains("COLLECT status=SUCCESS"));
        assertTrue(summary.contains("note=fallback report"));
    }

    @Test
    void endStep_shouldCountFailuresAndKeepStepOrder() {
        RunTelemetry telemetry = new RunTelemetry("r", "analyze", Instant.now());
        telemetry.startStep("TREND");
        telemetry.endStep("TREND", StageResult.failed("boom"));
        telemetry.startStep("INDEX");
        telemetry.endStep("INDEX", StageResult.skipped("no chunks"));
        telemetry.endStep("REPORT", null);
        telemetry.recordCheckpointFailure();

        List<RunTelemetry.StepRecord> records = telemetry.stepRecords();

        assertEquals(2, telemetry.errorsTotal());
        assertEquals(1, telemetry.checkpointFailures());
        assertEquals(3, records.size());
        assertEquals(StageStatus.SKIPPED, records.get(1).status());
        assertTrue(telemetry.getSummary().contains("checkpoint_failures=1"));
    }
}
