package com.marketintel.core;

import java.util.LinkedHashMap;
import java.util.Map;

public record StageResult(
        StageStatus status,
        String reason,
        Map<String, Object> evidence
) {
    public StageResult {
        status = status == null ? StageStatus.FAILED : status;
        reason = reason == null ? "" : reason;
        Map<String, Object> copy = evidence == null ? Map.of() : new LinkedHashMap<>(evidence);
        evidence = Map.copyOf(copy);
    }

    public static StageResult success(String reason) {
        return new StageResult(StageStatus.SUCCESS, reason, Map.of());
    }

    public static StageResult success(String reason, Map<String, Object> evidence) {
        return new StageResult(StageStatus.SUCCESS, reason, evidence);
    }

    public static StageResult degraded(String reason) {
        return new StageResult(StageStatus.DEGRADED, reason, Map.of());
    }

    public static StageResult skipped(String reason) {
        return new StageResult(StageStatus.SKIPPED, reason, Map.of());
    }

    public static StageResult failed(String reason) {
        return new StageResult(StageStatus.FAILED, reason, Map.of());
    }
}
