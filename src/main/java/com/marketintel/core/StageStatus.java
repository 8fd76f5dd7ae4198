package com.marketintel.core;

public enum StageStatus {
    SUCCESS,
    DEGRADED,
    SKIPPED,
    FAILED
}
