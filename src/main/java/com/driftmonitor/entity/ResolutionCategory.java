package com.driftmonitor.entity;

public enum ResolutionCategory {
    RETRAINED,
    DATA_FIXED,
    BASELINE_UPDATED,
    FALSE_POSITIVE
}
