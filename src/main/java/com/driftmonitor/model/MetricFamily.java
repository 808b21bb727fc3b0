package com.driftmonitor.model;

public enum MetricFamily {
    FAIRNESS,
    DATA,
    MODEL,
    EXPLANATION,
    COMPOSITE
}
