package com.driftmonitor.threshold;

public enum ThresholdDirection {
    /** Larger values are worse (divergences, parity drift). */
    HIGHER_IS_WORSE,
    /** Smaller values are worse (disparate impact ratio). */
    LOWER_IS_WORSE
}
