package com.driftmonitor.threshold;

import java.time.Instant;

public record ThresholdTableRejectedEvent(String source, String reason, Instant rejectedAt) {
}
