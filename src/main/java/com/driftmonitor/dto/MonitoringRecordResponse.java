package com.driftmonitor.dto;

import com.driftmonitor.entity.MonitoringRecord;
import com.driftmonitor.model.MetricResult;
import com.driftmonitor.model.Severity;
import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

@Value
@Builder
public class MonitoringRecordResponse {
    UUID id;
    String modelId;
    String runId;
    UUID baselineId;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant windowStart;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant windowEnd;
    long sampleCount;
    Map<String, MetricResult> metrics;
    Map<String, Double> familyScores;
    double aggregatedScore;
    Severity maxSeverity;
    boolean needsRetraining;
    Long durationMs;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant createdAt;

    public static MonitoringRecordResponse from(MonitoringRecord r) {
        return MonitoringRecordResponse.builder()
            .id(r.getId())
            .modelId(r.getModelId())
            .runId(r.getRunId())
            .baselineId(r.getBaselineId())
            .windowStart(r.getWindowStart())
            .windowEnd(r.getWindowEnd())
            .sampleCount(r.getSampleCount())
            .metrics(r.getMetrics())
            .familyScores(r.getFamilyScores())
            .aggregatedScore(r.getAggregatedScore())
            .maxSeverity(r.getMaxSeverity())
            .needsRetraining(r.isNeedsRetraining())
            .durationMs(r.getDurationMs())
            .createdAt(r.getCreatedAt())
            .build();
    }
}
