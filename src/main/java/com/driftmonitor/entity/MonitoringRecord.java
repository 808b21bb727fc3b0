package com.driftmonitor.entity;

import com.driftmonitor.entity.converter.DoubleMapConverter;
import com.driftmonitor.entity.converter.MetricResultMapConverter;
import com.driftmonitor.model.MetricResult;
import com.driftmonitor.model.Severity;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

@Entity
@Table(
    name = "monitoring_records",
    indexes = {
        @Index(name = "idx_monitoring_model_end", columnList = "model_id, window_end"),
    },
    uniqueConstraints = @UniqueConstraint(name = "uq_monitoring_run", columnNames = {"model_id", "run_id"})
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MonitoringRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(updatable = false, nullable = false)
    private UUID id;

    @Column(name = "model_id", nullable = false, length = 100, updatable = false)
    private String modelId;

    @Column(name = "run_id", nullable = false, length = 64, updatable = false)
    private String runId;

    @Column(name = "baseline_id", nullable = false, updatable = false)
    private UUID baselineId;

    @Column(name = "window_start", nullable = false, updatable = false)
    private Instant windowStart;

    @Column(name = "window_end", nullable = false, updatable = false)
    private Instant windowEnd;

    @Column(name = "sample_count", nullable = false, updatable = false)
    private long sampleCount;

    @Convert(converter = MetricResultMapConverter.class)
    @Column(columnDefinition = "TEXT", updatable = false)
    private Map<String, MetricResult> metrics;

    @Convert(converter = DoubleMapConverter.class)
    @Column(name = "family_scores", columnDefinition = "TEXT", updatable = false)
    private Map<String, Double> familyScores;

    @Column(name = "aggregated_score", nullable = false, updatable = false)
    private double aggregatedScore;

    @Enumerated(EnumType.STRING)
    @Column(name = "max_severity", nullable = false, length = 16, updatable = false)
    private Severity maxSeverity;

    @Column(name = "needs_retraining", nullable = false, updatable = false)
    private boolean needsRetraining;

    @Column(name = "duration_ms", updatable = false)
    private Long durationMs;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
