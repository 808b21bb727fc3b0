package com.driftmonitor.entity;

import com.driftmonitor.entity.converter.BaselineSummaryConverter;
import com.driftmonitor.entity.converter.ObjectMapConverter;
import com.driftmonitor.model.BaselineSummary;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

@Entity
@Table(
    name = "baseline_snapshots",
    indexes = {
        @Index(name = "idx_baseline_model", columnList = "model_id, version"),
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BaselineSnapshot {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(updatable = false, nullable = false)
    private UUID id;

    @Column(name = "model_id", nullable = false, length = 100, updatable = false)
    private String modelId;

    @Column(nullable = false, updatable = false)
    private int version;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private BaselineStatus status;

    @Column(name = "sample_count", nullable = false, updatable = false)
    private long sampleCount;

    @Convert(converter = BaselineSummaryConverter.class)
    @Column(columnDefinition = "TEXT", updatable = false)
    private BaselineSummary summary;

    @Convert(converter = ObjectMapConverter.class)
    @Column(columnDefinition = "TEXT", updatable = false)
    private Map<String, Object> metadata;

    @Column(name = "created_by", length = 100, updatable = false)
    private String createdBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "archived_at")
    private Instant archivedAt;
}
