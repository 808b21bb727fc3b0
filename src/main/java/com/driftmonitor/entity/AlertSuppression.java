package com.driftmonitor.entity;

import com.driftmonitor.entity.converter.SeveritySetConverter;
import com.driftmonitor.model.MetricNames;
import com.driftmonitor.model.Severity;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.Set;
import java.util.UUID;

@Entity
@Table(
    name = "alert_suppressions",
    indexes = {
        @Index(name = "idx_suppression_model", columnList = "model_id, ends_at"),
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AlertSuppression {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(updatable = false, nullable = false)
    private UUID id;

    @Column(name = "model_id", nullable = false, length = 100)
    private String modelId;

    @Column(name = "metric_name", length = 150)
    private String metricName;

    @Convert(converter = SeveritySetConverter.class)
    @Column(columnDefinition = "TEXT", nullable = false)
    private Set<Severity> severities;

    @Column(name = "starts_at", nullable = false)
    private Instant startsAt;

    @Column(name = "ends_at", nullable = false)
    private Instant endsAt;

    @Column(nullable = false, length = 1000)
    private String reason;

    @Column(name = "approved_by", length = 100)
    private String approvedBy;

    @Column(name = "created_by", length = 100)
    private String createdBy;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "use_count", nullable = false)
    private long useCount;

    @Column(name = "last_used_at")
    private Instant lastUsedAt;

    public boolean isActiveAt(Instant at) {
        return !at.isBefore(startsAt) && at.isBefore(endsAt);
    }

    /**
     * An unscoped suppression covers every metric of the model; a scoped one matches either the full
     * metric name ({@code psi:age}) or its type ({@code psi}).
     */
    public boolean covers(String metric, Severity severity) {
        if (severities == null || !severities.contains(severity)) {
            return false;
        }
        return metricName == null
            || metricName.equals(metric)
            || metricName.equals(MetricNames.typeOf(metric));
    }

    public boolean isApproved() {
        return approvedBy != null && !approvedBy.isBlank();
    }
}
