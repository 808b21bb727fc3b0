package com.driftmonitor.entity;

import com.driftmonitor.entity.converter.IncidentActionListConverter;
import com.driftmonitor.entity.converter.MetricResultMapConverter;
import com.driftmonitor.entity.converter.StringListConverter;
import com.driftmonitor.exception.IllegalStateTransitionException;
import com.driftmonitor.model.IncidentAction;
import com.driftmonitor.model.MetricFamily;
import com.driftmonitor.model.MetricResult;
import com.driftmonitor.model.Severity;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * A sustained problem on one (model, metric) pair. Never deleted.
 */
@Entity
@Table(
    name = "incidents",
    indexes = {
        @Index(name = "idx_incident_model_metric", columnList = "model_id, metric_name, status"),
        @Index(name = "idx_incident_status", columnList = "status, severity"),
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Incident {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(updatable = false, nullable = false)
    private UUID id;

    @Column(name = "model_id", nullable = false, length = 100, updatable = false)
    private String modelId;

    @Column(name = "metric_name", nullable = false, length = 150, updatable = false)
    private String metricName;

    @Enumerated(EnumType.STRING)
    @Column(name = "metric_family", length = 16, updatable = false)
    private MetricFamily metricFamily;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private Severity severity;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private IncidentStatus status;

    @Convert(converter = MetricResultMapConverter.class)
    @Column(name = "triggering_metrics", columnDefinition = "TEXT")
    private Map<String, MetricResult> triggeringMetrics;

    @Convert(converter = StringListConverter.class)
    @Column(name = "affected_groups", columnDefinition = "TEXT")
    private List<String> affectedGroups;

    @Builder.Default
    @Convert(converter = IncidentActionListConverter.class)
    @Column(name = "action_log", columnDefinition = "TEXT")
    private List<IncidentAction> actions = new ArrayList<>();

    @Column(name = "monitoring_record_id")
    private UUID monitoringRecordId;

    @Enumerated(EnumType.STRING)
    @Column(name = "resolution_category", length = 32)
    private ResolutionCategory resolutionCategory;

    @Column(name = "resolution_notes", length = 4000)
    private String resolutionNotes;

    @Column(name = "resolved_by", length = 100)
    private String resolvedBy;

    @Column(name = "risk_approved_by", length = 100)
    private String riskApprovedBy;

    @Column(name = "compliance_approved_by", length = 100)
    private String complianceApprovedBy;

    @Column(name = "risk_expires_at")
    private Instant riskExpiresAt;

    @Column(name = "acknowledged_at")
    private Instant acknowledgedAt;

    @Column(name = "acknowledged_by", length = 100)
    private String acknowledgedBy;

    @Column(name = "escalation_count", nullable = false)
    private int escalationCount;

    @Column(name = "last_escalated_at")
    private Instant lastEscalatedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "closed_at")
    private Instant closedAt;

    @Version
    private long revision;

    /**
     * Moves to {@code target} or fails with {@link IllegalStateTransitionException}; no state changes
     * on failure.
     */
    public void transitionTo(IncidentStatus target, Instant at) {
        if (!status.canTransitionTo(target)) {
            throw new IllegalStateTransitionException("Incident", id, status, target);
        }
        status = target;
        updatedAt = at;
        if (!target.isActive()) {
            closedAt = at;
        }
    }

    public void record(Instant at, String actor, String action, String notes) {
        if (actions == null) {
            actions = new ArrayList<>();
        }
        // converter-backed collections are only flushed when the reference changes
        List<IncidentAction> updated = new ArrayList<>(actions);
        updated.add(IncidentAction.builder().at(at).actor(actor).action(action).notes(notes).build());
        actions = updated;
        updatedAt = at;
    }

    public boolean isFairnessIncident() {
        return metricFamily == MetricFamily.FAIRNESS;
    }
}
