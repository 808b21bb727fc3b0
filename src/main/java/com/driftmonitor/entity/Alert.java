package com.driftmonitor.entity;

import com.driftmonitor.entity.converter.StringListConverter;
import com.driftmonitor.entity.converter.StringMapConverter;
import com.driftmonitor.model.Severity;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Entity
@Table(
    name = "alerts",
    indexes = {
        @Index(name = "idx_alert_dedup", columnList = "model_id, metric_name, severity, created_at"),
        @Index(name = "idx_alert_incident", columnList = "incident_id"),
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Alert {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(updatable = false, nullable = false)
    private UUID id;

    @Column(name = "incident_id", nullable = false, updatable = false)
    private UUID incidentId;

    @Column(name = "model_id", nullable = false, length = 100, updatable = false)
    private String modelId;

    @Column(name = "metric_name", nullable = false, length = 150, updatable = false)
    private String metricName;

    @Column(name = "metric_value", updatable = false)
    private Double value;

    @Column(updatable = false)
    private Double threshold;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16, updatable = false)
    private Severity severity;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private AlertStatus status;

    @Convert(converter = StringListConverter.class)
    @Column(name = "channels_attempted", columnDefinition = "TEXT")
    private List<String> channelsAttempted;

    @Convert(converter = StringListConverter.class)
    @Column(name = "channels_notified", columnDefinition = "TEXT")
    private List<String> channelsNotified;

    /** channel -> failure reason, for channels that exhausted their retries */
    @Convert(converter = StringMapConverter.class)
    @Column(name = "delivery_failures", columnDefinition = "TEXT")
    private Map<String, String> deliveryFailures;

    /** channel -> external reference returned by the channel */
    @Convert(converter = StringMapConverter.class)
    @Column(name = "delivery_refs", columnDefinition = "TEXT")
    private Map<String, String> deliveryRefs;

    @Column(name = "deduplicated_from", updatable = false)
    private UUID deduplicatedFrom;

    @Column(name = "deduplicated_count", nullable = false)
    private int deduplicatedCount;

    @Column(name = "last_deduplicated_at")
    private Instant lastDeduplicatedAt;

    @Column(name = "acknowledged_by", length = 100)
    private String acknowledgedBy;

    @Column(name = "acknowledged_at")
    private Instant acknowledgedAt;

    @Column(name = "acknowledgement_notes", length = 2000)
    private String acknowledgementNotes;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "delivered_at")
    private Instant deliveredAt;
}
