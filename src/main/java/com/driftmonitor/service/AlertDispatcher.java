package com.driftmonitor.service;

import com.driftmonitor.entity.Alert;
import com.driftmonitor.entity.AlertStatus;
import com.driftmonitor.entity.AlertSuppression;
import com.driftmonitor.entity.Incident;
import com.driftmonitor.model.MetricFamily;
import com.driftmonitor.model.MetricNames;
import com.driftmonitor.model.MetricResult;
import com.driftmonitor.model.Severity;
import com.driftmonitor.notification.AlertPayload;
import com.driftmonitor.notification.ChannelDelivery;
import com.driftmonitor.notification.ChannelRegistry;
import com.driftmonitor.notification.DeliveryReport;
import com.driftmonitor.notification.NotificationChannel;
import com.driftmonitor.repository.AlertRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Decides whether a detected metric becomes a new alert, then fans it out to the channels routed
 * for its severity.
 *
 * <p>Decision order: suppression window, deduplication, value-change suppression, create. The
 * decision and its write run under a per-(model, metric) lock in one transaction, so two concurrent
 * triggers for the same pair cannot both create an alert. Delivery happens after the alert row is
 * committed and does not hold the lock.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AlertDispatcher {

    private static final double DISPARATE_IMPACT_FLOOR = 0.80;

    private final AlertRepository alerts;
    private final SuppressionService suppressionService;
    private final ChannelRegistry channels;
    private final ChannelDelivery delivery;
    private final MetaAlertService metaAlerts;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    private final ConcurrentHashMap<String, Object> locks = new ConcurrentHashMap<>();

    @Value("${alerts.dedup-window-hours:6}")
    private long dedupWindowHours;

    @Value("${alerts.value-change-tolerance:0.05}")
    private double valueChangeTolerance;

    @Value("${drift.public-base-url:http://localhost:8080}")
    private String publicBaseUrl;

    public AlertOutcome trigger(Incident incident, MetricResult metric) {
        Severity severity = metric.getSeverity();
        if (severity == null || !severity.isAtLeast(Severity.WARNING)) {
            return AlertOutcome.suppressed("severity " + severity + " is not routed");
        }
        String key = incident.getModelId() + "|" + metric.getMetric();
        AlertOutcome decided;
        synchronized (locks.computeIfAbsent(key, k -> new Object())) {
            decided = transactionTemplate.execute(status -> decide(incident, metric, severity));
        }
        if (decided == null || decided.status() != AlertOutcome.Status.CREATED) {
            return decided;
        }
        CompletableFuture<DeliveryReport> delivered = deliver(decided.alert(), incident, metric);
        return new AlertOutcome(decided.status(), decided.reason(), decided.alert(), delivered);
    }

    /**
     * Sends an escalation notice for an unacknowledged CRITICAL incident to the escalation route.
     */
    public CompletableFuture<DeliveryReport> escalate(Incident incident, Alert pending) {
        AlertPayload payload = AlertPayload.builder()
            .title("ESCALATION #" + incident.getEscalationCount() + ": unacknowledged "
                + incident.getSeverity() + " incident on " + incident.getMetricName())
            .severityLabel(incident.getSeverity().name())
            .modelId(incident.getModelId())
            .metricName(incident.getMetricName())
            .value(pending != null ? pending.getValue() : null)
            .threshold(pending != null ? pending.getThreshold() : null)
            .affectedGroups(incident.getAffectedGroups() != null ? incident.getAffectedGroups() : List.of())
            .incidentRef(incidentRef(incident.getId()))
            .actionsLinks(links(pending != null ? pending.getId() : null, incident.getId()))
            .build();
        List<NotificationChannel> targets = channels.forEscalation();
        log.warn("Escalating incident | id={} | model={} | metric={} | escalation={} | channels={}",
                 incident.getId(), incident.getModelId(), incident.getMetricName(),
                 incident.getEscalationCount(), targets.stream().map(NotificationChannel::name).toList());
        return delivery.fanOut(targets, payload)
            .toFuture()
            .thenApply(report -> {
                if (report.allFailed()) {
                    metaAlerts.raise(incident.getModelId(), "escalation undeliverable",
                        "incident " + incident.getId() + " failures=" + report.failures());
                }
                return report;
            });
    }

    private AlertOutcome decide(Incident incident, MetricResult metric, Severity severity) {
        Instant now = clock.instant();
        String modelId = incident.getModelId();
        String metricName = metric.getMetric();

        Optional<AlertSuppression> window = suppressionService.findCovering(
            modelId, metricName, metric.getFamily(), severity, now);
        if (window.isPresent()) {
            return AlertOutcome.suppressed("suppression " + window.get().getId());
        }

        Instant since = now.minus(Duration.ofHours(dedupWindowHours));
        Optional<Alert> lastForMetric = alerts
            .findFirstByModelIdAndMetricNameAndCreatedAtGreaterThanEqualOrderByCreatedAtDesc(modelId, metricName, since);
        boolean escalating = lastForMetric.map(a -> severity.compareTo(a.getSeverity()) > 0).orElse(false);
        boolean zeroTolerance = isDisparateImpactViolation(metric);
        boolean bypass = escalating || zeroTolerance;

        Optional<Alert> duplicate = alerts
            .findFirstByModelIdAndMetricNameAndSeverityAndCreatedAtGreaterThanEqualOrderByCreatedAtDesc(
                modelId, metricName, severity, since);
        if (duplicate.isPresent() && !bypass) {
            Alert existing = duplicate.get();
            existing.setDeduplicatedCount(existing.getDeduplicatedCount() + 1);
            existing.setLastDeduplicatedAt(now);
            alerts.save(existing);
            log.info("Alert deduplicated | alertId={} | model={} | metric={} | severity={} | count={}",
                     existing.getId(), modelId, metricName, severity, existing.getDeduplicatedCount());
            return AlertOutcome.deduplicated(existing);
        }

        boolean criticalFairness = severity == Severity.CRITICAL && metric.getFamily() == MetricFamily.FAIRNESS;
        if (!bypass && !criticalFairness && lastForMetric.isPresent()
                && withinTolerance(lastForMetric.get().getValue(), metric.getValue())) {
            log.info("Alert suppressed, value unchanged | model={} | metric={} | previous={} | current={}",
                     modelId, metricName, lastForMetric.get().getValue(), metric.getValue());
            return AlertOutcome.suppressed("value change below " + valueChangeTolerance);
        }

        List<String> routed = channels.forSeverity(severity).stream().map(NotificationChannel::name).toList();
        Alert alert = alerts.save(Alert.builder()
            .incidentId(incident.getId())
            .modelId(modelId)
            .metricName(metricName)
            .value(metric.getValue())
            .threshold(metric.getThreshold())
            .severity(severity)
            .status(AlertStatus.PENDING)
            .channelsAttempted(routed)
            .channelsNotified(List.of())
            .deduplicatedFrom(bypass ? duplicate.or(() -> lastForMetric).map(Alert::getId).orElse(null) : null)
            .createdAt(now)
            .build());
        String reason = zeroTolerance ? "disparate impact below " + DISPARATE_IMPACT_FLOOR
            : escalating ? "severity escalated" : "new";
        log.info("Alert created | alertId={} | incident={} | model={} | metric={} | severity={} | reason={} | channels={}",
                 alert.getId(), incident.getId(), modelId, metricName, severity, reason, routed);
        return new AlertOutcome(AlertOutcome.Status.CREATED, reason, alert, null);
    }

    private CompletableFuture<DeliveryReport> deliver(Alert alert, Incident incident, MetricResult metric) {
        List<NotificationChannel> targets = channels.forSeverity(alert.getSeverity());
        AlertPayload payload = AlertPayload.builder()
            .title(titleFor(metric, incident.getModelId()))
            .severityLabel(alert.getSeverity().name())
            .modelId(alert.getModelId())
            .metricName(alert.getMetricName())
            .value(alert.getValue())
            .threshold(alert.getThreshold())
            .affectedGroups(metric.getAffectedGroups() != null ? metric.getAffectedGroups() : List.of())
            .incidentRef(incidentRef(incident.getId()))
            .actionsLinks(links(alert.getId(), incident.getId()))
            .build();
        return delivery.fanOut(targets, payload)
            .toFuture()
            .thenApply(report -> {
                recordDelivery(alert.getId(), report);
                if (alert.getSeverity() == Severity.CRITICAL && report.allFailed()) {
                    metaAlerts.raise(alert.getModelId(), "critical alert undeliverable",
                        "alert " + alert.getId() + " failures=" + report.failures());
                }
                return report;
            });
    }

    private void recordDelivery(UUID alertId, DeliveryReport report) {
        transactionTemplate.executeWithoutResult(status -> alerts.findById(alertId).ifPresent(a -> {
            a.setChannelsNotified(report.notified());
            a.setDeliveryFailures(report.failures());
            a.setDeliveryRefs(report.refs());
            a.setDeliveredAt(clock.instant());
            alerts.save(a);
        }));
        log.info("Alert delivery recorded | alertId={} | notified={} | failed={}",
                 alertId, report.notified(), report.failures().keySet());
    }

    private boolean isDisparateImpactViolation(MetricResult metric) {
        return MetricNames.DISPARATE_IMPACT_RATIO.equals(MetricNames.typeOf(metric.getMetric()))
            && metric.getValue() != null
            && metric.getValue() < DISPARATE_IMPACT_FLOOR;
    }

    private boolean withinTolerance(Double previous, Double current) {
        if (previous == null || current == null) {
            return false;
        }
        if (previous == 0.0) {
            return current == 0.0;
        }
        return Math.abs(current - previous) / Math.abs(previous) < valueChangeTolerance;
    }

    private static String titleFor(MetricResult metric, String modelId) {
        String family = metric.getFamily() != null ? metric.getFamily().name().toLowerCase() : "drift";
        return capitalize(family) + " drift on " + metric.getMetric() + " for model " + modelId;
    }

    private static String capitalize(String s) {
        return s.isEmpty() ? s : Character.toUpperCase(s.charAt(0)) + s.substring(1);
    }

    private static String incidentRef(UUID incidentId) {
        return "incident/" + incidentId;
    }

    private List<String> links(UUID alertId, UUID incidentId) {
        String base = publicBaseUrl.endsWith("/") ? publicBaseUrl.substring(0, publicBaseUrl.length() - 1) : publicBaseUrl;
        if (alertId == null) {
            return List.of(base + "/api/v1/incidents/" + incidentId);
        }
        return List.of(
            "Acknowledge: POST " + base + "/api/v1/alerts/" + alertId + "/acknowledge",
            "Incident: " + base + "/api/v1/incidents/" + incidentId);
    }
}
