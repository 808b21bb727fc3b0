package com.driftmonitor.service;

import com.driftmonitor.entity.Alert;
import com.driftmonitor.entity.AlertStatus;
import com.driftmonitor.entity.Incident;
import com.driftmonitor.entity.IncidentStatus;
import com.driftmonitor.entity.MonitoringRecord;
import com.driftmonitor.entity.ResolutionCategory;
import com.driftmonitor.exception.IllegalStateTransitionException;
import com.driftmonitor.exception.InvalidRequestException;
import com.driftmonitor.exception.ResourceNotFoundException;
import com.driftmonitor.model.MetricResult;
import com.driftmonitor.model.Severity;
import com.driftmonitor.repository.AlertRepository;
import com.driftmonitor.repository.IncidentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class IncidentService {

    static final String SYSTEM_ACTOR = "system";

    private final IncidentRepository incidents;
    private final AlertRepository alerts;
    private final Clock clock;

    /**
     * Reuses the active incident for (model, metric) or opens a new one. Severity only ratchets up
     * while the incident is active. A re-detection at or below the severity of an unexpired accepted
     * risk is logged on that incident, which is returned still in ACCEPTED_RISK.
     */
    @Transactional
    public Incident openOrUpdate(MonitoringRecord record, MetricResult metric) {
        Instant now = clock.instant();
        Optional<Incident> accepted = incidents
            .findFirstByModelIdAndMetricNameAndStatusAndRiskExpiresAtAfterOrderByCreatedAtDesc(
                record.getModelId(), metric.getMetric(), IncidentStatus.ACCEPTED_RISK, now)
            .filter(i -> i.getSeverity().isAtLeast(metric.getSeverity()));
        if (accepted.isPresent()) {
            Incident incident = accepted.get();
            incident.record(now, SYSTEM_ACTOR, "redetected_within_accepted_risk",
                metric.getSeverity() + " value=" + metric.getValue() + " run=" + record.getRunId());
            log.info("Re-detection covered by accepted risk | id={} | model={} | metric={} | expires={}",
                     incident.getId(), incident.getModelId(), incident.getMetricName(), incident.getRiskExpiresAt());
            return incidents.save(incident);
        }

        Optional<Incident> active = incidents.findFirstByModelIdAndMetricNameAndStatusInOrderByCreatedAtDesc(
            record.getModelId(), metric.getMetric(), IncidentStatus.active());

        if (active.isPresent()) {
            Incident incident = active.get();
            incident.setSeverity(Severity.max(incident.getSeverity(), metric.getSeverity()));
            Map<String, MetricResult> triggering = new LinkedHashMap<>(
                incident.getTriggeringMetrics() != null ? incident.getTriggeringMetrics() : Map.of());
            triggering.put(metric.getMetric(), metric);
            incident.setTriggeringMetrics(triggering);
            incident.setAffectedGroups(mergeGroups(incident.getAffectedGroups(), metric.getAffectedGroups()));
            incident.setMonitoringRecordId(record.getId());
            incident.record(now, SYSTEM_ACTOR, "redetected",
                metric.getSeverity() + " value=" + metric.getValue() + " run=" + record.getRunId());
            log.info("Incident updated | id={} | model={} | metric={} | severity={}",
                     incident.getId(), incident.getModelId(), incident.getMetricName(), incident.getSeverity());
            return incidents.save(incident);
        }

        Incident incident = Incident.builder()
            .modelId(record.getModelId())
            .metricName(metric.getMetric())
            .metricFamily(metric.getFamily())
            .severity(metric.getSeverity())
            .status(IncidentStatus.OPEN)
            .triggeringMetrics(new LinkedHashMap<>(Map.of(metric.getMetric(), metric)))
            .affectedGroups(metric.getAffectedGroups() != null ? new ArrayList<>(metric.getAffectedGroups()) : List.of())
            .monitoringRecordId(record.getId())
            .createdAt(now)
            .updatedAt(now)
            .build();
        incident.record(now, SYSTEM_ACTOR, "opened",
            metric.getSeverity() + " value=" + metric.getValue() + " run=" + record.getRunId());
        Incident saved = incidents.save(incident);
        log.info("Incident opened | id={} | model={} | metric={} | severity={}",
                 saved.getId(), saved.getModelId(), saved.getMetricName(), saved.getSeverity());
        return saved;
    }

    /**
     * Stamps a pending alert as acknowledged and moves its incident from OPEN to INVESTIGATING.
     */
    @Transactional
    public Alert acknowledge(UUID alertId, String actor, String notes) {
        requireActor(actor);
        Alert alert = alerts.findById(alertId)
            .orElseThrow(() -> new ResourceNotFoundException("Alert", alertId));
        if (alert.getStatus() != AlertStatus.PENDING) {
            throw new IllegalStateTransitionException("Alert", alertId, alert.getStatus(), AlertStatus.ACKNOWLEDGED);
        }
        Incident incident = get(alert.getIncidentId());
        if (!incident.getStatus().isActive()) {
            throw new IllegalStateTransitionException("Incident", incident.getId(), incident.getStatus(),
                IncidentStatus.INVESTIGATING);
        }

        Instant now = clock.instant();
        if (incident.getStatus() == IncidentStatus.OPEN) {
            incident.transitionTo(IncidentStatus.INVESTIGATING, now);
            incident.setAcknowledgedAt(now);
            incident.setAcknowledgedBy(actor);
        }
        incident.record(now, actor, "acknowledged", notes);
        incidents.save(incident);

        alert.setStatus(AlertStatus.ACKNOWLEDGED);
        alert.setAcknowledgedBy(actor);
        alert.setAcknowledgedAt(now);
        alert.setAcknowledgementNotes(notes);
        log.info("Alert acknowledged | alertId={} | incident={} | actor={}", alertId, incident.getId(), actor);
        return alerts.save(alert);
    }

    @Transactional
    public Incident resolve(UUID incidentId, ResolutionCategory category, String notes, String actor) {
        requireActor(actor);
        if (category == null) {
            throw new InvalidRequestException("A resolution category is required");
        }
        if (notes == null || notes.isBlank()) {
            throw new InvalidRequestException("Resolution notes are required");
        }
        Incident incident = get(incidentId);
        Instant now = clock.instant();
        incident.transitionTo(IncidentStatus.RESOLVED, now);
        incident.setResolutionCategory(category);
        incident.setResolutionNotes(notes);
        incident.setResolvedBy(actor);
        incident.record(now, actor, "resolved", category + ": " + notes);
        closeAlerts(incidentId);
        log.info("Incident resolved | id={} | category={} | actor={}", incidentId, category, actor);
        return incidents.save(incident);
    }

    /**
     * Accepts the risk until {@code expiresAt}. Fairness incidents also need a compliance approver.
     */
    @Transactional
    public Incident acceptRisk(UUID incidentId, String approver, String complianceApprover,
                               Instant expiresAt, String notes) {
        if (approver == null || approver.isBlank()) {
            throw new InvalidRequestException("Accepting risk requires an approver");
        }
        Incident incident = get(incidentId);
        if (incident.isFairnessIncident() && (complianceApprover == null || complianceApprover.isBlank())) {
            throw new InvalidRequestException("Fairness incidents require a compliance approver to accept risk");
        }
        Instant now = clock.instant();
        if (expiresAt == null || !expiresAt.isAfter(now)) {
            throw new InvalidRequestException("Risk acceptance needs an expiry in the future");
        }
        incident.transitionTo(IncidentStatus.ACCEPTED_RISK, now);
        incident.setRiskApprovedBy(approver);
        incident.setComplianceApprovedBy(complianceApprover);
        incident.setRiskExpiresAt(expiresAt);
        incident.setResolutionNotes(notes);
        incident.record(now, approver, "accepted_risk", "expires " + expiresAt + (notes != null ? ": " + notes : ""));
        closeAlerts(incidentId);
        log.info("Incident risk accepted | id={} | approver={} | compliance={} | expires={}",
                 incidentId, approver, complianceApprover, expiresAt);
        return incidents.save(incident);
    }

    @Transactional
    public Incident addAction(UUID incidentId, String actor, String action, String notes) {
        requireActor(actor);
        if (action == null || action.isBlank()) {
            throw new InvalidRequestException("action is required");
        }
        Incident incident = get(incidentId);
        incident.record(clock.instant(), actor, action.trim(), notes);
        return incidents.save(incident);
    }

    /**
     * Stamps one escalation if the incident is still an unacknowledged CRITICAL one and a full period
     * has passed since creation or the previous escalation. The optimistic lock on the incident makes
     * concurrent sweeps escalate at most once.
     */
    @Transactional
    public Optional<Incident> escalate(UUID incidentId, Instant now, Duration period) {
        Incident incident = get(incidentId);
        if (incident.getStatus() != IncidentStatus.OPEN || incident.getSeverity() != Severity.CRITICAL) {
            return Optional.empty();
        }
        Instant reference = incident.getLastEscalatedAt() != null ? incident.getLastEscalatedAt() : incident.getCreatedAt();
        if (now.isBefore(reference.plus(period))) {
            return Optional.empty();
        }
        incident.setEscalationCount(incident.getEscalationCount() + 1);
        incident.setLastEscalatedAt(now);
        incident.record(now, SYSTEM_ACTOR, "escalated", "unacknowledged escalation #" + incident.getEscalationCount());
        return Optional.of(incidents.saveAndFlush(incident));
    }

    @Transactional(readOnly = true)
    public Incident get(UUID incidentId) {
        return incidents.findById(incidentId)
            .orElseThrow(() -> new ResourceNotFoundException("Incident", incidentId));
    }

    @Transactional(readOnly = true)
    public Page<Incident> search(IncidentStatus status, Severity severity, String modelId, Pageable pageable) {
        return incidents.search(status, severity, modelId, pageable);
    }

    @Transactional(readOnly = true)
    public List<Alert> alertsFor(UUID incidentId) {
        return alerts.findByIncidentIdOrderByCreatedAtAsc(incidentId);
    }

    @Transactional(readOnly = true)
    public List<Alert> alertsForModel(String modelId, Severity severity, AlertStatus status) {
        return alerts.findForModel(modelId, severity, status);
    }

    private void closeAlerts(UUID incidentId) {
        alerts.findByIncidentIdOrderByCreatedAtAsc(incidentId).stream()
            .filter(a -> a.getStatus() != AlertStatus.RESOLVED)
            .forEach(a -> {
                a.setStatus(AlertStatus.RESOLVED);
                alerts.save(a);
            });
    }

    private static List<String> mergeGroups(List<String> existing, List<String> added) {
        Set<String> merged = new LinkedHashSet<>();
        if (existing != null) merged.addAll(existing);
        if (added != null) merged.addAll(added);
        return new ArrayList<>(merged);
    }

    private static void requireActor(String actor) {
        if (actor == null || actor.isBlank()) {
            throw new InvalidRequestException("actor is required");
        }
    }
}
