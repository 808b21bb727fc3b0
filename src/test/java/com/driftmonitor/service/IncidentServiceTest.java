package com.driftmonitor.service;

import com.driftmonitor.entity.Alert;
import com.driftmonitor.entity.AlertStatus;
import com.driftmonitor.entity.Incident;
import com.driftmonitor.entity.IncidentStatus;
import com.driftmonitor.entity.MonitoringRecord;
import com.driftmonitor.entity.ResolutionCategory;
import com.driftmonitor.exception.IllegalStateTransitionException;
import com.driftmonitor.exception.InvalidRequestException;
import com.driftmonitor.model.IncidentAction;
import com.driftmonitor.model.MetricFamily;
import com.driftmonitor.model.MetricResult;
import com.driftmonitor.model.Severity;
import com.driftmonitor.repository.AlertRepository;
import com.driftmonitor.repository.IncidentRepository;
import com.driftmonitor.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class IncidentServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");

    @Mock
    IncidentRepository incidents;

    @Mock
    AlertRepository alerts;

    IncidentService service;

    private final MutableClock clock = new MutableClock(NOW);

    @BeforeEach
    void setUp() {
        service = new IncidentService(incidents, alerts, clock);
    }

    @Test
    void openOrUpdate_noActiveIncident_opensOne() {
        when(incidents.findFirstByModelIdAndMetricNameAndStatusInOrderByCreatedAtDesc(
            "credit", "psi:region", IncidentStatus.active())).thenReturn(Optional.empty());
        when(incidents.save(any(Incident.class))).thenAnswer(inv -> inv.getArgument(0));

        Incident opened = service.openOrUpdate(record(), metric("psi:region", Severity.WARNING));

        assertThat(opened.getStatus()).isEqualTo(IncidentStatus.OPEN);
        assertThat(opened.getSeverity()).isEqualTo(Severity.WARNING);
        assertThat(opened.getMetricFamily()).isEqualTo(MetricFamily.DATA);
        assertThat(opened.getTriggeringMetrics()).containsKey("psi:region");
        assertThat(opened.getActions()).extracting(IncidentAction::getAction).containsExactly("opened");
        assertThat(opened.getCreatedAt()).isEqualTo(NOW);
    }

    @Test
    void openOrUpdate_activeIncident_isReusedAndSeverityOnlyRatchetsUp() {
        Incident existing = incident(IncidentStatus.INVESTIGATING, Severity.CRITICAL);
        when(incidents.findFirstByModelIdAndMetricNameAndStatusInOrderByCreatedAtDesc(
            "credit", "psi:region", IncidentStatus.active())).thenReturn(Optional.of(existing));
        when(incidents.save(any(Incident.class))).thenAnswer(inv -> inv.getArgument(0));

        Incident updated = service.openOrUpdate(record(), metric("psi:region", Severity.WARNING));

        assertThat(updated).isSameAs(existing);
        assertThat(updated.getSeverity()).isEqualTo(Severity.CRITICAL);
        assertThat(updated.getStatus()).isEqualTo(IncidentStatus.INVESTIGATING);
        assertThat(updated.getActions()).extracting(IncidentAction::getAction).contains("redetected");
    }

    @Test
    void acknowledge_movesOpenIncidentToInvestigating() {
        Incident incident = incident(IncidentStatus.OPEN, Severity.CRITICAL);
        Alert alert = pendingAlert(incident);
        when(alerts.findById(alert.getId())).thenReturn(Optional.of(alert));
        when(incidents.findById(incident.getId())).thenReturn(Optional.of(incident));
        when(alerts.save(alert)).thenReturn(alert);

        Alert acknowledged = service.acknowledge(alert.getId(), "bob", "looking into it");

        assertThat(acknowledged.getStatus()).isEqualTo(AlertStatus.ACKNOWLEDGED);
        assertThat(acknowledged.getAcknowledgedBy()).isEqualTo("bob");
        assertThat(incident.getStatus()).isEqualTo(IncidentStatus.INVESTIGATING);
        assertThat(incident.getAcknowledgedAt()).isEqualTo(NOW);
        verify(incidents).save(incident);
    }

    @Test
    void acknowledge_alreadyAcknowledgedAlert_isConflict() {
        Incident incident = incident(IncidentStatus.INVESTIGATING, Severity.CRITICAL);
        Alert alert = pendingAlert(incident);
        alert.setStatus(AlertStatus.ACKNOWLEDGED);
        when(alerts.findById(alert.getId())).thenReturn(Optional.of(alert));

        assertThatThrownBy(() -> service.acknowledge(alert.getId(), "bob", null))
            .isInstanceOf(IllegalStateTransitionException.class);
    }

    @Test
    void resolve_fromOpen_isIllegal() {
        Incident incident = incident(IncidentStatus.OPEN, Severity.WARNING);
        when(incidents.findById(incident.getId())).thenReturn(Optional.of(incident));

        assertThatThrownBy(() -> service.resolve(incident.getId(), ResolutionCategory.FALSE_POSITIVE, "noise", "bob"))
            .isInstanceOf(IllegalStateTransitionException.class);
        assertThat(incident.getStatus()).isEqualTo(IncidentStatus.OPEN);
    }

    @Test
    void resolve_fromInvestigating_closesIncidentAndItsAlerts() {
        Incident incident = incident(IncidentStatus.INVESTIGATING, Severity.WARNING);
        Alert alert = pendingAlert(incident);
        alert.setStatus(AlertStatus.ACKNOWLEDGED);
        when(incidents.findById(incident.getId())).thenReturn(Optional.of(incident));
        when(alerts.findByIncidentIdOrderByCreatedAtAsc(incident.getId())).thenReturn(List.of(alert));
        when(incidents.save(incident)).thenReturn(incident);
        clock.advance(Duration.ofHours(3));

        Incident resolved = service.resolve(incident.getId(), ResolutionCategory.RETRAINED, "model v2 deployed", "bob");

        assertThat(resolved.getStatus()).isEqualTo(IncidentStatus.RESOLVED);
        assertThat(resolved.getClosedAt()).isEqualTo(NOW.plus(Duration.ofHours(3)));
        assertThat(resolved.getResolutionCategory()).isEqualTo(ResolutionCategory.RETRAINED);
        assertThat(alert.getStatus()).isEqualTo(AlertStatus.RESOLVED);
    }

    @Test
    void resolve_resolvedIncident_cannotBeResolvedAgain() {
        Incident incident = incident(IncidentStatus.RESOLVED, Severity.WARNING);
        when(incidents.findById(incident.getId())).thenReturn(Optional.of(incident));

        assertThatThrownBy(() -> service.resolve(incident.getId(), ResolutionCategory.BASELINE_UPDATED, "again", "bob"))
            .isInstanceOf(IllegalStateTransitionException.class);
    }

    @Test
    void resolve_requiresNotes() {
        assertThatThrownBy(() -> service.resolve(UUID.randomUUID(), ResolutionCategory.BASELINE_UPDATED, " ", "bob"))
            .isInstanceOf(InvalidRequestException.class);
        verifyNoInteractions(incidents);
    }

    @Test
    void acceptRisk_fairnessIncidentWithoutComplianceApprover_isRejected() {
        Incident incident = incident(IncidentStatus.INVESTIGATING, Severity.CRITICAL);
        incident.setMetricFamily(MetricFamily.FAIRNESS);
        when(incidents.findById(incident.getId())).thenReturn(Optional.of(incident));

        assertThatThrownBy(() -> service.acceptRisk(incident.getId(), "carol", null,
                NOW.plus(Duration.ofDays(30)), "seasonal"))
            .isInstanceOf(InvalidRequestException.class)
            .hasMessageContaining("compliance");
        assertThat(incident.getStatus()).isEqualTo(IncidentStatus.INVESTIGATING);
    }

    @Test
    void acceptRisk_withApprovalsAndFutureExpiry_closesIncident() {
        Incident incident = incident(IncidentStatus.INVESTIGATING, Severity.CRITICAL);
        incident.setMetricFamily(MetricFamily.FAIRNESS);
        when(incidents.findById(incident.getId())).thenReturn(Optional.of(incident));
        when(alerts.findByIncidentIdOrderByCreatedAtAsc(incident.getId())).thenReturn(List.of());
        when(incidents.save(incident)).thenReturn(incident);

        Incident accepted = service.acceptRisk(incident.getId(), "carol", "dana",
            NOW.plus(Duration.ofDays(30)), "seasonal");

        assertThat(accepted.getStatus()).isEqualTo(IncidentStatus.ACCEPTED_RISK);
        assertThat(accepted.getComplianceApprovedBy()).isEqualTo("dana");
        assertThat(accepted.getRiskExpiresAt()).isEqualTo(NOW.plus(Duration.ofDays(30)));
    }

    @Test
    void acceptRisk_expiryInThePast_isRejected() {
        Incident incident = incident(IncidentStatus.INVESTIGATING, Severity.WARNING);
        when(incidents.findById(incident.getId())).thenReturn(Optional.of(incident));

        assertThatThrownBy(() -> service.acceptRisk(incident.getId(), "carol", null, NOW.minusSeconds(1), null))
            .isInstanceOf(InvalidRequestException.class);
    }

    @Test
    void escalate_stampsOncePerPeriod() {
        Incident incident = incident(IncidentStatus.OPEN, Severity.CRITICAL);
        incident.setCreatedAt(NOW.minus(Duration.ofMinutes(20)));
        when(incidents.findById(incident.getId())).thenReturn(Optional.of(incident));
        when(incidents.saveAndFlush(incident)).thenReturn(incident);
        Duration period = Duration.ofMinutes(15);

        assertThat(service.escalate(incident.getId(), NOW, period)).isPresent();
        assertThat(service.escalate(incident.getId(), NOW.plus(Duration.ofMinutes(5)), period)).isEmpty();
        assertThat(service.escalate(incident.getId(), NOW.plus(Duration.ofMinutes(15)), period)).isPresent();

        assertThat(incident.getEscalationCount()).isEqualTo(2);
        assertThat(incident.getLastEscalatedAt()).isEqualTo(NOW.plus(Duration.ofMinutes(15)));
    }

    @Test
    void escalate_investigatingIncident_isNotEscalated() {
        Incident incident = incident(IncidentStatus.INVESTIGATING, Severity.CRITICAL);
        incident.setCreatedAt(NOW.minus(Duration.ofHours(1)));
        when(incidents.findById(incident.getId())).thenReturn(Optional.of(incident));

        assertThat(service.escalate(incident.getId(), NOW, Duration.ofMinutes(15))).isEmpty();
        verify(incidents, never()).saveAndFlush(any());
    }

    @Test
    void openOrUpdate_unexpiredAcceptedRisk_absorbsRedetection() {
        Incident accepted = incident(IncidentStatus.ACCEPTED_RISK, Severity.CRITICAL);
        accepted.setRiskExpiresAt(NOW.plus(Duration.ofDays(7)));
        when(incidents.findFirstByModelIdAndMetricNameAndStatusAndRiskExpiresAtAfterOrderByCreatedAtDesc(
            "credit", "psi:region", IncidentStatus.ACCEPTED_RISK, NOW)).thenReturn(Optional.of(accepted));
        when(incidents.save(any(Incident.class))).thenAnswer(inv -> inv.getArgument(0));

        Incident result = service.openOrUpdate(record(), metric("psi:region", Severity.CRITICAL));

        assertThat(result).isSameAs(accepted);
        assertThat(result.getStatus()).isEqualTo(IncidentStatus.ACCEPTED_RISK);
        assertThat(result.getActions()).extracting(IncidentAction::getAction)
            .containsExactly("redetected_within_accepted_risk");
        verify(incidents, never()).findFirstByModelIdAndMetricNameAndStatusInOrderByCreatedAtDesc(any(), any(), any());
    }

    @Test
    void openOrUpdate_severityAboveAcceptedRisk_opensNewIncident() {
        Incident accepted = incident(IncidentStatus.ACCEPTED_RISK, Severity.WARNING);
        accepted.setRiskExpiresAt(NOW.plus(Duration.ofDays(7)));
        when(incidents.findFirstByModelIdAndMetricNameAndStatusAndRiskExpiresAtAfterOrderByCreatedAtDesc(
            "credit", "psi:region", IncidentStatus.ACCEPTED_RISK, NOW)).thenReturn(Optional.of(accepted));
        when(incidents.findFirstByModelIdAndMetricNameAndStatusInOrderByCreatedAtDesc(
            "credit", "psi:region", IncidentStatus.active())).thenReturn(Optional.empty());
        when(incidents.save(any(Incident.class))).thenAnswer(inv -> inv.getArgument(0));

        Incident result = service.openOrUpdate(record(), metric("psi:region", Severity.CRITICAL));

        assertThat(result).isNotSameAs(accepted);
        assertThat(result.getStatus()).isEqualTo(IncidentStatus.OPEN);
        assertThat(accepted.getActions()).isEmpty();
    }

    private static MonitoringRecord record() {
        return MonitoringRecord.builder().id(UUID.randomUUID()).modelId("credit").runId("run-1").build();
    }

    private static MetricResult metric(String name, Severity severity) {
        return MetricResult.builder()
            .metric(name).family(MetricFamily.DATA).available(true).value(0.2).severity(severity).build();
    }

    private static Incident incident(IncidentStatus status, Severity severity) {
        return Incident.builder()
            .id(UUID.randomUUID())
            .modelId("credit")
            .metricName("psi:region")
            .metricFamily(MetricFamily.DATA)
            .severity(severity)
            .status(status)
            .actions(new ArrayList<>())
            .createdAt(NOW)
            .build();
    }

    private static Alert pendingAlert(Incident incident) {
        return Alert.builder()
            .id(UUID.randomUUID())
            .incidentId(incident.getId())
            .modelId("credit")
            .metricName("psi:region")
            .severity(incident.getSeverity())
            .status(AlertStatus.PENDING)
            .build();
    }
}
