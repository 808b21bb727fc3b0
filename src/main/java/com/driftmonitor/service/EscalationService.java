package com.driftmonitor.service;

import com.driftmonitor.entity.Alert;
import com.driftmonitor.entity.AlertStatus;
import com.driftmonitor.entity.Incident;
import com.driftmonitor.entity.IncidentStatus;
import com.driftmonitor.model.Severity;
import com.driftmonitor.repository.IncidentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class EscalationService {

    private final IncidentRepository incidents;
    private final IncidentService incidentService;
    private final AlertDispatcher dispatcher;
    private final Clock clock;

    @Value("${alerts.escalation.after-minutes:15}")
    private long afterMinutes;

    @Scheduled(fixedDelayString = "${alerts.escalation.check-interval-ms:60000}",
               initialDelayString = "${alerts.escalation.check-interval-ms:60000}")
    public void scheduledSweep() {
        sweep();
    }

    /** Returns the number of incidents escalated by this sweep. */
    public int sweep() {
        Instant now = clock.instant();
        Duration period = Duration.ofMinutes(afterMinutes);
        int escalated = 0;
        for (Incident candidate : incidents.findByStatusAndSeverity(IncidentStatus.OPEN, Severity.CRITICAL)) {
            List<Alert> pending = incidentService.alertsFor(candidate.getId()).stream()
                .filter(a -> a.getStatus() == AlertStatus.PENDING)
                .toList();
            if (pending.isEmpty()) {
                continue;
            }
            try {
                Optional<Incident> stamped = incidentService.escalate(candidate.getId(), now, period);
                if (stamped.isPresent()) {
                    dispatcher.escalate(stamped.get(), pending.get(pending.size() - 1));
                    escalated++;
                }
            } catch (ObjectOptimisticLockingFailureException ex) {
                log.info("Escalation already stamped by a concurrent sweep | incident={}", candidate.getId());
            }
        }
        if (escalated > 0) {
            log.warn("Escalation sweep | escalated={}", escalated);
        }
        return escalated;
    }
}
