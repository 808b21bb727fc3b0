package com.driftmonitor.service;

import com.driftmonitor.entity.AlertSuppression;
import com.driftmonitor.exception.InvalidRequestException;
import com.driftmonitor.model.MetricFamily;
import com.driftmonitor.model.MetricNames;
import com.driftmonitor.model.Severity;
import com.driftmonitor.repository.AlertSuppressionRepository;
import com.driftmonitor.threshold.ThresholdTableRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

@Slf4j
@Service
@RequiredArgsConstructor
public class SuppressionService {

    private final AlertSuppressionRepository suppressions;
    private final ThresholdTableRegistry thresholds;
    private final Clock clock;

    @Transactional
    public AlertSuppression create(String modelId, String metricName, Set<Severity> severities,
                                   Instant startsAt, Instant endsAt, String reason,
                                   String approvedBy, String createdBy) {
        if (modelId == null || modelId.isBlank()) {
            throw new InvalidRequestException("modelId is required");
        }
        if (severities == null || severities.isEmpty()) {
            throw new InvalidRequestException("At least one severity must be suppressed");
        }
        Instant start = startsAt != null ? startsAt : clock.instant();
        if (endsAt == null || !endsAt.isAfter(start)) {
            throw new InvalidRequestException("Suppression end must be after its start");
        }
        String scope = metricName == null || metricName.isBlank() ? null : metricName.trim();
        if (scope != null) {
            String type = MetricNames.typeOf(scope);
            MetricFamily family = thresholds.current().rule(type)
                .orElseThrow(() -> new InvalidRequestException("Unknown metric type '" + type + "'"))
                .getFamily();
            if (family == MetricFamily.FAIRNESS && (approvedBy == null || approvedBy.isBlank())) {
                throw new InvalidRequestException("Suppressing fairness metric '" + scope + "' requires approvedBy");
            }
        }

        AlertSuppression saved = suppressions.save(AlertSuppression.builder()
            .modelId(modelId)
            .metricName(scope)
            .severities(EnumSet.copyOf(severities))
            .startsAt(start)
            .endsAt(endsAt)
            .reason(reason)
            .approvedBy(approvedBy)
            .createdBy(createdBy)
            .createdAt(clock.instant())
            .build());
        log.info("Suppression created | id={} | model={} | metric={} | severities={} | until={}",
                 saved.getId(), modelId, scope != null ? scope : "*", severities, endsAt);
        return saved;
    }

    /**
     * First active suppression covering the trigger, with its use recorded. Suppressions without an
     * approver never match fairness metrics.
     */
    @Transactional
    public Optional<AlertSuppression> findCovering(String modelId, String metricName, MetricFamily family,
                                                   Severity severity, Instant at) {
        Optional<AlertSuppression> match = suppressions.findActive(modelId, at).stream()
            .filter(s -> s.covers(metricName, severity))
            .filter(s -> family != MetricFamily.FAIRNESS || s.isApproved())
            .findFirst();
        match.ifPresent(s -> {
            s.setUseCount(s.getUseCount() + 1);
            s.setLastUsedAt(at);
            suppressions.save(s);
            log.info("Alert suppressed by window | suppressionId={} | model={} | metric={} | severity={} | uses={}",
                     s.getId(), modelId, metricName, severity, s.getUseCount());
        });
        return match;
    }

    @Transactional(readOnly = true)
    public List<AlertSuppression> list(String modelId) {
        return suppressions.search(modelId);
    }
}
