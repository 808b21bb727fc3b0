package com.driftmonitor.service;

import com.driftmonitor.dto.DriftStatusResponse;
import com.driftmonitor.dto.MonitoringRecordResponse;
import com.driftmonitor.entity.BaselineSnapshot;
import com.driftmonitor.entity.IncidentStatus;
import com.driftmonitor.entity.MonitoringRecord;
import com.driftmonitor.model.Severity;
import com.driftmonitor.repository.IncidentRepository;
import com.driftmonitor.repository.MonitoringRecordRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Service
@RequiredArgsConstructor
public class DriftStatusService {

    private final MonitoringRecordRepository records;
    private final IncidentRepository incidents;
    private final BaselineService baselineService;
    private final Clock clock;

    @Transactional(readOnly = true)
    public DriftStatusResponse status(String modelId) {
        Optional<MonitoringRecord> latest = records.findFirstByModelIdOrderByWindowEndDesc(modelId);
        Optional<BaselineSnapshot> baseline = baselineService.findActiveBaseline(modelId);
        Instant now = clock.instant();

        return DriftStatusResponse.builder()
            .modelId(modelId)
            .status(latest.map(r -> r.getMaxSeverity().name()).orElse("UNKNOWN"))
            .openCriticalIncidents(incidents.countByModelIdAndStatusInAndSeverity(
                modelId, IncidentStatus.active(), Severity.CRITICAL))
            .openWarningIncidents(incidents.countByModelIdAndStatusInAndSeverity(
                modelId, IncidentStatus.active(), Severity.WARNING))
            .needsRetraining(latest.map(MonitoringRecord::isNeedsRetraining).orElse(false))
            .baselineAgeDays(baseline
                .map(b -> Math.round(Duration.between(b.getCreatedAt(), now).toHours() / 24.0 * 10) / 10.0)
                .orElse(null))
            .baselineVersion(baseline.map(BaselineSnapshot::getVersion).orElse(null))
            .latest(latest.map(MonitoringRecordResponse::from).orElse(null))
            .build();
    }

    @Transactional(readOnly = true)
    public List<MonitoringRecord> history(String modelId, int days, int limit) {
        return records.findByModelIdAndWindowEndGreaterThanEqualOrderByWindowEndDesc(
            modelId, clock.instant().minus(Duration.ofDays(days)), PageRequest.of(0, limit));
    }
}
