package com.driftmonitor.repository;

import com.driftmonitor.entity.Alert;
import com.driftmonitor.entity.AlertStatus;
import com.driftmonitor.model.Severity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface AlertRepository extends JpaRepository<Alert, UUID> {

    Optional<Alert> findFirstByModelIdAndMetricNameAndSeverityAndCreatedAtGreaterThanEqualOrderByCreatedAtDesc(
        String modelId, String metricName, Severity severity, Instant since);

    Optional<Alert> findFirstByModelIdAndMetricNameAndCreatedAtGreaterThanEqualOrderByCreatedAtDesc(
        String modelId, String metricName, Instant since);

    List<Alert> findByIncidentIdOrderByCreatedAtAsc(UUID incidentId);

    @Query("""
        SELECT a FROM Alert a
        WHERE a.modelId = :modelId
          AND (:severity IS NULL OR a.severity = :severity)
          AND (:status IS NULL OR a.status = :status)
        ORDER BY a.createdAt DESC
    """)
    List<Alert> findForModel(
        @Param("modelId") String modelId,
        @Param("severity") Severity severity,
        @Param("status") AlertStatus status);
}
