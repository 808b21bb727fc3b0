package com.driftmonitor.repository;

import com.driftmonitor.entity.Incident;
import com.driftmonitor.entity.IncidentStatus;
import com.driftmonitor.model.Severity;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface IncidentRepository extends JpaRepository<Incident, UUID> {

    Optional<Incident> findFirstByModelIdAndMetricNameAndStatusInOrderByCreatedAtDesc(
        String modelId, String metricName, Collection<IncidentStatus> statuses);

    Optional<Incident> findFirstByModelIdAndMetricNameAndStatusAndRiskExpiresAtAfterOrderByCreatedAtDesc(
        String modelId, String metricName, IncidentStatus status, Instant now);

    List<Incident> findByStatusAndSeverity(IncidentStatus status, Severity severity);

    long countByModelIdAndStatusInAndSeverity(String modelId, Collection<IncidentStatus> statuses, Severity severity);

    @Query("""
        SELECT i FROM Incident i
        WHERE (:status IS NULL OR i.status = :status)
          AND (:severity IS NULL OR i.severity = :severity)
          AND (:modelId IS NULL OR i.modelId = :modelId)
    """)
    Page<Incident> search(
        @Param("status") IncidentStatus status,
        @Param("severity") Severity severity,
        @Param("modelId") String modelId,
        Pageable pageable);
}
