package com.driftmonitor.repository;

import com.driftmonitor.entity.AlertSuppression;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public interface AlertSuppressionRepository extends JpaRepository<AlertSuppression, UUID> {

    @Query("""
        SELECT s FROM AlertSuppression s
        WHERE s.modelId = :modelId
          AND s.startsAt <= :at
          AND s.endsAt > :at
        ORDER BY s.createdAt ASC
    """)
    List<AlertSuppression> findActive(@Param("modelId") String modelId, @Param("at") Instant at);

    @Query("""
        SELECT s FROM AlertSuppression s
        WHERE (:modelId IS NULL OR s.modelId = :modelId)
        ORDER BY s.startsAt DESC
    """)
    List<AlertSuppression> search(@Param("modelId") String modelId);
}
