package com.driftmonitor.repository;

import com.driftmonitor.entity.PredictionRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public interface PredictionRepository extends JpaRepository<PredictionRecord, UUID> {

    @Query("""
        SELECT p FROM PredictionRecord p
        WHERE p.modelId = :modelId
          AND p.predictedAt >= :from
          AND p.predictedAt < :to
        ORDER BY p.predictedAt ASC
    """)
    List<PredictionRecord> findWindow(
        @Param("modelId") String modelId,
        @Param("from") Instant from,
        @Param("to") Instant to);

    @Modifying
    @Query("DELETE FROM PredictionRecord p WHERE p.predictedAt < :cutoff")
    int deleteOlderThan(@Param("cutoff") Instant cutoff);
}
