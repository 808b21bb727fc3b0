package com.driftmonitor.repository;

import com.driftmonitor.entity.MonitoringRecord;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface MonitoringRecordRepository extends JpaRepository<MonitoringRecord, UUID> {

    Optional<MonitoringRecord> findFirstByModelIdOrderByWindowEndDesc(String modelId);

    List<MonitoringRecord> findByModelIdAndWindowEndGreaterThanEqualOrderByWindowEndDesc(
        String modelId, Instant since, Pageable pageable);
}
