package com.driftmonitor.repository;

import com.driftmonitor.entity.BaselineSnapshot;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.UUID;

public interface BaselineSnapshotRepository extends JpaRepository<BaselineSnapshot, UUID> {

    List<BaselineSnapshot> findByModelIdOrderByVersionDesc(String modelId);

    @Query("SELECT COALESCE(MAX(b.version), 0) FROM BaselineSnapshot b WHERE b.modelId = :modelId")
    int maxVersion(@Param("modelId") String modelId);
}
