package com.driftmonitor.repository;

import com.driftmonitor.entity.ActiveBaselinePointer;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.List;

public interface ActiveBaselinePointerRepository extends JpaRepository<ActiveBaselinePointer, String> {

    @Query("SELECT p.modelId FROM ActiveBaselinePointer p ORDER BY p.modelId")
    List<String> findMonitoredModelIds();
}
