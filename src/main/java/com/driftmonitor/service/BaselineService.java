package com.driftmonitor.service;

import com.driftmonitor.entity.ActiveBaselinePointer;
import com.driftmonitor.entity.BaselineSnapshot;
import com.driftmonitor.entity.BaselineStatus;
import com.driftmonitor.exception.BaselineConflictException;
import com.driftmonitor.exception.IllegalStateTransitionException;
import com.driftmonitor.exception.InsufficientSamplesException;
import com.driftmonitor.exception.NoBaselineException;
import com.driftmonitor.exception.ResourceNotFoundException;
import com.driftmonitor.metric.DistributionSummarizer;
import com.driftmonitor.model.BaselineSummary;
import com.driftmonitor.model.Observation;
import com.driftmonitor.repository.ActiveBaselinePointerRepository;
import com.driftmonitor.repository.BaselineSnapshotRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class BaselineService {

    private final BaselineSnapshotRepository snapshots;
    private final ActiveBaselinePointerRepository pointers;
    private final Clock clock;

    @Value("${drift.baseline.min-samples:30}")
    private int minSamples;

    @Value("${drift.baseline.numeric-bins:10}")
    private int numericBins;

    @Value("${drift.analysis.positive-class:1}")
    private String positiveClass;

    @Transactional(readOnly = true)
    public BaselineSnapshot getActiveBaseline(String modelId) {
        return findActiveBaseline(modelId).orElseThrow(() -> new NoBaselineException(modelId));
    }

    @Transactional(readOnly = true)
    public Optional<BaselineSnapshot> findActiveBaseline(String modelId) {
        return pointers.findById(modelId).flatMap(p -> snapshots.findById(p.getSnapshotId()));
    }

    @Transactional(readOnly = true)
    public List<BaselineSnapshot> history(String modelId) {
        return snapshots.findByModelIdOrderByVersionDesc(modelId);
    }

    @Transactional(readOnly = true)
    public List<String> monitoredModels() {
        return pointers.findMonitoredModelIds();
    }

    @Transactional
    public BaselineSnapshot createBaseline(String modelId, List<Observation> samples,
                                           Map<String, Object> metadata, String createdBy) {
        if (samples == null || samples.size() < minSamples) {
            throw new InsufficientSamplesException(modelId, samples == null ? 0 : samples.size(), minSamples);
        }
        Instant now = clock.instant();
        BaselineSummary summary = DistributionSummarizer.summarize(samples, numericBins, positiveClass);

        BaselineSnapshot created = snapshots.save(BaselineSnapshot.builder()
            .modelId(modelId)
            .version(snapshots.maxVersion(modelId) + 1)
            .status(BaselineStatus.ACTIVE)
            .sampleCount(samples.size())
            .summary(summary)
            .metadata(metadata != null ? new LinkedHashMap<>(metadata) : Map.of())
            .createdBy(createdBy)
            .createdAt(now)
            .build());

        Optional<ActiveBaselinePointer> existing = pointers.findById(modelId);
        ActiveBaselinePointer pointer;
        if (existing.isPresent()) {
            pointer = existing.get();
            UUID previousId = pointer.getSnapshotId();
            snapshots.findById(previousId).ifPresent(previous -> {
                previous.setStatus(BaselineStatus.ARCHIVED);
                previous.setArchivedAt(now);
            });
            pointer.setSnapshotId(created.getId());
            pointer.setActivatedAt(now);
        } else {
            pointer = ActiveBaselinePointer.builder()
                .modelId(modelId)
                .snapshotId(created.getId())
                .activatedAt(now)
                .build();
        }

        try {
            pointers.saveAndFlush(pointer);
        } catch (ObjectOptimisticLockingFailureException | DataIntegrityViolationException ex) {
            log.warn("Concurrent baseline activation rejected | modelId={} | snapshot={}", modelId, created.getId());
            throw new BaselineConflictException(modelId);
        }

        log.info("Baseline activated | modelId={} | snapshot={} | version={} | samples={}",
                 modelId, created.getId(), created.getVersion(), samples.size());
        return created;
    }

    /**
     * Archives a snapshot that is not the model's active one. The active snapshot can only be
     * superseded by creating a new baseline. Archiving an archived snapshot is a no-op.
     */
    @Transactional
    public BaselineSnapshot archiveBaseline(UUID snapshotId) {
        BaselineSnapshot snapshot = snapshots.findById(snapshotId)
            .orElseThrow(() -> new ResourceNotFoundException("Baseline snapshot", snapshotId));
        if (snapshot.getStatus() == BaselineStatus.ARCHIVED) {
            return snapshot;
        }
        boolean isActive = pointers.findById(snapshot.getModelId())
            .map(p -> p.getSnapshotId().equals(snapshotId))
            .orElse(false);
        if (isActive) {
            throw new IllegalStateTransitionException("Baseline snapshot", snapshotId,
                BaselineStatus.ACTIVE, BaselineStatus.ARCHIVED + " (supersede it with a new baseline)");
        }
        snapshot.setStatus(BaselineStatus.ARCHIVED);
        snapshot.setArchivedAt(clock.instant());
        log.info("Baseline archived | modelId={} | snapshot={}", snapshot.getModelId(), snapshotId);
        return snapshots.save(snapshot);
    }
}
