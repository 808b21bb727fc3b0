package com.driftmonitor.service;

import com.driftmonitor.entity.Incident;
import com.driftmonitor.entity.IncidentStatus;
import com.driftmonitor.entity.MonitoringRecord;
import com.driftmonitor.exception.AnalysisAlreadyRunningException;
import com.driftmonitor.exception.AnalysisFailedException;
import com.driftmonitor.exception.AnalysisTimeoutException;
import com.driftmonitor.exception.ConfigurationException;
import com.driftmonitor.exception.DataException;
import com.driftmonitor.exception.DriftMonitorException;
import com.driftmonitor.model.MetricResult;
import com.driftmonitor.model.Severity;
import com.driftmonitor.repository.MonitoringRecordRepository;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * One analysis run end to end: per-model guard, bounded analysis, record persisted, then incidents,
 * then alerts. A run that times out or fails writes nothing.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MonitoringService {

    private final DriftAnalyzer analyzer;
    private final MonitoringRecordRepository records;
    private final IncidentService incidentService;
    private final AlertDispatcher dispatcher;
    private final AnalysisLockRegistry locks;
    private final MetaAlertService metaAlerts;
    private final Clock clock;

    @Value("${drift.analysis.window-hours:24}")
    private long windowHours;

    @Value("${drift.analysis.timeout-seconds:600}")
    private long timeoutSeconds;

    @Value("${drift.analysis.pool-size:4}")
    private int poolSize;

    private ExecutorService executor;

    @PostConstruct
    void init() {
        executor = Executors.newFixedThreadPool(Math.max(2, poolSize));
    }

    @PreDestroy
    void shutdown() {
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    /**
     * Analyses the trailing window ending now. Throws {@link AnalysisAlreadyRunningException} if the
     * model already has a run in flight.
     */
    public MonitoringRecord analyzeNow(String modelId) {
        Instant to = clock.instant();
        return analyze(modelId, to.minus(Duration.ofHours(windowHours)), to);
    }

    /**
     * Scheduler entry point. Concurrency conflicts are not failures; everything else is logged and
     * left for the next schedule.
     */
    public void runScheduled(String modelId) {
        try {
            analyzeNow(modelId);
        } catch (AnalysisAlreadyRunningException ex) {
            log.debug("Scheduled analysis skipped, already running | model={}", modelId);
        } catch (DriftMonitorException ex) {
            log.warn("Scheduled analysis did not complete | model={} | code={} | reason={}",
                     modelId, ex.getErrorCode(), ex.getMessage());
        }
    }

    public MonitoringRecord analyze(String modelId, Instant from, Instant to) {
        if (!locks.tryAcquire(modelId)) {
            throw new AnalysisAlreadyRunningException(modelId);
        }
        String runId = UUID.randomUUID().toString();
        MDC.put("modelId", modelId);
        MDC.put("runId", runId);
        try {
            log.info("Analysis started | model={} | run={} | window=[{}, {})", modelId, runId, from, to);
            MonitoringRecord computed = runBounded(modelId, from, to, runId);
            MonitoringRecord saved = records.save(computed);
            log.info("Monitoring record saved | id={} | model={} | maxSeverity={} | aggregated={} | needsRetraining={}",
                     saved.getId(), modelId, saved.getMaxSeverity(), saved.getAggregatedScore(), saved.isNeedsRetraining());
            raiseIncidents(saved);
            return saved;
        } catch (ConfigurationException ex) {
            log.error("Analysis aborted by configuration error | model={} | run={} | reason={}",
                      modelId, runId, ex.getMessage());
            metaAlerts.raise(modelId, ex.getErrorCode(), ex.getMessage());
            throw ex;
        } catch (DataException ex) {
            log.warn("Analysis aborted by data error | model={} | run={} | reason={}", modelId, runId, ex.getMessage());
            throw ex;
        } finally {
            locks.release(modelId);
            MDC.remove("modelId");
            MDC.remove("runId");
        }
    }

    private MonitoringRecord runBounded(String modelId, Instant from, Instant to, String runId) {
        Future<MonitoringRecord> future = executor.submit(() -> {
            MDC.put("modelId", modelId);
            MDC.put("runId", runId);
            try {
                return analyzer.analyze(modelId, from, to, runId);
            } finally {
                MDC.clear();
            }
        });
        try {
            return future.get(timeoutSeconds, TimeUnit.SECONDS);
        } catch (TimeoutException ex) {
            future.cancel(true);
            log.error("Analysis timed out | model={} | run={} | timeoutSeconds={}", modelId, runId, timeoutSeconds);
            metaAlerts.raise(modelId, "analysis timeout", "run " + runId + " exceeded " + timeoutSeconds + "s");
            throw new AnalysisTimeoutException(modelId, timeoutSeconds);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof DriftMonitorException dme) {
                throw dme;
            }
            log.error("Analysis failed | model={} | run={}", modelId, runId, cause);
            throw new AnalysisFailedException(modelId, cause);
        } catch (InterruptedException ex) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new AnalysisFailedException(modelId, ex);
        }
    }

    /**
     * Incidents are persisted before their alerts are dispatched. Failures on one metric do not stop
     * the others.
     */
    private void raiseIncidents(MonitoringRecord record) {
        List<MetricResult> triggered = new ArrayList<>(record.getMetrics().values().stream()
            .filter(MetricResult::isAvailable)
            .filter(m -> m.getSeverity() != null && m.getSeverity().isAtLeast(Severity.WARNING))
            .toList());
        triggered.sort(Comparator.comparing(MetricResult::getSeverity).reversed()
            .thenComparing(MetricResult::getMetric));

        for (MetricResult metric : triggered) {
            try {
                Incident incident = incidentService.openOrUpdate(record, metric);
                if (incident.getStatus() == IncidentStatus.ACCEPTED_RISK) {
                    log.info("Metric handled | model={} | metric={} | severity={} | incident={} | alert=SKIPPED | reason=accepted risk",
                             record.getModelId(), metric.getMetric(), metric.getSeverity(), incident.getId());
                    continue;
                }
                AlertOutcome outcome = dispatcher.trigger(incident, metric);
                log.info("Metric handled | model={} | metric={} | severity={} | incident={} | alert={} | reason={}",
                         record.getModelId(), metric.getMetric(), metric.getSeverity(), incident.getId(),
                         outcome.status(), outcome.reason());
            } catch (RuntimeException ex) {
                log.error("Incident/alert handling failed | model={} | run={} | metric={}",
                          record.getModelId(), record.getRunId(), metric.getMetric(), ex);
            }
        }
    }
}
