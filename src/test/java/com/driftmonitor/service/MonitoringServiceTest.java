package com.driftmonitor.service;

import com.driftmonitor.entity.Incident;
import com.driftmonitor.entity.IncidentStatus;
import com.driftmonitor.entity.MonitoringRecord;
import com.driftmonitor.exception.AnalysisAlreadyRunningException;
import com.driftmonitor.exception.AnalysisTimeoutException;
import com.driftmonitor.exception.InsufficientSamplesException;
import com.driftmonitor.exception.NoBaselineException;
import com.driftmonitor.model.MetricFamily;
import com.driftmonitor.model.MetricResult;
import com.driftmonitor.model.Severity;
import com.driftmonitor.repository.MonitoringRecordRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MonitoringServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");

    @Mock
    DriftAnalyzer analyzer;

    @Mock
    MonitoringRecordRepository records;

    @Mock
    IncidentService incidentService;

    @Mock
    AlertDispatcher dispatcher;

    @Mock
    MetaAlertService metaAlerts;

    MonitoringService service;

    private final AnalysisLockRegistry locks = new AnalysisLockRegistry();

    @BeforeEach
    void setUp() {
        service = new MonitoringService(analyzer, records, incidentService, dispatcher, locks, metaAlerts,
            Clock.fixed(NOW, ZoneOffset.UTC));
        ReflectionTestUtils.setField(service, "windowHours", 24L);
        ReflectionTestUtils.setField(service, "timeoutSeconds", 1L);
        ReflectionTestUtils.setField(service, "poolSize", 2);
        service.init();
    }

    @AfterEach
    void tearDown() {
        service.shutdown();
    }

    @Test
    void analyzeNow_persistsRecordThenOpensIncidentsThenAlerts_mostSevereFirst() {
        MonitoringRecord computed = record(
            metric("psi:age", Severity.WARNING),
            metric("psi:region", Severity.CRITICAL),
            metric("wasserstein:age", Severity.INFO),
            MetricResult.unavailable("accuracy_drop", MetricFamily.MODEL, "no labels"));
        when(analyzer.analyze(eq("credit"), eq(NOW.minusSeconds(86_400)), eq(NOW), anyString())).thenReturn(computed);
        when(records.save(computed)).thenAnswer(inv -> {
            computed.setId(UUID.randomUUID());
            return computed;
        });
        Incident incident = Incident.builder().id(UUID.randomUUID()).status(IncidentStatus.OPEN).build();
        when(incidentService.openOrUpdate(eq(computed), any())).thenReturn(incident);
        when(dispatcher.trigger(eq(incident), any())).thenReturn(AlertOutcome.suppressed("test"));

        MonitoringRecord saved = service.analyzeNow("credit");

        assertThat(saved.getId()).isNotNull();
        InOrder order = inOrder(records, incidentService, dispatcher);
        order.verify(records).save(computed);
        order.verify(incidentService).openOrUpdate(computed, computed.getMetrics().get("psi:region"));
        order.verify(dispatcher).trigger(incident, computed.getMetrics().get("psi:region"));
        order.verify(incidentService).openOrUpdate(computed, computed.getMetrics().get("psi:age"));
        order.verify(dispatcher).trigger(incident, computed.getMetrics().get("psi:age"));
        verify(incidentService, times(2)).openOrUpdate(any(), any());
        assertThat(locks.isRunning("credit")).isFalse();
    }

    @Test
    void analyzeNow_oneMetricFailing_doesNotStopTheOthers() {
        MonitoringRecord computed = record(
            metric("psi:age", Severity.WARNING),
            metric("psi:region", Severity.CRITICAL));
        when(analyzer.analyze(eq("credit"), any(), any(), anyString())).thenReturn(computed);
        when(records.save(computed)).thenReturn(computed);
        Incident incident = Incident.builder().id(UUID.randomUUID()).build();
        when(incidentService.openOrUpdate(computed, computed.getMetrics().get("psi:region")))
            .thenThrow(new IllegalStateException("db hiccup"));
        when(incidentService.openOrUpdate(computed, computed.getMetrics().get("psi:age"))).thenReturn(incident);
        when(dispatcher.trigger(eq(incident), any())).thenReturn(AlertOutcome.suppressed("test"));

        service.analyzeNow("credit");

        verify(dispatcher).trigger(incident, computed.getMetrics().get("psi:age"));
    }

    @Test
    void analyzeNow_metricCoveredByAcceptedRisk_isNotDispatched() {
        MonitoringRecord computed = record(
            metric("psi:age", Severity.WARNING),
            metric("psi:region", Severity.CRITICAL));
        when(analyzer.analyze(eq("credit"), any(), any(), anyString())).thenReturn(computed);
        when(records.save(computed)).thenReturn(computed);
        Incident accepted = Incident.builder().id(UUID.randomUUID()).status(IncidentStatus.ACCEPTED_RISK).build();
        Incident open = Incident.builder().id(UUID.randomUUID()).status(IncidentStatus.OPEN).build();
        when(incidentService.openOrUpdate(computed, computed.getMetrics().get("psi:region"))).thenReturn(accepted);
        when(incidentService.openOrUpdate(computed, computed.getMetrics().get("psi:age"))).thenReturn(open);
        when(dispatcher.trigger(eq(open), any())).thenReturn(AlertOutcome.suppressed("test"));

        service.analyzeNow("credit");

        verify(dispatcher, never()).trigger(eq(accepted), any());
        verify(dispatcher).trigger(open, computed.getMetrics().get("psi:age"));
    }

    @Test
    void analyze_secondRunForSameModel_isRefusedWhileFirstIsInFlight() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        MonitoringRecord computed = record();
        when(analyzer.analyze(eq("credit"), any(), any(), anyString())).thenAnswer(inv -> {
            started.countDown();
            release.await(5, TimeUnit.SECONDS);
            return computed;
        });
        when(records.save(computed)).thenReturn(computed);

        CompletableFuture<MonitoringRecord> first = CompletableFuture.supplyAsync(() -> service.analyzeNow("credit"));
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

        assertThatThrownBy(() -> service.analyzeNow("credit"))
            .isInstanceOf(AnalysisAlreadyRunningException.class);

        release.countDown();
        assertThat(first.get(5, TimeUnit.SECONDS)).isSameAs(computed);
        verify(analyzer, times(1)).analyze(any(), any(), any(), any());
        assertThat(locks.isRunning("credit")).isFalse();
    }

    @Test
    void runScheduled_swallowsAlreadyRunning() {
        locks.tryAcquire("credit");

        assertThatCode(() -> service.runScheduled("credit")).doesNotThrowAnyException();
        verifyNoInteractions(analyzer);
    }

    @Test
    void analyze_exceedingTimeout_writesNothingAndRaisesMetaAlert() {
        CountDownLatch never = new CountDownLatch(1);
        when(analyzer.analyze(eq("credit"), any(), any(), anyString())).thenAnswer(inv -> {
            never.await(10, TimeUnit.SECONDS);
            return record();
        });

        assertThatThrownBy(() -> service.analyzeNow("credit"))
            .isInstanceOf(AnalysisTimeoutException.class);

        verifyNoInteractions(records, incidentService, dispatcher);
        verify(metaAlerts).raise(eq("credit"), eq("analysis timeout"), anyString());
        assertThat(locks.isRunning("credit")).isFalse();
    }

    @Test
    void analyze_missingBaseline_isRethrownWithMetaAlert() {
        when(analyzer.analyze(eq("credit"), any(), any(), anyString())).thenThrow(new NoBaselineException("credit"));

        assertThatThrownBy(() -> service.analyzeNow("credit"))
            .isInstanceOf(NoBaselineException.class);

        verify(metaAlerts).raise(eq("credit"), eq("NO_BASELINE"), anyString());
        verifyNoInteractions(records);
    }

    @Test
    void analyze_insufficientData_isRethrownWithoutMetaAlert() {
        when(analyzer.analyze(eq("credit"), any(), any(), anyString()))
            .thenThrow(new InsufficientSamplesException("credit", 3, 30));

        assertThatThrownBy(() -> service.analyzeNow("credit"))
            .isInstanceOf(InsufficientSamplesException.class);

        verifyNoInteractions(metaAlerts, records);
    }

    private static MonitoringRecord record(MetricResult... metrics) {
        Map<String, MetricResult> byName = new LinkedHashMap<>();
        for (MetricResult m : metrics) {
            byName.put(m.getMetric(), m);
        }
        return MonitoringRecord.builder()
            .modelId("credit")
            .runId("run")
            .metrics(byName)
            .maxSeverity(Severity.CRITICAL)
            .build();
    }

    private static MetricResult metric(String name, Severity severity) {
        return MetricResult.builder()
            .metric(name).family(MetricFamily.DATA).available(true).value(0.3).severity(severity).build();
    }
}
