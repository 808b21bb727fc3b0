package com.driftmonitor.controller;

import com.driftmonitor.config.RequestGuardFilter;
import com.driftmonitor.dto.AlertResponse;
import com.driftmonitor.dto.AnalyzeNowRequest;
import com.driftmonitor.dto.DriftStatusResponse;
import com.driftmonitor.dto.IngestPredictionsRequest;
import com.driftmonitor.dto.IngestPredictionsResponse;
import com.driftmonitor.dto.MonitoringRecordResponse;
import com.driftmonitor.entity.AlertStatus;
import com.driftmonitor.model.Severity;
import com.driftmonitor.service.DriftStatusService;
import com.driftmonitor.service.IncidentService;
import com.driftmonitor.service.MonitoringService;
import com.driftmonitor.service.PredictionIngestService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Slf4j
@Validated
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class MonitoringController {

    private final MonitoringService monitoringService;
    private final DriftStatusService statusService;
    private final PredictionIngestService ingestService;
    private final IncidentService incidentService;

    @PostMapping("/analyze-now")
    public ResponseEntity<MonitoringRecordResponse> analyzeNow(
            @Valid @RequestBody AnalyzeNowRequest request, HttpServletRequest httpRequest) {
        String requestId = RequestGuardFilter.requestIdOf(httpRequest);
        log.info("POST /analyze-now | model={} | requestId={}", request.getModelId(), requestId);
        return ResponseEntity.ok()
            .header(RequestGuardFilter.REQUEST_ID_HEADER, requestId)
            .body(MonitoringRecordResponse.from(monitoringService.analyzeNow(request.getModelId())));
    }

    @PostMapping("/models/{modelId}/predictions")
    public ResponseEntity<IngestPredictionsResponse> ingest(
            @PathVariable String modelId,
            @Valid @RequestBody IngestPredictionsRequest request, HttpServletRequest httpRequest) {
        String requestId = RequestGuardFilter.requestIdOf(httpRequest);
        int accepted = ingestService.ingest(modelId, request.getPredictions(), requestId);
        return ResponseEntity.status(HttpStatus.CREATED)
            .header(RequestGuardFilter.REQUEST_ID_HEADER, requestId)
            .body(IngestPredictionsResponse.builder()
                .modelId(modelId).accepted(accepted).requestId(requestId).build());
    }

    @GetMapping("/models/{modelId}/drift-status")
    public ResponseEntity<DriftStatusResponse> driftStatus(@PathVariable String modelId) {
        return ResponseEntity.ok(statusService.status(modelId));
    }

    @GetMapping("/models/{modelId}/monitoring-records")
    public ResponseEntity<List<MonitoringRecordResponse>> history(
            @PathVariable String modelId,
            @RequestParam(defaultValue = "7") @Min(1) @Max(365) int days,
            @RequestParam(defaultValue = "50") @Min(1) @Max(500) int limit) {
        return ResponseEntity.ok(statusService.history(modelId, days, limit).stream()
            .map(MonitoringRecordResponse::from)
            .toList());
    }

    @GetMapping("/models/{modelId}/alerts")
    public ResponseEntity<List<AlertResponse>> alerts(
            @PathVariable String modelId,
            @RequestParam(required = false) Severity severity,
            @RequestParam(required = false) AlertStatus status) {
        return ResponseEntity.ok(incidentService.alertsForModel(modelId, severity, status).stream()
            .map(AlertResponse::from)
            .toList());
    }
}
