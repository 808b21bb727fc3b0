package com.driftmonitor.controller;

import com.driftmonitor.config.RequestGuardFilter;
import com.driftmonitor.dto.AcceptRiskRequest;
import com.driftmonitor.dto.AcknowledgeAlertRequest;
import com.driftmonitor.dto.AlertResponse;
import com.driftmonitor.dto.IncidentActionRequest;
import com.driftmonitor.dto.IncidentResponse;
import com.driftmonitor.dto.ResolveIncidentRequest;
import com.driftmonitor.entity.IncidentStatus;
import com.driftmonitor.model.Severity;
import com.driftmonitor.service.IncidentService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@Slf4j
@Validated
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class IncidentController {

    private final IncidentService incidentService;

    @GetMapping("/incidents")
    public ResponseEntity<Page<IncidentResponse>> list(
            @RequestParam(required = false) IncidentStatus status,
            @RequestParam(required = false) Severity severity,
            @RequestParam(required = false) String modelId,
            @RequestParam(defaultValue = "0") @Min(0) int page,
            @RequestParam(defaultValue = "20") @Min(1) @Max(100) int size) {
        return ResponseEntity.ok(incidentService.search(status, severity, modelId,
                PageRequest.of(page, size, Sort.by(Sort.Direction.DESC, "createdAt")))
            .map(IncidentResponse::from));
    }

    @GetMapping("/incidents/{id}")
    public ResponseEntity<IncidentResponse> get(@PathVariable UUID id) {
        return ResponseEntity.ok(IncidentResponse.from(incidentService.get(id),
            incidentService.alertsFor(id).stream().map(AlertResponse::from).toList()));
    }

    @PostMapping("/alerts/{alertId}/acknowledge")
    public ResponseEntity<AlertResponse> acknowledge(
            @PathVariable UUID alertId,
            @Valid @RequestBody AcknowledgeAlertRequest request, HttpServletRequest httpRequest) {
        String requestId = RequestGuardFilter.requestIdOf(httpRequest);
        log.info("POST /alerts/{}/acknowledge | actor={} | requestId={}", alertId, request.getActor(), requestId);
        return ResponseEntity.ok()
            .header(RequestGuardFilter.REQUEST_ID_HEADER, requestId)
            .body(AlertResponse.from(incidentService.acknowledge(alertId, request.getActor(), request.getNotes())));
    }

    @PostMapping("/incidents/{id}/resolve")
    public ResponseEntity<IncidentResponse> resolve(
            @PathVariable UUID id, @Valid @RequestBody ResolveIncidentRequest request) {
        log.info("POST /incidents/{}/resolve | category={} | actor={}", id, request.getCategory(), request.getActor());
        return ResponseEntity.ok(IncidentResponse.from(
            incidentService.resolve(id, request.getCategory(), request.getNotes(), request.getActor())));
    }

    @PostMapping("/incidents/{id}/accept-risk")
    public ResponseEntity<IncidentResponse> acceptRisk(
            @PathVariable UUID id, @Valid @RequestBody AcceptRiskRequest request) {
        log.info("POST /incidents/{}/accept-risk | approver={} | expires={}", id, request.getApprover(), request.getExpiresAt());
        return ResponseEntity.ok(IncidentResponse.from(incidentService.acceptRisk(id, request.getApprover(),
            request.getComplianceApprover(), request.getExpiresAt(), request.getNotes())));
    }

    @PostMapping("/incidents/{id}/actions")
    public ResponseEntity<IncidentResponse> addAction(
            @PathVariable UUID id, @Valid @RequestBody IncidentActionRequest request) {
        return ResponseEntity.ok(IncidentResponse.from(
            incidentService.addAction(id, request.getActor(), request.getAction(), request.getNotes())));
    }
}
