package com.driftmonitor.controller;

import com.driftmonitor.dto.CreateSuppressionRequest;
import com.driftmonitor.dto.SuppressionResponse;
import com.driftmonitor.entity.AlertSuppression;
import com.driftmonitor.service.SuppressionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/api/v1/suppressions")
@RequiredArgsConstructor
public class SuppressionController {

    private final SuppressionService suppressionService;

    @PostMapping
    public ResponseEntity<SuppressionResponse> create(@Valid @RequestBody CreateSuppressionRequest request) {
        log.info("POST /suppressions | model={} | metric={} | severities={}",
                 request.getModelId(), request.getMetricName(), request.getSeverities());
        AlertSuppression created = suppressionService.create(request.getModelId(), request.getMetricName(),
            request.getSeverities(), request.getStart(), request.getEnd(), request.getReason(),
            request.getApprovedBy(), request.getCreatedBy());
        return ResponseEntity.status(HttpStatus.CREATED).body(SuppressionResponse.from(created));
    }

    @GetMapping
    public ResponseEntity<List<SuppressionResponse>> list(@RequestParam(required = false) String modelId) {
        return ResponseEntity.ok(suppressionService.list(modelId).stream().map(SuppressionResponse::from).toList());
    }
}
