package com.driftmonitor.controller;

import com.driftmonitor.config.RequestGuardFilter;
import com.driftmonitor.dto.BaselineResponse;
import com.driftmonitor.dto.CreateBaselineRequest;
import com.driftmonitor.dto.PredictionSample;
import com.driftmonitor.entity.BaselineSnapshot;
import com.driftmonitor.service.BaselineService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@Slf4j
@Validated
@RestController
@RequestMapping("/api/v1/baselines")
@RequiredArgsConstructor
public class BaselineController {

    private final BaselineService baselineService;

    @PostMapping
    public ResponseEntity<BaselineResponse> create(
            @Valid @RequestBody CreateBaselineRequest request, HttpServletRequest httpRequest) {
        String requestId = RequestGuardFilter.requestIdOf(httpRequest);
        log.info("POST /baselines | model={} | samples={} | requestId={}",
                 request.getModelId(), request.getSamples().size(), requestId);
        BaselineSnapshot created = baselineService.createBaseline(
            request.getModelId(),
            request.getSamples().stream().map(PredictionSample::toObservation).toList(),
            request.getMetadata(),
            request.getCreatedBy());
        return ResponseEntity.status(HttpStatus.CREATED)
            .header(RequestGuardFilter.REQUEST_ID_HEADER, requestId)
            .header("Location", "/api/v1/baselines/" + created.getModelId() + "/active")
            .body(BaselineResponse.from(created));
    }

    @GetMapping("/{modelId}/active")
    public ResponseEntity<BaselineResponse> active(@PathVariable String modelId) {
        return ResponseEntity.ok(BaselineResponse.from(baselineService.getActiveBaseline(modelId)));
    }

    @GetMapping("/{modelId}")
    public ResponseEntity<List<BaselineResponse>> history(@PathVariable String modelId) {
        return ResponseEntity.ok(baselineService.history(modelId).stream().map(BaselineResponse::from).toList());
    }

    @PostMapping("/{snapshotId}/archive")
    public ResponseEntity<BaselineResponse> archive(@PathVariable UUID snapshotId) {
        log.info("POST /baselines/{}/archive", snapshotId);
        return ResponseEntity.ok(BaselineResponse.from(baselineService.archiveBaseline(snapshotId)));
    }
}
