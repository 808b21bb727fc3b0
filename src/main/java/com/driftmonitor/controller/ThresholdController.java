package com.driftmonitor.controller;

import com.driftmonitor.dto.ThresholdTableResponse;
import com.driftmonitor.threshold.ThresholdTable;
import com.driftmonitor.threshold.ThresholdTableRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@Slf4j
@RestController
@RequestMapping("/api/v1/thresholds")
@RequiredArgsConstructor
public class ThresholdController {

    private final ThresholdTableRegistry registry;

    @GetMapping
    public ResponseEntity<ThresholdTableResponse> current() {
        return ResponseEntity.ok(snapshot());
    }

    @PutMapping
    public ResponseEntity<ThresholdTableResponse> replace(
            @RequestBody ThresholdTable table,
            @RequestHeader(value = "X-Actor", defaultValue = "api") String actor) {
        log.info("PUT /thresholds | actor={}", actor);
        registry.replace(table, actor);
        return ResponseEntity.ok(snapshot());
    }

    @PostMapping("/reload")
    public ResponseEntity<ThresholdTableResponse> reload() {
        log.info("POST /thresholds/reload");
        registry.reload();
        return ResponseEntity.ok(snapshot());
    }

    private ThresholdTableResponse snapshot() {
        return ThresholdTableResponse.builder()
            .source(registry.source())
            .loadedAt(registry.loadedAt())
            .table(registry.current())
            .build();
    }
}
