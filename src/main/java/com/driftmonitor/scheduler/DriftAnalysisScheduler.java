package com.driftmonitor.scheduler;

import com.driftmonitor.service.BaselineService;
import com.driftmonitor.service.MonitoringService;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "drift.scheduler.enabled", havingValue = "true", matchIfMissing = true)
public class DriftAnalysisScheduler {

    private final BaselineService baselineService;
    private final MonitoringService monitoringService;

    @Value("${drift.scheduler.pool-size:4}")
    private int poolSize;

    private ExecutorService executor;

    @PostConstruct
    void init() {
        executor = Executors.newFixedThreadPool(Math.max(1, poolSize));
    }

    @PreDestroy
    void shutdown() {
        if (executor != null) {
            executor.shutdown();
        }
    }

    @Scheduled(fixedDelayString = "${drift.scheduler.interval-ms:21600000}",
               initialDelayString = "${drift.scheduler.initial-delay-ms:60000}")
    public void runAll() {
        List<String> models = baselineService.monitoredModels();
        log.info("Scheduled drift analysis | models={}", models.size());
        CompletableFuture<?>[] runs = models.stream()
            .map(modelId -> CompletableFuture.runAsync(() -> monitoringService.runScheduled(modelId), executor))
            .toArray(CompletableFuture[]::new);
        CompletableFuture.allOf(runs).join();
    }
}
