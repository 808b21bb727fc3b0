package com.driftmonitor.service;

import com.driftmonitor.dto.PredictionSample;
import com.driftmonitor.entity.PredictionRecord;
import com.driftmonitor.exception.BatchSizeExceededException;
import com.driftmonitor.exception.InvalidRequestException;
import com.driftmonitor.repository.PredictionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class PredictionIngestService {

    private final PredictionRepository repository;
    private final Clock clock;

    @Value("${drift.ingest.max-batch-size:5000}")
    private int maxBatchSize;

    @Value("${drift.retention.prediction-days:90}")
    private int retentionDays;

    @Transactional
    public int ingest(String modelId, List<PredictionSample> samples, String requestId) {
        if (modelId == null || modelId.isBlank()) {
            throw new InvalidRequestException("modelId is required");
        }
        if (samples.size() > maxBatchSize) {
            throw new BatchSizeExceededException(samples.size(), maxBatchSize);
        }
        Instant now = clock.instant();
        List<PredictionRecord> records = samples.stream()
            .map(s -> PredictionRecord.builder()
                .modelId(modelId)
                .modelVersion(s.getModelVersion())
                .predictedAt(s.getPredictedAt() != null ? s.getPredictedAt() : now)
                .features(s.getFeatures())
                .predictedClass(s.getPredictedClass())
                .confidence(s.getConfidence())
                .classProbabilities(s.getClassProbabilities())
                .protectedAttributes(s.getProtectedAttributes())
                .groundTruth(s.getGroundTruth())
                .shapValues(s.getShapValues())
                .requestId(requestId)
                .build())
            .toList();
        repository.saveAll(records);
        log.info("Predictions ingested | model={} | count={} | requestId={}", modelId, records.size(), requestId);
        return records.size();
    }

    @Transactional
    @Scheduled(cron = "${drift.retention.cron:0 30 3 * * *}")
    public int purgeExpired() {
        Instant cutoff = clock.instant().minus(Duration.ofDays(retentionDays));
        int deleted = repository.deleteOlderThan(cutoff);
        log.info("Prediction retention cleanup | cutoff={} | deleted={}", cutoff, deleted);
        return deleted;
    }
}
