package com.driftmonitor.service;

import com.driftmonitor.dto.PredictionSample;
import com.driftmonitor.entity.PredictionRecord;
import com.driftmonitor.exception.BatchSizeExceededException;
import com.driftmonitor.repository.PredictionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PredictionIngestServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");

    @Mock
    PredictionRepository repository;

    PredictionIngestService service;

    @BeforeEach
    void setUp() {
        service = new PredictionIngestService(repository, Clock.fixed(NOW, ZoneOffset.UTC));
        ReflectionTestUtils.setField(service, "maxBatchSize", 3);
        ReflectionTestUtils.setField(service, "retentionDays", 90);
    }

    @Test
    @SuppressWarnings("unchecked")
    void ingest_mapsSamplesAndDefaultsTimestamp() {
        var sample = PredictionSample.builder()
            .features(Map.of("age", 41, "region", "north"))
            .predictedClass("1")
            .confidence(0.82)
            .protectedAttributes(Map.of("gender", "female"))
            .build();

        int accepted = service.ingest("credit", List.of(sample), "req-1");

        assertThat(accepted).isEqualTo(1);
        ArgumentCaptor<List<PredictionRecord>> saved = ArgumentCaptor.forClass(List.class);
        verify(repository).saveAll(saved.capture());
        PredictionRecord record = saved.getValue().get(0);
        assertThat(record.getModelId()).isEqualTo("credit");
        assertThat(record.getPredictedAt()).isEqualTo(NOW);
        assertThat(record.getRequestId()).isEqualTo("req-1");
        assertThat(record.getProtectedAttributes()).containsEntry("gender", "female");
    }

    @Test
    void ingest_oversizedBatch_isRejected() {
        var sample = PredictionSample.builder().predictedClass("0").build();

        assertThatThrownBy(() -> service.ingest("credit", Collections.nCopies(4, sample), "req-2"))
            .isInstanceOf(BatchSizeExceededException.class);
        verifyNoInteractions(repository);
    }

    @Test
    void purgeExpired_deletesRowsOlderThanRetention() {
        when(repository.deleteOlderThan(NOW.minus(Duration.ofDays(90)))).thenReturn(12);

        assertThat(service.purgeExpired()).isEqualTo(12);
    }
}
