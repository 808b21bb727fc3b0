package com.driftmonitor.entity;

import com.driftmonitor.entity.converter.DoubleMapConverter;
import com.driftmonitor.entity.converter.ObjectMapConverter;
import com.driftmonitor.entity.converter.StringMapConverter;
import com.driftmonitor.model.Observation;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

@Entity
@Table(
    name = "prediction_records",
    indexes = {
        @Index(name = "idx_pred_model_ts", columnList = "model_id, predicted_at"),
        @Index(name = "idx_pred_ingested", columnList = "ingested_at"),
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PredictionRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(updatable = false, nullable = false)
    private UUID id;

    @Column(name = "model_id", nullable = false, length = 100)
    private String modelId;

    @Column(name = "model_version", length = 64)
    private String modelVersion;

    @Column(name = "predicted_at", nullable = false)
    private Instant predictedAt;

    @Convert(converter = ObjectMapConverter.class)
    @Column(columnDefinition = "TEXT")
    private Map<String, Object> features;

    @Column(name = "predicted_class", nullable = false, length = 64)
    private String predictedClass;

    private Double confidence;

    @Convert(converter = DoubleMapConverter.class)
    @Column(name = "class_probabilities", columnDefinition = "TEXT")
    private Map<String, Double> classProbabilities;

    @Convert(converter = StringMapConverter.class)
    @Column(name = "protected_attributes", columnDefinition = "TEXT")
    private Map<String, String> protectedAttributes;

    @Column(name = "ground_truth", length = 64)
    private String groundTruth;

    @Convert(converter = DoubleMapConverter.class)
    @Column(name = "shap_values", columnDefinition = "TEXT")
    private Map<String, Double> shapValues;

    @CreationTimestamp
    @Column(name = "ingested_at", updatable = false)
    private Instant ingestedAt;

    @Column(name = "request_id", length = 64)
    private String requestId;

    public Observation toObservation() {
        return new Observation(features, predictedClass, confidence, protectedAttributes, groundTruth, shapValues);
    }
}
