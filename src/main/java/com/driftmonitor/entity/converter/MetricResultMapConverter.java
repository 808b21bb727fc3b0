package com.driftmonitor.entity.converter;

import com.driftmonitor.model.MetricResult;
import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

import java.util.Map;

@Converter
public class MetricResultMapConverter extends JsonAttributeConverter<Map<String, MetricResult>> {
    public MetricResultMapConverter() {
        super(new TypeReference<>() {});
    }
}
