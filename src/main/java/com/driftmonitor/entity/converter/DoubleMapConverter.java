package com.driftmonitor.entity.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

import java.util.Map;

@Converter
public class DoubleMapConverter extends JsonAttributeConverter<Map<String, Double>> {
    public DoubleMapConverter() {
        super(new TypeReference<>() {});
    }
}
