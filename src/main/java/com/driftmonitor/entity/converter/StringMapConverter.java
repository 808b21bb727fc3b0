package com.driftmonitor.entity.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

import java.util.Map;

@Converter
public class StringMapConverter extends JsonAttributeConverter<Map<String, String>> {
    public StringMapConverter() {
        super(new TypeReference<>() {});
    }
}
