package com.driftmonitor.entity.converter;

import com.driftmonitor.model.Severity;
import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

import java.util.Set;

@Converter
public class SeveritySetConverter extends JsonAttributeConverter<Set<Severity>> {
    public SeveritySetConverter() {
        super(new TypeReference<>() {});
    }
}
