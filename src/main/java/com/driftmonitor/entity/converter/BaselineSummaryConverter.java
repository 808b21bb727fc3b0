package com.driftmonitor.entity.converter;

import com.driftmonitor.model.BaselineSummary;
import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

@Converter
public class BaselineSummaryConverter extends JsonAttributeConverter<BaselineSummary> {
    public BaselineSummaryConverter() {
        super(new TypeReference<>() {});
    }
}
