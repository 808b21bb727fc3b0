package com.driftmonitor.entity.converter;

import com.driftmonitor.model.IncidentAction;
import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

import java.util.List;

@Converter
public class IncidentActionListConverter extends JsonAttributeConverter<List<IncidentAction>> {
    public IncidentActionListConverter() {
        super(new TypeReference<>() {});
    }
}
