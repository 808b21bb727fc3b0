package com.driftmonitor.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class IncidentAction {
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant at;
    String actor;
    String action;
    String notes;
}
