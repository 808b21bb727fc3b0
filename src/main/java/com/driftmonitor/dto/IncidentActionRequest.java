package com.driftmonitor.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class IncidentActionRequest {

    @NotBlank(message = "actor is required")
    String actor;

    @NotBlank(message = "action is required")
    String action;

    String notes;
}
