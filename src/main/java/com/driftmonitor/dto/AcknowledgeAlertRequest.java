package com.driftmonitor.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class AcknowledgeAlertRequest {

    @NotBlank(message = "actor is required")
    String actor;

    @Size(max = 2000, message = "notes must be at most 2000 characters")
    String notes;
}
