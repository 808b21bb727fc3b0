package com.driftmonitor.dto;

import com.driftmonitor.entity.ResolutionCategory;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class ResolveIncidentRequest {

    @NotBlank(message = "actor is required")
    String actor;

    @NotNull(message = "category is required (RETRAINED, DATA_FIXED, BASELINE_UPDATED, FALSE_POSITIVE)")
    ResolutionCategory category;

    @NotBlank(message = "notes are required")
    @Size(max = 4000, message = "notes must be at most 4000 characters")
    String notes;
}
