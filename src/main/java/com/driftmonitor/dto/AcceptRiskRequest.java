package com.driftmonitor.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

@Value
@Builder
@Jacksonized
public class AcceptRiskRequest {

    @NotBlank(message = "approver is required")
    String approver;

    /** required for fairness incidents */
    String complianceApprover;

    @NotNull(message = "expiresAt is required")
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant expiresAt;

    String notes;
}
