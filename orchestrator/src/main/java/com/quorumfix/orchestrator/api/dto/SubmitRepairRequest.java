package com.quorumfix.orchestrator.api.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

/**
 * Request body for POST /repairs.
 *
 * Required: bugDescription
 * Optional: testSelector (null runs the whole suite), maxIterations,
 * minConfidence, minAgreement. Omitted values use the configured defaults.
 */
public record SubmitRepairRequest(
        String  testSelector,
        @NotBlank String bugDescription,
        @Min(1) @Max(50) Integer maxIterations,
        @DecimalMin("0.0") @DecimalMax("1.0") Double minConfidence,
        @Min(1) Integer minAgreement
) {}
