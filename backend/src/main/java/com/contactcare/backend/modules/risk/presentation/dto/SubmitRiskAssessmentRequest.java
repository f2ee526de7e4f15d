package com.contactcare.backend.modules.risk.presentation.dto;

import jakarta.validation.constraints.NotBlank;

public record SubmitRiskAssessmentRequest(
        @NotBlank(message = "SUBMITTED_BY_REQUIRED")
        String submittedBy
) {
}
