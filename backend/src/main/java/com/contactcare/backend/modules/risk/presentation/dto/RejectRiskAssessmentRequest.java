package com.contactcare.backend.modules.risk.presentation.dto;

import jakarta.validation.constraints.NotBlank;

public record RejectRiskAssessmentRequest(
        @NotBlank(message = "REJECTED_BY_REQUIRED")
        String rejectedBy,
        @NotBlank(message = "REASON_REQUIRED")
        String reason
) {
}
