package com.contactcare.backend.modules.risk.presentation.dto;

import jakarta.validation.constraints.NotBlank;

public record ApproveRiskAssessmentRequest(
        @NotBlank(message = "APPROVED_BY_REQUIRED")
        String approvedBy,
        String approvedByName,
        String approvedByRole,
        String approvalComments
) {
}
