package com.contactcare.backend.modules.risk.presentation.dto;

import java.time.LocalDate;
import java.util.UUID;

import com.contactcare.backend.modules.risk.domain.RiskLevel;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record CreateRiskAssessmentRequest(
        @NotNull(message = "CHILD_REQUIRED")
        UUID childId,
        @NotNull(message = "FAMILY_MEMBER_REQUIRED")
        UUID familyMemberId,
        @NotNull(message = "ORGANIZATION_REQUIRED")
        UUID organizationId,
        @NotNull(message = "ASSESSMENT_DATE_REQUIRED")
        LocalDate assessmentDate,
        @NotBlank(message = "ASSESSED_BY_REQUIRED")
        String assessedByName,
        String assessedByRole,
        @NotNull(message = "RISK_LEVEL_REQUIRED")
        RiskLevel overallRiskLevel,
        String riskSummary,
        String keyConcerns,
        boolean contactRecommended,
        String recommendationRationale,
        @NotBlank(message = "CREATED_BY_REQUIRED")
        String createdBy
) {
}
