package com.contactcare.backend.modules.risk.presentation.dto;

import java.time.LocalDate;
import java.util.List;

import com.contactcare.backend.modules.risk.domain.RiskLevel;

import jakarta.validation.constraints.NotBlank;

/**
 * Partial update of an assessment that has not been approved. Null fields are left unchanged.
 */
public record UpdateRiskAssessmentRequest(
        LocalDate assessmentDate,
        RiskLevel overallRiskLevel,
        String riskSummary,
        String keyConcerns,
        List<@NotBlank String> identifiedRisks,
        List<@NotBlank String> mitigationStrategies,
        Boolean contactRecommended,
        String recommendationRationale,
        @NotBlank(message = "UPDATED_BY_REQUIRED")
        String updatedBy
) {
}
