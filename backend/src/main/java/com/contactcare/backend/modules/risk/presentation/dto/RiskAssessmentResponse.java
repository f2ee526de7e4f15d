package com.contactcare.backend.modules.risk.presentation.dto;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record RiskAssessmentResponse(
        UUID riskAssessmentId,
        String assessmentNumber,
        UUID childId,
        UUID familyMemberId,
        UUID organizationId,
        LocalDate assessmentDate,
        String assessedByName,
        String assessedByRole,
        String overallRiskLevel,
        String riskSummary,
        String keyConcerns,
        List<String> identifiedRisks,
        List<String> mitigationStrategies,
        boolean contactRecommended,
        String recommendationRationale,
        String status,
        String approvedBy,
        String approvedByName,
        String approvedByRole,
        LocalDate approvalDate,
        String approvalComments,
        LocalDate nextReviewDate,
        int reviewFrequencyMonths,
        boolean current,
        boolean reviewOverdue,
        int version,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {
}
