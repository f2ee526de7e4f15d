package com.contactcare.backend.modules.statistics.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

public record FamilyContactStatisticsResponse(
        UUID organizationId,
        OffsetDateTime generatedAt,
        FamilyMemberStats familyMembers,
        ScheduleStats schedules,
        SessionStats sessions,
        RiskStats riskAssessments
) {

    public record FamilyMemberStats(long total) {
    }

    public record ScheduleStats(long active, long dueForReview) {
    }

    public record SessionStats(long upcoming) {
    }

    public record RiskStats(long highRisk) {
    }
}
