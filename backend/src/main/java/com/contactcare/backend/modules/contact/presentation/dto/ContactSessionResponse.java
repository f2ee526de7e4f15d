package com.contactcare.backend.modules.contact.presentation.dto;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ContactSessionResponse(
        UUID contactSessionId,
        String sessionNumber,
        UUID childId,
        UUID familyMemberId,
        UUID contactScheduleId,
        UUID organizationId,
        String status,
        LocalDate sessionDate,
        String scheduledStartTime,
        String scheduledEndTime,
        String actualStartTime,
        String actualEndTime,
        Integer durationMinutes,
        boolean supervised,
        String childAttendance,
        String familyMemberAttendance,
        Integer childLateMinutes,
        Integer familyMemberLateMinutes,
        String nonAttendanceReason,
        String childEmotionalStateBefore,
        String childEmotionalStateDuring,
        String childEmotionalStateAfter,
        String emotionalStateChange,
        String interactionQuality,
        String overallAssessment,
        boolean safeguardingConcernsRaised,
        boolean contactTerminatedEarly,
        String highestIncidentSeverity,
        boolean requiresUrgentReview,
        boolean successful,
        boolean hasConcerns,
        boolean onTime,
        String completedBy,
        OffsetDateTime completedDate,
        String cancelledBy,
        String cancellationReason,
        OffsetDateTime cancellationDate,
        boolean rescheduled,
        LocalDate rescheduledDate,
        int version,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {
}
