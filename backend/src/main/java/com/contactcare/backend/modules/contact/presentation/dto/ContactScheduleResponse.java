package com.contactcare.backend.modules.contact.presentation.dto;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ContactScheduleResponse(
        UUID contactScheduleId,
        String contactScheduleNumber,
        UUID childId,
        UUID familyMemberId,
        UUID organizationId,
        String contactType,
        String contactFrequency,
        boolean supervisionRequired,
        Integer durationMinutes,
        String status,
        LocalDate startDate,
        LocalDate endDate,
        LocalDate lastContactDate,
        LocalDate nextContactDate,
        LocalDate nextReviewDate,
        boolean reviewDue,
        int totalContactsScheduled,
        int totalContactsCompleted,
        int totalContactsCancelled,
        String notes,
        int version,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {
}
