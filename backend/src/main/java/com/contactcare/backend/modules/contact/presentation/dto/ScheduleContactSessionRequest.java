package com.contactcare.backend.modules.contact.presentation.dto;

import java.time.LocalDate;
import java.util.UUID;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

public record ScheduleContactSessionRequest(
        @NotNull(message = "CHILD_REQUIRED")
        UUID childId,
        @NotNull(message = "FAMILY_MEMBER_REQUIRED")
        UUID familyMemberId,
        UUID contactScheduleId,
        @NotNull(message = "ORGANIZATION_REQUIRED")
        UUID organizationId,
        @NotNull(message = "SESSION_DATE_REQUIRED")
        LocalDate sessionDate,
        @NotBlank(message = "START_TIME_REQUIRED")
        @Pattern(regexp = SessionTimes.PATTERN, message = "START_TIME_INVALID")
        String scheduledStartTime,
        @NotBlank(message = "END_TIME_REQUIRED")
        @Pattern(regexp = SessionTimes.PATTERN, message = "END_TIME_INVALID")
        String scheduledEndTime,
        boolean supervised,
        @NotBlank(message = "CREATED_BY_REQUIRED")
        String createdBy
) {
}
