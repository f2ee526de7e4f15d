package com.contactcare.backend.modules.contact.presentation.dto;

import java.time.LocalDate;
import java.util.UUID;

import com.contactcare.backend.modules.contact.domain.ContactFrequency;
import com.contactcare.backend.modules.contact.domain.ContactType;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

public record CreateContactScheduleRequest(
        @NotNull(message = "CHILD_REQUIRED")
        UUID childId,
        @NotNull(message = "FAMILY_MEMBER_REQUIRED")
        UUID familyMemberId,
        @NotNull(message = "ORGANIZATION_REQUIRED")
        UUID organizationId,
        @NotNull(message = "CONTACT_TYPE_REQUIRED")
        ContactType contactType,
        @NotNull(message = "CONTACT_FREQUENCY_REQUIRED")
        ContactFrequency contactFrequency,
        boolean supervisionRequired,
        @Positive(message = "DURATION_MUST_BE_POSITIVE")
        Integer durationMinutes,
        @NotNull(message = "START_DATE_REQUIRED")
        LocalDate startDate,
        LocalDate endDate,
        String notes,
        @NotBlank(message = "CREATED_BY_REQUIRED")
        String createdBy
) {
}
