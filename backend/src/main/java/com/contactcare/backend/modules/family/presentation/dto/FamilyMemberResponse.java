package com.contactcare.backend.modules.family.presentation.dto;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record FamilyMemberResponse(
        UUID familyMemberId,
        String familyMemberNumber,
        UUID childId,
        UUID organizationId,
        String firstName,
        String lastName,
        String relationshipType,
        boolean hasParentalResponsibility,
        String status,
        String contactRestrictionLevel,
        boolean dbsCheckRequired,
        LocalDate dbsCheckDate,
        LocalDate dbsExpiryDate,
        boolean contactAllowed,
        String phone,
        String email,
        String notes,
        int version,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {
}
