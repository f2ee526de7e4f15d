package com.contactcare.backend.modules.family.presentation.dto;

import java.time.LocalDate;
import java.util.UUID;

import com.contactcare.backend.modules.family.domain.ContactRestrictionLevel;
import com.contactcare.backend.modules.family.domain.RelationshipType;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record RegisterFamilyMemberRequest(
        @NotNull(message = "CHILD_REQUIRED")
        UUID childId,
        @NotNull(message = "ORGANIZATION_REQUIRED")
        UUID organizationId,
        @NotBlank(message = "FIRST_NAME_REQUIRED")
        @Size(max = 100, message = "FIRST_NAME_TOO_LONG")
        String firstName,
        @NotBlank(message = "LAST_NAME_REQUIRED")
        @Size(max = 100, message = "LAST_NAME_TOO_LONG")
        String lastName,
        @NotNull(message = "RELATIONSHIP_TYPE_REQUIRED")
        RelationshipType relationshipType,
        boolean hasParentalResponsibility,
        ContactRestrictionLevel contactRestrictionLevel,
        boolean dbsCheckRequired,
        LocalDate dbsCheckDate,
        LocalDate dbsExpiryDate,
        @Size(max = 40, message = "PHONE_TOO_LONG")
        String phone,
        @Email(message = "EMAIL_INVALID")
        String email,
        String notes,
        @NotBlank(message = "CREATED_BY_REQUIRED")
        String createdBy
) {
}
