package com.contactcare.backend.modules.family.presentation.dto;

import java.time.LocalDate;

import com.contactcare.backend.modules.family.domain.ContactRestrictionLevel;
import com.contactcare.backend.modules.family.domain.FamilyMemberStatus;
import com.contactcare.backend.modules.family.domain.RelationshipType;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Fields a caller may change on a family member. Null means "leave as is".
 * Identity, child and organisation links are not patchable.
 */
public record UpdateFamilyMemberRequest(
        @Size(max = 100, message = "FIRST_NAME_TOO_LONG")
        String firstName,
        @Size(max = 100, message = "LAST_NAME_TOO_LONG")
        String lastName,
        RelationshipType relationshipType,
        Boolean hasParentalResponsibility,
        FamilyMemberStatus status,
        ContactRestrictionLevel contactRestrictionLevel,
        Boolean dbsCheckRequired,
        LocalDate dbsCheckDate,
        LocalDate dbsExpiryDate,
        @Size(max = 40, message = "PHONE_TOO_LONG")
        String phone,
        @Email(message = "EMAIL_INVALID")
        String email,
        String notes,
        @NotBlank(message = "UPDATED_BY_REQUIRED")
        String updatedBy
) {
}
