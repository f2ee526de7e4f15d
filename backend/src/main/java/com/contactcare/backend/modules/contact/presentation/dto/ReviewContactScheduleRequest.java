package com.contactcare.backend.modules.contact.presentation.dto;

import java.time.LocalDate;

import jakarta.validation.constraints.NotBlank;

/**
 * Records an explicit schedule review. {@code reviewDate} defaults to today.
 */
public record ReviewContactScheduleRequest(
        LocalDate reviewDate,
        String outcome,
        @NotBlank(message = "REVIEWED_BY_REQUIRED")
        String reviewedBy
) {
}
