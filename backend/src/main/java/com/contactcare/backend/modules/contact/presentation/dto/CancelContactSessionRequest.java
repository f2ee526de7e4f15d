package com.contactcare.backend.modules.contact.presentation.dto;

import java.time.LocalDate;

import jakarta.validation.constraints.NotBlank;

public record CancelContactSessionRequest(
        @NotBlank(message = "CANCELLED_BY_REQUIRED")
        String cancelledBy,
        @NotBlank(message = "CANCELLATION_REASON_REQUIRED")
        String cancellationReason,
        boolean rescheduled,
        LocalDate rescheduledDate
) {
}
