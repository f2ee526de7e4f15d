package com.contactcare.backend.modules.contact.presentation.dto;

import jakarta.validation.constraints.NotBlank;

public record SuspendContactScheduleRequest(
        @NotBlank(message = "REASON_REQUIRED")
        String reason,
        @NotBlank(message = "UPDATED_BY_REQUIRED")
        String updatedBy
) {
}
