package com.contactcare.backend.modules.contact.presentation.dto;

import com.contactcare.backend.modules.contact.domain.AttendanceStatus;
import com.contactcare.backend.modules.contact.domain.ChildEmotionalState;
import com.contactcare.backend.modules.contact.domain.IncidentSeverity;
import com.contactcare.backend.modules.contact.domain.InteractionQuality;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.PositiveOrZero;

public record CompleteContactSessionRequest(
        @NotBlank(message = "ACTUAL_START_TIME_REQUIRED")
        @Pattern(regexp = SessionTimes.PATTERN, message = "ACTUAL_START_TIME_INVALID")
        String actualStartTime,
        @NotBlank(message = "ACTUAL_END_TIME_REQUIRED")
        @Pattern(regexp = SessionTimes.PATTERN, message = "ACTUAL_END_TIME_INVALID")
        String actualEndTime,
        AttendanceStatus childAttendance,
        AttendanceStatus familyMemberAttendance,
        @PositiveOrZero(message = "CHILD_LATE_MINUTES_NEGATIVE")
        Integer childLateMinutes,
        @PositiveOrZero(message = "FAMILY_MEMBER_LATE_MINUTES_NEGATIVE")
        Integer familyMemberLateMinutes,
        String nonAttendanceReason,
        ChildEmotionalState childEmotionalStateBefore,
        ChildEmotionalState childEmotionalStateDuring,
        ChildEmotionalState childEmotionalStateAfter,
        InteractionQuality interactionQuality,
        String overallAssessment,
        Boolean safeguardingConcernsRaised,
        Boolean contactTerminatedEarly,
        IncidentSeverity highestIncidentSeverity,
        @NotBlank(message = "COMPLETED_BY_REQUIRED")
        String completedBy
) {
}
