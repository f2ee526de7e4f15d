package com.contactcare.backend.modules.contact.application;

import java.util.UUID;

import com.contactcare.backend.global.error.ProblemException;

import org.springframework.http.HttpStatus;

/**
 * A session change could not be carried into its schedule's counters. The surrounding
 * transaction rolls back, so neither the session nor the schedule change is kept.
 */
public class CascadeInconsistencyException extends ProblemException {

    public static final String CODE = "SCHEDULE_CASCADE_FAILED";

    private final UUID contactScheduleId;
    private final String operation;

    public CascadeInconsistencyException(UUID contactScheduleId, String operation, Throwable cause) {
        super(
                HttpStatus.INTERNAL_SERVER_ERROR,
                CODE,
                "Contact schedule " + contactScheduleId + " could not record " + operation,
                cause
        );
        this.contactScheduleId = contactScheduleId;
        this.operation = operation;
    }

    public UUID getContactScheduleId() {
        return contactScheduleId;
    }

    public String getOperation() {
        return operation;
    }
}
