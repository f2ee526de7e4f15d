package com.contactcare.backend.modules.contact.application;

import java.util.UUID;

/**
 * The schedule row was locked by another transaction. Unlike other cascade failures this one
 * is worth retrying, in a fresh transaction.
 */
public class ScheduleLockUnavailableException extends CascadeInconsistencyException {

    public ScheduleLockUnavailableException(UUID contactScheduleId, String operation, Throwable cause) {
        super(contactScheduleId, operation, cause);
    }
}
