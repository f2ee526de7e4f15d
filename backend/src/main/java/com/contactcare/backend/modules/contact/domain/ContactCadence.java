package com.contactcare.backend.modules.contact.domain;

import java.time.LocalDate;

/**
 * Date arithmetic for contact and review cadence.
 *
 * <p>Month and year offsets use {@link LocalDate#plusMonths(long)} and
 * {@link LocalDate#plusYears(long)}, which clamp to the last valid day of the target
 * month: 2025-01-31 plus one month is 2025-02-28, and 2024-02-29 plus one year is
 * 2025-02-28.
 */
public final class ContactCadence {

    public static final int SCHEDULE_REVIEW_MONTHS = 6;

    private ContactCadence() {
    }

    public static LocalDate nextContactDate(LocalDate lastContactDate, ContactFrequency frequency) {
        if (lastContactDate == null) {
            throw new IllegalArgumentException("lastContactDate must not be null");
        }
        if (frequency == null) {
            return lastContactDate.plusMonths(1);
        }
        return switch (frequency) {
            case DAILY -> lastContactDate.plusDays(1);
            case TWICE_WEEKLY -> lastContactDate.plusDays(3);
            case WEEKLY -> lastContactDate.plusDays(7);
            case FORTNIGHTLY -> lastContactDate.plusDays(14);
            case MONTHLY -> lastContactDate.plusMonths(1);
            case QUARTERLY -> lastContactDate.plusMonths(3);
            case ANNUALLY -> lastContactDate.plusYears(1);
        };
    }

    public static LocalDate scheduleReviewDate(LocalDate from) {
        if (from == null) {
            throw new IllegalArgumentException("from must not be null");
        }
        return from.plusMonths(SCHEDULE_REVIEW_MONTHS);
    }
}
