package com.contactcare.backend.global.common;

import java.time.Year;

/**
 * Formats organisation-scoped reference numbers such as {@code FM-2025-0001}.
 */
public final class ReferenceNumberFormatter {

    public static final String FAMILY_MEMBER_PREFIX = "FM";
    public static final String CONTACT_SCHEDULE_PREFIX = "CS";
    public static final String CONTACT_SESSION_PREFIX = "SESS";
    public static final String RISK_ASSESSMENT_PREFIX = "CRA";

    private ReferenceNumberFormatter() {
    }

    public static String yearPrefix(String prefix, Year year) {
        if (prefix == null || prefix.isBlank()) {
            throw new IllegalArgumentException("prefix must not be blank");
        }
        return prefix + "-" + year.getValue() + "-";
    }

    public static String format(String prefix, Year year, long sequence, int width) {
        if (sequence <= 0) {
            throw new IllegalArgumentException("sequence must be positive");
        }
        if (width <= 0) {
            throw new IllegalArgumentException("width must be positive");
        }
        return yearPrefix(prefix, year) + String.format("%0" + width + "d", sequence);
    }
}
