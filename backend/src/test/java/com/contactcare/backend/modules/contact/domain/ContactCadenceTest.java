package com.contactcare.backend.modules.contact.domain;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.LocalDate;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class ContactCadenceTest {

    @ParameterizedTest
    @CsvSource({
            "DAILY, 2025-01-09",
            "TWICE_WEEKLY, 2025-01-11",
            "WEEKLY, 2025-01-15",
            "FORTNIGHTLY, 2025-01-22",
            "MONTHLY, 2025-02-08",
            "QUARTERLY, 2025-04-08",
            "ANNUALLY, 2026-01-08"
    })
    void nextContactDateFollowsFrequency(ContactFrequency frequency, LocalDate expected) {
        assertThat(ContactCadence.nextContactDate(LocalDate.of(2025, 1, 8), frequency)).isEqualTo(expected);
    }

    @Test
    @DisplayName("unknown frequency falls back to one month")
    void missingFrequencyFallsBackToOneMonth() {
        assertThat(ContactCadence.nextContactDate(LocalDate.of(2025, 3, 10), null))
                .isEqualTo(LocalDate.of(2025, 4, 10));
    }

    @Test
    void monthEndClampsAndIsStable() {
        LocalDate first = ContactCadence.nextContactDate(LocalDate.of(2025, 1, 31), ContactFrequency.MONTHLY);
        LocalDate second = ContactCadence.nextContactDate(LocalDate.of(2025, 1, 31), ContactFrequency.MONTHLY);

        assertThat(first).isEqualTo(LocalDate.of(2025, 2, 28)).isEqualTo(second);
        assertThat(ContactCadence.nextContactDate(LocalDate.of(2024, 1, 31), ContactFrequency.MONTHLY))
                .isEqualTo(LocalDate.of(2024, 2, 29));
    }

    @Test
    void reviewIsSixMonthsAfterStart() {
        assertThat(ContactCadence.scheduleReviewDate(LocalDate.of(2025, 1, 1))).isEqualTo(LocalDate.of(2025, 7, 1));
        assertThat(ContactCadence.scheduleReviewDate(LocalDate.of(2025, 8, 31))).isEqualTo(LocalDate.of(2026, 2, 28));
    }
}
