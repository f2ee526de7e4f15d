package com.contactcare.backend.modules.contact.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.LocalDate;

import com.contactcare.backend.support.TestEntities;

import org.junit.jupiter.api.Test;

class ContactScheduleTest {

    private final ContactSchedule schedule =
            TestEntities.weeklySchedule(TestEntities.activeParent(), LocalDate.of(2025, 1, 1));

    @Test
    void completionMovesCadenceFromSessionDate() {
        schedule.recordSessionScheduled();
        schedule.recordSessionCompleted(LocalDate.of(2025, 1, 8));

        assertThat(schedule.getTotalContactsCompleted()).isEqualTo(1);
        assertThat(schedule.getLastContactDate()).isEqualTo(LocalDate.of(2025, 1, 8));
        assertThat(schedule.getNextContactDate()).isEqualTo(LocalDate.of(2025, 1, 15));
    }

    @Test
    void refusesTransitionWithoutOpenContact() {
        schedule.recordSessionScheduled();
        schedule.recordSessionCancelled();

        assertThatThrownBy(() -> schedule.recordSessionCompleted(LocalDate.of(2025, 1, 8)))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(schedule::recordSessionCancelled)
                .isInstanceOf(IllegalStateException.class);
        assertThat(schedule.getTotalContactsScheduled())
                .isGreaterThanOrEqualTo(schedule.getTotalContactsCompleted() + schedule.getTotalContactsCancelled());
    }

    @Test
    void reviewDueFromReviewDateWhileActive() {
        assertThat(schedule.isReviewDue(LocalDate.of(2025, 6, 30))).isFalse();
        assertThat(schedule.isReviewDue(LocalDate.of(2025, 7, 1))).isTrue();

        schedule.setStatus(ContactScheduleStatus.SUSPENDED);
        assertThat(schedule.isReviewDue(LocalDate.of(2025, 7, 1))).isFalse();
    }

    @Test
    void notesAreAppendedInOrder() {
        schedule.appendNote("first");
        schedule.appendNote("  ");
        schedule.appendNote("second");

        assertThat(schedule.getNotes()).isEqualTo("first\n\nsecond");
    }
}
