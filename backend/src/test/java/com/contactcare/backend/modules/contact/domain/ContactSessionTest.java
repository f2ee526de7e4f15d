package com.contactcare.backend.modules.contact.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.LocalDate;
import java.time.OffsetDateTime;

import com.contactcare.backend.support.TestEntities;

import org.junit.jupiter.api.Test;

class ContactSessionTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2025-01-08T12:00:00Z");

    private final ContactSession session = TestEntities.scheduledSession(
            TestEntities.weeklySchedule(TestEntities.activeParent(), LocalDate.of(2025, 1, 1)),
            LocalDate.of(2025, 1, 8));

    @Test
    void durationIsNullUntilBothActualTimesAreKnown() {
        assertThat(session.calculateDuration()).isNull();
        session.setActualStartTime("10:05");
        assertThat(session.calculateDuration()).isNull();
        session.setActualEndTime("11:20");
        assertThat(session.calculateDuration()).isEqualTo(75);
    }

    @Test
    void completionStampsOutcome() {
        session.setActualStartTime("10:00");
        session.setActualEndTime("11:00");

        session.markCompleted("carer", NOW);

        assertThat(session.getStatus()).isEqualTo(ContactSessionStatus.COMPLETED);
        assertThat(session.getDurationMinutes()).isEqualTo(60);
        assertThat(session.getCompletedDate()).isEqualTo(NOW);
        assertThat(session.getVersion()).isEqualTo(2);
    }

    @Test
    void cancelledSessionCannotBeCompleted() {
        session.markCancelled("carer", "Child unwell", true, LocalDate.of(2025, 1, 10), NOW);

        assertThat(session.getRescheduledDate()).isEqualTo(LocalDate.of(2025, 1, 10));
        assertThatThrownBy(() -> session.markCompleted("carer", NOW))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void rescheduledDateIgnoredWhenNotRescheduled() {
        session.markCancelled("carer", "Family member withdrew", false, LocalDate.of(2025, 1, 10), NOW);

        assertThat(session.getRescheduledDate()).isNull();
    }

    @Test
    void malformedActualTimeIsRejected() {
        session.setActualStartTime("10am");
        session.setActualEndTime("11:00");

        assertThatThrownBy(session::calculateDuration).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void onlyCompletedCalmSessionIsSuccessful() {
        session.setInteractionQuality(InteractionQuality.GOOD);
        assertThat(session.wasSuccessful()).isFalse();

        session.markCompleted("carer", NOW);
        assertThat(session.wasSuccessful()).isTrue();

        session.setInteractionQuality(InteractionQuality.POOR);
        assertThat(session.wasSuccessful()).isFalse();
    }

    @Test
    void earlyTerminationIsUnsuccessfulAndConcerning() {
        session.markCompleted("carer", NOW);
        assertThat(session.hasConcerns()).isFalse();

        session.setContactTerminatedEarly(true);

        assertThat(session.wasSuccessful()).isFalse();
        assertThat(session.hasConcerns()).isTrue();
    }

    @Test
    void anyRecordedIncidentIsAConcern() {
        session.setHighestIncidentSeverity(IncidentSeverity.LOW);

        assertThat(session.hasConcerns()).isTrue();
    }

    @Test
    void punctualityNeedsBothPartiesAttendingWithoutLateness() {
        session.setChildAttendance(AttendanceStatus.ATTENDED);
        session.setFamilyMemberAttendance(AttendanceStatus.ATTENDED);
        session.setFamilyMemberLateMinutes(0);
        assertThat(session.wasOnTime()).isTrue();

        session.setChildLateMinutes(5);
        assertThat(session.wasOnTime()).isFalse();

        session.setChildLateMinutes(null);
        session.setFamilyMemberAttendance(AttendanceStatus.DID_NOT_ATTEND);
        assertThat(session.wasOnTime()).isFalse();
    }

    @Test
    void emotionalStateChangeComparesArrivalAndDeparture() {
        assertThat(session.getEmotionalStateChange()).isEqualTo(EmotionalStateChange.UNKNOWN);

        session.setChildEmotionalStateBefore(ChildEmotionalState.ANXIOUS);
        session.setChildEmotionalStateAfter(ChildEmotionalState.HAPPY);
        assertThat(session.getEmotionalStateChange()).isEqualTo(EmotionalStateChange.IMPROVED);

        session.setChildEmotionalStateAfter(ChildEmotionalState.WITHDRAWN);
        assertThat(session.getEmotionalStateChange()).isEqualTo(EmotionalStateChange.CHANGED);

        session.setChildEmotionalStateBefore(ChildEmotionalState.EXCITED);
        assertThat(session.getEmotionalStateChange()).isEqualTo(EmotionalStateChange.DETERIORATED);

        session.setChildEmotionalStateAfter(ChildEmotionalState.EXCITED);
        assertThat(session.getEmotionalStateChange()).isEqualTo(EmotionalStateChange.NO_CHANGE);
    }
}
