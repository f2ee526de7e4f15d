package com.contactcare.backend.modules.contact;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import com.contactcare.backend.global.config.RetryConfig;
import com.contactcare.backend.global.error.ProblemException;
import com.contactcare.backend.modules.audit.application.AuditLogService;
import com.contactcare.backend.modules.contact.application.CascadeInconsistencyException;
import com.contactcare.backend.modules.contact.application.CascadeRetryListener;
import com.contactcare.backend.modules.contact.application.ContactScheduleService;
import com.contactcare.backend.modules.contact.application.ContactSessionService;
import com.contactcare.backend.modules.contact.application.DefaultUrgentReviewPolicy;
import com.contactcare.backend.modules.contact.application.ScheduleLockUnavailableException;
import com.contactcare.backend.modules.contact.domain.ContactSchedule;
import com.contactcare.backend.modules.contact.domain.ContactSession;
import com.contactcare.backend.modules.contact.domain.ContactSessionStatus;
import com.contactcare.backend.modules.contact.infrastructure.persistence.ContactSessionRepository;
import com.contactcare.backend.modules.contact.presentation.dto.CancelContactSessionRequest;
import com.contactcare.backend.modules.contact.presentation.dto.CompleteContactSessionRequest;
import com.contactcare.backend.modules.family.application.FamilyMemberService;
import com.contactcare.backend.support.TestEntities;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.junit.jupiter.SpringJUnitConfig;

/**
 * Runs the session service behind the real retry proxy: a schedule locked by another
 * transaction re-runs the whole operation, every other failure surfaces on the first attempt.
 */
@SpringJUnitConfig(ContactSessionRetryTest.Config.class)
@TestPropertySource(properties = {
        "contactcare.cascade.max-attempts=3",
        "contactcare.cascade.backoff-ms=1"
})
class ContactSessionRetryTest {

    @Configuration
    @Import({RetryConfig.class, CascadeRetryListener.class, ContactSessionService.class})
    static class Config {

        @Bean
        Clock clock() {
            return Clock.fixed(OffsetDateTime.parse("2025-01-08T15:00:00Z").toInstant(), ZoneOffset.UTC);
        }

        @Bean
        DefaultUrgentReviewPolicy urgentReviewPolicy() {
            return new DefaultUrgentReviewPolicy();
        }
    }

    @MockBean
    private ContactSessionRepository contactSessionRepository;

    @MockBean
    private ContactScheduleService contactScheduleService;

    @MockBean
    private FamilyMemberService familyMemberService;

    @MockBean
    private AuditLogService auditLogService;

    @Autowired
    private ContactSessionService contactSessionService;

    private ContactSchedule schedule;
    private UUID sessionId;

    @BeforeEach
    void setUp() {
        schedule = TestEntities.weeklySchedule(TestEntities.activeParent(), LocalDate.of(2025, 1, 1));
        sessionId = UUID.randomUUID();
        // each attempt reloads the row as a rolled-back transaction would leave it
        when(contactSessionRepository.findById(sessionId)).thenAnswer(invocation -> Optional.of(
                TestEntities.withId(TestEntities.scheduledSession(schedule, LocalDate.of(2025, 1, 8)), sessionId)));
        when(contactSessionRepository.save(any(ContactSession.class)))
                .thenAnswer(invocation -> invocation.getArgument(0));
    }

    @Test
    void lockedScheduleIsRetriedUntilItFrees() {
        ScheduleLockUnavailableException locked = lockedSchedule("completed");
        doThrow(locked).doThrow(locked).doNothing()
                .when(contactScheduleService).recordSessionCompleted(schedule.getId(), LocalDate.of(2025, 1, 8));

        assertThat(contactSessionService.complete(sessionId, completeRequest()).status())
                .isEqualTo(ContactSessionStatus.COMPLETED.name());

        verify(contactSessionRepository, times(3)).findById(sessionId);
        verify(contactScheduleService, times(3)).recordSessionCompleted(schedule.getId(), LocalDate.of(2025, 1, 8));
        verify(auditLogService, times(1)).record(any());
    }

    @Test
    void lockHeldThroughEveryAttemptFailsTheCascade() {
        doThrow(lockedSchedule("cancelled"))
                .when(contactScheduleService).recordSessionCancelled(schedule.getId());

        assertThatThrownBy(() -> contactSessionService.cancel(sessionId,
                new CancelContactSessionRequest("carer", "Child unwell", false, null)))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo(CascadeInconsistencyException.CODE));

        verify(contactScheduleService, times(3)).recordSessionCancelled(schedule.getId());
        verify(auditLogService, never()).record(any());
    }

    @Test
    void closedSessionIsNotRetried() {
        ContactSession closed = TestEntities.withId(
                TestEntities.scheduledSession(schedule, LocalDate.of(2025, 1, 8)), sessionId);
        closed.markCancelled("carer", "Family member withdrew", false, null, OffsetDateTime.now());
        when(contactSessionRepository.findById(sessionId)).thenReturn(Optional.of(closed));

        assertThatThrownBy(() -> contactSessionService.complete(sessionId, completeRequest()))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo(ContactSessionService.SESSION_ALREADY_CLOSED));

        verify(contactSessionRepository, times(1)).findById(sessionId);
    }

    @Test
    void nonLockCascadeFailureIsNotRetried() {
        doThrow(new CascadeInconsistencyException(schedule.getId(), "completed", new IllegalStateException("underflow")))
                .when(contactScheduleService).recordSessionCompleted(schedule.getId(), LocalDate.of(2025, 1, 8));

        assertThatThrownBy(() -> contactSessionService.complete(sessionId, completeRequest()))
                .isExactlyInstanceOf(CascadeInconsistencyException.class);

        verify(contactScheduleService, times(1)).recordSessionCompleted(schedule.getId(), LocalDate.of(2025, 1, 8));
    }

    private ScheduleLockUnavailableException lockedSchedule(String operation) {
        return new ScheduleLockUnavailableException(schedule.getId(), operation,
                new CannotAcquireLockException("could not obtain lock on row in relation \"contact_schedule\""));
    }

    private static CompleteContactSessionRequest completeRequest() {
        return new CompleteContactSessionRequest(
                "10:00", "11:30", null, null, null, null, null, null, null, null,
                null, null, null, null, null, "carer");
    }
}
