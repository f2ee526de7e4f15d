package com.contactcare.backend.modules.contact.application;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.Year;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.contactcare.backend.global.common.ReferenceNumberFormatter;
import com.contactcare.backend.global.error.ProblemException;
import com.contactcare.backend.modules.audit.application.AuditLogService;
import com.contactcare.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.contactcare.backend.modules.contact.domain.ContactSession;
import com.contactcare.backend.modules.contact.domain.ContactSessionStatus;
import com.contactcare.backend.modules.contact.infrastructure.persistence.ContactSessionRepository;
import com.contactcare.backend.modules.contact.presentation.dto.CancelContactSessionRequest;
import com.contactcare.backend.modules.contact.presentation.dto.CompleteContactSessionRequest;
import com.contactcare.backend.modules.contact.presentation.dto.ContactSessionResponse;
import com.contactcare.backend.modules.contact.presentation.dto.ScheduleContactSessionRequest;
import com.contactcare.backend.modules.family.application.FamilyMemberService;

import org.springframework.http.HttpStatus;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Session lifecycle: SCHEDULED, then exactly one of COMPLETED or CANCELLED.
 *
 * <p>Every transition is carried into the linked schedule's counters within the same
 * transaction. When the schedule row is locked by a concurrent transition the whole operation
 * is retried in a new transaction; once {@code contactcare.cascade.max-attempts} is used up the
 * caller receives {@code SCHEDULE_CASCADE_FAILED}. The family member's contact permission is
 * not re-checked here; it gates schedule creation only.
 */
@Service
@Transactional
public class ContactSessionService {

    public static final String CONTACT_SESSION_NOT_FOUND = "CONTACT_SESSION_NOT_FOUND";
    public static final String SESSION_ALREADY_CLOSED = "SESSION_ALREADY_CLOSED";
    public static final String ACTUAL_END_BEFORE_START = "ACTUAL_END_BEFORE_START";
    public static final String INVALID_DATE_RANGE = "INVALID_DATE_RANGE";

    private final ContactSessionRepository contactSessionRepository;
    private final ContactScheduleService contactScheduleService;
    private final FamilyMemberService familyMemberService;
    private final UrgentReviewPolicy urgentReviewPolicy;
    private final AuditLogService auditLogService;
    private final Clock clock;

    public ContactSessionService(
            ContactSessionRepository contactSessionRepository,
            ContactScheduleService contactScheduleService,
            FamilyMemberService familyMemberService,
            UrgentReviewPolicy urgentReviewPolicy,
            AuditLogService auditLogService,
            Clock clock
    ) {
        this.contactSessionRepository = contactSessionRepository;
        this.contactScheduleService = contactScheduleService;
        this.familyMemberService = familyMemberService;
        this.urgentReviewPolicy = urgentReviewPolicy;
        this.auditLogService = auditLogService;
        this.clock = clock;
    }

    @Retryable(
            retryFor = ScheduleLockUnavailableException.class,
            maxAttemptsExpression = "${contactcare.cascade.max-attempts:3}",
            backoff = @Backoff(delayExpression = "${contactcare.cascade.backoff-ms:50}", multiplier = 2),
            listeners = CascadeRetryListener.BEAN_NAME
    )
    public ContactSessionResponse schedule(ScheduleContactSessionRequest request) {
        familyMemberService.ensureChildExists(request.childId());
        familyMemberService.loadMember(request.familyMemberId());
        if (request.contactScheduleId() != null) {
            contactScheduleService.ensureAcceptsSession(
                    request.contactScheduleId(),
                    request.childId(),
                    request.familyMemberId(),
                    request.organizationId()
            );
        }

        ContactSession session = new ContactSession();
        session.setSessionNumber(nextSessionNumber(request.organizationId()));
        session.setChildId(request.childId());
        session.setFamilyMemberId(request.familyMemberId());
        session.setContactScheduleId(request.contactScheduleId());
        session.setOrganizationId(request.organizationId());
        session.setSessionDate(request.sessionDate());
        session.setScheduledStartTime(request.scheduledStartTime());
        session.setScheduledEndTime(request.scheduledEndTime());
        session.setSupervised(request.supervised());
        session.setCreatedBy(request.createdBy());

        ContactSession saved = contactSessionRepository.save(session);
        contactScheduleService.recordSessionScheduled(saved.getContactScheduleId());

        auditLogService.record(AuditLogCommand.of(
                "CONTACT_SESSION_SCHEDULED",
                AuditLogService.RESOURCE_CONTACT_SESSION,
                saved.getId(),
                saved.getOrganizationId(),
                request.createdBy()
        ).withDetail(sessionDetail(saved)));
        return toResponse(saved);
    }

    @Retryable(
            retryFor = ScheduleLockUnavailableException.class,
            maxAttemptsExpression = "${contactcare.cascade.max-attempts:3}",
            backoff = @Backoff(delayExpression = "${contactcare.cascade.backoff-ms:50}", multiplier = 2),
            listeners = CascadeRetryListener.BEAN_NAME
    )
    public ContactSessionResponse complete(UUID contactSessionId, CompleteContactSessionRequest request) {
        ContactSession session = loadSession(contactSessionId);
        ensureOpen(session);
        if (LocalTime.parse(request.actualEndTime()).isBefore(LocalTime.parse(request.actualStartTime()))) {
            throw ProblemException.unprocessable(ACTUAL_END_BEFORE_START,
                    "actualEndTime must not be before actualStartTime");
        }

        session.setActualStartTime(request.actualStartTime());
        session.setActualEndTime(request.actualEndTime());
        if (request.childAttendance() != null) {
            session.setChildAttendance(request.childAttendance());
        }
        if (request.familyMemberAttendance() != null) {
            session.setFamilyMemberAttendance(request.familyMemberAttendance());
        }
        if (request.childLateMinutes() != null) {
            session.setChildLateMinutes(request.childLateMinutes());
        }
        if (request.familyMemberLateMinutes() != null) {
            session.setFamilyMemberLateMinutes(request.familyMemberLateMinutes());
        }
        if (request.nonAttendanceReason() != null) {
            session.setNonAttendanceReason(request.nonAttendanceReason().trim());
        }
        if (request.childEmotionalStateBefore() != null) {
            session.setChildEmotionalStateBefore(request.childEmotionalStateBefore());
        }
        if (request.childEmotionalStateDuring() != null) {
            session.setChildEmotionalStateDuring(request.childEmotionalStateDuring());
        }
        if (request.childEmotionalStateAfter() != null) {
            session.setChildEmotionalStateAfter(request.childEmotionalStateAfter());
        }
        if (request.interactionQuality() != null) {
            session.setInteractionQuality(request.interactionQuality());
        }
        if (request.overallAssessment() != null) {
            session.setOverallAssessment(request.overallAssessment().trim());
        }
        if (request.safeguardingConcernsRaised() != null) {
            session.setSafeguardingConcernsRaised(request.safeguardingConcernsRaised());
        }
        if (request.contactTerminatedEarly() != null) {
            session.setContactTerminatedEarly(request.contactTerminatedEarly());
        }
        if (request.highestIncidentSeverity() != null) {
            session.setHighestIncidentSeverity(request.highestIncidentSeverity());
        }
        session.markCompleted(request.completedBy(), OffsetDateTime.now(clock));

        ContactSession saved = contactSessionRepository.save(session);
        contactScheduleService.recordSessionCompleted(saved.getContactScheduleId(), saved.getSessionDate());

        Map<String, Object> detail = sessionDetail(saved);
        detail.put("requiresUrgentReview", requiresUrgentReview(saved));
        detail.put("successful", saved.wasSuccessful());
        auditLogService.record(AuditLogCommand.of(
                "CONTACT_SESSION_COMPLETED",
                AuditLogService.RESOURCE_CONTACT_SESSION,
                saved.getId(),
                saved.getOrganizationId(),
                request.completedBy()
        ).withDetail(detail));
        return toResponse(saved);
    }

    @Retryable(
            retryFor = ScheduleLockUnavailableException.class,
            maxAttemptsExpression = "${contactcare.cascade.max-attempts:3}",
            backoff = @Backoff(delayExpression = "${contactcare.cascade.backoff-ms:50}", multiplier = 2),
            listeners = CascadeRetryListener.BEAN_NAME
    )
    public ContactSessionResponse cancel(UUID contactSessionId, CancelContactSessionRequest request) {
        ContactSession session = loadSession(contactSessionId);
        ensureOpen(session);

        session.markCancelled(
                request.cancelledBy(),
                request.cancellationReason().trim(),
                request.rescheduled(),
                request.rescheduledDate(),
                OffsetDateTime.now(clock)
        );

        ContactSession saved = contactSessionRepository.save(session);
        contactScheduleService.recordSessionCancelled(saved.getContactScheduleId());

        Map<String, Object> detail = sessionDetail(saved);
        detail.put("reason", saved.getCancellationReason());
        auditLogService.record(AuditLogCommand.of(
                "CONTACT_SESSION_CANCELLED",
                AuditLogService.RESOURCE_CONTACT_SESSION,
                saved.getId(),
                saved.getOrganizationId(),
                request.cancelledBy()
        ).withDetail(detail));
        return toResponse(saved);
    }

    public boolean requiresUrgentReview(ContactSession session) {
        return session.isCompleted() && urgentReviewPolicy.requiresUrgentReview(session);
    }

    @Transactional(readOnly = true)
    public ContactSessionResponse get(UUID contactSessionId) {
        return toResponse(loadSession(contactSessionId));
    }

    /**
     * Sessions of a child, newest first, optionally narrowed to one family member and to
     * an inclusive date range.
     */
    @Transactional(readOnly = true)
    public List<ContactSessionResponse> list(UUID childId, UUID familyMemberId, LocalDate from, LocalDate to) {
        if (from != null && to != null && to.isBefore(from)) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, INVALID_DATE_RANGE, "to must not be before from");
        }
        List<ContactSession> sessions = familyMemberId != null
                ? contactSessionRepository.findByChildIdAndFamilyMemberIdOrderBySessionDateDesc(childId, familyMemberId)
                : contactSessionRepository.findByChildIdOrderBySessionDateDesc(childId);
        return sessions.stream()
                .filter(session -> from == null || !session.getSessionDate().isBefore(from))
                .filter(session -> to == null || !session.getSessionDate().isAfter(to))
                .map(this::toResponse)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<ContactSessionResponse> listRequiringUrgentReview(UUID organizationId) {
        return contactSessionRepository.findByOrganizationIdAndStatus(organizationId, ContactSessionStatus.COMPLETED)
                .stream()
                .filter(this::requiresUrgentReview)
                .map(this::toResponse)
                .toList();
    }

    private void ensureOpen(ContactSession session) {
        if (session.getStatus().isTerminal()) {
            throw ProblemException.conflict(SESSION_ALREADY_CLOSED,
                    "Contact session " + session.getSessionNumber() + " is already " + session.getStatus());
        }
    }

    private ContactSession loadSession(UUID contactSessionId) {
        return contactSessionRepository.findById(contactSessionId)
                .orElseThrow(() -> ProblemException.notFound(CONTACT_SESSION_NOT_FOUND, contactSessionId));
    }

    private String nextSessionNumber(UUID organizationId) {
        Year year = Year.now(clock);
        String prefix = ReferenceNumberFormatter.yearPrefix(ReferenceNumberFormatter.CONTACT_SESSION_PREFIX, year);
        long existing = contactSessionRepository.countByOrganizationIdAndSessionNumberStartingWith(
                organizationId, prefix);
        return ReferenceNumberFormatter.format(ReferenceNumberFormatter.CONTACT_SESSION_PREFIX, year, existing + 1, 5);
    }

    private Map<String, Object> sessionDetail(ContactSession session) {
        Map<String, Object> detail = new HashMap<>();
        detail.put("sessionNumber", session.getSessionNumber());
        detail.put("sessionDate", session.getSessionDate().toString());
        detail.put("status", session.getStatus().name());
        if (session.getContactScheduleId() != null) {
            detail.put("contactScheduleId", session.getContactScheduleId().toString());
        }
        return detail;
    }

    private ContactSessionResponse toResponse(ContactSession session) {
        return new ContactSessionResponse(
                session.getId(),
                session.getSessionNumber(),
                session.getChildId(),
                session.getFamilyMemberId(),
                session.getContactScheduleId(),
                session.getOrganizationId(),
                session.getStatus().name(),
                session.getSessionDate(),
                session.getScheduledStartTime(),
                session.getScheduledEndTime(),
                session.getActualStartTime(),
                session.getActualEndTime(),
                session.getDurationMinutes(),
                session.isSupervised(),
                enumName(session.getChildAttendance()),
                enumName(session.getFamilyMemberAttendance()),
                session.getChildLateMinutes(),
                session.getFamilyMemberLateMinutes(),
                session.getNonAttendanceReason(),
                enumName(session.getChildEmotionalStateBefore()),
                enumName(session.getChildEmotionalStateDuring()),
                enumName(session.getChildEmotionalStateAfter()),
                session.getEmotionalStateChange().name(),
                enumName(session.getInteractionQuality()),
                session.getOverallAssessment(),
                session.isSafeguardingConcernsRaised(),
                session.isContactTerminatedEarly(),
                enumName(session.getHighestIncidentSeverity()),
                requiresUrgentReview(session),
                session.wasSuccessful(),
                session.hasConcerns(),
                session.wasOnTime(),
                session.getCompletedBy(),
                session.getCompletedDate(),
                session.getCancelledBy(),
                session.getCancellationReason(),
                session.getCancellationDate(),
                session.isRescheduled(),
                session.getRescheduledDate(),
                session.getVersion(),
                session.getCreatedAt(),
                session.getUpdatedAt()
        );
    }

    private static String enumName(Enum<?> value) {
        return value != null ? value.name() : null;
    }
}
