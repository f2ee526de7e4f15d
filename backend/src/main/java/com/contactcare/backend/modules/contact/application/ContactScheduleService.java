package com.contactcare.backend.modules.contact.application;

import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.Year;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.contactcare.backend.global.common.ReferenceNumberFormatter;
import com.contactcare.backend.global.error.ProblemException;
import com.contactcare.backend.modules.audit.application.AuditLogService;
import com.contactcare.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.contactcare.backend.modules.contact.domain.ContactCadence;
import com.contactcare.backend.modules.contact.domain.ContactSchedule;
import com.contactcare.backend.modules.contact.domain.ContactScheduleStatus;
import com.contactcare.backend.modules.contact.infrastructure.persistence.ContactScheduleRepository;
import com.contactcare.backend.modules.contact.presentation.dto.ContactScheduleResponse;
import com.contactcare.backend.modules.contact.presentation.dto.CreateContactScheduleRequest;
import com.contactcare.backend.modules.contact.presentation.dto.ReviewContactScheduleRequest;
import com.contactcare.backend.modules.contact.presentation.dto.SuspendContactScheduleRequest;
import com.contactcare.backend.modules.family.application.FamilyMemberService;
import com.contactcare.backend.modules.family.domain.FamilyMember;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class ContactScheduleService {

    public static final String CONTACT_SCHEDULE_NOT_FOUND = "CONTACT_SCHEDULE_NOT_FOUND";
    public static final String CONTACT_SCHEDULE_NOT_ACTIVE = "CONTACT_SCHEDULE_NOT_ACTIVE";
    public static final String INVALID_SCHEDULE_DATES = "INVALID_SCHEDULE_DATES";
    public static final String SCHEDULE_MISMATCH = "SCHEDULE_MISMATCH";

    private final ContactScheduleRepository contactScheduleRepository;
    private final FamilyMemberService familyMemberService;
    private final ScheduleCounterCascade scheduleCounterCascade;
    private final AuditLogService auditLogService;
    private final Clock clock;

    public ContactScheduleService(
            ContactScheduleRepository contactScheduleRepository,
            FamilyMemberService familyMemberService,
            ScheduleCounterCascade scheduleCounterCascade,
            AuditLogService auditLogService,
            Clock clock
    ) {
        this.contactScheduleRepository = contactScheduleRepository;
        this.familyMemberService = familyMemberService;
        this.scheduleCounterCascade = scheduleCounterCascade;
        this.auditLogService = auditLogService;
        this.clock = clock;
    }

    public ContactScheduleResponse create(CreateContactScheduleRequest request) {
        familyMemberService.ensureChildExists(request.childId());
        FamilyMember member = familyMemberService.loadMember(request.familyMemberId());
        if (!familyMemberService.isContactAllowed(member)) {
            throw new ContactNotAllowedException(member.getId(), member.getFullName());
        }
        if (request.endDate() != null && request.endDate().isBefore(request.startDate())) {
            throw ProblemException.unprocessable(INVALID_SCHEDULE_DATES,
                    "endDate must not be before startDate");
        }

        ContactSchedule schedule = new ContactSchedule();
        schedule.setContactScheduleNumber(nextScheduleNumber(request.organizationId()));
        schedule.setChildId(request.childId());
        schedule.setFamilyMemberId(member.getId());
        schedule.setOrganizationId(request.organizationId());
        schedule.setContactType(request.contactType());
        schedule.setContactFrequency(request.contactFrequency());
        schedule.setSupervisionRequired(request.supervisionRequired());
        schedule.setDurationMinutes(request.durationMinutes());
        schedule.setStatus(ContactScheduleStatus.ACTIVE);
        schedule.setStartDate(request.startDate());
        schedule.setEndDate(request.endDate());
        schedule.setNextReviewDate(ContactCadence.scheduleReviewDate(request.startDate()));
        schedule.appendNote(request.notes() != null ? request.notes().trim() : null);
        schedule.setCreatedBy(request.createdBy());

        ContactSchedule saved = contactScheduleRepository.save(schedule);
        auditLogService.record(AuditLogCommand.of(
                "CONTACT_SCHEDULE_CREATED",
                AuditLogService.RESOURCE_CONTACT_SCHEDULE,
                saved.getId(),
                saved.getOrganizationId(),
                request.createdBy()
        ).withDetail(Map.of(
                "contactScheduleNumber", saved.getContactScheduleNumber(),
                "familyMemberId", saved.getFamilyMemberId().toString(),
                "contactFrequency", saved.getContactFrequency().name()
        )));
        return toResponse(saved);
    }

    @Transactional(readOnly = true)
    public ContactScheduleResponse get(UUID contactScheduleId) {
        return toResponse(loadSchedule(contactScheduleId));
    }

    @Transactional(readOnly = true)
    public List<ContactScheduleResponse> listActive(UUID childId) {
        return contactScheduleRepository.findByChildIdOrderByStartDateAsc(childId).stream()
                .filter(ContactSchedule::isActive)
                .map(this::toResponse)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<ContactScheduleResponse> listDueForReview(UUID organizationId) {
        return findDueForReview(organizationId).stream()
                .map(this::toResponse)
                .toList();
    }

    @Transactional(readOnly = true)
    public long countDueForReview(UUID organizationId) {
        return contactScheduleRepository.countByOrganizationIdAndStatusAndNextReviewDateLessThanEqual(
                organizationId, ContactScheduleStatus.ACTIVE, LocalDate.now(clock));
    }

    public ContactScheduleResponse suspend(UUID contactScheduleId, SuspendContactScheduleRequest request) {
        ContactSchedule schedule = loadSchedule(contactScheduleId);
        ContactScheduleStatus previousStatus = schedule.getStatus();
        OffsetDateTime now = OffsetDateTime.now(clock);

        schedule.setStatus(ContactScheduleStatus.SUSPENDED);
        schedule.appendNote("Suspended: " + request.reason().trim() + " (" + now + ")");
        schedule.setUpdatedBy(request.updatedBy());
        schedule.incrementVersion();

        ContactSchedule saved = contactScheduleRepository.save(schedule);
        auditLogService.record(AuditLogCommand.of(
                "CONTACT_SCHEDULE_SUSPENDED",
                AuditLogService.RESOURCE_CONTACT_SCHEDULE,
                saved.getId(),
                saved.getOrganizationId(),
                request.updatedBy()
        ).withDetail(Map.of(
                "previousStatus", previousStatus.name(),
                "reason", request.reason().trim()
        )));
        return toResponse(saved);
    }

    /**
     * Records a completed review and pushes the next review six months past the review date.
     * Ended schedules are no longer reviewed.
     */
    public ContactScheduleResponse review(UUID contactScheduleId, ReviewContactScheduleRequest request) {
        ContactSchedule schedule = loadSchedule(contactScheduleId);
        if (schedule.getStatus() == ContactScheduleStatus.ENDED) {
            throw ProblemException.conflict(CONTACT_SCHEDULE_NOT_ACTIVE,
                    "Contact schedule " + schedule.getContactScheduleNumber() + " has ended");
        }
        LocalDate reviewDate = request.reviewDate() != null ? request.reviewDate() : LocalDate.now(clock);
        LocalDate previousReviewDate = schedule.getNextReviewDate();

        String outcome = request.outcome() != null ? request.outcome().trim() : "";
        schedule.appendNote(outcome.isEmpty()
                ? "Reviewed on " + reviewDate
                : "Reviewed on " + reviewDate + ": " + outcome);
        schedule.setNextReviewDate(ContactCadence.scheduleReviewDate(reviewDate));
        schedule.setUpdatedBy(request.reviewedBy());
        schedule.incrementVersion();

        ContactSchedule saved = contactScheduleRepository.save(schedule);
        auditLogService.record(AuditLogCommand.of(
                "CONTACT_SCHEDULE_REVIEWED",
                AuditLogService.RESOURCE_CONTACT_SCHEDULE,
                saved.getId(),
                saved.getOrganizationId(),
                request.reviewedBy()
        ).withDetail(Map.of(
                "previousReviewDate", String.valueOf(previousReviewDate),
                "nextReviewDate", saved.getNextReviewDate().toString()
        )));
        return toResponse(saved);
    }

    /**
     * A new session may only be linked to an ACTIVE schedule of the same child, family member
     * and organisation. Suspended and ended schedules take no new sessions.
     */
    @Transactional(readOnly = true)
    public void ensureAcceptsSession(UUID contactScheduleId, UUID childId, UUID familyMemberId, UUID organizationId) {
        ContactSchedule schedule = loadSchedule(contactScheduleId);
        if (!schedule.getChildId().equals(childId)
                || !schedule.getFamilyMemberId().equals(familyMemberId)
                || !schedule.getOrganizationId().equals(organizationId)) {
            throw ProblemException.unprocessable(SCHEDULE_MISMATCH,
                    "Contact schedule " + schedule.getContactScheduleNumber()
                            + " belongs to a different child, family member or organisation");
        }
        if (!schedule.isActive()) {
            throw ProblemException.conflict(CONTACT_SCHEDULE_NOT_ACTIVE,
                    "Contact schedule " + schedule.getContactScheduleNumber() + " is " + schedule.getStatus());
        }
    }

    public void recordSessionScheduled(UUID contactScheduleId) {
        scheduleCounterCascade.apply(contactScheduleId, "scheduled", ContactSchedule::recordSessionScheduled);
    }

    public void recordSessionCompleted(UUID contactScheduleId, LocalDate sessionDate) {
        scheduleCounterCascade.apply(contactScheduleId, "completed",
                schedule -> schedule.recordSessionCompleted(sessionDate));
    }

    public void recordSessionCancelled(UUID contactScheduleId) {
        scheduleCounterCascade.apply(contactScheduleId, "cancelled", ContactSchedule::recordSessionCancelled);
    }

    private List<ContactSchedule> findDueForReview(UUID organizationId) {
        return contactScheduleRepository
                .findByOrganizationIdAndStatusAndNextReviewDateLessThanEqualOrderByNextReviewDateAsc(
                        organizationId, ContactScheduleStatus.ACTIVE, LocalDate.now(clock));
    }

    private ContactSchedule loadSchedule(UUID contactScheduleId) {
        return contactScheduleRepository.findById(contactScheduleId)
                .orElseThrow(() -> ProblemException.notFound(CONTACT_SCHEDULE_NOT_FOUND, contactScheduleId));
    }

    private String nextScheduleNumber(UUID organizationId) {
        Year year = Year.now(clock);
        String prefix = ReferenceNumberFormatter.yearPrefix(ReferenceNumberFormatter.CONTACT_SCHEDULE_PREFIX, year);
        long existing = contactScheduleRepository.countByOrganizationIdAndContactScheduleNumberStartingWith(
                organizationId, prefix);
        return ReferenceNumberFormatter.format(ReferenceNumberFormatter.CONTACT_SCHEDULE_PREFIX, year, existing + 1, 4);
    }

    private ContactScheduleResponse toResponse(ContactSchedule schedule) {
        return new ContactScheduleResponse(
                schedule.getId(),
                schedule.getContactScheduleNumber(),
                schedule.getChildId(),
                schedule.getFamilyMemberId(),
                schedule.getOrganizationId(),
                schedule.getContactType().name(),
                schedule.getContactFrequency().name(),
                schedule.isSupervisionRequired(),
                schedule.getDurationMinutes(),
                schedule.getStatus().name(),
                schedule.getStartDate(),
                schedule.getEndDate(),
                schedule.getLastContactDate(),
                schedule.getNextContactDate(),
                schedule.getNextReviewDate(),
                schedule.isReviewDue(LocalDate.now(clock)),
                schedule.getTotalContactsScheduled(),
                schedule.getTotalContactsCompleted(),
                schedule.getTotalContactsCancelled(),
                schedule.getNotes(),
                schedule.getVersion(),
                schedule.getCreatedAt(),
                schedule.getUpdatedAt()
        );
    }
}
