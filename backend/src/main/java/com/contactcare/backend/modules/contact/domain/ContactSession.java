package com.contactcare.backend.modules.contact.domain;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.UUID;

import com.contactcare.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

@Entity
@Table(name = "contact_session")
public class ContactSession extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "session_number", nullable = false, length = 50, updatable = false)
    private String sessionNumber;

    @Column(name = "child_id", nullable = false, columnDefinition = "uuid")
    private UUID childId;

    @Column(name = "family_member_id", nullable = false, columnDefinition = "uuid")
    private UUID familyMemberId;

    @Column(name = "contact_schedule_id", columnDefinition = "uuid")
    private UUID contactScheduleId;

    @Column(name = "organization_id", nullable = false, columnDefinition = "uuid")
    private UUID organizationId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private ContactSessionStatus status = ContactSessionStatus.SCHEDULED;

    @Column(name = "session_date", nullable = false)
    private LocalDate sessionDate;

    @Column(name = "scheduled_start_time", nullable = false, length = 8)
    private String scheduledStartTime;

    @Column(name = "scheduled_end_time", nullable = false, length = 8)
    private String scheduledEndTime;

    @Column(name = "actual_start_time", length = 8)
    private String actualStartTime;

    @Column(name = "actual_end_time", length = 8)
    private String actualEndTime;

    @Column(name = "duration_minutes")
    private Integer durationMinutes;

    @Column(name = "supervised", nullable = false)
    private boolean supervised;

    @Enumerated(EnumType.STRING)
    @Column(name = "child_attendance", length = 32)
    private AttendanceStatus childAttendance;

    @Enumerated(EnumType.STRING)
    @Column(name = "family_member_attendance", length = 32)
    private AttendanceStatus familyMemberAttendance;

    @Column(name = "child_late_minutes")
    private Integer childLateMinutes;

    @Column(name = "family_member_late_minutes")
    private Integer familyMemberLateMinutes;

    @Column(name = "non_attendance_reason")
    private String nonAttendanceReason;

    @Enumerated(EnumType.STRING)
    @Column(name = "child_emotional_state_before", length = 16)
    private ChildEmotionalState childEmotionalStateBefore;

    @Enumerated(EnumType.STRING)
    @Column(name = "child_emotional_state_during", length = 16)
    private ChildEmotionalState childEmotionalStateDuring;

    @Enumerated(EnumType.STRING)
    @Column(name = "child_emotional_state_after", length = 16)
    private ChildEmotionalState childEmotionalStateAfter;

    @Enumerated(EnumType.STRING)
    @Column(name = "interaction_quality", length = 32)
    private InteractionQuality interactionQuality;

    @Column(name = "overall_assessment")
    private String overallAssessment;

    @Column(name = "safeguarding_concerns_raised", nullable = false)
    private boolean safeguardingConcernsRaised;

    @Column(name = "contact_terminated_early", nullable = false)
    private boolean contactTerminatedEarly;

    @Enumerated(EnumType.STRING)
    @Column(name = "highest_incident_severity", length = 16)
    private IncidentSeverity highestIncidentSeverity;

    @Column(name = "completed_by", length = 200)
    private String completedBy;

    @Column(name = "completed_date")
    private OffsetDateTime completedDate;

    @Column(name = "cancelled_by", length = 200)
    private String cancelledBy;

    @Column(name = "cancellation_reason")
    private String cancellationReason;

    @Column(name = "cancellation_date")
    private OffsetDateTime cancellationDate;

    @Column(name = "rescheduled", nullable = false)
    private boolean rescheduled;

    @Column(name = "rescheduled_date")
    private LocalDate rescheduledDate;

    @Column(name = "created_by", nullable = false, length = 200, updatable = false)
    private String createdBy;

    @Column(name = "updated_by", length = 200)
    private String updatedBy;

    @Column(name = "version", nullable = false)
    private int version = 1;

    public UUID getId() {
        return id;
    }

    public String getSessionNumber() {
        return sessionNumber;
    }

    public void setSessionNumber(String sessionNumber) {
        this.sessionNumber = sessionNumber;
    }

    public UUID getChildId() {
        return childId;
    }

    public void setChildId(UUID childId) {
        this.childId = childId;
    }

    public UUID getFamilyMemberId() {
        return familyMemberId;
    }

    public void setFamilyMemberId(UUID familyMemberId) {
        this.familyMemberId = familyMemberId;
    }

    public UUID getContactScheduleId() {
        return contactScheduleId;
    }

    public void setContactScheduleId(UUID contactScheduleId) {
        this.contactScheduleId = contactScheduleId;
    }

    public UUID getOrganizationId() {
        return organizationId;
    }

    public void setOrganizationId(UUID organizationId) {
        this.organizationId = organizationId;
    }

    public ContactSessionStatus getStatus() {
        return status;
    }

    public LocalDate getSessionDate() {
        return sessionDate;
    }

    public void setSessionDate(LocalDate sessionDate) {
        this.sessionDate = sessionDate;
    }

    public String getScheduledStartTime() {
        return scheduledStartTime;
    }

    public void setScheduledStartTime(String scheduledStartTime) {
        this.scheduledStartTime = scheduledStartTime;
    }

    public String getScheduledEndTime() {
        return scheduledEndTime;
    }

    public void setScheduledEndTime(String scheduledEndTime) {
        this.scheduledEndTime = scheduledEndTime;
    }

    public String getActualStartTime() {
        return actualStartTime;
    }

    public void setActualStartTime(String actualStartTime) {
        this.actualStartTime = actualStartTime;
    }

    public String getActualEndTime() {
        return actualEndTime;
    }

    public void setActualEndTime(String actualEndTime) {
        this.actualEndTime = actualEndTime;
    }

    public Integer getDurationMinutes() {
        return durationMinutes;
    }

    public boolean isSupervised() {
        return supervised;
    }

    public void setSupervised(boolean supervised) {
        this.supervised = supervised;
    }

    public AttendanceStatus getChildAttendance() {
        return childAttendance;
    }

    public void setChildAttendance(AttendanceStatus childAttendance) {
        this.childAttendance = childAttendance;
    }

    public AttendanceStatus getFamilyMemberAttendance() {
        return familyMemberAttendance;
    }

    public void setFamilyMemberAttendance(AttendanceStatus familyMemberAttendance) {
        this.familyMemberAttendance = familyMemberAttendance;
    }

    public Integer getChildLateMinutes() {
        return childLateMinutes;
    }

    public void setChildLateMinutes(Integer childLateMinutes) {
        this.childLateMinutes = childLateMinutes;
    }

    public Integer getFamilyMemberLateMinutes() {
        return familyMemberLateMinutes;
    }

    public void setFamilyMemberLateMinutes(Integer familyMemberLateMinutes) {
        this.familyMemberLateMinutes = familyMemberLateMinutes;
    }

    public String getNonAttendanceReason() {
        return nonAttendanceReason;
    }

    public void setNonAttendanceReason(String nonAttendanceReason) {
        this.nonAttendanceReason = nonAttendanceReason;
    }

    public ChildEmotionalState getChildEmotionalStateBefore() {
        return childEmotionalStateBefore;
    }

    public void setChildEmotionalStateBefore(ChildEmotionalState childEmotionalStateBefore) {
        this.childEmotionalStateBefore = childEmotionalStateBefore;
    }

    public ChildEmotionalState getChildEmotionalStateDuring() {
        return childEmotionalStateDuring;
    }

    public void setChildEmotionalStateDuring(ChildEmotionalState childEmotionalStateDuring) {
        this.childEmotionalStateDuring = childEmotionalStateDuring;
    }

    public ChildEmotionalState getChildEmotionalStateAfter() {
        return childEmotionalStateAfter;
    }

    public void setChildEmotionalStateAfter(ChildEmotionalState childEmotionalStateAfter) {
        this.childEmotionalStateAfter = childEmotionalStateAfter;
    }

    public InteractionQuality getInteractionQuality() {
        return interactionQuality;
    }

    public void setInteractionQuality(InteractionQuality interactionQuality) {
        this.interactionQuality = interactionQuality;
    }

    public String getOverallAssessment() {
        return overallAssessment;
    }

    public void setOverallAssessment(String overallAssessment) {
        this.overallAssessment = overallAssessment;
    }

    public boolean isSafeguardingConcernsRaised() {
        return safeguardingConcernsRaised;
    }

    public void setSafeguardingConcernsRaised(boolean safeguardingConcernsRaised) {
        this.safeguardingConcernsRaised = safeguardingConcernsRaised;
    }

    public boolean isContactTerminatedEarly() {
        return contactTerminatedEarly;
    }

    public void setContactTerminatedEarly(boolean contactTerminatedEarly) {
        this.contactTerminatedEarly = contactTerminatedEarly;
    }

    public IncidentSeverity getHighestIncidentSeverity() {
        return highestIncidentSeverity;
    }

    public void setHighestIncidentSeverity(IncidentSeverity highestIncidentSeverity) {
        this.highestIncidentSeverity = highestIncidentSeverity;
    }

    public String getCompletedBy() {
        return completedBy;
    }

    public OffsetDateTime getCompletedDate() {
        return completedDate;
    }

    public String getCancelledBy() {
        return cancelledBy;
    }

    public String getCancellationReason() {
        return cancellationReason;
    }

    public OffsetDateTime getCancellationDate() {
        return cancellationDate;
    }

    public boolean isRescheduled() {
        return rescheduled;
    }

    public LocalDate getRescheduledDate() {
        return rescheduledDate;
    }

    public String getCreatedBy() {
        return createdBy;
    }

    public void setCreatedBy(String createdBy) {
        this.createdBy = createdBy;
    }

    public String getUpdatedBy() {
        return updatedBy;
    }

    public int getVersion() {
        return version;
    }

    public boolean isCompleted() {
        return status == ContactSessionStatus.COMPLETED;
    }

    /**
     * Completed without poor or concerning interaction, safeguarding concerns or early termination.
     */
    public boolean wasSuccessful() {
        return isCompleted()
                && interactionQuality != InteractionQuality.POOR
                && interactionQuality != InteractionQuality.CONCERNING
                && !safeguardingConcernsRaised
                && !contactTerminatedEarly;
    }

    public boolean hasConcerns() {
        return safeguardingConcernsRaised
                || highestIncidentSeverity != null
                || interactionQuality == InteractionQuality.CONCERNING
                || contactTerminatedEarly;
    }

    public boolean wasOnTime() {
        return childAttendance == AttendanceStatus.ATTENDED
                && familyMemberAttendance == AttendanceStatus.ATTENDED
                && isZeroOrMissing(childLateMinutes)
                && isZeroOrMissing(familyMemberLateMinutes);
    }

    public EmotionalStateChange getEmotionalStateChange() {
        return EmotionalStateChange.between(childEmotionalStateBefore, childEmotionalStateAfter);
    }

    public void markCompleted(String completedBy, OffsetDateTime completedAt) {
        ensureScheduled();
        this.durationMinutes = calculateDuration();
        this.status = ContactSessionStatus.COMPLETED;
        this.completedBy = completedBy;
        this.completedDate = completedAt;
        this.updatedBy = completedBy;
        this.version += 1;
    }

    public void markCancelled(
            String cancelledBy,
            String reason,
            boolean rescheduled,
            LocalDate rescheduledDate,
            OffsetDateTime cancelledAt
    ) {
        ensureScheduled();
        this.status = ContactSessionStatus.CANCELLED;
        this.cancelledBy = cancelledBy;
        this.cancellationReason = reason;
        this.rescheduled = rescheduled;
        this.rescheduledDate = rescheduled ? rescheduledDate : null;
        this.cancellationDate = cancelledAt;
        this.updatedBy = cancelledBy;
        this.version += 1;
    }

    /**
     * Minutes between the actual start and end times, or {@code null} when either is missing.
     */
    public Integer calculateDuration() {
        if (actualStartTime == null || actualEndTime == null) {
            return null;
        }
        try {
            LocalTime start = LocalTime.parse(actualStartTime);
            LocalTime end = LocalTime.parse(actualEndTime);
            return (int) Duration.between(start, end).toMinutes();
        } catch (DateTimeParseException ex) {
            throw new IllegalArgumentException("Actual times must use HH:mm", ex);
        }
    }

    private static boolean isZeroOrMissing(Integer minutes) {
        return minutes == null || minutes == 0;
    }

    private void ensureScheduled() {
        if (status.isTerminal()) {
            throw new IllegalStateException("Contact session " + id + " is already " + status);
        }
    }
}
