package com.contactcare.backend.modules.contact.domain;

import java.time.LocalDate;
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
@Table(name = "contact_schedule")
public class ContactSchedule extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "contact_schedule_number", nullable = false, length = 50, updatable = false)
    private String contactScheduleNumber;

    @Column(name = "child_id", nullable = false, columnDefinition = "uuid")
    private UUID childId;

    @Column(name = "family_member_id", nullable = false, columnDefinition = "uuid")
    private UUID familyMemberId;

    @Column(name = "organization_id", nullable = false, columnDefinition = "uuid")
    private UUID organizationId;

    @Enumerated(EnumType.STRING)
    @Column(name = "contact_type", nullable = false, length = 32)
    private ContactType contactType;

    @Enumerated(EnumType.STRING)
    @Column(name = "contact_frequency", nullable = false, length = 32)
    private ContactFrequency contactFrequency;

    @Column(name = "supervision_required", nullable = false)
    private boolean supervisionRequired;

    @Column(name = "duration_minutes")
    private Integer durationMinutes;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private ContactScheduleStatus status = ContactScheduleStatus.ACTIVE;

    @Column(name = "start_date", nullable = false)
    private LocalDate startDate;

    @Column(name = "end_date")
    private LocalDate endDate;

    @Column(name = "last_contact_date")
    private LocalDate lastContactDate;

    @Column(name = "next_contact_date")
    private LocalDate nextContactDate;

    @Column(name = "next_review_date", nullable = false)
    private LocalDate nextReviewDate;

    @Column(name = "total_contacts_scheduled", nullable = false)
    private int totalContactsScheduled;

    @Column(name = "total_contacts_completed", nullable = false)
    private int totalContactsCompleted;

    @Column(name = "total_contacts_cancelled", nullable = false)
    private int totalContactsCancelled;

    @Column(name = "notes")
    private String notes;

    @Column(name = "created_by", nullable = false, length = 200, updatable = false)
    private String createdBy;

    @Column(name = "updated_by", length = 200)
    private String updatedBy;

    @Column(name = "version", nullable = false)
    private int version = 1;

    public UUID getId() {
        return id;
    }

    public String getContactScheduleNumber() {
        return contactScheduleNumber;
    }

    public void setContactScheduleNumber(String contactScheduleNumber) {
        this.contactScheduleNumber = contactScheduleNumber;
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

    public UUID getOrganizationId() {
        return organizationId;
    }

    public void setOrganizationId(UUID organizationId) {
        this.organizationId = organizationId;
    }

    public ContactType getContactType() {
        return contactType;
    }

    public void setContactType(ContactType contactType) {
        this.contactType = contactType;
    }

    public ContactFrequency getContactFrequency() {
        return contactFrequency;
    }

    public void setContactFrequency(ContactFrequency contactFrequency) {
        this.contactFrequency = contactFrequency;
    }

    public boolean isSupervisionRequired() {
        return supervisionRequired;
    }

    public void setSupervisionRequired(boolean supervisionRequired) {
        this.supervisionRequired = supervisionRequired;
    }

    public Integer getDurationMinutes() {
        return durationMinutes;
    }

    public void setDurationMinutes(Integer durationMinutes) {
        this.durationMinutes = durationMinutes;
    }

    public ContactScheduleStatus getStatus() {
        return status;
    }

    public void setStatus(ContactScheduleStatus status) {
        this.status = status;
    }

    public LocalDate getStartDate() {
        return startDate;
    }

    public void setStartDate(LocalDate startDate) {
        this.startDate = startDate;
    }

    public LocalDate getEndDate() {
        return endDate;
    }

    public void setEndDate(LocalDate endDate) {
        this.endDate = endDate;
    }

    public LocalDate getLastContactDate() {
        return lastContactDate;
    }

    public LocalDate getNextContactDate() {
        return nextContactDate;
    }

    public void setNextContactDate(LocalDate nextContactDate) {
        this.nextContactDate = nextContactDate;
    }

    public LocalDate getNextReviewDate() {
        return nextReviewDate;
    }

    public void setNextReviewDate(LocalDate nextReviewDate) {
        this.nextReviewDate = nextReviewDate;
    }

    public int getTotalContactsScheduled() {
        return totalContactsScheduled;
    }

    public int getTotalContactsCompleted() {
        return totalContactsCompleted;
    }

    public int getTotalContactsCancelled() {
        return totalContactsCancelled;
    }

    public String getNotes() {
        return notes;
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

    public void setUpdatedBy(String updatedBy) {
        this.updatedBy = updatedBy;
    }

    public int getVersion() {
        return version;
    }

    public void incrementVersion() {
        this.version += 1;
    }

    public boolean isActive() {
        return status != null && status.isActive();
    }

    public boolean isReviewDue(LocalDate today) {
        return isActive() && nextReviewDate != null && !today.isBefore(nextReviewDate);
    }

    public int getOpenContacts() {
        return totalContactsScheduled - totalContactsCompleted - totalContactsCancelled;
    }

    public void appendNote(String line) {
        if (line == null || line.isBlank()) {
            return;
        }
        this.notes = (notes == null || notes.isEmpty()) ? line : notes + "\n\n" + line;
    }

    public void recordSessionScheduled() {
        totalContactsScheduled += 1;
    }

    /**
     * Counts a completed contact and moves the cadence forward from the session date.
     * Refused when no scheduled contact is left open, so {@code scheduled >= completed + cancelled}
     * holds after every call.
     */
    public void recordSessionCompleted(LocalDate sessionDate) {
        ensureOpenContact();
        totalContactsCompleted += 1;
        lastContactDate = sessionDate;
        nextContactDate = ContactCadence.nextContactDate(sessionDate, contactFrequency);
    }

    public void recordSessionCancelled() {
        ensureOpenContact();
        totalContactsCancelled += 1;
    }

    private void ensureOpenContact() {
        if (getOpenContacts() <= 0) {
            throw new IllegalStateException("Contact schedule " + id + " has no open scheduled contact");
        }
    }
}
