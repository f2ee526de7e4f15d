package com.contactcare.backend.modules.family.domain;

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
@Table(name = "family_member")
public class FamilyMember extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "family_member_number", nullable = false, length = 50, updatable = false)
    private String familyMemberNumber;

    @Column(name = "child_id", nullable = false, columnDefinition = "uuid")
    private UUID childId;

    @Column(name = "organization_id", nullable = false, columnDefinition = "uuid")
    private UUID organizationId;

    @Column(name = "first_name", nullable = false, length = 100)
    private String firstName;

    @Column(name = "last_name", nullable = false, length = 100)
    private String lastName;

    @Enumerated(EnumType.STRING)
    @Column(name = "relationship_type", nullable = false, length = 32)
    private RelationshipType relationshipType;

    @Column(name = "has_parental_responsibility", nullable = false)
    private boolean hasParentalResponsibility;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private FamilyMemberStatus status = FamilyMemberStatus.ACTIVE;

    @Enumerated(EnumType.STRING)
    @Column(name = "contact_restriction_level", nullable = false, length = 32)
    private ContactRestrictionLevel contactRestrictionLevel = ContactRestrictionLevel.NONE;

    @Column(name = "dbs_check_required", nullable = false)
    private boolean dbsCheckRequired;

    @Column(name = "dbs_check_date")
    private LocalDate dbsCheckDate;

    @Column(name = "dbs_expiry_date")
    private LocalDate dbsExpiryDate;

    @Column(name = "phone", length = 40)
    private String phone;

    @Column(name = "email", length = 200)
    private String email;

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

    public String getFamilyMemberNumber() {
        return familyMemberNumber;
    }

    public void setFamilyMemberNumber(String familyMemberNumber) {
        this.familyMemberNumber = familyMemberNumber;
    }

    public UUID getChildId() {
        return childId;
    }

    public void setChildId(UUID childId) {
        this.childId = childId;
    }

    public UUID getOrganizationId() {
        return organizationId;
    }

    public void setOrganizationId(UUID organizationId) {
        this.organizationId = organizationId;
    }

    public String getFirstName() {
        return firstName;
    }

    public void setFirstName(String firstName) {
        this.firstName = firstName;
    }

    public String getLastName() {
        return lastName;
    }

    public void setLastName(String lastName) {
        this.lastName = lastName;
    }

    public String getFullName() {
        return (firstName + " " + lastName).trim();
    }

    public RelationshipType getRelationshipType() {
        return relationshipType;
    }

    public void setRelationshipType(RelationshipType relationshipType) {
        this.relationshipType = relationshipType;
    }

    public boolean isHasParentalResponsibility() {
        return hasParentalResponsibility;
    }

    public void setHasParentalResponsibility(boolean hasParentalResponsibility) {
        this.hasParentalResponsibility = hasParentalResponsibility;
    }

    public FamilyMemberStatus getStatus() {
        return status;
    }

    public void setStatus(FamilyMemberStatus status) {
        this.status = status;
    }

    public ContactRestrictionLevel getContactRestrictionLevel() {
        return contactRestrictionLevel;
    }

    public void setContactRestrictionLevel(ContactRestrictionLevel contactRestrictionLevel) {
        this.contactRestrictionLevel = contactRestrictionLevel;
    }

    public boolean isDbsCheckRequired() {
        return dbsCheckRequired;
    }

    public void setDbsCheckRequired(boolean dbsCheckRequired) {
        this.dbsCheckRequired = dbsCheckRequired;
    }

    public LocalDate getDbsCheckDate() {
        return dbsCheckDate;
    }

    public void setDbsCheckDate(LocalDate dbsCheckDate) {
        this.dbsCheckDate = dbsCheckDate;
    }

    public LocalDate getDbsExpiryDate() {
        return dbsExpiryDate;
    }

    public void setDbsExpiryDate(LocalDate dbsExpiryDate) {
        this.dbsExpiryDate = dbsExpiryDate;
    }

    public String getPhone() {
        return phone;
    }

    public void setPhone(String phone) {
        this.phone = phone;
    }

    public String getEmail() {
        return email;
    }

    public void setEmail(String email) {
        this.email = email;
    }

    public String getNotes() {
        return notes;
    }

    public void setNotes(String notes) {
        this.notes = notes;
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

    /**
     * A background check counts as valid once it has been carried out and, when an
     * expiry date is recorded, until the day before that date.
     */
    public boolean hasValidDbsCheck(LocalDate today) {
        if (dbsCheckDate == null) {
            return false;
        }
        return dbsExpiryDate == null || today.isBefore(dbsExpiryDate);
    }

    public boolean isContactAllowed(LocalDate today) {
        if (status == null || !status.isActive()) {
            return false;
        }
        if (contactRestrictionLevel != null && !contactRestrictionLevel.permitsContact()) {
            return false;
        }
        return !dbsCheckRequired || hasValidDbsCheck(today);
    }
}
