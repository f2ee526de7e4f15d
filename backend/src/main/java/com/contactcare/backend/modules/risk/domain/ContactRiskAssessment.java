package com.contactcare.backend.modules.risk.domain;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import com.contactcare.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UuidGenerator;
import org.hibernate.type.SqlTypes;

@Entity
@Table(name = "contact_risk_assessment")
public class ContactRiskAssessment extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "assessment_number", nullable = false, length = 50, updatable = false)
    private String assessmentNumber;

    @Column(name = "child_id", nullable = false, columnDefinition = "uuid")
    private UUID childId;

    @Column(name = "family_member_id", nullable = false, columnDefinition = "uuid")
    private UUID familyMemberId;

    @Column(name = "organization_id", nullable = false, columnDefinition = "uuid")
    private UUID organizationId;

    @Column(name = "assessment_date", nullable = false)
    private LocalDate assessmentDate;

    @Column(name = "assessed_by_name", nullable = false, length = 200)
    private String assessedByName;

    @Column(name = "assessed_by_role", length = 100)
    private String assessedByRole;

    @Enumerated(EnumType.STRING)
    @Column(name = "overall_risk_level", nullable = false, length = 16)
    private RiskLevel overallRiskLevel;

    @Column(name = "risk_summary")
    private String riskSummary;

    @Column(name = "key_concerns")
    private String keyConcerns;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "identified_risks", nullable = false, columnDefinition = "jsonb")
    private List<String> identifiedRisks = new ArrayList<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "mitigation_strategies", nullable = false, columnDefinition = "jsonb")
    private List<String> mitigationStrategies = new ArrayList<>();

    @Column(name = "contact_recommended", nullable = false)
    private boolean contactRecommended;

    @Column(name = "recommendation_rationale")
    private String recommendationRationale;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 24)
    private RiskAssessmentStatus status = RiskAssessmentStatus.DRAFT;

    @Column(name = "approved_by", length = 200)
    private String approvedBy;

    @Column(name = "approved_by_name", length = 200)
    private String approvedByName;

    @Column(name = "approved_by_role", length = 100)
    private String approvedByRole;

    @Column(name = "approval_date")
    private LocalDate approvalDate;

    @Column(name = "approval_comments")
    private String approvalComments;

    @Column(name = "next_review_date", nullable = false)
    private LocalDate nextReviewDate;

    @Column(name = "review_frequency_months", nullable = false)
    private int reviewFrequencyMonths;

    @Column(name = "created_by", nullable = false, length = 200, updatable = false)
    private String createdBy;

    @Column(name = "updated_by", length = 200)
    private String updatedBy;

    @Column(name = "version", nullable = false)
    private int version = 1;

    public UUID getId() {
        return id;
    }

    public String getAssessmentNumber() {
        return assessmentNumber;
    }

    public void setAssessmentNumber(String assessmentNumber) {
        this.assessmentNumber = assessmentNumber;
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

    public LocalDate getAssessmentDate() {
        return assessmentDate;
    }

    public String getAssessedByName() {
        return assessedByName;
    }

    public void setAssessedByName(String assessedByName) {
        this.assessedByName = assessedByName;
    }

    public String getAssessedByRole() {
        return assessedByRole;
    }

    public void setAssessedByRole(String assessedByRole) {
        this.assessedByRole = assessedByRole;
    }

    public RiskLevel getOverallRiskLevel() {
        return overallRiskLevel;
    }

    public String getRiskSummary() {
        return riskSummary;
    }

    public void setRiskSummary(String riskSummary) {
        this.riskSummary = riskSummary;
    }

    public String getKeyConcerns() {
        return keyConcerns;
    }

    public void setKeyConcerns(String keyConcerns) {
        this.keyConcerns = keyConcerns;
    }

    public List<String> getIdentifiedRisks() {
        return identifiedRisks;
    }

    public void setIdentifiedRisks(List<String> identifiedRisks) {
        this.identifiedRisks = new ArrayList<>(identifiedRisks);
    }

    public List<String> getMitigationStrategies() {
        return mitigationStrategies;
    }

    public void setMitigationStrategies(List<String> mitigationStrategies) {
        this.mitigationStrategies = new ArrayList<>(mitigationStrategies);
    }

    public boolean isContactRecommended() {
        return contactRecommended;
    }

    public void setContactRecommended(boolean contactRecommended) {
        this.contactRecommended = contactRecommended;
    }

    public String getRecommendationRationale() {
        return recommendationRationale;
    }

    public void setRecommendationRationale(String recommendationRationale) {
        this.recommendationRationale = recommendationRationale;
    }

    public RiskAssessmentStatus getStatus() {
        return status;
    }

    public void setStatus(RiskAssessmentStatus status) {
        this.status = status;
    }

    public String getApprovedBy() {
        return approvedBy;
    }

    public String getApprovedByName() {
        return approvedByName;
    }

    public String getApprovedByRole() {
        return approvedByRole;
    }

    public LocalDate getApprovalDate() {
        return approvalDate;
    }

    public String getApprovalComments() {
        return approvalComments;
    }

    public LocalDate getNextReviewDate() {
        return nextReviewDate;
    }

    public int getReviewFrequencyMonths() {
        return reviewFrequencyMonths;
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
     * Sets the date and level together and derives the review cadence from them.
     */
    public void assess(LocalDate assessmentDate, RiskLevel overallRiskLevel) {
        this.assessmentDate = assessmentDate;
        this.overallRiskLevel = overallRiskLevel;
        this.reviewFrequencyMonths = overallRiskLevel.reviewMonths();
        this.nextReviewDate = assessmentDate.plusMonths(reviewFrequencyMonths);
    }

    public void approve(String approvedBy, String approvedByName, String approvedByRole, LocalDate approvalDate) {
        this.status = RiskAssessmentStatus.APPROVED;
        this.approvedBy = approvedBy;
        this.approvedByName = approvedByName;
        this.approvedByRole = approvedByRole;
        this.approvalDate = approvalDate;
        this.updatedBy = approvedBy;
    }

    public void reject(String rejectedBy) {
        this.status = RiskAssessmentStatus.REJECTED;
        this.updatedBy = rejectedBy;
    }

    public void mergeApprovalComments(String comments) {
        if (comments == null || comments.isBlank()) {
            return;
        }
        this.approvalComments = (approvalComments == null || approvalComments.isEmpty())
                ? comments
                : approvalComments + "\n\n" + comments;
    }

    public boolean isApproved() {
        return status == RiskAssessmentStatus.APPROVED;
    }

    public boolean isCurrent(LocalDate today) {
        return isApproved() && today.isBefore(nextReviewDate);
    }

    public boolean isReviewOverdue(LocalDate today) {
        return isApproved() && !today.isBefore(nextReviewDate);
    }
}
