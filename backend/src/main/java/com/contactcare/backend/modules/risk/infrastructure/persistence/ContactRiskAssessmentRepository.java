package com.contactcare.backend.modules.risk.infrastructure.persistence;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import com.contactcare.backend.modules.risk.domain.ContactRiskAssessment;
import com.contactcare.backend.modules.risk.domain.RiskAssessmentStatus;
import com.contactcare.backend.modules.risk.domain.RiskLevel;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ContactRiskAssessmentRepository extends JpaRepository<ContactRiskAssessment, UUID> {

    List<ContactRiskAssessment> findByChildIdAndFamilyMemberIdAndStatusOrderByAssessmentDateDesc(
            UUID childId,
            UUID familyMemberId,
            RiskAssessmentStatus status
    );

    List<ContactRiskAssessment> findByOrganizationIdAndStatusAndNextReviewDateLessThanEqualOrderByNextReviewDateAsc(
            UUID organizationId,
            RiskAssessmentStatus status,
            LocalDate reviewDate
    );

    long countByOrganizationIdAndStatusAndNextReviewDateLessThanEqual(
            UUID organizationId,
            RiskAssessmentStatus status,
            LocalDate reviewDate
    );

    @Query("select distinct a.organizationId from ContactRiskAssessment a where a.status = :status")
    List<UUID> findOrganizationIdsByStatus(@Param("status") RiskAssessmentStatus status);

    long countByOrganizationIdAndOverallRiskLevel(UUID organizationId, RiskLevel overallRiskLevel);

    long countByOrganizationIdAndAssessmentNumberStartingWith(UUID organizationId, String prefix);
}
