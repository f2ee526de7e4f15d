package com.contactcare.backend.modules.risk.application;

import java.time.Clock;
import java.time.LocalDate;
import java.time.Year;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import com.contactcare.backend.global.common.ReferenceNumberFormatter;
import com.contactcare.backend.global.error.ProblemException;
import com.contactcare.backend.modules.audit.application.AuditLogService;
import com.contactcare.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.contactcare.backend.modules.family.application.FamilyMemberService;
import com.contactcare.backend.modules.risk.domain.ContactRiskAssessment;
import com.contactcare.backend.modules.risk.domain.RiskAssessmentStatus;
import com.contactcare.backend.modules.risk.infrastructure.persistence.ContactRiskAssessmentRepository;
import com.contactcare.backend.modules.risk.presentation.dto.ApproveRiskAssessmentRequest;
import com.contactcare.backend.modules.risk.presentation.dto.CreateRiskAssessmentRequest;
import com.contactcare.backend.modules.risk.presentation.dto.RejectRiskAssessmentRequest;
import com.contactcare.backend.modules.risk.presentation.dto.RiskAssessmentResponse;
import com.contactcare.backend.modules.risk.presentation.dto.SubmitRiskAssessmentRequest;
import com.contactcare.backend.modules.risk.presentation.dto.UpdateRiskAssessmentRequest;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Risk assessments move DRAFT → PENDING_APPROVAL → APPROVED or REJECTED. A draft may also be
 * approved or rejected directly. Only approved assessments count as current, and overdue
 * detection is evaluated at query time rather than stored.
 */
@Service
@Transactional
public class ContactRiskAssessmentService {

    public static final String RISK_ASSESSMENT_NOT_FOUND = "RISK_ASSESSMENT_NOT_FOUND";
    public static final String RISK_ASSESSMENT_ALREADY_APPROVED = "RISK_ASSESSMENT_ALREADY_APPROVED";
    public static final String RISK_ASSESSMENT_NOT_PENDING = "RISK_ASSESSMENT_NOT_PENDING";

    private final ContactRiskAssessmentRepository riskAssessmentRepository;
    private final FamilyMemberService familyMemberService;
    private final AuditLogService auditLogService;
    private final Clock clock;

    public ContactRiskAssessmentService(
            ContactRiskAssessmentRepository riskAssessmentRepository,
            FamilyMemberService familyMemberService,
            AuditLogService auditLogService,
            Clock clock
    ) {
        this.riskAssessmentRepository = riskAssessmentRepository;
        this.familyMemberService = familyMemberService;
        this.auditLogService = auditLogService;
        this.clock = clock;
    }

    public RiskAssessmentResponse create(CreateRiskAssessmentRequest request) {
        familyMemberService.ensureChildExists(request.childId());
        familyMemberService.loadMember(request.familyMemberId());

        ContactRiskAssessment assessment = new ContactRiskAssessment();
        assessment.setAssessmentNumber(nextAssessmentNumber(request.organizationId()));
        assessment.setChildId(request.childId());
        assessment.setFamilyMemberId(request.familyMemberId());
        assessment.setOrganizationId(request.organizationId());
        assessment.assess(request.assessmentDate(), request.overallRiskLevel());
        assessment.setAssessedByName(request.assessedByName().trim());
        assessment.setAssessedByRole(trimToNull(request.assessedByRole()));
        assessment.setRiskSummary(trimToNull(request.riskSummary()));
        assessment.setKeyConcerns(trimToNull(request.keyConcerns()));
        assessment.setContactRecommended(request.contactRecommended());
        assessment.setRecommendationRationale(trimToNull(request.recommendationRationale()));
        assessment.setStatus(RiskAssessmentStatus.DRAFT);
        assessment.setCreatedBy(request.createdBy());

        ContactRiskAssessment saved = riskAssessmentRepository.save(assessment);
        record("RISK_ASSESSMENT_CREATED", saved, request.createdBy(), Map.of(
                "assessmentNumber", saved.getAssessmentNumber(),
                "overallRiskLevel", saved.getOverallRiskLevel().name(),
                "nextReviewDate", saved.getNextReviewDate().toString()
        ));
        return toResponse(saved);
    }

    public RiskAssessmentResponse updateDraft(UUID riskAssessmentId, UpdateRiskAssessmentRequest request) {
        ContactRiskAssessment assessment = loadAssessment(riskAssessmentId);
        if (!assessment.getStatus().isEditable()) {
            throw ProblemException.conflict(RISK_ASSESSMENT_ALREADY_APPROVED,
                    "Risk assessment " + assessment.getAssessmentNumber() + " is approved and can no longer change");
        }

        if (request.assessmentDate() != null || request.overallRiskLevel() != null) {
            assessment.assess(
                    request.assessmentDate() != null ? request.assessmentDate() : assessment.getAssessmentDate(),
                    request.overallRiskLevel() != null ? request.overallRiskLevel() : assessment.getOverallRiskLevel()
            );
        }
        if (request.riskSummary() != null) {
            assessment.setRiskSummary(trimToNull(request.riskSummary()));
        }
        if (request.keyConcerns() != null) {
            assessment.setKeyConcerns(trimToNull(request.keyConcerns()));
        }
        if (request.identifiedRisks() != null) {
            assessment.setIdentifiedRisks(request.identifiedRisks());
        }
        if (request.mitigationStrategies() != null) {
            assessment.setMitigationStrategies(request.mitigationStrategies());
        }
        if (request.contactRecommended() != null) {
            assessment.setContactRecommended(request.contactRecommended());
        }
        if (request.recommendationRationale() != null) {
            assessment.setRecommendationRationale(trimToNull(request.recommendationRationale()));
        }
        // a reworked assessment has to go through approval again
        assessment.setStatus(RiskAssessmentStatus.DRAFT);
        assessment.setUpdatedBy(request.updatedBy());
        assessment.incrementVersion();

        ContactRiskAssessment saved = riskAssessmentRepository.save(assessment);
        record("RISK_ASSESSMENT_UPDATED", saved, request.updatedBy(), Map.of(
                "overallRiskLevel", saved.getOverallRiskLevel().name(),
                "version", saved.getVersion()
        ));
        return toResponse(saved);
    }

    public RiskAssessmentResponse submitForApproval(UUID riskAssessmentId, SubmitRiskAssessmentRequest request) {
        ContactRiskAssessment assessment = loadAssessment(riskAssessmentId);
        if (assessment.getStatus() != RiskAssessmentStatus.DRAFT) {
            throw ProblemException.conflict(RISK_ASSESSMENT_NOT_PENDING,
                    "Only a draft can be submitted, status is " + assessment.getStatus());
        }
        assessment.setStatus(RiskAssessmentStatus.PENDING_APPROVAL);
        assessment.setUpdatedBy(request.submittedBy());
        assessment.incrementVersion();

        ContactRiskAssessment saved = riskAssessmentRepository.save(assessment);
        record("RISK_ASSESSMENT_SUBMITTED", saved, request.submittedBy(), Map.of());
        return toResponse(saved);
    }

    public RiskAssessmentResponse approve(UUID riskAssessmentId, ApproveRiskAssessmentRequest request) {
        ContactRiskAssessment assessment = loadAssessment(riskAssessmentId);
        ensureAwaitingDecision(assessment);

        assessment.approve(
                request.approvedBy(),
                trimToNull(request.approvedByName()),
                trimToNull(request.approvedByRole()),
                LocalDate.now(clock)
        );
        assessment.mergeApprovalComments(trimToNull(request.approvalComments()));
        assessment.incrementVersion();

        ContactRiskAssessment saved = riskAssessmentRepository.save(assessment);
        record("RISK_ASSESSMENT_APPROVED", saved, request.approvedBy(), Map.of(
                "approvalDate", saved.getApprovalDate().toString(),
                "nextReviewDate", saved.getNextReviewDate().toString()
        ));
        return toResponse(saved);
    }

    public RiskAssessmentResponse reject(UUID riskAssessmentId, RejectRiskAssessmentRequest request) {
        ContactRiskAssessment assessment = loadAssessment(riskAssessmentId);
        ensureAwaitingDecision(assessment);

        assessment.reject(request.rejectedBy());
        assessment.mergeApprovalComments("Rejected: " + request.reason().trim());
        assessment.incrementVersion();

        ContactRiskAssessment saved = riskAssessmentRepository.save(assessment);
        record("RISK_ASSESSMENT_REJECTED", saved, request.rejectedBy(), Map.of("reason", request.reason().trim()));
        return toResponse(saved);
    }

    @Transactional(readOnly = true)
    public RiskAssessmentResponse get(UUID riskAssessmentId) {
        return toResponse(loadAssessment(riskAssessmentId));
    }

    /**
     * The most recent approved assessment for the pair that is still within its review period.
     */
    @Transactional(readOnly = true)
    public Optional<RiskAssessmentResponse> getCurrent(UUID childId, UUID familyMemberId) {
        LocalDate today = LocalDate.now(clock);
        return riskAssessmentRepository
                .findByChildIdAndFamilyMemberIdAndStatusOrderByAssessmentDateDesc(
                        childId, familyMemberId, RiskAssessmentStatus.APPROVED)
                .stream()
                .filter(assessment -> assessment.isCurrent(today))
                .findFirst()
                .map(this::toResponse);
    }

    @Transactional(readOnly = true)
    public List<RiskAssessmentResponse> listOverdue(UUID organizationId) {
        return findOverdue(organizationId).stream()
                .map(this::toResponse)
                .toList();
    }

    @Transactional(readOnly = true)
    public long countOverdue(UUID organizationId) {
        return riskAssessmentRepository.countByOrganizationIdAndStatusAndNextReviewDateLessThanEqual(
                organizationId, RiskAssessmentStatus.APPROVED, LocalDate.now(clock));
    }

    private List<ContactRiskAssessment> findOverdue(UUID organizationId) {
        return riskAssessmentRepository
                .findByOrganizationIdAndStatusAndNextReviewDateLessThanEqualOrderByNextReviewDateAsc(
                        organizationId, RiskAssessmentStatus.APPROVED, LocalDate.now(clock));
    }

    private void ensureAwaitingDecision(ContactRiskAssessment assessment) {
        if (!assessment.getStatus().isAwaitingDecision()) {
            throw ProblemException.conflict(RISK_ASSESSMENT_NOT_PENDING,
                    "Risk assessment " + assessment.getAssessmentNumber() + " is already " + assessment.getStatus());
        }
    }

    private ContactRiskAssessment loadAssessment(UUID riskAssessmentId) {
        return riskAssessmentRepository.findById(riskAssessmentId)
                .orElseThrow(() -> ProblemException.notFound(RISK_ASSESSMENT_NOT_FOUND, riskAssessmentId));
    }

    private void record(String actionType, ContactRiskAssessment assessment, String actor, Map<String, Object> detail) {
        auditLogService.record(AuditLogCommand.of(
                actionType,
                AuditLogService.RESOURCE_RISK_ASSESSMENT,
                assessment.getId(),
                assessment.getOrganizationId(),
                actor
        ).withDetail(detail));
    }

    private String nextAssessmentNumber(UUID organizationId) {
        Year year = Year.now(clock);
        String prefix = ReferenceNumberFormatter.yearPrefix(ReferenceNumberFormatter.RISK_ASSESSMENT_PREFIX, year);
        long existing = riskAssessmentRepository.countByOrganizationIdAndAssessmentNumberStartingWith(
                organizationId, prefix);
        return ReferenceNumberFormatter.format(ReferenceNumberFormatter.RISK_ASSESSMENT_PREFIX, year, existing + 1, 4);
    }

    private String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private RiskAssessmentResponse toResponse(ContactRiskAssessment assessment) {
        LocalDate today = LocalDate.now(clock);
        return new RiskAssessmentResponse(
                assessment.getId(),
                assessment.getAssessmentNumber(),
                assessment.getChildId(),
                assessment.getFamilyMemberId(),
                assessment.getOrganizationId(),
                assessment.getAssessmentDate(),
                assessment.getAssessedByName(),
                assessment.getAssessedByRole(),
                assessment.getOverallRiskLevel().name(),
                assessment.getRiskSummary(),
                assessment.getKeyConcerns(),
                List.copyOf(assessment.getIdentifiedRisks()),
                List.copyOf(assessment.getMitigationStrategies()),
                assessment.isContactRecommended(),
                assessment.getRecommendationRationale(),
                assessment.getStatus().name(),
                assessment.getApprovedBy(),
                assessment.getApprovedByName(),
                assessment.getApprovedByRole(),
                assessment.getApprovalDate(),
                assessment.getApprovalComments(),
                assessment.getNextReviewDate(),
                assessment.getReviewFrequencyMonths(),
                assessment.isCurrent(today),
                assessment.isReviewOverdue(today),
                assessment.getVersion(),
                assessment.getCreatedAt(),
                assessment.getUpdatedAt()
        );
    }
}
