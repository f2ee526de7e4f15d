package com.contactcare.backend.modules.family.application;

import java.time.Clock;
import java.time.LocalDate;
import java.time.Year;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.contactcare.backend.global.common.ReferenceNumberFormatter;
import com.contactcare.backend.global.error.ProblemException;
import com.contactcare.backend.modules.audit.application.AuditLogService;
import com.contactcare.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.contactcare.backend.modules.child.infrastructure.persistence.ChildRepository;
import com.contactcare.backend.modules.family.domain.ContactRestrictionLevel;
import com.contactcare.backend.modules.family.domain.FamilyMember;
import com.contactcare.backend.modules.family.domain.FamilyMemberStatus;
import com.contactcare.backend.modules.family.infrastructure.persistence.FamilyMemberRepository;
import com.contactcare.backend.modules.family.presentation.dto.FamilyMemberResponse;
import com.contactcare.backend.modules.family.presentation.dto.RegisterFamilyMemberRequest;
import com.contactcare.backend.modules.family.presentation.dto.UpdateFamilyMemberRequest;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class FamilyMemberService {

    public static final String FAMILY_MEMBER_NOT_FOUND = "FAMILY_MEMBER_NOT_FOUND";
    public static final String CHILD_NOT_FOUND = "CHILD_NOT_FOUND";

    private final FamilyMemberRepository familyMemberRepository;
    private final ChildRepository childRepository;
    private final AuditLogService auditLogService;
    private final Clock clock;

    public FamilyMemberService(
            FamilyMemberRepository familyMemberRepository,
            ChildRepository childRepository,
            AuditLogService auditLogService,
            Clock clock
    ) {
        this.familyMemberRepository = familyMemberRepository;
        this.childRepository = childRepository;
        this.auditLogService = auditLogService;
        this.clock = clock;
    }

    public FamilyMemberResponse register(RegisterFamilyMemberRequest request) {
        ensureChildExists(request.childId());

        FamilyMember member = new FamilyMember();
        member.setFamilyMemberNumber(nextFamilyMemberNumber(request.organizationId()));
        member.setChildId(request.childId());
        member.setOrganizationId(request.organizationId());
        member.setFirstName(request.firstName().trim());
        member.setLastName(request.lastName().trim());
        member.setRelationshipType(request.relationshipType());
        member.setHasParentalResponsibility(request.hasParentalResponsibility());
        member.setContactRestrictionLevel(request.contactRestrictionLevel() != null
                ? request.contactRestrictionLevel()
                : ContactRestrictionLevel.NONE);
        member.setDbsCheckRequired(request.dbsCheckRequired());
        member.setDbsCheckDate(request.dbsCheckDate());
        member.setDbsExpiryDate(request.dbsExpiryDate());
        member.setPhone(trimToNull(request.phone()));
        member.setEmail(trimToNull(request.email()));
        member.setNotes(trimToNull(request.notes()));
        member.setStatus(FamilyMemberStatus.ACTIVE);
        member.setCreatedBy(request.createdBy());

        FamilyMember saved = familyMemberRepository.save(member);
        auditLogService.record(AuditLogCommand.of(
                "FAMILY_MEMBER_REGISTERED",
                AuditLogService.RESOURCE_FAMILY_MEMBER,
                saved.getId(),
                saved.getOrganizationId(),
                request.createdBy()
        ).withDetail(Map.of(
                "familyMemberNumber", saved.getFamilyMemberNumber(),
                "relationshipType", saved.getRelationshipType().name()
        )));
        return toResponse(saved);
    }

    public FamilyMemberResponse update(UUID familyMemberId, UpdateFamilyMemberRequest request) {
        FamilyMember member = loadMember(familyMemberId);
        FamilyMemberStatus previousStatus = member.getStatus();

        if (request.firstName() != null) {
            member.setFirstName(request.firstName().trim());
        }
        if (request.lastName() != null) {
            member.setLastName(request.lastName().trim());
        }
        if (request.relationshipType() != null) {
            member.setRelationshipType(request.relationshipType());
        }
        if (request.hasParentalResponsibility() != null) {
            member.setHasParentalResponsibility(request.hasParentalResponsibility());
        }
        if (request.status() != null) {
            member.setStatus(request.status());
        }
        if (request.contactRestrictionLevel() != null) {
            member.setContactRestrictionLevel(request.contactRestrictionLevel());
        }
        if (request.dbsCheckRequired() != null) {
            member.setDbsCheckRequired(request.dbsCheckRequired());
        }
        if (request.dbsCheckDate() != null) {
            member.setDbsCheckDate(request.dbsCheckDate());
        }
        if (request.dbsExpiryDate() != null) {
            member.setDbsExpiryDate(request.dbsExpiryDate());
        }
        if (request.phone() != null) {
            member.setPhone(trimToNull(request.phone()));
        }
        if (request.email() != null) {
            member.setEmail(trimToNull(request.email()));
        }
        if (request.notes() != null) {
            member.setNotes(trimToNull(request.notes()));
        }
        member.setUpdatedBy(request.updatedBy());
        member.incrementVersion();

        FamilyMember saved = familyMemberRepository.save(member);
        auditLogService.record(AuditLogCommand.of(
                "FAMILY_MEMBER_UPDATED",
                AuditLogService.RESOURCE_FAMILY_MEMBER,
                saved.getId(),
                saved.getOrganizationId(),
                request.updatedBy()
        ).withDetail(Map.of(
                "previousStatus", previousStatus.name(),
                "status", saved.getStatus().name(),
                "version", saved.getVersion()
        )));
        return toResponse(saved);
    }

    @Transactional(readOnly = true)
    public FamilyMemberResponse get(UUID familyMemberId) {
        return toResponse(loadMember(familyMemberId));
    }

    @Transactional(readOnly = true)
    public List<FamilyMemberResponse> listForChild(UUID childId, boolean activeOnly) {
        List<FamilyMember> members = activeOnly
                ? familyMemberRepository.findByChildIdAndStatusOrderByRelationshipTypeAscLastNameAsc(
                        childId, FamilyMemberStatus.ACTIVE)
                : familyMemberRepository.findByChildIdOrderByRelationshipTypeAscLastNameAsc(childId);
        return members.stream()
                .map(this::toResponse)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<FamilyMemberResponse> listExpiredBackgroundChecks(UUID organizationId) {
        LocalDate today = LocalDate.now(clock);
        return familyMemberRepository.findByOrganizationIdAndDbsCheckRequiredTrue(organizationId).stream()
                .filter(member -> !member.hasValidDbsCheck(today))
                .map(this::toResponse)
                .toList();
    }

    public boolean isContactAllowed(FamilyMember member) {
        return member.isContactAllowed(LocalDate.now(clock));
    }

    /**
     * Loads a member for other modules that need the entity itself, such as the
     * contact-permission check on schedule creation.
     */
    @Transactional(readOnly = true)
    public FamilyMember loadMember(UUID familyMemberId) {
        return familyMemberRepository.findById(familyMemberId)
                .orElseThrow(() -> ProblemException.notFound(FAMILY_MEMBER_NOT_FOUND, familyMemberId));
    }

    @Transactional(readOnly = true)
    public void ensureChildExists(UUID childId) {
        if (childId == null || !childRepository.existsById(childId)) {
            throw ProblemException.notFound(CHILD_NOT_FOUND, childId);
        }
    }

    private String nextFamilyMemberNumber(UUID organizationId) {
        Year year = Year.now(clock);
        String prefix = ReferenceNumberFormatter.yearPrefix(ReferenceNumberFormatter.FAMILY_MEMBER_PREFIX, year);
        long existing = familyMemberRepository.countByOrganizationIdAndFamilyMemberNumberStartingWith(
                organizationId, prefix);
        return ReferenceNumberFormatter.format(ReferenceNumberFormatter.FAMILY_MEMBER_PREFIX, year, existing + 1, 4);
    }

    private String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private FamilyMemberResponse toResponse(FamilyMember member) {
        return new FamilyMemberResponse(
                member.getId(),
                member.getFamilyMemberNumber(),
                member.getChildId(),
                member.getOrganizationId(),
                member.getFirstName(),
                member.getLastName(),
                member.getRelationshipType() != null ? member.getRelationshipType().name() : null,
                member.isHasParentalResponsibility(),
                member.getStatus().name(),
                member.getContactRestrictionLevel().name(),
                member.isDbsCheckRequired(),
                member.getDbsCheckDate(),
                member.getDbsExpiryDate(),
                isContactAllowed(member),
                member.getPhone(),
                member.getEmail(),
                member.getNotes(),
                member.getVersion(),
                member.getCreatedAt(),
                member.getUpdatedAt()
        );
    }
}
