package com.contactcare.backend.modules.family.infrastructure.persistence;

import java.util.List;
import java.util.UUID;

import com.contactcare.backend.modules.family.domain.FamilyMember;
import com.contactcare.backend.modules.family.domain.FamilyMemberStatus;

import org.springframework.data.jpa.repository.JpaRepository;

public interface FamilyMemberRepository extends JpaRepository<FamilyMember, UUID> {

    List<FamilyMember> findByChildIdOrderByRelationshipTypeAscLastNameAsc(UUID childId);

    List<FamilyMember> findByChildIdAndStatusOrderByRelationshipTypeAscLastNameAsc(
            UUID childId,
            FamilyMemberStatus status
    );

    List<FamilyMember> findByOrganizationIdAndDbsCheckRequiredTrue(UUID organizationId);

    long countByOrganizationId(UUID organizationId);

    long countByOrganizationIdAndFamilyMemberNumberStartingWith(UUID organizationId, String prefix);
}
