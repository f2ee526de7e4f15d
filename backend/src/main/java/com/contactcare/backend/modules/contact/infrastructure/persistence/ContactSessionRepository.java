package com.contactcare.backend.modules.contact.infrastructure.persistence;

import java.util.List;
import java.util.UUID;

import com.contactcare.backend.modules.contact.domain.ContactSession;
import com.contactcare.backend.modules.contact.domain.ContactSessionStatus;

import org.springframework.data.jpa.repository.JpaRepository;

public interface ContactSessionRepository extends JpaRepository<ContactSession, UUID> {

    List<ContactSession> findByChildIdOrderBySessionDateDesc(UUID childId);

    List<ContactSession> findByChildIdAndFamilyMemberIdOrderBySessionDateDesc(UUID childId, UUID familyMemberId);

    List<ContactSession> findByOrganizationIdAndStatus(UUID organizationId, ContactSessionStatus status);

    long countByOrganizationIdAndStatus(UUID organizationId, ContactSessionStatus status);

    long countByOrganizationIdAndSessionNumberStartingWith(UUID organizationId, String prefix);
}
