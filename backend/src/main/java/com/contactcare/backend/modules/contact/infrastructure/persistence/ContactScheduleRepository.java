package com.contactcare.backend.modules.contact.infrastructure.persistence;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;

import com.contactcare.backend.modules.contact.domain.ContactSchedule;
import com.contactcare.backend.modules.contact.domain.ContactScheduleStatus;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;

public interface ContactScheduleRepository extends JpaRepository<ContactSchedule, UUID> {

    /**
     * {@code select ... for update nowait}: a row locked elsewhere fails at once instead of blocking.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "0"))
    @Query("select s from ContactSchedule s where s.id = :id")
    Optional<ContactSchedule> findByIdForUpdate(@Param("id") UUID id);

    List<ContactSchedule> findByChildIdOrderByStartDateAsc(UUID childId);

    List<ContactSchedule> findByOrganizationIdAndStatusAndNextReviewDateLessThanEqualOrderByNextReviewDateAsc(
            UUID organizationId,
            ContactScheduleStatus status,
            LocalDate reviewDate
    );

    long countByOrganizationIdAndStatusAndNextReviewDateLessThanEqual(
            UUID organizationId,
            ContactScheduleStatus status,
            LocalDate reviewDate
    );

    @Query("select distinct s.organizationId from ContactSchedule s where s.status = :status")
    List<UUID> findOrganizationIdsByStatus(@Param("status") ContactScheduleStatus status);

    long countByOrganizationIdAndStatus(UUID organizationId, ContactScheduleStatus status);

    long countByOrganizationIdAndContactScheduleNumberStartingWith(UUID organizationId, String prefix);
}
