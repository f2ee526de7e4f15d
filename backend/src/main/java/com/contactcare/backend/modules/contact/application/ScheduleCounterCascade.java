package com.contactcare.backend.modules.contact.application;

import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;

import com.contactcare.backend.modules.contact.domain.ContactSchedule;
import com.contactcare.backend.modules.contact.infrastructure.persistence.ContactScheduleRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.stereotype.Component;

/**
 * Applies a counter change to a contact schedule inside the caller's transaction.
 *
 * <p>The schedule row is locked without waiting. A lock held elsewhere surfaces as
 * {@link ScheduleLockUnavailableException}; the session operation is then retried as a whole
 * in a new transaction (see {@link ContactSessionService}). Any other failure while changing
 * or writing the schedule is a {@link CascadeInconsistencyException} and rolls the caller back.
 * A schedule that no longer exists is skipped with a warning.
 */
@Component
public class ScheduleCounterCascade {

    private static final Logger log = LoggerFactory.getLogger(ScheduleCounterCascade.class);

    private final ContactScheduleRepository contactScheduleRepository;

    public ScheduleCounterCascade(ContactScheduleRepository contactScheduleRepository) {
        this.contactScheduleRepository = contactScheduleRepository;
    }

    /**
     * @return {@code true} when the schedule was updated, {@code false} when it was skipped
     */
    public boolean apply(UUID contactScheduleId, String operation, Consumer<ContactSchedule> mutation) {
        if (contactScheduleId == null) {
            return false;
        }
        Optional<ContactSchedule> locked;
        try {
            locked = contactScheduleRepository.findByIdForUpdate(contactScheduleId);
        } catch (PessimisticLockingFailureException ex) {
            throw new ScheduleLockUnavailableException(contactScheduleId, operation, ex);
        }
        if (locked.isEmpty()) {
            log.warn("[Cascade][{}] schedule={} not found, counter update skipped", operation, contactScheduleId);
            return false;
        }

        ContactSchedule schedule = locked.get();
        try {
            mutation.accept(schedule);
            contactScheduleRepository.saveAndFlush(schedule);
        } catch (IllegalStateException | DataAccessException ex) {
            throw new CascadeInconsistencyException(contactScheduleId, operation, ex);
        }
        return true;
    }
}
