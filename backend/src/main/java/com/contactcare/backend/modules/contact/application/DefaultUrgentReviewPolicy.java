package com.contactcare.backend.modules.contact.application;

import com.contactcare.backend.modules.contact.domain.ContactSession;
import com.contactcare.backend.modules.contact.domain.InteractionQuality;

import org.springframework.stereotype.Component;

/**
 * Flags a session when safeguarding concerns were raised, contact ended early, the interaction
 * was concerning, or an incident of HIGH or CRITICAL severity occurred.
 */
@Component
public class DefaultUrgentReviewPolicy implements UrgentReviewPolicy {

    @Override
    public boolean requiresUrgentReview(ContactSession session) {
        return session.isSafeguardingConcernsRaised()
                || session.isContactTerminatedEarly()
                || session.getInteractionQuality() == InteractionQuality.CONCERNING
                || (session.getHighestIncidentSeverity() != null && session.getHighestIncidentSeverity().isSerious());
    }
}
