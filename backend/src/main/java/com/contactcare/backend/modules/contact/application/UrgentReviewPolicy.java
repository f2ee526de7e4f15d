package com.contactcare.backend.modules.contact.application;

import com.contactcare.backend.modules.contact.domain.ContactSession;

/**
 * Decides whether a completed contact session needs urgent review by the social work team.
 * Declare a {@code @Primary} bean of this type to replace {@link DefaultUrgentReviewPolicy}.
 */
@FunctionalInterface
public interface UrgentReviewPolicy {

    boolean requiresUrgentReview(ContactSession session);
}
