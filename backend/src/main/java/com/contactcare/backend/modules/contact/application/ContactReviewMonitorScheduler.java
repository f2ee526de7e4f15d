package com.contactcare.backend.modules.contact.application;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.UUID;

import com.contactcare.backend.modules.contact.domain.ContactScheduleStatus;
import com.contactcare.backend.modules.contact.infrastructure.persistence.ContactScheduleRepository;
import com.contactcare.backend.modules.risk.application.ContactRiskAssessmentService;
import com.contactcare.backend.modules.risk.domain.RiskAssessmentStatus;
import com.contactcare.backend.modules.risk.infrastructure.persistence.ContactRiskAssessmentRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
public class ContactReviewMonitorScheduler {

    private static final Logger log = LoggerFactory.getLogger(ContactReviewMonitorScheduler.class);

    private final ContactScheduleRepository contactScheduleRepository;
    private final ContactRiskAssessmentRepository riskAssessmentRepository;
    private final ContactScheduleService contactScheduleService;
    private final ContactRiskAssessmentService riskAssessmentService;

    public ContactReviewMonitorScheduler(
            ContactScheduleRepository contactScheduleRepository,
            ContactRiskAssessmentRepository riskAssessmentRepository,
            ContactScheduleService contactScheduleService,
            ContactRiskAssessmentService riskAssessmentService
    ) {
        this.contactScheduleRepository = contactScheduleRepository;
        this.riskAssessmentRepository = riskAssessmentRepository;
        this.contactScheduleService = contactScheduleService;
        this.riskAssessmentService = riskAssessmentService;
    }

    @Scheduled(cron = "${contactcare.review-monitor.cron:0 0 7 * * *}")
    @Transactional(readOnly = true)
    public void runDailyReport() {
        int flagged = reportOutstandingReviews();
        if (flagged == 0) {
            log.info("[ReviewMonitor] no outstanding reviews");
        }
    }

    /**
     * @return number of organisations with at least one review outstanding
     */
    @Transactional(readOnly = true)
    public int reportOutstandingReviews() {
        Set<UUID> organizationIds = new LinkedHashSet<>(
                contactScheduleRepository.findOrganizationIdsByStatus(ContactScheduleStatus.ACTIVE));
        organizationIds.addAll(riskAssessmentRepository.findOrganizationIdsByStatus(RiskAssessmentStatus.APPROVED));

        int flagged = 0;
        for (UUID organizationId : organizationIds) {
            long schedulesDue = contactScheduleService.countDueForReview(organizationId);
            long assessmentsOverdue = riskAssessmentService.countOverdue(organizationId);
            if (schedulesDue > 0 || assessmentsOverdue > 0) {
                flagged++;
                log.info("[ReviewMonitor] organization={} schedulesDueForReview={} riskAssessmentsOverdue={}",
                        organizationId, schedulesDue, assessmentsOverdue);
            }
        }
        return flagged;
    }
}
