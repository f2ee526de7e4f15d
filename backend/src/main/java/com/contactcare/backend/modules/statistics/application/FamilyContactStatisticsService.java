package com.contactcare.backend.modules.statistics.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.contactcare.backend.modules.contact.application.ContactScheduleService;
import com.contactcare.backend.modules.contact.domain.ContactScheduleStatus;
import com.contactcare.backend.modules.contact.domain.ContactSessionStatus;
import com.contactcare.backend.modules.contact.infrastructure.persistence.ContactScheduleRepository;
import com.contactcare.backend.modules.contact.infrastructure.persistence.ContactSessionRepository;
import com.contactcare.backend.modules.family.infrastructure.persistence.FamilyMemberRepository;
import com.contactcare.backend.modules.risk.domain.RiskLevel;
import com.contactcare.backend.modules.risk.infrastructure.persistence.ContactRiskAssessmentRepository;
import com.contactcare.backend.modules.statistics.presentation.dto.FamilyContactStatisticsResponse;
import com.contactcare.backend.modules.statistics.presentation.dto.FamilyContactStatisticsResponse.FamilyMemberStats;
import com.contactcare.backend.modules.statistics.presentation.dto.FamilyContactStatisticsResponse.RiskStats;
import com.contactcare.backend.modules.statistics.presentation.dto.FamilyContactStatisticsResponse.ScheduleStats;
import com.contactcare.backend.modules.statistics.presentation.dto.FamilyContactStatisticsResponse.SessionStats;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Organisation-wide counts, recomputed on every call. The high-risk figure counts
 * assessments at exactly {@link RiskLevel#HIGH}.
 */
@Service
@Transactional(readOnly = true)
public class FamilyContactStatisticsService {

    private final FamilyMemberRepository familyMemberRepository;
    private final ContactScheduleRepository contactScheduleRepository;
    private final ContactSessionRepository contactSessionRepository;
    private final ContactRiskAssessmentRepository riskAssessmentRepository;
    private final ContactScheduleService contactScheduleService;
    private final Clock clock;

    public FamilyContactStatisticsService(
            FamilyMemberRepository familyMemberRepository,
            ContactScheduleRepository contactScheduleRepository,
            ContactSessionRepository contactSessionRepository,
            ContactRiskAssessmentRepository riskAssessmentRepository,
            ContactScheduleService contactScheduleService,
            Clock clock
    ) {
        this.familyMemberRepository = familyMemberRepository;
        this.contactScheduleRepository = contactScheduleRepository;
        this.contactSessionRepository = contactSessionRepository;
        this.riskAssessmentRepository = riskAssessmentRepository;
        this.contactScheduleService = contactScheduleService;
        this.clock = clock;
    }

    public FamilyContactStatisticsResponse getStatistics(UUID organizationId) {
        long familyMembers = familyMemberRepository.countByOrganizationId(organizationId);
        long activeSchedules = contactScheduleRepository.countByOrganizationIdAndStatus(
                organizationId, ContactScheduleStatus.ACTIVE);
        long dueForReview = contactScheduleService.countDueForReview(organizationId);
        long upcomingSessions = contactSessionRepository.countByOrganizationIdAndStatus(
                organizationId, ContactSessionStatus.SCHEDULED);
        long highRisk = riskAssessmentRepository.countByOrganizationIdAndOverallRiskLevel(
                organizationId, RiskLevel.HIGH);

        return new FamilyContactStatisticsResponse(
                organizationId,
                OffsetDateTime.now(clock),
                new FamilyMemberStats(familyMembers),
                new ScheduleStats(activeSchedules, dueForReview),
                new SessionStats(upcomingSessions),
                new RiskStats(highRisk)
        );
    }
}
