package com.contactcare.backend.modules.statistics;

import static com.contactcare.backend.support.TestEntities.ORGANIZATION_ID;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import com.contactcare.backend.modules.audit.application.AuditLogService;
import com.contactcare.backend.modules.child.infrastructure.persistence.ChildRepository;
import com.contactcare.backend.modules.contact.application.ContactScheduleService;
import com.contactcare.backend.modules.contact.application.ScheduleCounterCascade;
import com.contactcare.backend.modules.contact.domain.ContactScheduleStatus;
import com.contactcare.backend.modules.contact.domain.ContactSessionStatus;
import com.contactcare.backend.modules.contact.infrastructure.persistence.ContactScheduleRepository;
import com.contactcare.backend.modules.contact.infrastructure.persistence.ContactSessionRepository;
import com.contactcare.backend.modules.family.application.FamilyMemberService;
import com.contactcare.backend.modules.family.infrastructure.persistence.FamilyMemberRepository;
import com.contactcare.backend.modules.risk.domain.RiskLevel;
import com.contactcare.backend.modules.risk.infrastructure.persistence.ContactRiskAssessmentRepository;
import com.contactcare.backend.modules.statistics.application.FamilyContactStatisticsService;
import com.contactcare.backend.modules.statistics.presentation.dto.FamilyContactStatisticsResponse;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class FamilyContactStatisticsServiceTest {

    @Mock
    private FamilyMemberRepository familyMemberRepository;

    @Mock
    private ContactScheduleRepository contactScheduleRepository;

    @Mock
    private ContactSessionRepository contactSessionRepository;

    @Mock
    private ContactRiskAssessmentRepository riskAssessmentRepository;

    @Mock
    private ChildRepository childRepository;

    @Mock
    private AuditLogService auditLogService;

    @Test
    void countsEachFigureForTheOrganisation() {
        Clock clock = Clock.fixed(OffsetDateTime.parse("2025-07-01T06:00:00Z").toInstant(), ZoneOffset.UTC);
        ContactScheduleService contactScheduleService = new ContactScheduleService(
                contactScheduleRepository,
                new FamilyMemberService(familyMemberRepository, childRepository, auditLogService, clock),
                new ScheduleCounterCascade(contactScheduleRepository),
                auditLogService,
                clock
        );
        FamilyContactStatisticsService statisticsService = new FamilyContactStatisticsService(
                familyMemberRepository,
                contactScheduleRepository,
                contactSessionRepository,
                riskAssessmentRepository,
                contactScheduleService,
                clock
        );

        when(familyMemberRepository.countByOrganizationId(ORGANIZATION_ID)).thenReturn(4L);
        when(contactScheduleRepository.countByOrganizationIdAndStatus(ORGANIZATION_ID, ContactScheduleStatus.ACTIVE))
                .thenReturn(2L);
        when(contactScheduleRepository.countByOrganizationIdAndStatusAndNextReviewDateLessThanEqual(
                ORGANIZATION_ID, ContactScheduleStatus.ACTIVE, LocalDate.of(2025, 7, 1)))
                .thenReturn(1L);
        when(contactSessionRepository.countByOrganizationIdAndStatus(ORGANIZATION_ID, ContactSessionStatus.SCHEDULED))
                .thenReturn(5L);
        when(riskAssessmentRepository.countByOrganizationIdAndOverallRiskLevel(ORGANIZATION_ID, RiskLevel.HIGH))
                .thenReturn(1L);

        FamilyContactStatisticsResponse statistics = statisticsService.getStatistics(ORGANIZATION_ID);

        assertThat(statistics.familyMembers().total()).isEqualTo(4);
        assertThat(statistics.schedules().active()).isEqualTo(2);
        assertThat(statistics.schedules().dueForReview()).isEqualTo(1);
        assertThat(statistics.sessions().upcoming()).isEqualTo(5);
        assertThat(statistics.riskAssessments().highRisk()).isEqualTo(1);
        assertThat(statistics.generatedAt()).isEqualTo(OffsetDateTime.parse("2025-07-01T06:00:00Z"));
    }
}
