package com.contactcare.backend.modules.contact;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.contactcare.backend.modules.audit.domain.AuditLog;
import com.contactcare.backend.modules.audit.infrastructure.AuditLogRepository;
import com.contactcare.backend.modules.child.domain.Child;
import com.contactcare.backend.modules.child.infrastructure.persistence.ChildRepository;
import com.contactcare.backend.modules.contact.domain.ContactSchedule;
import com.contactcare.backend.modules.contact.infrastructure.persistence.ContactScheduleRepository;
import com.contactcare.backend.support.AbstractPostgresIntegrationTest;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

@SpringBootTest
@AutoConfigureMockMvc
class FamilyContactIntegrationTest extends AbstractPostgresIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private ChildRepository childRepository;

    @Autowired
    private AuditLogRepository auditLogRepository;

    @Autowired
    private ContactScheduleRepository contactScheduleRepository;

    @Autowired
    private Clock clock;

    private UUID organizationId;
    private UUID childId;

    @BeforeEach
    void setUp() {
        organizationId = UUID.randomUUID();
        Child child = new Child();
        child.setOrganizationId(organizationId);
        child.setFirstName("Riley");
        child.setLastName("Jones");
        childId = childRepository.save(child).getId();
    }

    @Test
    void weeklyContactLifecycle() throws Exception {
        UUID memberId = registerParent();

        JsonNode schedule = postJson("/family-contact/schedules", Map.of(
                "childId", childId,
                "familyMemberId", memberId,
                "organizationId", organizationId,
                "contactType", "FACE_TO_FACE",
                "contactFrequency", "WEEKLY",
                "supervisionRequired", true,
                "startDate", "2025-01-01",
                "createdBy", "social.worker"
        ), 201);
        assertThat(schedule.get("nextReviewDate").asText()).isEqualTo("2025-07-01");
        assertThat(schedule.get("contactScheduleNumber").asText()).matches("CS-\\d{4}-0001");
        UUID scheduleId = UUID.fromString(schedule.get("contactScheduleId").asText());

        JsonNode session = postJson("/family-contact/sessions", Map.of(
                "childId", childId,
                "familyMemberId", memberId,
                "contactScheduleId", scheduleId,
                "organizationId", organizationId,
                "sessionDate", "2025-01-08",
                "scheduledStartTime", "10:00",
                "scheduledEndTime", "11:30",
                "supervised", true,
                "createdBy", "social.worker"
        ), 201);
        assertThat(session.get("sessionNumber").asText()).matches("SESS-\\d{4}-00001");
        UUID sessionId = UUID.fromString(session.get("contactSessionId").asText());

        JsonNode completed = postJson("/family-contact/sessions/" + sessionId + "/complete", Map.of(
                "actualStartTime", "10:00",
                "actualEndTime", "11:15",
                "interactionQuality", "GOOD",
                "completedBy", "carer"
        ), 200);
        assertThat(completed.get("status").asText()).isEqualTo("COMPLETED");
        assertThat(completed.get("durationMinutes").asInt()).isEqualTo(75);

        mockMvc.perform(get("/family-contact/schedules/{id}", scheduleId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalContactsScheduled").value(1))
                .andExpect(jsonPath("$.totalContactsCompleted").value(1))
                .andExpect(jsonPath("$.lastContactDate").value("2025-01-08"))
                .andExpect(jsonPath("$.nextContactDate").value("2025-01-15"));

        mockMvc.perform(post("/family-contact/sessions/{id}/cancel", sessionId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"cancelledBy\": \"carer\", \"cancellationReason\": \"late\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("SESSION_ALREADY_CLOSED"));

        List<AuditLog> sessionAudit = auditLogRepository
                .findByResourceTypeAndResourceKeyOrderByCreatedAtAsc("CONTACT_SESSION", sessionId.toString());
        assertThat(sessionAudit).extracting(AuditLog::getActionType)
                .containsExactly("CONTACT_SESSION_SCHEDULED", "CONTACT_SESSION_COMPLETED");
    }

    @Test
    void suspendedMemberCannotGetNewSchedule() throws Exception {
        UUID memberId = registerParent();
        mockMvc.perform(patch("/family-contact/family-members/{id}", memberId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\": \"SUSPENDED\", \"updatedBy\": \"manager\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.contactAllowed").value(false));

        mockMvc.perform(post("/family-contact/schedules")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of(
                                "childId", childId,
                                "familyMemberId", memberId,
                                "organizationId", organizationId,
                                "contactType", "TELEPHONE",
                                "contactFrequency", "MONTHLY",
                                "startDate", "2025-01-01",
                                "createdBy", "social.worker"))))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("CONTACT_NOT_ALLOWED"));
    }

    @Test
    void approvedCriticalAssessmentBecomesCurrentAndCountsInStatistics() throws Exception {
        UUID memberId = registerParent();

        JsonNode assessment = postJson("/family-contact/risk-assessments", Map.of(
                "childId", childId,
                "familyMemberId", memberId,
                "organizationId", organizationId,
                "assessmentDate", "2025-01-01",
                "assessedByName", "Alex Morgan",
                "overallRiskLevel", "CRITICAL",
                "contactRecommended", false,
                "createdBy", "social.worker"
        ), 201);
        assertThat(assessment.get("nextReviewDate").asText()).isEqualTo("2025-04-01");
        assertThat(assessment.get("reviewFrequencyMonths").asInt()).isEqualTo(3);
        UUID assessmentId = UUID.fromString(assessment.get("riskAssessmentId").asText());

        postJson("/family-contact/risk-assessments/" + assessmentId + "/approve",
                Map.of("approvedBy", "manager-1"), 200);

        // review fell due on 2025-04-01
        mockMvc.perform(get("/family-contact/risk-assessments/overdue")
                        .param("organizationId", organizationId.toString()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].riskAssessmentId").value(assessmentId.toString()));

        mockMvc.perform(get("/family-contact/statistics").param("organizationId", organizationId.toString()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.familyMembers.total").value(1))
                .andExpect(jsonPath("$.riskAssessments.highRisk").value(0));
    }

    @Test
    void sessionForAnotherChildsScheduleLeavesItUntouched() throws Exception {
        UUID memberId = registerParent();
        UUID scheduleId = createWeeklySchedule(memberId, "2025-01-01");

        Child sibling = new Child();
        sibling.setOrganizationId(organizationId);
        sibling.setFirstName("Jamie");
        sibling.setLastName("Jones");
        UUID siblingId = childRepository.save(sibling).getId();

        mockMvc.perform(post("/family-contact/sessions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of(
                                "childId", siblingId,
                                "familyMemberId", memberId,
                                "contactScheduleId", scheduleId,
                                "organizationId", UUID.randomUUID(),
                                "sessionDate", "2025-01-08",
                                "scheduledStartTime", "10:00",
                                "scheduledEndTime", "11:30",
                                "createdBy", "social.worker"))))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("SCHEDULE_MISMATCH"));

        mockMvc.perform(get("/family-contact/schedules/{id}", scheduleId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalContactsScheduled").value(0));
    }

    @Test
    void scheduleIsDueForReviewOnItsReviewDate() throws Exception {
        UUID memberId = registerParent();
        UUID dueToday = createWeeklySchedule(memberId, "2025-01-01");
        UUID dueTomorrow = createWeeklySchedule(memberId, "2025-01-01");
        LocalDate today = LocalDate.now(clock);
        moveReviewDate(dueToday, today);
        moveReviewDate(dueTomorrow, today.plusDays(1));

        mockMvc.perform(get("/family-contact/schedules/due-for-review")
                        .param("organizationId", organizationId.toString()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].contactScheduleId").value(dueToday.toString()));
    }

    private UUID createWeeklySchedule(UUID memberId, String startDate) throws Exception {
        JsonNode schedule = postJson("/family-contact/schedules", Map.of(
                "childId", childId,
                "familyMemberId", memberId,
                "organizationId", organizationId,
                "contactType", "FACE_TO_FACE",
                "contactFrequency", "WEEKLY",
                "startDate", startDate,
                "createdBy", "social.worker"
        ), 201);
        return UUID.fromString(schedule.get("contactScheduleId").asText());
    }

    private void moveReviewDate(UUID scheduleId, LocalDate reviewDate) {
        ContactSchedule schedule = contactScheduleRepository.findById(scheduleId).orElseThrow();
        schedule.setNextReviewDate(reviewDate);
        contactScheduleRepository.save(schedule);
    }

    private UUID registerParent() throws Exception {
        JsonNode member = postJson("/family-contact/family-members", Map.of(
                "childId", childId,
                "organizationId", organizationId,
                "firstName", "Sam",
                "lastName", "Taylor",
                "relationshipType", "PARENT",
                "hasParentalResponsibility", true,
                "createdBy", "social.worker"
        ), 201);
        assertThat(member.get("status").asText()).isEqualTo("ACTIVE");
        return UUID.fromString(member.get("familyMemberId").asText());
    }

    private JsonNode postJson(String path, Map<String, Object> body, int expectedStatus) throws Exception {
        MvcResult result = mockMvc.perform(post(path)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(body)))
                .andExpect(status().is(expectedStatus))
                .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }
}
