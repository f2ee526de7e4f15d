package com.contactcare.backend.modules.contact;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import com.contactcare.backend.global.error.ProblemException;
import com.contactcare.backend.global.web.RequestIdFilter;
import com.contactcare.backend.modules.contact.application.CascadeInconsistencyException;
import com.contactcare.backend.modules.contact.application.ContactSessionService;
import com.contactcare.backend.modules.contact.presentation.ContactSessionController;
import com.contactcare.backend.modules.contact.presentation.dto.CompleteContactSessionRequest;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(controllers = ContactSessionController.class)
class ContactSessionControllerTest {

    private static final UUID SESSION_ID = UUID.fromString("00000000-0000-0000-0000-00000000e001");

    private static final String COMPLETE_BODY = """
            {
              "actualStartTime": "10:00",
              "actualEndTime": "11:00",
              "interactionQuality": "GOOD",
              "completedBy": "carer"
            }
            """;

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ContactSessionService contactSessionService;

    @Test
    void closedSessionIsReportedAsConflict() throws Exception {
        when(contactSessionService.complete(eq(SESSION_ID), any(CompleteContactSessionRequest.class)))
                .thenThrow(new ProblemException(HttpStatus.CONFLICT, ContactSessionService.SESSION_ALREADY_CLOSED,
                        "Contact session SESS-2025-00001 is already CANCELLED"));

        mockMvc.perform(post("/family-contact/sessions/{id}/complete", SESSION_ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(COMPLETE_BODY))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("SESSION_ALREADY_CLOSED"))
                .andExpect(jsonPath("$.status").value(409));
    }

    @Test
    void cascadeFailureIsReportedAsServerError() throws Exception {
        UUID scheduleId = UUID.randomUUID();
        when(contactSessionService.complete(eq(SESSION_ID), any(CompleteContactSessionRequest.class)))
                .thenThrow(new CascadeInconsistencyException(scheduleId, "completed", null));

        mockMvc.perform(post("/family-contact/sessions/{id}/complete", SESSION_ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(COMPLETE_BODY))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.code").value(CascadeInconsistencyException.CODE));
    }

    @Test
    void malformedTimeFailsValidation() throws Exception {
        mockMvc.perform(post("/family-contact/sessions/{id}/complete", SESSION_ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"actualStartTime": "10am", "actualEndTime": "11:00", "completedBy": "carer"}
                                """))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("validation_error"));
        verify(contactSessionService, never()).complete(any(), any());
    }

    @Test
    void unknownEnumValueIsMalformed() throws Exception {
        mockMvc.perform(post("/family-contact/sessions/{id}/complete", SESSION_ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"actualStartTime": "10:00", "actualEndTime": "11:00",
                                 "interactionQuality": "WONDERFUL", "completedBy": "carer"}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("malformed_request"));
    }

    @Test
    void listPassesDateBoundsAndEchoesRequestId() throws Exception {
        UUID childId = UUID.randomUUID();
        when(contactSessionService.list(childId, null, LocalDate.of(2025, 1, 1), LocalDate.of(2025, 1, 31)))
                .thenReturn(List.of());

        mockMvc.perform(get("/family-contact/sessions")
                        .param("childId", childId.toString())
                        .param("from", "2025-01-01")
                        .param("to", "2025-01-31")
                        .header(RequestIdFilter.REQUEST_ID_HEADER, "req-42"))
                .andExpect(status().isOk())
                .andExpect(header().string(RequestIdFilter.REQUEST_ID_HEADER, "req-42"))
                .andExpect(jsonPath("$").isArray());
    }
}
