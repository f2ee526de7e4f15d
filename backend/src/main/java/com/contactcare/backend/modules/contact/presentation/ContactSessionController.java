package com.contactcare.backend.modules.contact.presentation;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import com.contactcare.backend.modules.contact.application.ContactSessionService;
import com.contactcare.backend.modules.contact.presentation.dto.CancelContactSessionRequest;
import com.contactcare.backend.modules.contact.presentation.dto.CompleteContactSessionRequest;
import com.contactcare.backend.modules.contact.presentation.dto.ContactSessionResponse;
import com.contactcare.backend.modules.contact.presentation.dto.ScheduleContactSessionRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import jakarta.validation.Valid;

import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/family-contact/sessions")
public class ContactSessionController {

    private final ContactSessionService contactSessionService;

    public ContactSessionController(ContactSessionService contactSessionService) {
        this.contactSessionService = contactSessionService;
    }

    @PostMapping
    public ResponseEntity<ContactSessionResponse> schedule(@Valid @RequestBody ScheduleContactSessionRequest request) {
        return ResponseEntity.status(201).body(contactSessionService.schedule(request));
    }

    @GetMapping
    public ResponseEntity<List<ContactSessionResponse>> list(
            @RequestParam("childId") UUID childId,
            @RequestParam(name = "familyMemberId", required = false) UUID familyMemberId,
            @RequestParam(name = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(name = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to
    ) {
        return ResponseEntity.ok(contactSessionService.list(childId, familyMemberId, from, to));
    }

    @GetMapping("/urgent-review")
    public ResponseEntity<List<ContactSessionResponse>> listRequiringUrgentReview(
            @RequestParam("organizationId") UUID organizationId
    ) {
        return ResponseEntity.ok(contactSessionService.listRequiringUrgentReview(organizationId));
    }

    @GetMapping("/{contactSessionId}")
    public ResponseEntity<ContactSessionResponse> get(@PathVariable("contactSessionId") UUID contactSessionId) {
        return ResponseEntity.ok(contactSessionService.get(contactSessionId));
    }

    @Operation(summary = "Complete contact session", description = "Records what happened and updates the linked schedule.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Completed"),
            @ApiResponse(responseCode = "409", description = "Session already closed – code `SESSION_ALREADY_CLOSED`"),
            @ApiResponse(responseCode = "500", description = "Schedule update failed – code `SCHEDULE_CASCADE_FAILED`")
    })
    @PostMapping("/{contactSessionId}/complete")
    public ResponseEntity<ContactSessionResponse> complete(
            @PathVariable("contactSessionId") UUID contactSessionId,
            @Valid @RequestBody CompleteContactSessionRequest request
    ) {
        return ResponseEntity.ok(contactSessionService.complete(contactSessionId, request));
    }

    @PostMapping("/{contactSessionId}/cancel")
    public ResponseEntity<ContactSessionResponse> cancel(
            @PathVariable("contactSessionId") UUID contactSessionId,
            @Valid @RequestBody CancelContactSessionRequest request
    ) {
        return ResponseEntity.ok(contactSessionService.cancel(contactSessionId, request));
    }
}
