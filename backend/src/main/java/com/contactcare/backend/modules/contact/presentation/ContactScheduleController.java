package com.contactcare.backend.modules.contact.presentation;

import java.util.List;
import java.util.UUID;

import com.contactcare.backend.modules.contact.application.ContactScheduleService;
import com.contactcare.backend.modules.contact.presentation.dto.ContactScheduleResponse;
import com.contactcare.backend.modules.contact.presentation.dto.CreateContactScheduleRequest;
import com.contactcare.backend.modules.contact.presentation.dto.ReviewContactScheduleRequest;
import com.contactcare.backend.modules.contact.presentation.dto.SuspendContactScheduleRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/family-contact/schedules")
public class ContactScheduleController {

    private final ContactScheduleService contactScheduleService;

    public ContactScheduleController(ContactScheduleService contactScheduleService) {
        this.contactScheduleService = contactScheduleService;
    }

    @Operation(summary = "Create contact schedule", description = "Creates a recurring contact arrangement for a child and family member.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Created"),
            @ApiResponse(responseCode = "404", description = "Child or family member not found"),
            @ApiResponse(responseCode = "409", description = "Contact not permitted – code `CONTACT_NOT_ALLOWED`")
    })
    @PostMapping
    public ResponseEntity<ContactScheduleResponse> create(@Valid @RequestBody CreateContactScheduleRequest request) {
        return ResponseEntity.status(201).body(contactScheduleService.create(request));
    }

    @GetMapping
    public ResponseEntity<List<ContactScheduleResponse>> listActive(@RequestParam("childId") UUID childId) {
        return ResponseEntity.ok(contactScheduleService.listActive(childId));
    }

    @GetMapping("/due-for-review")
    public ResponseEntity<List<ContactScheduleResponse>> listDueForReview(
            @RequestParam("organizationId") UUID organizationId
    ) {
        return ResponseEntity.ok(contactScheduleService.listDueForReview(organizationId));
    }

    @GetMapping("/{contactScheduleId}")
    public ResponseEntity<ContactScheduleResponse> get(@PathVariable("contactScheduleId") UUID contactScheduleId) {
        return ResponseEntity.ok(contactScheduleService.get(contactScheduleId));
    }

    @PostMapping("/{contactScheduleId}/suspend")
    public ResponseEntity<ContactScheduleResponse> suspend(
            @PathVariable("contactScheduleId") UUID contactScheduleId,
            @Valid @RequestBody SuspendContactScheduleRequest request
    ) {
        return ResponseEntity.ok(contactScheduleService.suspend(contactScheduleId, request));
    }

    @Operation(summary = "Review contact schedule", description = "Records a review and moves the next review date six months on.")
    @PostMapping("/{contactScheduleId}/review")
    public ResponseEntity<ContactScheduleResponse> review(
            @PathVariable("contactScheduleId") UUID contactScheduleId,
            @Valid @RequestBody ReviewContactScheduleRequest request
    ) {
        return ResponseEntity.ok(contactScheduleService.review(contactScheduleId, request));
    }
}
