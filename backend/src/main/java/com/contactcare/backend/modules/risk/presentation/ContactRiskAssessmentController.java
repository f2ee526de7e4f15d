package com.contactcare.backend.modules.risk.presentation;

import java.util.List;
import java.util.UUID;

import com.contactcare.backend.modules.risk.application.ContactRiskAssessmentService;
import com.contactcare.backend.modules.risk.presentation.dto.ApproveRiskAssessmentRequest;
import com.contactcare.backend.modules.risk.presentation.dto.CreateRiskAssessmentRequest;
import com.contactcare.backend.modules.risk.presentation.dto.RejectRiskAssessmentRequest;
import com.contactcare.backend.modules.risk.presentation.dto.RiskAssessmentResponse;
import com.contactcare.backend.modules.risk.presentation.dto.SubmitRiskAssessmentRequest;
import com.contactcare.backend.modules.risk.presentation.dto.UpdateRiskAssessmentRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/family-contact/risk-assessments")
public class ContactRiskAssessmentController {

    private final ContactRiskAssessmentService riskAssessmentService;

    public ContactRiskAssessmentController(ContactRiskAssessmentService riskAssessmentService) {
        this.riskAssessmentService = riskAssessmentService;
    }

    @PostMapping
    public ResponseEntity<RiskAssessmentResponse> create(@Valid @RequestBody CreateRiskAssessmentRequest request) {
        return ResponseEntity.status(201).body(riskAssessmentService.create(request));
    }

    @Operation(summary = "Current risk assessment", description = "Latest approved assessment still within its review period.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Current assessment"),
            @ApiResponse(responseCode = "204", description = "No current assessment")
    })
    @GetMapping("/current")
    public ResponseEntity<RiskAssessmentResponse> getCurrent(
            @RequestParam("childId") UUID childId,
            @RequestParam("familyMemberId") UUID familyMemberId
    ) {
        return riskAssessmentService.getCurrent(childId, familyMemberId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @GetMapping("/overdue")
    public ResponseEntity<List<RiskAssessmentResponse>> listOverdue(@RequestParam("organizationId") UUID organizationId) {
        return ResponseEntity.ok(riskAssessmentService.listOverdue(organizationId));
    }

    @GetMapping("/{riskAssessmentId}")
    public ResponseEntity<RiskAssessmentResponse> get(@PathVariable("riskAssessmentId") UUID riskAssessmentId) {
        return ResponseEntity.ok(riskAssessmentService.get(riskAssessmentId));
    }

    @PatchMapping("/{riskAssessmentId}")
    public ResponseEntity<RiskAssessmentResponse> updateDraft(
            @PathVariable("riskAssessmentId") UUID riskAssessmentId,
            @Valid @RequestBody UpdateRiskAssessmentRequest request
    ) {
        return ResponseEntity.ok(riskAssessmentService.updateDraft(riskAssessmentId, request));
    }

    @PostMapping("/{riskAssessmentId}/submit")
    public ResponseEntity<RiskAssessmentResponse> submit(
            @PathVariable("riskAssessmentId") UUID riskAssessmentId,
            @Valid @RequestBody SubmitRiskAssessmentRequest request
    ) {
        return ResponseEntity.ok(riskAssessmentService.submitForApproval(riskAssessmentId, request));
    }

    @PostMapping("/{riskAssessmentId}/approve")
    public ResponseEntity<RiskAssessmentResponse> approve(
            @PathVariable("riskAssessmentId") UUID riskAssessmentId,
            @Valid @RequestBody ApproveRiskAssessmentRequest request
    ) {
        return ResponseEntity.ok(riskAssessmentService.approve(riskAssessmentId, request));
    }

    @PostMapping("/{riskAssessmentId}/reject")
    public ResponseEntity<RiskAssessmentResponse> reject(
            @PathVariable("riskAssessmentId") UUID riskAssessmentId,
            @Valid @RequestBody RejectRiskAssessmentRequest request
    ) {
        return ResponseEntity.ok(riskAssessmentService.reject(riskAssessmentId, request));
    }
}
