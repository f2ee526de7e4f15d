package com.contactcare.backend.modules.family.presentation;

import java.util.List;
import java.util.UUID;

import com.contactcare.backend.modules.family.application.FamilyMemberService;
import com.contactcare.backend.modules.family.presentation.dto.FamilyMemberResponse;
import com.contactcare.backend.modules.family.presentation.dto.RegisterFamilyMemberRequest;
import com.contactcare.backend.modules.family.presentation.dto.UpdateFamilyMemberRequest;

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
@RequestMapping("/family-contact/family-members")
public class FamilyMemberController {

    private final FamilyMemberService familyMemberService;

    public FamilyMemberController(FamilyMemberService familyMemberService) {
        this.familyMemberService = familyMemberService;
    }

    @Operation(summary = "Register family member", description = "Registers a family member against an existing child.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Registered"),
            @ApiResponse(responseCode = "404", description = "Child not found – code `CHILD_NOT_FOUND`")
    })
    @PostMapping
    public ResponseEntity<FamilyMemberResponse> register(@Valid @RequestBody RegisterFamilyMemberRequest request) {
        return ResponseEntity.status(201).body(familyMemberService.register(request));
    }

    @GetMapping
    public ResponseEntity<List<FamilyMemberResponse>> listForChild(
            @RequestParam("childId") UUID childId,
            @RequestParam(name = "activeOnly", defaultValue = "false") boolean activeOnly
    ) {
        return ResponseEntity.ok(familyMemberService.listForChild(childId, activeOnly));
    }

    @GetMapping("/expired-dbs")
    public ResponseEntity<List<FamilyMemberResponse>> listExpiredBackgroundChecks(
            @RequestParam("organizationId") UUID organizationId
    ) {
        return ResponseEntity.ok(familyMemberService.listExpiredBackgroundChecks(organizationId));
    }

    @GetMapping("/{familyMemberId}")
    public ResponseEntity<FamilyMemberResponse> get(@PathVariable("familyMemberId") UUID familyMemberId) {
        return ResponseEntity.ok(familyMemberService.get(familyMemberId));
    }

    @PatchMapping("/{familyMemberId}")
    public ResponseEntity<FamilyMemberResponse> update(
            @PathVariable("familyMemberId") UUID familyMemberId,
            @Valid @RequestBody UpdateFamilyMemberRequest request
    ) {
        return ResponseEntity.ok(familyMemberService.update(familyMemberId, request));
    }
}
