package com.contactcare.backend.modules.statistics.presentation;

import java.util.UUID;

import com.contactcare.backend.modules.statistics.application.FamilyContactStatisticsService;
import com.contactcare.backend.modules.statistics.presentation.dto.FamilyContactStatisticsResponse;

import io.swagger.v3.oas.annotations.Operation;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/family-contact/statistics")
public class FamilyContactStatisticsController {

    private final FamilyContactStatisticsService statisticsService;

    public FamilyContactStatisticsController(FamilyContactStatisticsService statisticsService) {
        this.statisticsService = statisticsService;
    }

    @Operation(summary = "Family contact statistics", description = "Counts for the organisation's dashboard.")
    @GetMapping
    public ResponseEntity<FamilyContactStatisticsResponse> getStatistics(
            @RequestParam("organizationId") UUID organizationId
    ) {
        return ResponseEntity.ok(statisticsService.getStatistics(organizationId));
    }
}
