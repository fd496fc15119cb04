package com.company.radar.controller;

import com.company.radar.dto.response.DashboardSummaryResponse;
import com.company.radar.security.AccountContext;
import com.company.radar.service.overview.DashboardService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/api/v1/accounts/{accountId}/dashboard-summary")
@Tag(name = "Dashboard", description = "Health classification of every property of the account")
@RequiredArgsConstructor
@SecurityRequirement(name = "bearer-jwt")
public class DashboardController {

    private final DashboardService dashboardService;
    private final AccountContext accountContext;

    @GetMapping
    @Operation(summary = "Get dashboard summary",
            description = "Properties grouped by website with a critical, warning, healthy or insufficient_data status")
    @PreAuthorize("hasAnyRole('UI_READER', 'ADMIN')")
    public ResponseEntity<DashboardSummaryResponse> getSummary(@PathVariable UUID accountId) {
        accountContext.verifyAccess(accountId);
        return ResponseEntity.ok(dashboardService.summary(accountId));
    }
}
