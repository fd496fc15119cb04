package com.company.radar.controller;

import com.company.radar.dto.response.AlertResponse;
import com.company.radar.security.AccountContext;
import com.company.radar.service.alert.AlertQueryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/v1/accounts/{accountId}/alerts")
@Tag(name = "Alerts", description = "Read-only list of triggered alerts")
@RequiredArgsConstructor
@Validated
@SecurityRequirement(name = "bearer-jwt")
public class AlertController {

    private final AlertQueryService alertQueryService;
    private final AccountContext accountContext;

    @GetMapping
    @Operation(summary = "List recent alerts", description = "Newest first")
    @PreAuthorize("hasAnyRole('UI_READER', 'ADMIN')")
    public ResponseEntity<List<AlertResponse>> listAlerts(
            @PathVariable UUID accountId,
            @RequestParam(defaultValue = "50") @Min(1) @Max(200) int limit) {
        accountContext.verifyAccess(accountId);

        List<AlertResponse> alerts = alertQueryService.recentAlerts(accountId, limit).stream()
                .map(AlertResponse::from)
                .collect(Collectors.toList());

        return ResponseEntity.ok(alerts);
    }
}
