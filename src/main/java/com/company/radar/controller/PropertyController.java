package com.company.radar.controller;

import com.company.radar.domain.enums.MetricSource;
import com.company.radar.dto.response.DeviceVisibilityResponse;
import com.company.radar.dto.response.PageVisibilityResponse;
import com.company.radar.dto.response.PropertyOverviewResponse;
import com.company.radar.dto.response.PropertyResponse;
import com.company.radar.security.AccountContext;
import com.company.radar.service.analysis.VisibilityQueryService;
import com.company.radar.service.overview.PropertyOverviewService;
import io.micrometer.core.instrument.MeterRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.CacheControl;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/v1/accounts/{accountId}/properties")
@Tag(name = "Properties", description = "Monitored properties, their 7v7 overview and visibility breakdowns")
@RequiredArgsConstructor
@SecurityRequirement(name = "bearer-jwt")
public class PropertyController {

    private final PropertyOverviewService overviewService;
    private final VisibilityQueryService visibilityQueryService;
    private final AccountContext accountContext;
    private final MeterRegistry meterRegistry;

    @GetMapping
    @Operation(summary = "List properties synced for the account")
    @PreAuthorize("hasAnyRole('UI_READER', 'ADMIN')")
    public ResponseEntity<List<PropertyResponse>> list(@PathVariable UUID accountId) {
        accountContext.verifyAccess(accountId);

        List<PropertyResponse> properties = overviewService.listProperties(accountId).stream()
                .map(PropertyResponse::from)
                .collect(Collectors.toList());
        return ResponseEntity.ok(properties);
    }

    @GetMapping("/{propertyId}/overview")
    @Operation(summary = "Get property overview",
            description = "Clicks, impressions, CTR and position for the last and previous windows with deltas")
    @PreAuthorize("hasAnyRole('UI_READER', 'ADMIN')")
    public ResponseEntity<PropertyOverviewResponse> getOverview(
            @PathVariable UUID accountId,
            @PathVariable UUID propertyId) {
        accountContext.verifyAccess(accountId);

        meterRegistry.counter("api.properties.overview.requests").increment();

        PropertyOverviewResponse response = overviewService.getOverview(accountId, propertyId);

        return ResponseEntity.ok()
                .cacheControl(CacheControl.maxAge(60, TimeUnit.SECONDS).cachePrivate())
                .body(response);
    }

    @GetMapping("/{propertyId}/pages")
    @Operation(summary = "Get page visibility",
            description = "New, lost, dropping and gaining pages between the last and previous windows")
    @PreAuthorize("hasAnyRole('UI_READER', 'ADMIN')")
    public ResponseEntity<PageVisibilityResponse> getPages(
            @PathVariable UUID accountId,
            @PathVariable UUID propertyId) {
        accountContext.verifyAccess(accountId);

        meterRegistry.counter("api.properties.visibility.requests", "dimension", "page").increment();

        return ResponseEntity.ok(PageVisibilityResponse.from(
                visibilityQueryService.analyze(accountId, propertyId, MetricSource.PAGE)));
    }

    @GetMapping("/{propertyId}/devices")
    @Operation(summary = "Get device visibility",
            description = "Clicks, impressions and CTR per device for both windows with deltas")
    @PreAuthorize("hasAnyRole('UI_READER', 'ADMIN')")
    public ResponseEntity<DeviceVisibilityResponse> getDevices(
            @PathVariable UUID accountId,
            @PathVariable UUID propertyId) {
        accountContext.verifyAccess(accountId);

        meterRegistry.counter("api.properties.visibility.requests", "dimension", "device").increment();

        return ResponseEntity.ok(DeviceVisibilityResponse.from(
                visibilityQueryService.analyze(accountId, propertyId, MetricSource.DEVICE)));
    }
}
