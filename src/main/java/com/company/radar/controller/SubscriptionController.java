package com.company.radar.controller;

import com.company.radar.domain.AlertSubscription;
import com.company.radar.dto.request.SubscriptionRequest;
import com.company.radar.dto.response.SubscriptionResponse;
import com.company.radar.security.AccountContext;
import com.company.radar.service.alert.SubscriptionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.net.URI;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/v1/accounts/{accountId}/subscriptions")
@Tag(name = "Alert Subscriptions", description = "Manage who receives alert emails for each property")
@RequiredArgsConstructor
@Slf4j
@SecurityRequirement(name = "bearer-jwt")
public class SubscriptionController {

    private final SubscriptionService subscriptionService;
    private final AccountContext accountContext;

    @GetMapping
    @Operation(summary = "List subscriptions of the account")
    @PreAuthorize("hasAnyRole('UI_READER', 'ADMIN')")
    public ResponseEntity<List<SubscriptionResponse>> list(@PathVariable UUID accountId) {
        accountContext.verifyAccess(accountId);

        List<SubscriptionResponse> subscriptions = subscriptionService.list(accountId).stream()
                .map(SubscriptionResponse::from)
                .collect(Collectors.toList());
        return ResponseEntity.ok(subscriptions);
    }

    @PostMapping
    @Operation(summary = "Subscribe a recipient to a property",
            description = "409 when the recipient is already subscribed to the property")
    @PreAuthorize("hasAnyRole('UI_READER', 'ADMIN')")
    public ResponseEntity<SubscriptionResponse> subscribe(
            @PathVariable UUID accountId,
            @Valid @RequestBody SubscriptionRequest request) {
        accountContext.verifyAccess(accountId);

        AlertSubscription subscription = subscriptionService.subscribe(
                accountId, request.getRecipient(), request.getPropertyId());

        return ResponseEntity
                .created(URI.create("/api/v1/accounts/" + accountId + "/subscriptions/" + subscription.getId()))
                .body(SubscriptionResponse.from(subscription));
    }

    @DeleteMapping("/{subscriptionId}")
    @Operation(summary = "Remove a subscription")
    @PreAuthorize("hasAnyRole('UI_READER', 'ADMIN')")
    public ResponseEntity<Void> unsubscribe(@PathVariable UUID accountId, @PathVariable UUID subscriptionId) {
        accountContext.verifyAccess(accountId);

        if (!subscriptionService.unsubscribe(accountId, subscriptionId)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.noContent().build();
    }
}
