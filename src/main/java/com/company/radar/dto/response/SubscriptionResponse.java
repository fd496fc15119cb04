package com.company.radar.dto.response;

import com.company.radar.domain.AlertSubscription;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubscriptionResponse {
    private UUID id;
    private String recipient;
    private UUID propertyId;
    private Instant createdAt;

    public static SubscriptionResponse from(AlertSubscription subscription) {
        return SubscriptionResponse.builder()
                .id(subscription.getId())
                .recipient(subscription.getRecipient())
                .propertyId(subscription.getPropertyId())
                .createdAt(subscription.getCreatedAt())
                .build();
    }
}
