package com.company.radar.dto.response;

import com.company.radar.domain.Property;
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
public class PropertyResponse {
    private UUID id;
    private String siteUrl;
    private String baseDomain;
    private String permissionLevel;
    private Instant createdAt;

    public static PropertyResponse from(Property property) {
        return PropertyResponse.builder()
                .id(property.getId())
                .siteUrl(property.getSiteUrl())
                .baseDomain(property.getBaseDomain())
                .permissionLevel(property.getPermissionLevel())
                .createdAt(property.getCreatedAt())
                .build();
    }
}
