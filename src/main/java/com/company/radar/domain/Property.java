package com.company.radar.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;
import java.util.UUID;

/**
 * A monitored site under an account. Identity is immutable after sync.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Property implements Serializable {
    private static final long serialVersionUID = 1L;

    private UUID id;
    private UUID accountId;
    private String siteUrl;
    private String permissionLevel;
    private Instant createdAt;

    /**
     * Site URL without scheme, "sc-domain:" prefix or trailing slash, for log lines and mail.
     */
    public String getBaseDomain() {
        if (siteUrl == null) return null;
        return siteUrl
                .replaceFirst("^sc-domain:", "")
                .replaceFirst("^https?://", "")
                .replaceFirst("/+$", "");
    }
}
