package com.company.radar.service.ingestion;

import com.company.radar.client.SearchAnalyticsClient;
import com.company.radar.client.dto.SiteEntry;
import com.company.radar.domain.Property;
import com.company.radar.repository.PropertyRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Mirrors the upstream site list into properties. Sites the account can only
 * read partially are ignored.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PropertySyncService {

    static final Set<String> ALLOWED_PERMISSIONS = Set.of("siteOwner", "siteFullUser");

    private final SearchAnalyticsClient client;
    private final PropertyRepository propertyRepository;

    public List<Property> sync(UUID accountId, String accessToken) {
        List<SiteEntry> sites = client.listSites(accessToken);

        List<Property> synced = new ArrayList<>();
        for (SiteEntry site : sites) {
            if (site.getSiteUrl() == null || !ALLOWED_PERMISSIONS.contains(site.getPermissionLevel())) {
                log.debug("Skipping site {} with permission {}", site.getSiteUrl(), site.getPermissionLevel());
                continue;
            }
            synced.add(propertyRepository.upsert(accountId, site.getSiteUrl(), site.getPermissionLevel()));
        }

        log.info("Synced {} of {} upstream sites for account {}", synced.size(), sites.size(), accountId);
        return synced;
    }
}
