package com.company.radar.service.overview;

import com.company.radar.config.ExecutorConfig;
import com.company.radar.config.RedisCacheConfig;
import com.company.radar.event.PipelineCompletedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.UUID;

@Service
@Slf4j
@RequiredArgsConstructor
public class CacheEvictionService {

    private final CacheManager cacheManager;

    @EventListener
    @Async(ExecutorConfig.EVENT_EXECUTOR)
    public void onPipelineCompleted(PipelineCompletedEvent event) {
        Cache overviewCache = cacheManager.getCache(RedisCacheConfig.PROPERTY_OVERVIEW_CACHE);
        if (overviewCache == null) {
            return;
        }

        for (UUID propertyId : event.getIngestedPropertyIds()) {
            overviewCache.evict(event.getAccountId() + ":" + propertyId);
        }
        log.debug("Evicted {} overview entries for account {}",
                event.getIngestedPropertyIds().size(), event.getAccountId());
    }
}
