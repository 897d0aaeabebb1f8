package com.promptguard.content.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class CacheMaintenanceScheduler {

    private static final Logger log = LoggerFactory.getLogger(CacheMaintenanceScheduler.class);

    private final ResultCache resultCache;

    public CacheMaintenanceScheduler(ResultCache resultCache) {
        this.resultCache = resultCache;
    }

    @Scheduled(fixedDelayString = "${promptguard.sanitization.cache-cleanup-interval:PT1H}",
            initialDelayString = "${promptguard.sanitization.cache-cleanup-interval:PT1H}")
    public void purgeStaleEntries() {
        long removed = resultCache.purgeStale();
        if (removed > 0) {
            log.info("Purged {} stale sanitization cache entries ({} remaining)", removed, resultCache.size());
        }
    }
}
