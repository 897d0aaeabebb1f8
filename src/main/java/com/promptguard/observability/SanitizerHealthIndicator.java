package com.promptguard.observability;

import com.promptguard.content.ContentGuard;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

@Component
public class SanitizerHealthIndicator implements HealthIndicator {

    private final ContentGuard contentGuard;

    public SanitizerHealthIndicator(ContentGuard contentGuard) {
        this.contentGuard = contentGuard;
    }

    @Override
    public Health health() {
        int patternCount = contentGuard.patternDatabase().patterns().size();
        if (patternCount == 0) {
            return Health.down().withDetail("reason", "No threat patterns loaded").build();
        }

        // Switched-off screening reports UNKNOWN rather than DOWN
        Health.Builder builder = contentGuard.config().enabled() ? Health.up() : Health.unknown();
        return builder
                .withDetail("enabled", contentGuard.config().enabled())
                .withDetail("patternGeneration", contentGuard.patternGeneration())
                .withDetail("patternCount", patternCount)
                .withDetail("cacheEnabled", contentGuard.config().cacheEnabled())
                .withDetail("cacheSize", contentGuard.resultCache().size())
                .build();
    }
}
