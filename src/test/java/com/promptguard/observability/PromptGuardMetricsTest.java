package com.promptguard.observability;

import com.promptguard.content.SanitizationAction;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class PromptGuardMetricsTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final PromptGuardMetrics metrics = new PromptGuardMetrics(registry);

    @Test
    void analysisCountAndLatency() {
        metrics.recordAnalysis(SanitizationAction.SANITIZE, false, 4.0);
        metrics.recordAnalysis(SanitizationAction.SANITIZE, false, 6.0);

        assertEquals(2.0, registry.get("promptguard.analysis")
                .tag("action", "SANITIZE").counter().count(), 1e-9);
        assertEquals(10.0, registry.get("promptguard.analysis.latency")
                .tag("cache", "miss").timer().totalTime(TimeUnit.MILLISECONDS), 1e-6);
    }

    @Test
    void cacheSizeGaugeFollowsSupplier() {
        AtomicLong size = new AtomicLong(3);
        metrics.bindCacheSize(size::get);
        assertEquals(3.0, registry.get("promptguard.cache.size").gauge().value(), 1e-9);

        size.set(7);
        assertEquals(7.0, registry.get("promptguard.cache.size").gauge().value(), 1e-9);
    }
}
