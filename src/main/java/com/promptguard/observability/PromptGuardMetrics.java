package com.promptguard.observability;

import com.promptguard.content.SanitizationAction;
import com.promptguard.content.detect.DetectedThreat;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Micrometer meters for the screening engine.
 */
public class PromptGuardMetrics {

    private final MeterRegistry registry;

    public PromptGuardMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    // --- Analysis ---

    public void recordAnalysis(SanitizationAction action, boolean cacheHit, double durationMs) {
        Counter.builder("promptguard.analysis")
                .tag("action", action.name())
                .tag("cache", cacheHit ? "hit" : "miss")
                .register(registry).increment();
        Timer.builder("promptguard.analysis.latency")
                .tag("cache", cacheHit ? "hit" : "miss")
                .register(registry)
                .record((long) (durationMs * 1_000_000), TimeUnit.NANOSECONDS);
    }

    public void recordThreats(List<DetectedThreat> threats) {
        for (DetectedThreat threat : threats) {
            Counter.builder("promptguard.threats.detected")
                    .tag("category", threat.category().id())
                    .tag("severity", threat.severity().name())
                    .register(registry).increment();
        }
    }

    // --- Events ---

    public void recordEventDropped(String reason) {
        Counter.builder("promptguard.events.dropped")
                .tag("reason", reason)
                .register(registry).increment();
    }

    // --- Cache ---

    public void bindCacheSize(Supplier<Number> size) {
        Gauge.builder("promptguard.cache.size", size, s -> s.get().doubleValue())
                .strongReference(true)
                .register(registry);
    }

    public MeterRegistry getRegistry() {
        return registry;
    }
}
