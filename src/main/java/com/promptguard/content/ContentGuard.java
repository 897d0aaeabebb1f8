package com.promptguard.content;

import com.promptguard.audit.SecurityEvent;
import com.promptguard.audit.SecurityEventPublisher;
import com.promptguard.content.cache.ResultCache;
import com.promptguard.content.detect.DetectedThreat;
import com.promptguard.content.detect.ThreatDetector;
import com.promptguard.content.pattern.PatternDatabase;
import com.promptguard.content.sanitize.ContentSanitizer;
import com.promptguard.content.sanitize.SanitizationOutcome;
import com.promptguard.content.score.ThreatScorer;
import com.promptguard.observability.PromptGuardMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Entry point of the screening engine: cache lookup, detection, scoring,
 * sanitization with escalation, then statistics, events and caching.
 * Synchronous and safe to call from many threads; the host owns one instance
 * per configuration.
 */
public class ContentGuard {

    private static final Logger log = LoggerFactory.getLogger(ContentGuard.class);

    private final SanitizationConfig config;
    private final PatternDatabase patternDatabase;
    private final ThreatDetector detector;
    private final ThreatScorer scorer;
    private final ContentSanitizer sanitizer;
    private final ResultCache resultCache;
    private final SecurityEventPublisher eventPublisher;
    private final PromptGuardMetrics metrics;
    private final SanitizationStatistics statistics = new SanitizationStatistics();

    public ContentGuard(SanitizationConfig config,
                        PatternDatabase patternDatabase,
                        ResultCache resultCache,
                        SecurityEventPublisher eventPublisher,
                        PromptGuardMetrics metrics) {
        this.config = config;
        this.patternDatabase = patternDatabase;
        this.detector = new ThreatDetector(patternDatabase);
        this.scorer = new ThreatScorer(patternDatabase);
        this.sanitizer = new ContentSanitizer();
        this.resultCache = resultCache;
        this.eventPublisher = eventPublisher;
        this.metrics = metrics;
    }

    public SanitizationResult analyze(ContentInput input) {
        return analyze(input, RequestContext.system());
    }

    public SanitizationResult analyze(ContentInput input, RequestContext requester) {
        long startNanos = System.nanoTime();
        ContentInput content = input != null ? input : new ContentInput("");
        RequestContext who = requester != null ? requester : RequestContext.system();
        String body = content.bodyOrEmpty();

        // Fail open when screening is switched off
        if (!config.enabled()) {
            SanitizationResult result = buildResult(SanitizationAction.ALLOW, 0, List.of(), body,
                    null, 0, startNanos);
            complete(content, who, result, elapsedMs(startNanos));
            return result;
        }

        if (config.cacheEnabled()) {
            Optional<SanitizationResult> cached = resultCache.get(body, patternDatabase.generation());
            if (cached.isPresent()) {
                statistics.recordCacheHit();
                log.debug("Cache hit for content length={} action={}", body.length(), cached.get().action());
                complete(content, who, cached.get(), elapsedMs(startNanos));
                return cached.get();
            }
            statistics.recordCacheMiss();
        }

        List<DetectedThreat> threats = detector.detect(body);
        int score = scorer.score(threats, body, config);
        SanitizationAction action = scorer.action(score, config);

        String sanitizedContent = null;
        int sectionsRemoved = 0;
        if (action == SanitizationAction.SANITIZE) {
            SanitizationOutcome outcome = sanitizer.sanitize(body, threats);
            sanitizedContent = outcome.sanitizedContent();
            sectionsRemoved = outcome.sectionsRemoved();

            boolean usable = sanitizer.isUsable(sanitizedContent, body);
            boolean escalate = scorer.shouldEscalate(body.length(), sanitizedContent.length(), threats);
            if (!usable || escalate) {
                log.debug("Escalating SANITIZE to BLOCK: usable={} escalate={} removed={}%",
                        usable, escalate, String.format("%.1f", sanitizer.removalPercentage(body, sanitizedContent)));
                action = SanitizationAction.BLOCK;
                sanitizedContent = null;
            }
        }

        SanitizationResult result = buildResult(action, score, threats, body, sanitizedContent,
                sectionsRemoved, startNanos);
        metrics.recordThreats(threats);
        complete(content, who, result, result.metadata().processingDurationMs());

        if (config.cacheEnabled()) {
            resultCache.put(body, result);
        }
        return result;
    }

    private SanitizationResult buildResult(SanitizationAction action, int score, List<DetectedThreat> threats,
                                           String body, String sanitizedContent, int sectionsRemoved,
                                           long startNanos) {
        SanitizationResult.Metadata metadata = new SanitizationResult.Metadata(
                Instant.now(),
                elapsedMs(startNanos),
                body.length(),
                threats.size(),
                sectionsRemoved,
                false,
                patternDatabase.generation());
        return new SanitizationResult(action, score, threats, body,
                Optional.ofNullable(sanitizedContent), metadata);
    }

    private void complete(ContentInput input, RequestContext requester, SanitizationResult result,
                          double durationMs) {
        boolean cacheHit = result.metadata().cacheHit();
        statistics.recordOutcome(result.action(), result.score(), durationMs);
        metrics.recordAnalysis(result.action(), cacheHit, durationMs);

        if (config.enabled() && scorer.shouldWarn(result.score(), result.action(), config)) {
            if (result.action() != SanitizationAction.ALLOW) {
                log.warn("Content {} from principal={} score={} band={} threats={} top={}",
                        result.action(), requester.requesterIdentity(), result.score(),
                        scorer.severityOf(result.score()), result.threats().size(),
                        result.topThreat().map(DetectedThreat::patternName).orElse("none"));
            }
            eventPublisher.publish(SecurityEvent.of(input, requester, result));
        }
    }

    private static double elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000.0;
    }

    public SanitizerStats statistics() {
        return statistics.snapshot(patternDatabase.generation());
    }

    public void resetStatistics() {
        statistics.reset();
        log.info("Sanitizer statistics reset");
    }

    public String patternGeneration() {
        return patternDatabase.generation();
    }

    public PatternDatabase patternDatabase() {
        return patternDatabase;
    }

    public SanitizationConfig config() {
        return config;
    }

    public ResultCache resultCache() {
        return resultCache;
    }
}
