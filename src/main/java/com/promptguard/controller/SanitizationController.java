package com.promptguard.controller;

import com.promptguard.content.ContentGuard;
import com.promptguard.content.ContentInput;
import com.promptguard.content.RequestContext;
import com.promptguard.content.SanitizationResult;
import com.promptguard.content.SanitizerStats;
import com.promptguard.content.UntrustedContentFilter;
import com.promptguard.content.cache.ResultCache;
import com.promptguard.content.pattern.ThreatCategory;
import com.promptguard.content.pattern.ThreatSeverity;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/sanitization")
public class SanitizationController {

    private static final Logger log = LoggerFactory.getLogger(SanitizationController.class);

    private final ContentGuard contentGuard;
    private final UntrustedContentFilter contentFilter;

    public SanitizationController(ContentGuard contentGuard, UntrustedContentFilter contentFilter) {
        this.contentGuard = contentGuard;
        this.contentFilter = contentFilter;
    }

    // --- Screening ---

    @PostMapping("/analyze")
    public SanitizationResult analyze(@RequestBody ContentInput input,
                                      @RequestHeader(value = "X-Requester-Id", required = false) String requesterId,
                                      @RequestHeader(value = "X-User-Id", required = false) String userId,
                                      HttpServletRequest request) {
        if (input == null) {
            throw new IllegalArgumentException("Request body is required");
        }
        return contentGuard.analyze(input, requestContext(requesterId, userId, request));
    }

    /**
     * Text safe to forward downstream; a blocked body surfaces as 422 through
     * {@link ErrorHandler}.
     */
    @PostMapping("/admit")
    public AdmitResponse admit(@RequestBody ContentInput input,
                               @RequestHeader(value = "X-Requester-Id", required = false) String requesterId,
                               @RequestHeader(value = "X-User-Id", required = false) String userId,
                               HttpServletRequest request) {
        if (input == null) {
            throw new IllegalArgumentException("Request body is required");
        }
        String content = contentFilter.admit(input, requestContext(requesterId, userId, request));
        return new AdmitResponse(content, !content.equals(input.bodyOrEmpty()));
    }

    private static RequestContext requestContext(String requesterId, String userId, HttpServletRequest request) {
        String requester = requesterId != null && !requesterId.isBlank() ? requesterId : request.getRemoteAddr();
        return new RequestContext(requester, userId);
    }

    // --- Statistics ---

    @GetMapping("/stats")
    public StatsResponse getStats() {
        return new StatsResponse(contentGuard.statistics(), contentGuard.resultCache().stats());
    }

    @PostMapping("/stats/reset")
    public SanitizerStats resetStats() {
        contentGuard.resetStatistics();
        return contentGuard.statistics();
    }

    // --- Cache ---

    @PostMapping("/cache/clear")
    public ResultCache.CacheStats clearCache() {
        contentGuard.resultCache().clear();
        log.info("Sanitization cache cleared by operator");
        return contentGuard.resultCache().stats();
    }

    // --- Patterns ---

    @GetMapping("/patterns")
    public PatternCatalogResponse getPatterns() {
        List<PatternDto> patterns = contentGuard.patternDatabase().patterns().stream()
                .map(p -> new PatternDto(p.name(), p.severity(), p.category(), p.score(), p.description()))
                .toList();
        return new PatternCatalogResponse(contentGuard.patternGeneration(), patterns);
    }

    // --- DTOs ---

    public record AdmitResponse(String content, boolean sanitized) {}

    public record StatsResponse(SanitizerStats sanitizer, ResultCache.CacheStats cache) {}

    public record PatternCatalogResponse(String generation, List<PatternDto> patterns) {}

    public record PatternDto(String name, ThreatSeverity severity, ThreatCategory category,
                             int score, String description) {}
}
