package com.promptguard.content;

import com.promptguard.content.detect.DetectedThreat;

/**
 * Caller-side contract for pipelines feeding a language model: forward the
 * original text on ALLOW, the cleaned text on SANITIZE, and abort on BLOCK.
 */
public class UntrustedContentFilter {

    private final ContentGuard contentGuard;

    public UntrustedContentFilter(ContentGuard contentGuard) {
        this.contentGuard = contentGuard;
    }

    /**
     * Text that is safe to hand downstream.
     *
     * @throws ContentRejectedException when the content is blocked
     */
    public String admit(ContentInput input, RequestContext requester) {
        SanitizationResult result = contentGuard.analyze(input, requester);
        return result.contentToForward()
                .orElseThrow(() -> new ContentRejectedException(result));
    }

    public String admit(String body) {
        return admit(new ContentInput(body), RequestContext.system());
    }

    public static class ContentRejectedException extends RuntimeException {
        private final int score;
        private final String topPattern;
        private final int threatCount;

        public ContentRejectedException(SanitizationResult result) {
            super("Content rejected by prompt-injection screening (score " + result.score() + ")");
            this.score = result.score();
            this.topPattern = result.topThreat().map(DetectedThreat::patternName).orElse(null);
            this.threatCount = result.threats().size();
        }

        public int getScore() { return score; }

        public String getTopPattern() { return topPattern; }

        public int getThreatCount() { return threatCount; }
    }
}
