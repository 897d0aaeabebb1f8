package com.promptguard.audit;

import com.promptguard.content.ContentInput;
import com.promptguard.content.RequestContext;
import com.promptguard.content.SanitizationAction;
import com.promptguard.content.SanitizationResult;
import com.promptguard.content.detect.DetectedThreat;

import java.time.Instant;

public record SecurityEvent(
        String type,
        Instant occurredAt,
        String requesterIdentity,
        String userId,
        String contentId,
        String sourceId,
        SanitizationAction action,
        int score,
        int inputLength,
        String contentPreview,
        int threatCount,
        String topPattern
) {
    public static final String TYPE_AI_INJECTION_ATTEMPT = "AI_INJECTION_ATTEMPT";
    public static final String TYPE_AI_CONTENT_SCREENED = "AI_CONTENT_SCREENED";

    static final int PREVIEW_LENGTH = 200;

    public static SecurityEvent of(ContentInput input, RequestContext requester, SanitizationResult result) {
        String body = input.bodyOrEmpty();
        String type = result.action() == SanitizationAction.ALLOW
                ? TYPE_AI_CONTENT_SCREENED : TYPE_AI_INJECTION_ATTEMPT;
        return new SecurityEvent(
                type,
                result.metadata().processedAt(),
                requester.requesterIdentity(),
                requester.userId(),
                input.contentId(),
                input.sourceId(),
                result.action(),
                result.score(),
                body.length(),
                body.length() > PREVIEW_LENGTH ? body.substring(0, PREVIEW_LENGTH) : body,
                result.threats().size(),
                result.topThreat().map(DetectedThreat::patternName).orElse(null));
    }
}
