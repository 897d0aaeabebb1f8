package com.promptguard.audit;

import com.promptguard.content.ContentInput;
import com.promptguard.content.RequestContext;
import com.promptguard.content.SanitizationAction;
import com.promptguard.content.SanitizationResult;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class SecurityEventTest {

    private static SanitizationResult result(SanitizationAction action, int score, String body) {
        return new SanitizationResult(action, score, List.of(), body, Optional.empty(),
                new SanitizationResult.Metadata(Instant.now(), 1.0, body.length(), 0, 0, false, "1.0.0"));
    }

    @Test
    void previewIsTruncated() {
        String body = "x".repeat(500);
        SecurityEvent event = SecurityEvent.of(new ContentInput(body), RequestContext.system(),
                result(SanitizationAction.BLOCK, 100, body));

        assertEquals(SecurityEvent.PREVIEW_LENGTH, event.contentPreview().length());
        assertEquals(500, event.inputLength());
        assertEquals("system", event.requesterIdentity());
        assertNull(event.topPattern());
    }

    @Test
    void typeFollowsAction() {
        assertEquals(SecurityEvent.TYPE_AI_INJECTION_ATTEMPT, SecurityEvent.of(new ContentInput("a"),
                RequestContext.system(), result(SanitizationAction.SANITIZE, 60, "a")).type());
        assertEquals(SecurityEvent.TYPE_AI_CONTENT_SCREENED, SecurityEvent.of(new ContentInput("a"),
                RequestContext.system(), result(SanitizationAction.ALLOW, 30, "a")).type());
    }

    @Test
    void blankRequesterBecomesUnknown() {
        assertEquals("unknown", new RequestContext(" ", null).requesterIdentity());
    }
}
