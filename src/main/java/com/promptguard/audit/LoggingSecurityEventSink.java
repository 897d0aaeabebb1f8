package com.promptguard.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.promptguard.content.SanitizationAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Default sink: one structured audit line per event on the
 * {@code promptguard.audit} logger.
 */
public class LoggingSecurityEventSink implements SecurityEventSink {

    private static final Logger log = LoggerFactory.getLogger(LoggingSecurityEventSink.class);
    private static final Logger audit = LoggerFactory.getLogger("promptguard.audit");

    private final ObjectMapper objectMapper;

    public LoggingSecurityEventSink(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void record(SecurityEvent event) {
        String details = toDetails(event);
        if (event.action() == SanitizationAction.ALLOW) {
            audit.info("audit event={} action={} principal={} score={} details={}",
                    event.type(), event.action(), event.requesterIdentity(), event.score(), details);
        } else {
            audit.warn("audit event={} action={} principal={} score={} details={}",
                    event.type(), event.action(), event.requesterIdentity(), event.score(), details);
        }
    }

    String toDetails(SecurityEvent event) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("userId", event.userId());
        details.put("contentId", event.contentId());
        details.put("sourceId", event.sourceId());
        details.put("inputLength", event.inputLength());
        details.put("threatCount", event.threatCount());
        details.put("topPattern", event.topPattern());
        details.put("preview", event.contentPreview());
        try {
            return objectMapper.writeValueAsString(details);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize audit details for {}: {}", event.type(), e.getMessage());
            return "{}";
        }
    }
}
