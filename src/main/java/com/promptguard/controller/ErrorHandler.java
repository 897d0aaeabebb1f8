package com.promptguard.controller;

import com.promptguard.content.UntrustedContentFilter.ContentRejectedException;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.HashMap;
import java.util.Map;

@RestControllerAdvice
public class ErrorHandler {

    @ExceptionHandler(ContentRejectedException.class)
    @ResponseStatus(HttpStatus.UNPROCESSABLE_ENTITY)
    public Map<String, Object> handleRejected(ContentRejectedException ex) {
        Map<String, Object> body = new HashMap<>();
        body.put("code", "CONTENT_BLOCKED");
        body.put("message", ex.getMessage());
        body.put("score", ex.getScore());
        body.put("threat_count", ex.getThreatCount());
        body.put("top_pattern", ex.getTopPattern());
        return body;
    }

    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleBadRequest(IllegalArgumentException ex) {
        return Map.of(
                "code", "BAD_REQUEST",
                "message", String.valueOf(ex.getMessage()));
    }
}
