package com.promptguard.content.sanitize;

public record SanitizationOutcome(String sanitizedContent, int sectionsRemoved) {}
