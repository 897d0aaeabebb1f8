package com.promptguard.content;

public enum SanitizationAction {
    ALLOW,
    SANITIZE,
    BLOCK
}
