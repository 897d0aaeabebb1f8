package com.promptguard.content;

/**
 * Who asked for the analysis. Forwarded to the security event sink only.
 */
public record RequestContext(String requesterIdentity, String userId) {

    private static final RequestContext SYSTEM = new RequestContext("system", null);

    public RequestContext {
        if (requesterIdentity == null || requesterIdentity.isBlank()) {
            requesterIdentity = "unknown";
        }
    }

    public static RequestContext system() {
        return SYSTEM;
    }
}
