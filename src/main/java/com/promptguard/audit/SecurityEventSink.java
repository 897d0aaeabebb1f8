package com.promptguard.audit;

/**
 * Destination for screening events: an event store, alerting pipeline or
 * plain log. Implementations may block; callers dispatch through
 * {@link SecurityEventPublisher} so analysis never waits on them.
 */
public interface SecurityEventSink {

    void record(SecurityEvent event);
}
