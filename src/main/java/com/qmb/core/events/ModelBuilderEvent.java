package com.qmb.core.events;

import java.time.Instant;
import java.util.Map;

/**
 * Event emitted as a build session progresses.
 *
 * @param eventType e.g. "session.started", "stage.approved", "export.created"
 * @param sessionId owning session
 * @param stage     stage letter, or {@code null} for session-level events
 */
public record ModelBuilderEvent(
        String eventType,
        String sessionId,
        String stage,
        Map<String, Object> payload,
        Instant timestamp
) {
    public static ModelBuilderEvent of(String eventType, String sessionId, String stage, Map<String, Object> payload) {
        return new ModelBuilderEvent(eventType, sessionId, stage, payload, Instant.now());
    }
}
