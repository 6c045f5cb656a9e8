package com.qmb.core.logging;

import com.qmb.core.events.EventBus;
import com.qmb.core.events.ModelBuilderEvent;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Writes every session event to the {@code qmb.audit} logger and keeps the most recent
 * entries of each session for the {@code qmb_audit} tool.
 */
@Component
public class AuditTrail {

    private static final Logger audit = LoggerFactory.getLogger("qmb.audit");

    static final int MAX_ENTRIES_PER_SESSION = 200;

    private final EventBus eventBus;
    private final Map<String, Deque<ModelBuilderEvent>> history = new ConcurrentHashMap<>();
    private EventBus.Subscription subscription;

    public AuditTrail(EventBus eventBus) {
        this.eventBus = eventBus;
    }

    @PostConstruct
    void start() {
        subscription = eventBus.subscribeAll(this::record);
    }

    @PreDestroy
    void stop() {
        if (subscription != null) {
            subscription.unsubscribe();
        }
    }

    void record(ModelBuilderEvent event) {
        if (event.stage() != null) {
            audit.info("[{}] {} stage={} {}", event.sessionId(), event.eventType(), event.stage(), event.payload());
        } else {
            audit.info("[{}] {} {}", event.sessionId(), event.eventType(), event.payload());
        }
        Deque<ModelBuilderEvent> entries = history.computeIfAbsent(event.sessionId(), k -> new ArrayDeque<>());
        synchronized (entries) {
            entries.addLast(event);
            while (entries.size() > MAX_ENTRIES_PER_SESSION) {
                entries.removeFirst();
            }
        }
    }

    /** Recorded events of a session, oldest first. */
    public List<ModelBuilderEvent> history(String sessionId) {
        Deque<ModelBuilderEvent> entries = history.get(sessionId);
        if (entries == null) {
            return List.of();
        }
        synchronized (entries) {
            return List.copyOf(entries);
        }
    }
}
