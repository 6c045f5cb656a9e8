package com.qmb.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub for build session events.
 * <p>
 * Every subscriber sees the events of all sessions and filters on
 * {@link ModelBuilderEvent#sessionId()} itself. A failing subscriber is logged and skipped;
 * it never affects the publisher or other subscribers.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final CopyOnWriteArrayList<Consumer<ModelBuilderEvent>> subscribers = new CopyOnWriteArrayList<>();

    public void publish(ModelBuilderEvent event) {
        log.debug("Publishing event: {} for session {}", event.eventType(), event.sessionId());

        for (Consumer<ModelBuilderEvent> subscriber : subscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * @return handle used to unsubscribe
     */
    public Subscription subscribeAll(Consumer<ModelBuilderEvent> consumer) {
        subscribers.add(consumer);
        return () -> subscribers.remove(consumer);
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<ModelBuilderEvent> subscriber, ModelBuilderEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
