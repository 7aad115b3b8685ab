package com.codeharness.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub event bus for compilation and test-run events.
 * <p>
 * Supports per-session subscriptions and global subscriptions that receive all events.
 * Safe to publish from worker threads; a subscriber that throws is logged and skipped.
 */
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<HarnessEvent>>> sessionSubscribers =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<HarnessEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    public void publish(HarnessEvent event) {
        log.trace("Publishing {} for session {}", event.eventType(), event.sessionId());

        List<Consumer<HarnessEvent>> sessionSubs = sessionSubscribers.get(event.sessionId());
        if (sessionSubs != null) {
            for (Consumer<HarnessEvent> subscriber : sessionSubs) {
                deliverSafely(subscriber, event);
            }
        }
        for (Consumer<HarnessEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to events of one session.
     *
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String sessionId, Consumer<HarnessEvent> consumer) {
        sessionSubscribers.computeIfAbsent(sessionId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        return () -> {
            CopyOnWriteArrayList<Consumer<HarnessEvent>> subs = sessionSubscribers.get(sessionId);
            if (subs != null) {
                subs.remove(consumer);
                if (subs.isEmpty()) {
                    sessionSubscribers.remove(sessionId, subs);
                }
            }
        };
    }

    public Subscription subscribeAll(Consumer<HarnessEvent> consumer) {
        globalSubscribers.add(consumer);
        return () -> globalSubscribers.remove(consumer);
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<HarnessEvent> subscriber, HarnessEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
