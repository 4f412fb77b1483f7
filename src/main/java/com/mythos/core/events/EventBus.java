package com.mythos.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Synchronous in-memory pub/sub for objective and achievement events.
 * <p>
 * Subscribers register for one event type or for everything. A subscriber that throws is
 * logged and skipped; delivery to the others continues. Subscribers must not call back into
 * mutating manager operations.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    /** Subscribers keyed by event type. */
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<MythosEvent>>> typeSubscribers =
            new ConcurrentHashMap<>();

    /** Subscribers that receive every event. */
    private final CopyOnWriteArrayList<Consumer<MythosEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    /**
     * Publish an event to its type's subscribers, then to global subscribers.
     *
     * @param event the event to publish
     */
    public void publish(MythosEvent event) {
        log.debug("Publishing event: {} for {}", event.eventType(), event.subjectId());

        List<Consumer<MythosEvent>> typeSubs = typeSubscribers.get(event.eventType());
        if (typeSubs != null) {
            for (Consumer<MythosEvent> subscriber : typeSubs) {
                deliverSafely(subscriber, event);
            }
        }

        for (Consumer<MythosEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to one event type.
     *
     * @param eventType the event type to listen for
     * @param consumer  callback invoked for each matching event
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String eventType, Consumer<MythosEvent> consumer) {
        typeSubscribers.computeIfAbsent(eventType, k -> new CopyOnWriteArrayList<>()).add(consumer);
        log.debug("Subscribed to event type {}", eventType);
        return () -> {
            CopyOnWriteArrayList<Consumer<MythosEvent>> subs = typeSubscribers.get(eventType);
            if (subs != null) {
                subs.remove(consumer);
            }
        };
    }

    /**
     * Subscribe to every event.
     *
     * @param consumer callback invoked for each event
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribeAll(Consumer<MythosEvent> consumer) {
        globalSubscribers.add(consumer);
        log.debug("Subscribed to all events (global)");
        return () -> globalSubscribers.remove(consumer);
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<MythosEvent> subscriber, MythosEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
