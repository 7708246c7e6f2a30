package com.agentvm.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub event bus for pool lifecycle events.
 * <p>
 * Supports per-pool subscriptions and global subscriptions that receive all events.
 * Thread-safe for concurrent publish and subscribe operations; a failing subscriber
 * never affects the publisher or other subscribers.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    /** Per-pool subscribers keyed by poolId. */
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<PoolEvent>>> poolSubscribers =
            new ConcurrentHashMap<>();

    /** Global subscribers that receive events from all pools. */
    private final CopyOnWriteArrayList<Consumer<PoolEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    /**
     * Publish an event to all matching subscribers (pool-specific and global).
     *
     * @param event the event to publish
     */
    public void publish(PoolEvent event) {
        log.debug("Publishing event: {} for pool {}", event.eventType(), event.poolId());

        List<Consumer<PoolEvent>> poolSubs = poolSubscribers.get(event.poolId());
        if (poolSubs != null) {
            for (Consumer<PoolEvent> subscriber : poolSubs) {
                deliverSafely(subscriber, event);
            }
        }

        for (Consumer<PoolEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to events for a specific pool.
     *
     * @param poolId   the pool to subscribe to
     * @param consumer callback invoked for each event
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String poolId, Consumer<PoolEvent> consumer) {
        poolSubscribers.computeIfAbsent(poolId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        log.debug("Subscribed to pool {}", poolId);
        return () -> {
            CopyOnWriteArrayList<Consumer<PoolEvent>> subs = poolSubscribers.get(poolId);
            if (subs != null) {
                subs.remove(consumer);
            }
        };
    }

    /**
     * Subscribe to events from all pools.
     */
    public Subscription subscribeAll(Consumer<PoolEvent> consumer) {
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

    private void deliverSafely(Consumer<PoolEvent> subscriber, PoolEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
