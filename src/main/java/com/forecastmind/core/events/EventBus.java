package com.forecastmind.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub bus for pipeline events.
 * <p>
 * Subscribers register either for one forecast or globally. A subscriber that throws
 * is logged and skipped; it never affects delivery to the others or the publisher.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<ForecastEvent>>> forecastSubscribers =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<ForecastEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    public void publish(ForecastEvent event) {
        log.debug("Publishing {} for forecast {}", event.eventType(), event.forecastId());

        List<Consumer<ForecastEvent>> subs = forecastSubscribers.get(event.forecastId());
        if (subs != null) {
            for (Consumer<ForecastEvent> subscriber : subs) {
                deliverSafely(subscriber, event);
            }
        }
        for (Consumer<ForecastEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to events of one forecast.
     *
     * @return a handle that removes the subscription
     */
    public Subscription subscribe(String forecastId, Consumer<ForecastEvent> consumer) {
        forecastSubscribers.computeIfAbsent(forecastId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        log.debug("Subscribed to forecast {}", forecastId);
        return () -> forecastSubscribers.computeIfPresent(forecastId, (k, subs) -> {
            subs.remove(consumer);
            return subs.isEmpty() ? null : subs;
        });
    }

    /** Subscribe to events of every forecast. */
    public Subscription subscribeAll(Consumer<ForecastEvent> consumer) {
        globalSubscribers.add(consumer);
        log.debug("Subscribed to all forecast events");
        return () -> globalSubscribers.remove(consumer);
    }

    /** Number of per-forecast subscribers currently registered for {@code forecastId}. */
    public int subscriberCount(String forecastId) {
        List<Consumer<ForecastEvent>> subs = forecastSubscribers.get(forecastId);
        return subs != null ? subs.size() : 0;
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<ForecastEvent> subscriber, ForecastEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
