package com.forecastmind.dispatch.api;

import com.forecastmind.core.events.EventBus;
import com.forecastmind.core.events.ForecastEvent;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Relays {@link EventBus} events for one forecast to an {@link SseEmitter}.
 * <p>
 * The emitter completes itself after a terminal event (pipeline completed, pipeline error
 * or task cancelled). Idle connections get a comment heartbeat every 30 seconds.
 */
@Service
public class SseStreamingService {

    private static final Logger log = LoggerFactory.getLogger(SseStreamingService.class);

    /** Long enough for a deep forecast. */
    private static final long DEFAULT_TIMEOUT_MS = 15 * 60 * 1000L;

    private static final long HEARTBEAT_INTERVAL_SECONDS = 30;

    private final EventBus eventBus;
    private final long timeoutMs;

    private final CopyOnWriteArrayList<Registration> registrations = new CopyOnWriteArrayList<>();

    private final ScheduledExecutorService heartbeat = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "sse-heartbeat");
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public SseStreamingService(EventBus eventBus) {
        this(eventBus, DEFAULT_TIMEOUT_MS);
    }

    SseStreamingService(EventBus eventBus, long timeoutMs) {
        this.eventBus = eventBus;
        this.timeoutMs = timeoutMs;
    }

    @PostConstruct
    void startHeartbeat() {
        heartbeat.scheduleAtFixedRate(this::sendHeartbeats,
                HEARTBEAT_INTERVAL_SECONDS, HEARTBEAT_INTERVAL_SECONDS, TimeUnit.SECONDS);
    }

    @PreDestroy
    void stopHeartbeat() {
        heartbeat.shutdownNow();
        for (Registration registration : registrations) {
            registration.emitter().complete();
        }
        log.info("SSE streaming stopped ({} open stream(s) closed)", registrations.size());
    }

    public SseEmitter createEmitter(String forecastId) {
        SseEmitter emitter = new SseEmitter(timeoutMs);
        EventBus.Subscription subscription = eventBus.subscribe(forecastId, event -> relay(emitter, event));
        var registration = new Registration(forecastId, emitter, subscription);
        registrations.add(registration);

        emitter.onCompletion(() -> cleanup(registration));
        emitter.onTimeout(() -> {
            log.debug("SSE stream for forecast {} timed out", forecastId);
            cleanup(registration);
        });
        emitter.onError(ex -> {
            log.debug("SSE stream for forecast {} errored: {}", forecastId, ex.getMessage());
            cleanup(registration);
        });

        try {
            emitter.send(SseEmitter.event().comment("connected"));
        } catch (IOException e) {
            log.warn("Failed to open SSE stream for forecast {}: {}", forecastId, e.getMessage());
        }
        log.info("SSE stream opened for forecast {}", forecastId);
        return emitter;
    }

    public int activeEmitterCount() {
        return registrations.size();
    }

    void sendHeartbeats() {
        for (Registration registration : registrations) {
            try {
                registration.emitter().send(SseEmitter.event().comment("heartbeat"));
            } catch (IOException | IllegalStateException e) {
                // lifecycle callbacks remove the registration
                log.debug("Heartbeat skipped for forecast {}: {}", registration.forecastId(), e.getMessage());
            }
        }
    }

    private void relay(SseEmitter emitter, ForecastEvent event) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("forecastId", event.forecastId());
        if (event.taskId() != null) {
            data.put("taskId", event.taskId());
        }
        data.putAll(event.payload());
        data.put("timestamp", event.timestamp().toString());
        try {
            emitter.send(SseEmitter.event().name(event.eventType()).data(data));
            if (event.isTerminal()) {
                emitter.complete();
            }
        } catch (IOException | IllegalStateException e) {
            log.debug("Could not relay {} for forecast {}: {}", event.eventType(), event.forecastId(), e.getMessage());
        }
    }

    private void cleanup(Registration registration) {
        registration.subscription().unsubscribe();
        registrations.remove(registration);
    }

    private record Registration(String forecastId, SseEmitter emitter, EventBus.Subscription subscription) {}
}
