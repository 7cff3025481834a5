package com.forecastmind.core.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically reclaims terminal forecasts past their retention window.
 */
@Component
public class StoreCleanupScheduler {

    private static final Logger log = LoggerFactory.getLogger(StoreCleanupScheduler.class);

    private final ContextStore store;
    private final StoreProperties properties;

    public StoreCleanupScheduler(ContextStore store, StoreProperties properties) {
        this.store = store;
        this.properties = properties;
    }

    @Scheduled(fixedDelayString = "${forecast.store.cleanup-interval:PT1H}",
               initialDelayString = "${forecast.store.cleanup-interval:PT1H}")
    public void cleanup() {
        int removed = store.cleanupTerminal(properties.getRetention());
        log.debug("Scheduled store cleanup removed {} forecast(s)", removed);
    }
}
