package com.phillippitts.petpal.service.events;

import com.phillippitts.petpal.service.broadcast.BusFanoutDegradedEvent;
import com.phillippitts.petpal.service.capability.AdapterFailureEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized handler for operational warnings. Throttled to one line per key per minute to avoid
 * log spam while an adapter or the shared bus keeps failing.
 */
@Component
class OperationalEventsListener {
    private static final Logger LOG = LogManager.getLogger(OperationalEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    @EventListener
    void onBusFanoutDegraded(BusFanoutDegradedEvent e) {
        if (shouldLog("bus-" + e.channel())) {
            LOG.warn("Shared bus '{}' degraded: {}. Sibling instances will miss notifications "
                    + "until Redis is reachable.", e.channel(), e.reason());
        }
    }

    @EventListener
    void onAdapterFailure(AdapterFailureEvent e) {
        String key = "adapter-" + e.capability() + '-' + e.operation() + '-' + e.context().get("reason");
        if (shouldLog(key)) {
            LOG.warn("Capability {}.{} failed: {} (reason={})", e.capability(), e.operation(), e.message(),
                    e.context().get("reason"));
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
