package com.phillippitts.terrarium.service.safety;

import com.phillippitts.terrarium.bus.EventBus;
import com.phillippitts.terrarium.bus.EventHandler;
import com.phillippitts.terrarium.bus.EventTypes;
import com.phillippitts.terrarium.service.safety.event.EmergencyResumeEvent;
import com.phillippitts.terrarium.service.safety.event.EmergencyStopEvent;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Operator-facing log of safety events. Throttled per alert type to avoid log spam while a
 * reading stays out of range for many cycles.
 */
@Component
class SafetyEventsListener {
    private static final Logger LOG = LogManager.getLogger(SafetyEventsListener.class);

    private static final Duration THROTTLE = Duration.ofMinutes(1);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private final EventBus eventBus;
    private final Clock clock;

    private EventHandler alertHandler;
    private EventHandler stopHandler;
    private EventHandler resumeHandler;

    @Autowired
    SafetyEventsListener(EventBus eventBus) {
        this(eventBus, Clock.systemUTC());
    }

    // Visible for tests
    SafetyEventsListener(EventBus eventBus, Clock clock) {
        this.eventBus = eventBus;
        this.clock = clock;
    }

    @PostConstruct
    void subscribe() {
        alertHandler = eventBus.subscribe(EventTypes.SAFETY_ALERT, payload -> {
            if (payload instanceof SafetyViolation v) {
                onSafetyAlert(v);
            }
        });
        stopHandler = eventBus.subscribe(EventTypes.EMERGENCY_STOP, payload -> {
            if (payload instanceof EmergencyStopEvent e) {
                onEmergencyStop(e);
            }
        });
        resumeHandler = eventBus.subscribe(EventTypes.EMERGENCY_RESUME, payload -> {
            if (payload instanceof EmergencyResumeEvent e) {
                onEmergencyResume(e);
            }
        });
    }

    @PreDestroy
    void unsubscribe() {
        eventBus.unsubscribe(EventTypes.SAFETY_ALERT, alertHandler);
        eventBus.unsubscribe(EventTypes.EMERGENCY_STOP, stopHandler);
        eventBus.unsubscribe(EventTypes.EMERGENCY_RESUME, resumeHandler);
    }

    void onSafetyAlert(SafetyViolation v) {
        if (shouldLog("alert-" + v.type())) {
            LOG.warn("Safety alert: type={}, value={}, limit={}. Acknowledge once the enclosure is checked.",
                    v.type(), v.value(), v.limit());
        }
    }

    void onEmergencyStop(EmergencyStopEvent e) {
        // Never throttled: one per danger episode by construction
        LOG.warn("Emergency stop latched at {}: {}. Actuators must stay in failsafe state until cleared.",
                e.timestamp(), e.reason());
    }

    void onEmergencyResume(EmergencyResumeEvent e) {
        lastLog.clear();
        LOG.info("Emergency stop cleared at {}", e.timestamp());
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = clock.instant();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
