package com.phillippitts.terrarium.service.health;

import com.phillippitts.terrarium.service.loop.MainLoop;
import com.phillippitts.terrarium.service.safety.EmergencyStopState;
import com.phillippitts.terrarium.service.safety.SafetyService;
import com.phillippitts.terrarium.service.watchdog.Watchdog;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Health indicator for the supervision runtime.
 *
 * <ul>
 *   <li>UP: loop running, no emergency stop, every supervised service within its restart budget</li>
 *   <li>DEGRADED: loop not running, or a supervised service exhausted its restart budget</li>
 *   <li>DOWN: an emergency stop is latched</li>
 * </ul>
 *
 * <p>Exposed through the actuator health endpoint over JMX; the application runs no web server.
 */
@Component
public class SupervisionHealthIndicator implements HealthIndicator {

    static final String DEGRADED = "DEGRADED";

    private final MainLoop mainLoop;
    private final Watchdog watchdog;
    private final SafetyService safetyService;

    public SupervisionHealthIndicator(MainLoop mainLoop, Watchdog watchdog, SafetyService safetyService) {
        this.mainLoop = mainLoop;
        this.watchdog = watchdog;
        this.safetyService = safetyService;
    }

    @Override
    public Health health() {
        EmergencyStopState emergency = safetyService.getEmergencyStopState();
        List<String> exhausted = watchdog.getExhaustedServices();
        boolean loopRunning = mainLoop.isRunning();

        Health.Builder builder = new Health.Builder();
        if (emergency.active()) {
            builder.down()
                    .withDetail("status", "Emergency stop latched")
                    .withDetail("reason", emergency.reason())
                    .withDetail("since", String.valueOf(emergency.armedAt()));
        } else if (!loopRunning || !exhausted.isEmpty()) {
            builder.status(DEGRADED)
                    .withDetail("status", loopRunning ? "Supervision partially unavailable" : "Control loop not running");
        } else {
            builder.up().withDetail("status", "Supervision operational");
        }

        return builder
                .withDetail("loop", mainLoop.getState().name().toLowerCase(Locale.ROOT))
                .withDetail("cycles", mainLoop.getStats().cycles())
                .withDetail("watchdog", watchdog.isRunning() ? "running" : "stopped")
                .withDetail("unsupervised", exhausted)
                .withDetail("activeAlerts", safetyService.getSafetyStatus().activeAlerts())
                .build();
    }
}
