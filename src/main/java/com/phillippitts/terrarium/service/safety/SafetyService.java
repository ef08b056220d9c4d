package com.phillippitts.terrarium.service.safety;

import com.phillippitts.terrarium.bus.EventBus;
import com.phillippitts.terrarium.bus.EventTypes;
import com.phillippitts.terrarium.config.properties.SafetyProperties;
import com.phillippitts.terrarium.exception.ConfigurationException;
import com.phillippitts.terrarium.service.safety.event.EmergencyResumeEvent;
import com.phillippitts.terrarium.service.safety.event.EmergencyStopEvent;
import com.phillippitts.terrarium.service.metrics.SupervisionMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.DoubleFunction;

/**
 * Evaluates sensor snapshots against critical limits and owns the latched emergency stop.
 *
 * <p>Each check is independent: a failure while evaluating one parameter is logged and the
 * remaining parameters are still evaluated. Every violation found is logged, stored and
 * published as {@code safety_alert}; the first critical one arms the emergency stop, which
 * publishes {@code emergency_stop} once per danger episode. Only {@link #clearEmergencyStop()}
 * re-arms it. Readings returning to the safe range never clear it.
 *
 * <p>State is guarded by a lock; events are published after the lock is released.
 */
@Service
public class SafetyService {

    private static final Logger LOG = LogManager.getLogger(SafetyService.class);

    static final String SERVICE_NAME = "safety_service";

    private final EventBus eventBus;
    private final SupervisionMetrics metrics;
    private final Clock clock;
    private final SafetyLimits limits;

    private final ReentrantLock lock = new ReentrantLock();
    private final List<ActiveAlert> alerts = new ArrayList<>();
    private final List<SafetyViolation> violations = new ArrayList<>();
    private EmergencyStopState emergencyStop = EmergencyStopState.idle();

    private long safetyChecks;
    private long violationsDetected;
    private long emergencyStops;
    private long alertsGenerated;
    private final Instant startedAt;

    @Autowired
    public SafetyService(EventBus eventBus, SafetyProperties properties, SupervisionMetrics metrics) {
        this(eventBus, loadLimits(new SafetyLimitsLoader(), Path.of(properties.getLimitsFile())),
                metrics, Clock.systemUTC());
    }

    // Visible for tests
    SafetyService(EventBus eventBus, SafetyLimits limits, SupervisionMetrics metrics, Clock clock) {
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus");
        this.limits = Objects.requireNonNull(limits, "limits");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.startedAt = clock.instant();
    }

    /**
     * Loads limits from {@code path}. Absent or malformed documents are not fatal: the problem is
     * logged and the built-in defaults are returned.
     */
    static SafetyLimits loadLimits(SafetyLimitsLoader loader, Path path) {
        try {
            Optional<SafetyLimits> loaded = loader.load(path);
            if (loaded.isPresent()) {
                return loaded.get();
            }
            LOG.warn("Safety limits file not found at {}; using built-in defaults", path);
        } catch (ConfigurationException e) {
            LOG.error("Safety limits unusable, using built-in defaults: {}", e.getMessage(), e);
        }
        return SafetyLimits.defaults();
    }

    /**
     * Checks one raw sensor snapshot (flat or nested shape, see {@link SensorSnapshot}).
     *
     * @return {@code true} if no violation was found
     */
    public boolean checkSafetyLimits(Map<String, ?> sensorData) {
        return checkSafetyLimits(SensorSnapshot.from(sensorData));
    }

    /**
     * @return {@code true} if no violation was found
     */
    public boolean checkSafetyLimits(SensorSnapshot snapshot) {
        Instant now = clock.instant();
        List<SafetyViolation> found = new ArrayList<>(4);
        evaluate("temperature", snapshot.temperature(), v -> checkTemperature(v, now), found);
        evaluate("humidity", snapshot.humidity(), v -> checkHumidity(v, now), found);
        evaluate("air_quality", snapshot.airQuality(), v -> checkAirQuality(v, now), found);
        evaluate("water_level", snapshot.waterLevel(), v -> checkWaterLevel(v, now), found);

        SafetyViolation trigger = null;
        lock.lock();
        try {
            safetyChecks++;
            for (SafetyViolation violation : found) {
                violations.add(violation);
                alerts.add(new ActiveAlert(violation, now));
                violationsDetected++;
                alertsGenerated++;
                if (trigger == null && violation.isCritical() && !emergencyStop.active()) {
                    trigger = violation;
                }
            }
            if (trigger != null) {
                emergencyStop = new EmergencyStopState(true, trigger.message(), now);
                emergencyStops++;
            }
        } finally {
            lock.unlock();
        }

        for (SafetyViolation violation : found) {
            metrics.incrementViolations(violation.parameter());
            LOG.error("SAFETY VIOLATION: {}", violation.message());
            eventBus.emit(EventTypes.SAFETY_ALERT, violation);
        }
        if (trigger != null) {
            metrics.incrementEmergencyStops();
            LOG.error("EMERGENCY STOP triggered: {}", trigger.message());
            eventBus.emit(EventTypes.EMERGENCY_STOP, new EmergencyStopEvent(trigger.message(), now, trigger));
        }
        return found.isEmpty();
    }

    private void evaluate(String parameter, OptionalDouble reading,
                          DoubleFunction<Optional<SafetyViolation>> check, List<SafetyViolation> found) {
        if (reading.isEmpty()) {
            return;
        }
        try {
            check.apply(reading.getAsDouble()).ifPresent(found::add);
        } catch (RuntimeException e) {
            LOG.error("Failed to evaluate {} limits: {}", parameter, e.getMessage(), e);
        }
    }

    private Optional<SafetyViolation> checkTemperature(double value, Instant now) {
        if (value > limits.temperatureMax()) {
            return Optional.of(violation(ViolationKind.TEMPERATURE_CRITICAL_HIGH, value, limits.temperatureMax(),
                    String.format(Locale.ROOT, "Critical high temperature: %.1f°C (limit: %s°C)",
                            value, limits.temperatureMax()), now));
        }
        if (value < limits.temperatureMin()) {
            return Optional.of(violation(ViolationKind.TEMPERATURE_CRITICAL_LOW, value, limits.temperatureMin(),
                    String.format(Locale.ROOT, "Critical low temperature: %.1f°C (limit: %s°C)",
                            value, limits.temperatureMin()), now));
        }
        return Optional.empty();
    }

    private Optional<SafetyViolation> checkHumidity(double value, Instant now) {
        if (value > limits.humidityMax()) {
            return Optional.of(violation(ViolationKind.HUMIDITY_CRITICAL_HIGH, value, limits.humidityMax(),
                    String.format(Locale.ROOT, "Critical high humidity: %.1f%% (limit: %s%%)",
                            value, limits.humidityMax()), now));
        }
        if (value < limits.humidityMin()) {
            return Optional.of(violation(ViolationKind.HUMIDITY_CRITICAL_LOW, value, limits.humidityMin(),
                    String.format(Locale.ROOT, "Critical low humidity: %.1f%% (limit: %s%%)",
                            value, limits.humidityMin()), now));
        }
        return Optional.empty();
    }

    private Optional<SafetyViolation> checkAirQuality(double aqi, Instant now) {
        if (aqi >= limits.airQualityHazardous()) {
            return Optional.of(violation(ViolationKind.AIR_QUALITY_HAZARDOUS, aqi, limits.airQualityHazardous(),
                    String.format(Locale.ROOT, "Hazardous air quality: AQI %.0f (limit: %.0f)",
                            aqi, limits.airQualityHazardous()), now));
        }
        return Optional.empty();
    }

    private Optional<SafetyViolation> checkWaterLevel(double level, Instant now) {
        if (level <= limits.waterLevelCritical()) {
            return Optional.of(violation(ViolationKind.WATER_LEVEL_CRITICAL, level, limits.waterLevelCritical(),
                    String.format(Locale.ROOT, "Critical water level: %.1f%% (limit: %s%%)",
                            level, limits.waterLevelCritical()), now));
        }
        return Optional.empty();
    }

    private static SafetyViolation violation(ViolationKind kind, double value, double limit,
                                             String message, Instant now) {
        return new SafetyViolation(kind, kind.parameter(), value, limit, Severity.CRITICAL, message, now);
    }

    /**
     * Marks the alert at {@code index} (position in {@link #getAlerts()}) as acknowledged.
     *
     * @return {@code false} if the index is out of range; nothing is changed in that case
     */
    public boolean acknowledgeAlert(int index) {
        lock.lock();
        try {
            if (index < 0 || index >= alerts.size()) {
                return false;
            }
            alerts.get(index).acknowledge();
        } finally {
            lock.unlock();
        }
        LOG.info("Alert {} acknowledged", index);
        return true;
    }

    /**
     * Clears a latched emergency stop and publishes {@code emergency_resume}.
     *
     * @return {@code false} if no emergency stop was active; nothing is published in that case
     */
    public boolean clearEmergencyStop() {
        Instant now = clock.instant();
        lock.lock();
        try {
            if (!emergencyStop.active()) {
                return false;
            }
            emergencyStop = new EmergencyStopState(false, emergencyStop.reason(), emergencyStop.armedAt());
        } finally {
            lock.unlock();
        }
        LOG.info("Emergency stop cleared by operator");
        eventBus.emit(EventTypes.EMERGENCY_RESUME, new EmergencyResumeEvent(now));
        return true;
    }

    public boolean isEmergencyStopActive() {
        lock.lock();
        try {
            return emergencyStop.active();
        } finally {
            lock.unlock();
        }
    }

    public EmergencyStopState getEmergencyStopState() {
        lock.lock();
        try {
            return emergencyStop;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return unacknowledged alerts, oldest first
     */
    public List<ActiveAlert> getActiveAlerts() {
        lock.lock();
        try {
            return alerts.stream().filter(a -> !a.isAcknowledged()).toList();
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return every alert raised since the last reset, acknowledged or not; indexes match
     *         {@link #acknowledgeAlert(int)}
     */
    public List<ActiveAlert> getAlerts() {
        lock.lock();
        try {
            return List.copyOf(alerts);
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return violations detected within {@code window} of now, oldest first
     */
    public List<SafetyViolation> getViolations(Duration window) {
        Instant cutoff = clock.instant().minus(window);
        lock.lock();
        try {
            return violations.stream().filter(v -> !v.timestamp().isBefore(cutoff)).toList();
        } finally {
            lock.unlock();
        }
    }

    public SafetyStatus getSafetyStatus() {
        lock.lock();
        try {
            int unacknowledged = (int) alerts.stream().filter(a -> !a.isAcknowledged()).count();
            return new SafetyStatus(emergencyStop.active(), unacknowledged, alerts.size(), violations.size(),
                    new SafetyStats(safetyChecks, violationsDetected, emergencyStops, alertsGenerated, startedAt));
        } finally {
            lock.unlock();
        }
    }

    public SafetyServiceStatus getStatus() {
        return new SafetyServiceStatus(SERVICE_NAME, true, getSafetyStatus(), limits, limits.failsafes());
    }

    public SafetyLimits getLimits() {
        return limits;
    }

    /**
     * Drops alerts and violations and releases the emergency stop without publishing any event.
     * Lifetime counters are kept.
     */
    public void resetSafetyData() {
        lock.lock();
        try {
            alerts.clear();
            violations.clear();
            emergencyStop = EmergencyStopState.idle();
        } finally {
            lock.unlock();
        }
        LOG.info("Safety data reset");
    }
}
