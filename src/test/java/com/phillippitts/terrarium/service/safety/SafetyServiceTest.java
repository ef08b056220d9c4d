package com.phillippitts.terrarium.service.safety;

import com.phillippitts.terrarium.bus.EventBus;
import com.phillippitts.terrarium.bus.EventTypes;
import com.phillippitts.terrarium.service.metrics.SupervisionMetrics;
import com.phillippitts.terrarium.service.safety.event.EmergencyResumeEvent;
import com.phillippitts.terrarium.service.safety.event.EmergencyStopEvent;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class SafetyServiceTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T12:00:00Z"));
    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final EventBus bus = new EventBus();
    private final List<String> events = new ArrayList<>();
    private final List<Object> payloads = new ArrayList<>();
    private SafetyService service;

    @BeforeEach
    void setUp() {
        for (String type : List.of(EventTypes.SAFETY_ALERT, EventTypes.EMERGENCY_STOP, EventTypes.EMERGENCY_RESUME)) {
            bus.subscribe(type, p -> {
                events.add(type);
                payloads.add(p);
            });
        }
        service = new SafetyService(bus, SafetyLimits.defaults(), new SupervisionMetrics(registry), clock);
    }

    @Test
    void shouldReturnTrueAndEmitNothingWhenWithinLimits() {
        boolean safe = service.checkSafetyLimits(Map.of(
                "temperature", 25.0, "humidity", 60.0, "air_quality", 50, "water_level", 80.0));

        assertThat(safe).isTrue();
        assertThat(events).isEmpty();
        assertThat(service.getSafetyStatus().stats().safetyChecks()).isEqualTo(1);
    }

    @Test
    void shouldEmitEmergencyStopOncePerEpisode() {
        assertThat(service.checkSafetyLimits(Map.of("temperature", 50.0))).isFalse();

        assertThat(events).containsExactly(EventTypes.SAFETY_ALERT, EventTypes.EMERGENCY_STOP);
        assertThat(service.getViolations(Duration.ofHours(24))).hasSize(1);
        EmergencyStopEvent stop = (EmergencyStopEvent) payloads.get(1);
        assertThat(stop.reason()).isEqualTo("Critical high temperature: 50.0°C (limit: 45.0°C)");
        assertThat(stop.violation().type()).isEqualTo("temperature_critical_high");

        events.clear();
        assertThat(service.checkSafetyLimits(Map.of("temperature", 60.0))).isFalse();

        assertThat(events).containsExactly(EventTypes.SAFETY_ALERT);
        assertThat(service.isEmergencyStopActive()).isTrue();
        assertThat(registry.get("terrarium.safety.emergency.stops").counter().count()).isEqualTo(1.0);
    }

    @Test
    void shouldRearmAfterClear() {
        service.checkSafetyLimits(Map.of("temperature", 50.0));
        events.clear();

        assertThat(service.clearEmergencyStop()).isTrue();
        assertThat(events).containsExactly(EventTypes.EMERGENCY_RESUME);
        assertThat(payloads.get(payloads.size() - 1)).isInstanceOf(EmergencyResumeEvent.class);
        assertThat(service.isEmergencyStopActive()).isFalse();

        events.clear();
        service.checkSafetyLimits(Map.of("temperature", 2.0));

        assertThat(events).containsExactly(EventTypes.SAFETY_ALERT, EventTypes.EMERGENCY_STOP);
        assertThat(service.getEmergencyStopState().reason()).startsWith("Critical low temperature: 2.0°C");
    }

    @Test
    void clearShouldReturnFalseAndEmitNothingWhenNotArmed() {
        assertThat(service.clearEmergencyStop()).isFalse();
        assertThat(events).isEmpty();
    }

    @Test
    void shouldNeverAutoClearWhenReadingsRecover() {
        service.checkSafetyLimits(Map.of("humidity", 100.0));

        assertThat(service.checkSafetyLimits(Map.of("humidity", 60.0))).isTrue();

        assertThat(service.isEmergencyStopActive()).isTrue();
    }

    @Test
    void shouldPublishAllAlertsBeforeSingleStopTriggeredByFirstViolation() {
        boolean safe = service.checkSafetyLimits(Map.of("temperature", 50.0, "water_level", 10.0));

        assertThat(safe).isFalse();
        assertThat(events).containsExactly(
                EventTypes.SAFETY_ALERT, EventTypes.SAFETY_ALERT, EventTypes.EMERGENCY_STOP);
        EmergencyStopEvent stop = (EmergencyStopEvent) payloads.get(2);
        assertThat(stop.violation().kind()).isEqualTo(ViolationKind.TEMPERATURE_CRITICAL_HIGH);
        assertThat(service.getActiveAlerts()).hasSize(2);
    }

    @Test
    void shouldReadNestedSnapshot() {
        boolean safe = service.checkSafetyLimits(Map.of(
                "dht22", Map.of("temperature", 20.0, "humidity", 5.0),
                "air_quality", Map.of("aqi", 350),
                "water_level", Map.of("level", 50.0)));

        assertThat(safe).isFalse();
        List<SafetyViolation> violations = service.getViolations(Duration.ofHours(1));
        assertThat(violations).extracting(SafetyViolation::type)
                .containsExactly("humidity_critical_low", "air_quality_hazardous");
        assertThat(violations.get(1).message()).isEqualTo("Hazardous air quality: AQI 350 (limit: 300)");
    }

    @Test
    void shouldApplyInclusiveFloorAndThresholdButExclusiveTemperatureBounds() {
        assertThat(service.checkSafetyLimits(Map.of("temperature", 45.0, "humidity", 10.0))).isTrue();
        assertThat(service.checkSafetyLimits(Map.of("air_quality", 300))).isFalse();
        assertThat(service.checkSafetyLimits(Map.of("water_level", 15.0))).isFalse();
    }

    @Test
    void shouldSkipAbsentAndNonNumericReadings() {
        assertThat(service.checkSafetyLimits(Map.of("temperature", "hot", "other", 1))).isTrue();
        assertThat(service.checkSafetyLimits(Map.of())).isTrue();
        assertThat(events).isEmpty();
    }

    @Test
    void acknowledgeOutOfRangeShouldReturnFalseAndChangeNothing() {
        service.checkSafetyLimits(Map.of("temperature", 50.0));

        assertThat(service.acknowledgeAlert(1)).isFalse();
        assertThat(service.acknowledgeAlert(-1)).isFalse();
        assertThat(service.getActiveAlerts()).hasSize(1);

        assertThat(service.acknowledgeAlert(0)).isTrue();
        assertThat(service.getActiveAlerts()).isEmpty();
        assertThat(service.getAlerts()).hasSize(1);
        assertThat(service.getSafetyStatus().activeAlerts()).isZero();
        assertThat(service.getSafetyStatus().totalAlerts()).isEqualTo(1);
    }

    @Test
    void getViolationsShouldFilterByWindow() {
        service.checkSafetyLimits(Map.of("temperature", 50.0));
        clock.advance(Duration.ofHours(2));
        service.checkSafetyLimits(Map.of("water_level", 1.0));

        assertThat(service.getViolations(Duration.ofHours(1))).extracting(SafetyViolation::parameter)
                .containsExactly("water_level");
        assertThat(service.getViolations(Duration.ofHours(24))).hasSize(2);
    }

    @Test
    void resetShouldDropStateWithoutEmitting() {
        service.checkSafetyLimits(Map.of("temperature", 50.0));
        events.clear();

        service.resetSafetyData();

        assertThat(events).isEmpty();
        assertThat(service.isEmergencyStopActive()).isFalse();
        assertThat(service.getAlerts()).isEmpty();
        SafetyStatus status = service.getSafetyStatus();
        assertThat(status.safetyViolations()).isZero();
        assertThat(status.stats().violationsDetected()).isEqualTo(1);
        assertThat(status.stats().emergencyStops()).isEqualTo(1);
    }

    @Test
    void failingSubscriberShouldNotBreakEnforcement() {
        bus.subscribe(EventTypes.SAFETY_ALERT, p -> {
            throw new IllegalStateException("display offline");
        });

        assertThat(service.checkSafetyLimits(Map.of("temperature", 50.0))).isFalse();

        assertThat(events).containsExactly(EventTypes.SAFETY_ALERT, EventTypes.EMERGENCY_STOP);
        assertThat(bus.getStats().errors()).isEqualTo(1);
    }

    @Test
    void statusShouldExposeLimitsAndFailsafes() {
        SafetyLimits limits = new SafetyLimits(10, 40, 20, 90, 200, 5, Map.of("heater", "off"));
        SafetyService custom = new SafetyService(bus, limits, SupervisionMetrics.standalone(), clock);

        SafetyServiceStatus status = custom.getStatus();

        assertThat(status.serviceName()).isEqualTo("safety_service");
        assertThat(status.safetyLimits().temperatureMax()).isEqualTo(40.0);
        assertThat(status.failsafes()).containsEntry("heater", "off");
        assertThat(custom.checkSafetyLimits(Map.of("temperature", 41.0))).isFalse();
    }

    @Test
    void loadLimitsShouldFallBackToDefaultsWhenMissingOrMalformed(@TempDir Path dir) throws IOException {
        SafetyLimitsLoader loader = new SafetyLimitsLoader();
        assertThat(SafetyService.loadLimits(loader, dir.resolve("absent.json"))).isEqualTo(SafetyLimits.defaults());

        Path broken = dir.resolve("broken.json");
        Files.writeString(broken, "{ not json");
        assertThat(SafetyService.loadLimits(loader, broken)).isEqualTo(SafetyLimits.defaults());
    }
}
