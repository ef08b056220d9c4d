package com.phillippitts.terrarium.service.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SupervisionMetricsTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final SupervisionMetrics metrics = new SupervisionMetrics(registry);

    @Test
    void shouldCountCyclesAndErrors() {
        metrics.incrementCycles();
        metrics.incrementCycles();
        metrics.incrementCycleErrors();

        assertThat(registry.get("terrarium.loop.cycles").counter().count()).isEqualTo(2.0);
        assertThat(registry.get("terrarium.loop.errors").counter().count()).isEqualTo(1.0);
    }

    @Test
    void shouldTagRestartsPerService() {
        metrics.incrementRestarts("control_service");
        metrics.incrementRestarts("control_service");
        metrics.incrementRestarts("camera");
        metrics.incrementBudgetExhausted("camera");

        assertThat(registry.get("terrarium.watchdog.restarts").tag("service", "control_service").counter().count())
                .isEqualTo(2.0);
        assertThat(registry.get("terrarium.watchdog.restarts").tag("service", "camera").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.get("terrarium.watchdog.budget.exhausted").tag("service", "camera").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void shouldTagViolationsPerParameter() {
        metrics.incrementViolations("temperature");
        metrics.incrementEmergencyStops();

        assertThat(registry.get("terrarium.safety.violations").tag("parameter", "temperature").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.get("terrarium.safety.emergency.stops").counter().count()).isEqualTo(1.0);
    }
}
