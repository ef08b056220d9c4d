package com.phillippitts.terrarium.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.stereotype.Component;

/**
 * Centralized metrics for the supervision runtime.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Control loop cycles and cycle failures</li>
 *   <li>Event handler failures per event type</li>
 *   <li>Watchdog restarts and exhausted restart budgets per service</li>
 *   <li>Safety violations per parameter and emergency stops</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer.
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class SupervisionMetrics {

    private static final String METRIC_PREFIX = "terrarium";

    private final MeterRegistry registry;

    public SupervisionMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Metrics backed by a private in-memory registry, for components constructed outside Spring.
     */
    public static SupervisionMetrics standalone() {
        return new SupervisionMetrics(new SimpleMeterRegistry());
    }

    public void incrementCycles() {
        Counter.builder(METRIC_PREFIX + ".loop.cycles")
                .description("Number of executed control loop cycles")
                .register(registry)
                .increment();
    }

    public void incrementCycleErrors() {
        Counter.builder(METRIC_PREFIX + ".loop.errors")
                .description("Number of control loop cycles that failed")
                .register(registry)
                .increment();
    }

    /**
     * @param eventType event type whose handler threw
     */
    public void incrementHandlerFailures(String eventType) {
        Counter.builder(METRIC_PREFIX + ".bus.handler.failures")
                .description("Number of event handler invocations that threw")
                .tag("type", eventType)
                .register(registry)
                .increment();
    }

    /**
     * @param serviceName supervised service that was restarted
     */
    public void incrementRestarts(String serviceName) {
        Counter.builder(METRIC_PREFIX + ".watchdog.restarts")
                .description("Number of successful watchdog restarts")
                .tag("service", serviceName)
                .register(registry)
                .increment();
    }

    /**
     * @param serviceName supervised service whose restart budget ran out
     */
    public void incrementBudgetExhausted(String serviceName) {
        Counter.builder(METRIC_PREFIX + ".watchdog.budget.exhausted")
                .description("Number of services left unsupervised after exhausting their restart budget")
                .tag("service", serviceName)
                .register(registry)
                .increment();
    }

    /**
     * @param parameter violated parameter (temperature, humidity, air_quality, water_level)
     */
    public void incrementViolations(String parameter) {
        Counter.builder(METRIC_PREFIX + ".safety.violations")
                .description("Number of detected safety violations")
                .tag("parameter", parameter)
                .register(registry)
                .increment();
    }

    public void incrementEmergencyStops() {
        Counter.builder(METRIC_PREFIX + ".safety.emergency.stops")
                .description("Number of armed emergency stops")
                .register(registry)
                .increment();
    }
}
