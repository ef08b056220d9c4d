package com.phillippitts.terrarium.service.safety;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable record of one threshold crossing. Published as the payload of {@code safety_alert}
 * and appended to the violation log of {@link SafetyService}.
 *
 * @param kind      what was crossed
 * @param parameter sensor parameter (temperature, humidity, air_quality, water_level)
 * @param value     observed reading
 * @param limit     threshold that was crossed
 * @param severity  always {@link Severity#CRITICAL} today
 * @param message   human-readable description, one decimal place for readings
 * @param timestamp detection time
 */
public record SafetyViolation(
        ViolationKind kind,
        String parameter,
        double value,
        double limit,
        Severity severity,
        String message,
        Instant timestamp
) {

    public SafetyViolation {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(timestamp, "timestamp");
    }

    /** Wire identifier of the violation kind, e.g. {@code temperature_critical_high}. */
    public String type() {
        return kind.code();
    }

    public boolean isCritical() {
        return severity == Severity.CRITICAL;
    }
}
