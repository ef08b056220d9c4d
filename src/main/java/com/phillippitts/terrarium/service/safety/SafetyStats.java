package com.phillippitts.terrarium.service.safety;

import java.time.Instant;

/**
 * Monotonic counters kept by {@link SafetyService}; reset only on process restart.
 */
public record SafetyStats(
        long safetyChecks,
        long violationsDetected,
        long emergencyStops,
        long alertsGenerated,
        Instant startedAt
) {
}
