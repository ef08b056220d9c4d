package com.phillippitts.terrarium.service.safety;

/**
 * Summary of the current safety state.
 *
 * @param emergencyStop     whether the emergency stop is latched
 * @param activeAlerts      unacknowledged alerts
 * @param totalAlerts       all alerts, acknowledged or not
 * @param safetyViolations  entries in the violation log
 * @param stats             lifetime counters
 */
public record SafetyStatus(
        boolean emergencyStop,
        int activeAlerts,
        int totalAlerts,
        int safetyViolations,
        SafetyStats stats
) {
}
