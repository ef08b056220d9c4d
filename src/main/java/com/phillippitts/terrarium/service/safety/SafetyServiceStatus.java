package com.phillippitts.terrarium.service.safety;

import java.util.Map;

/**
 * Full service view: safety summary plus the limits in force and the opaque failsafe section.
 */
public record SafetyServiceStatus(
        String serviceName,
        boolean enabled,
        SafetyStatus safetyStatus,
        SafetyLimits safetyLimits,
        Map<String, Object> failsafes
) {
}
