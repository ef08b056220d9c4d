package com.phillippitts.terrarium.service.safety;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Critical thresholds enforced by {@link SafetyService}.
 *
 * @param temperatureMin        temperature below this is critical (°C)
 * @param temperatureMax        temperature above this is critical (°C)
 * @param humidityMin           humidity below this is critical (%)
 * @param humidityMax           humidity above this is critical (%)
 * @param airQualityHazardous   AQI at or above this is hazardous
 * @param waterLevelCritical    water level at or below this is critical (%)
 * @param failsafes             opaque {@code failsafes} section of the limits document, never interpreted here
 */
public record SafetyLimits(
        double temperatureMin,
        double temperatureMax,
        double humidityMin,
        double humidityMax,
        double airQualityHazardous,
        double waterLevelCritical,
        Map<String, Object> failsafes
) {

    public static final double DEFAULT_TEMPERATURE_MIN = 5.0;
    public static final double DEFAULT_TEMPERATURE_MAX = 45.0;
    public static final double DEFAULT_HUMIDITY_MIN = 10.0;
    public static final double DEFAULT_HUMIDITY_MAX = 99.0;
    public static final double DEFAULT_AIR_QUALITY_HAZARDOUS = 300.0;
    public static final double DEFAULT_WATER_LEVEL_CRITICAL = 15.0;

    public SafetyLimits {
        failsafes = failsafes == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(failsafes));
    }

    /**
     * Limits used when no safety document is available.
     */
    public static SafetyLimits defaults() {
        return new SafetyLimits(
                DEFAULT_TEMPERATURE_MIN,
                DEFAULT_TEMPERATURE_MAX,
                DEFAULT_HUMIDITY_MIN,
                DEFAULT_HUMIDITY_MAX,
                DEFAULT_AIR_QUALITY_HAZARDOUS,
                DEFAULT_WATER_LEVEL_CRITICAL,
                Map.of());
    }
}
