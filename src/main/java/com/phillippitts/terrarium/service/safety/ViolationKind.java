package com.phillippitts.terrarium.service.safety;

/**
 * Kinds of threshold crossing detected by {@link SafetyService}.
 */
public enum ViolationKind {

    TEMPERATURE_CRITICAL_HIGH("temperature_critical_high", "temperature"),
    TEMPERATURE_CRITICAL_LOW("temperature_critical_low", "temperature"),
    HUMIDITY_CRITICAL_HIGH("humidity_critical_high", "humidity"),
    HUMIDITY_CRITICAL_LOW("humidity_critical_low", "humidity"),
    AIR_QUALITY_HAZARDOUS("air_quality_hazardous", "air_quality"),
    WATER_LEVEL_CRITICAL("water_level_critical", "water_level");

    private final String code;
    private final String parameter;

    ViolationKind(String code, String parameter) {
        this.code = code;
        this.parameter = parameter;
    }

    /** Wire identifier used as the {@code type} of a {@code safety_alert} payload. */
    public String code() {
        return code;
    }

    public String parameter() {
        return parameter;
    }
}
