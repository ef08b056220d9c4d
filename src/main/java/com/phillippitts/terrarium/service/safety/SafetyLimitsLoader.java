package com.phillippitts.terrarium.service.safety;

import com.phillippitts.terrarium.exception.ConfigurationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

/**
 * Reads the safety limits document:
 *
 * <pre>
 * {
 *   "temperature": {"critical_min": 5, "critical_max": 45},
 *   "humidity":    {"critical_min": 10, "critical_max": 99},
 *   "air_quality": {"hazardous_threshold": 300},
 *   "water_level": {"critical_level": 15},
 *   "failsafes":   { ... }
 * }
 * </pre>
 *
 * Missing sections or keys fall back to {@link SafetyLimits} defaults individually.
 */
public class SafetyLimitsLoader {

    private static final Logger LOG = LogManager.getLogger(SafetyLimitsLoader.class);

    /**
     * @return limits read from {@code path}, or empty if the file does not exist
     * @throws ConfigurationException if the file exists but cannot be read or is not a JSON object
     */
    public Optional<SafetyLimits> load(Path path) {
        if (!Files.isRegularFile(path)) {
            return Optional.empty();
        }
        String content;
        try {
            content = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ConfigurationException(path.toString(), "Cannot read safety limits", e);
        }
        try {
            SafetyLimits limits = parse(new JSONObject(content));
            LOG.info("Safety limits loaded from {}", path);
            return Optional.of(limits);
        } catch (JSONException e) {
            throw new ConfigurationException(path.toString(), "Malformed safety limits: " + e.getMessage(), e);
        }
    }

    SafetyLimits parse(JSONObject root) {
        JSONObject temperature = section(root, "temperature");
        JSONObject humidity = section(root, "humidity");
        JSONObject airQuality = section(root, "air_quality");
        JSONObject waterLevel = section(root, "water_level");
        JSONObject failsafes = root.optJSONObject("failsafes");

        Map<String, Object> failsafeMap = failsafes == null ? Map.of() : failsafes.toMap();
        return new SafetyLimits(
                temperature.optDouble("critical_min", SafetyLimits.DEFAULT_TEMPERATURE_MIN),
                temperature.optDouble("critical_max", SafetyLimits.DEFAULT_TEMPERATURE_MAX),
                humidity.optDouble("critical_min", SafetyLimits.DEFAULT_HUMIDITY_MIN),
                humidity.optDouble("critical_max", SafetyLimits.DEFAULT_HUMIDITY_MAX),
                airQuality.optDouble("hazardous_threshold", SafetyLimits.DEFAULT_AIR_QUALITY_HAZARDOUS),
                waterLevel.optDouble("critical_level", SafetyLimits.DEFAULT_WATER_LEVEL_CRITICAL),
                failsafeMap);
    }

    private static JSONObject section(JSONObject root, String key) {
        JSONObject section = root.optJSONObject(key);
        return section == null ? new JSONObject() : section;
    }
}
