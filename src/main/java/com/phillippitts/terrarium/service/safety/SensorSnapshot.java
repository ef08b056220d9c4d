package com.phillippitts.terrarium.service.safety;

import java.util.Map;
import java.util.OptionalDouble;

/**
 * The four safety-relevant readings extracted from a raw sensor map.
 *
 * <p>Two input shapes are accepted:
 * <ul>
 *   <li>nested: {@code dht22{temperature,humidity}}, {@code air_quality{aqi}}, {@code water_level{level}}</li>
 *   <li>flat: {@code temperature}, {@code humidity}, {@code air_quality} (or {@code airQuality}),
 *       {@code water_level} (or {@code waterLevel}) as numbers</li>
 * </ul>
 * A {@code dht22} group takes precedence over flat temperature/humidity keys. Absent or
 * non-numeric readings are reported as empty and skipped by the checks.
 */
public record SensorSnapshot(
        OptionalDouble temperature,
        OptionalDouble humidity,
        OptionalDouble airQuality,
        OptionalDouble waterLevel
) {

    public static SensorSnapshot from(Map<String, ?> raw) {
        if (raw == null || raw.isEmpty()) {
            return new SensorSnapshot(OptionalDouble.empty(), OptionalDouble.empty(),
                    OptionalDouble.empty(), OptionalDouble.empty());
        }

        OptionalDouble temperature;
        OptionalDouble humidity;
        Object dht22 = raw.get("dht22");
        if (dht22 instanceof Map<?, ?> group) {
            temperature = number(group.get("temperature"));
            humidity = number(group.get("humidity"));
        } else {
            temperature = number(raw.get("temperature"));
            humidity = number(raw.get("humidity"));
        }

        OptionalDouble airQuality = groupedOrFlat(raw, "air_quality", "airQuality", "aqi");
        OptionalDouble waterLevel = groupedOrFlat(raw, "water_level", "waterLevel", "level");
        return new SensorSnapshot(temperature, humidity, airQuality, waterLevel);
    }

    private static OptionalDouble groupedOrFlat(Map<String, ?> raw, String key, String camelKey, String innerKey) {
        Object value = raw.containsKey(key) ? raw.get(key) : raw.get(camelKey);
        if (value instanceof Map<?, ?> group) {
            return number(group.get(innerKey));
        }
        return number(value);
    }

    private static OptionalDouble number(Object value) {
        if (value instanceof Number n) {
            double d = n.doubleValue();
            return Double.isNaN(d) ? OptionalDouble.empty() : OptionalDouble.of(d);
        }
        return OptionalDouble.empty();
    }
}
