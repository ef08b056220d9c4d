package com.phillippitts.terrarium.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The layered JSON configuration handed to the control collaborator. Every section is opaque to
 * the supervision runtime: it is read, never interpreted.
 *
 * @param main          {@code config.json}
 * @param gpio          {@code gpio_config.json}
 * @param safetyLimits  {@code safety_limits.json}
 * @param policies      {@code policies/*.json} keyed by file stem
 * @param species       {@code species/**}{@code /*.json} keyed by file stem
 * @param terrariums    {@code terrariums/*.json} keyed by file stem
 */
public record LayeredConfiguration(
        Map<String, Object> main,
        Map<String, Object> gpio,
        Map<String, Object> safetyLimits,
        Map<String, Map<String, Object>> policies,
        Map<String, Map<String, Object>> species,
        Map<String, Map<String, Object>> terrariums
) {

    public LayeredConfiguration {
        main = freeze(main);
        gpio = freeze(gpio);
        safetyLimits = freeze(safetyLimits);
        policies = freeze(policies);
        species = freeze(species);
        terrariums = freeze(terrariums);
    }

    public static LayeredConfiguration empty() {
        return new LayeredConfiguration(null, null, null, null, null, null);
    }

    public boolean isEmpty() {
        return main.isEmpty() && gpio.isEmpty() && safetyLimits.isEmpty()
                && policies.isEmpty() && species.isEmpty() && terrariums.isEmpty();
    }

    private static <V> Map<String, V> freeze(Map<String, V> map) {
        return map == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(map));
    }
}
