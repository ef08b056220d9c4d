package com.phillippitts.terrarium.service.safety;

import com.phillippitts.terrarium.exception.ConfigurationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SafetyLimitsLoaderTest {

    private final SafetyLimitsLoader loader = new SafetyLimitsLoader();

    @Test
    void shouldReportAbsentFileAsEmpty(@TempDir Path dir) {
        assertThat(loader.load(dir.resolve("safety_limits.json"))).isEmpty();
    }

    @Test
    void shouldReadConfiguredLimitsAndFailsafes(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("safety_limits.json");
        Files.writeString(file, """
                {
                  "temperature": {"critical_min": 8, "critical_max": 38.5},
                  "humidity": {"critical_min": 30, "critical_max": 95},
                  "air_quality": {"hazardous_threshold": 250},
                  "water_level": {"critical_level": 20},
                  "failsafes": {"heater": {"max_on_minutes": 30}}
                }
                """);

        SafetyLimits limits = loader.load(file).orElseThrow();

        assertThat(limits.temperatureMin()).isEqualTo(8.0);
        assertThat(limits.temperatureMax()).isEqualTo(38.5);
        assertThat(limits.humidityMin()).isEqualTo(30.0);
        assertThat(limits.humidityMax()).isEqualTo(95.0);
        assertThat(limits.airQualityHazardous()).isEqualTo(250.0);
        assertThat(limits.waterLevelCritical()).isEqualTo(20.0);
        assertThat(limits.failsafes()).containsKey("heater");
    }

    @Test
    void shouldDefaultMissingSectionsIndividually(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("safety_limits.json");
        Files.writeString(file, "{\"temperature\": {\"critical_max\": 40}}");

        SafetyLimits limits = loader.load(file).orElseThrow();

        assertThat(limits.temperatureMax()).isEqualTo(40.0);
        assertThat(limits.temperatureMin()).isEqualTo(SafetyLimits.DEFAULT_TEMPERATURE_MIN);
        assertThat(limits.humidityMax()).isEqualTo(SafetyLimits.DEFAULT_HUMIDITY_MAX);
        assertThat(limits.waterLevelCritical()).isEqualTo(SafetyLimits.DEFAULT_WATER_LEVEL_CRITICAL);
        assertThat(limits.failsafes()).isEmpty();
    }

    @Test
    void shouldRejectMalformedDocument(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("safety_limits.json");
        Files.writeString(file, "[1, 2, 3]");

        assertThatThrownBy(() -> loader.load(file))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("safety_limits.json");
    }
}
