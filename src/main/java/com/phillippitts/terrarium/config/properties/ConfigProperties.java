package com.phillippitts.terrarium.config.properties;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Location of the layered JSON configuration (main, GPIO, safety, policies, species, terrariums).
 */
@Validated
@ConfigurationProperties(prefix = "terrarium.config")
public class ConfigProperties {

    @NotBlank
    private final String directory;

    @ConstructorBinding
    public ConfigProperties(String directory) {
        this.directory = directory == null ? "config" : directory;
    }

    public String getDirectory() {
        return directory;
    }
}
