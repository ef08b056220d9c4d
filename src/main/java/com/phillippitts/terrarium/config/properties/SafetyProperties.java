package com.phillippitts.terrarium.config.properties;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for safety limit enforcement.
 */
@Validated
@ConfigurationProperties(prefix = "terrarium.safety")
public class SafetyProperties {

    static final String DEFAULT_LIMITS_FILE = "config/safety_limits.json";

    /** Path of the safety limits document. Built-in defaults apply when it is absent. */
    @NotBlank
    private final String limitsFile;

    @ConstructorBinding
    public SafetyProperties(String limitsFile) {
        this.limitsFile = limitsFile == null ? DEFAULT_LIMITS_FILE : limitsFile;
    }

    public String getLimitsFile() {
        return limitsFile;
    }
}
