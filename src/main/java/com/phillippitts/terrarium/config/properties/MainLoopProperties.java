package com.phillippitts.terrarium.config.properties;

import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Typed properties for the control loop.
 */
@Validated
@ConfigurationProperties(prefix = "terrarium.loop")
public class MainLoopProperties {

    /** Minimum time between two cycles. Cycles may lag under load but never run more often. */
    @NotNull
    private final Duration interval;

    /** Sleep between two scheduling checks. */
    @NotNull
    private final Duration pollTick;

    /** Extra sleep after a failed cycle. */
    @NotNull
    private final Duration errorBackoff;

    /** Run the loop on the main thread once the application has started. */
    private final boolean enabled;

    @ConstructorBinding
    public MainLoopProperties(Duration interval, Duration pollTick, Duration errorBackoff, Boolean enabled) {
        this.interval = requirePositive("interval", interval == null ? Duration.ofSeconds(1) : interval);
        this.pollTick = requirePositive("pollTick", pollTick == null ? Duration.ofMillis(100) : pollTick);
        this.errorBackoff = errorBackoff == null ? Duration.ofSeconds(1) : errorBackoff;
        this.enabled = enabled == null || enabled;
    }

    /**
     * Defaults: 1 s interval, 100 ms poll tick, 1 s error backoff, enabled.
     */
    public MainLoopProperties() {
        this(null, null, null, null);
    }

    public Duration getInterval() {
        return interval;
    }

    public Duration getPollTick() {
        return pollTick;
    }

    public Duration getErrorBackoff() {
        return errorBackoff;
    }

    public boolean isEnabled() {
        return enabled;
    }

    private static Duration requirePositive(String name, Duration value) {
        if (value.isNegative() || value.isZero()) {
            throw new IllegalArgumentException("terrarium.loop." + name + " must be positive, got " + value);
        }
        return value;
    }
}
