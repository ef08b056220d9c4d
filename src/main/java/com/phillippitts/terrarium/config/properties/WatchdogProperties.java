package com.phillippitts.terrarium.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for the service watchdog.
 */
@ConfigurationProperties(prefix = "terrarium.watchdog")
@Validated
public class WatchdogProperties {

    /** Enable/disable the watchdog poll thread. */
    private boolean enabled = true;

    /** Interval between two health polls. */
    @NotNull
    private Duration checkInterval = Duration.ofSeconds(30);

    /** Heartbeat timeout applied to services registered without an explicit one. */
    @NotNull
    private Duration defaultTimeout = Duration.ofSeconds(300);

    /** Restart budget per service; once spent the service stays registered but is no longer restarted. */
    @Min(value = 0, message = "Max restarts must not be negative")
    private int maxRestarts = 3;

    /** Pause between stopping and starting a service during a restart. */
    @NotNull
    private Duration restartGracePeriod = Duration.ofSeconds(2);

    /** Upper bound on waiting for the poll thread to exit on stop. */
    @NotNull
    private Duration joinTimeout = Duration.ofSeconds(5);

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Duration getCheckInterval() {
        return checkInterval;
    }

    public void setCheckInterval(Duration checkInterval) {
        this.checkInterval = checkInterval;
    }

    public Duration getDefaultTimeout() {
        return defaultTimeout;
    }

    public void setDefaultTimeout(Duration defaultTimeout) {
        this.defaultTimeout = defaultTimeout;
    }

    public int getMaxRestarts() {
        return maxRestarts;
    }

    public void setMaxRestarts(int maxRestarts) {
        this.maxRestarts = maxRestarts;
    }

    public Duration getRestartGracePeriod() {
        return restartGracePeriod;
    }

    public void setRestartGracePeriod(Duration restartGracePeriod) {
        this.restartGracePeriod = restartGracePeriod;
    }

    public Duration getJoinTimeout() {
        return joinTimeout;
    }

    public void setJoinTimeout(Duration joinTimeout) {
        this.joinTimeout = joinTimeout;
    }
}
