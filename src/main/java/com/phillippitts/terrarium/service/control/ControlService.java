package com.phillippitts.terrarium.service.control;

import com.phillippitts.terrarium.config.LayeredConfiguration;
import com.phillippitts.terrarium.service.watchdog.RunningFlag;
import com.phillippitts.terrarium.service.watchdog.ServiceStatus;
import com.phillippitts.terrarium.service.watchdog.Startable;
import com.phillippitts.terrarium.service.watchdog.StatusReporter;
import com.phillippitts.terrarium.service.watchdog.Stoppable;

import java.util.Map;

/**
 * Control collaborator driven by the main loop: owns the sensors and actuators and hands the
 * latest sensor snapshot to safety enforcement once per cycle.
 *
 * <p>Also supervisable: the watchdog probes it through {@link #getStatus()} and restarts it
 * through {@link #stop()}/{@link #start()}.
 */
public interface ControlService extends StatusReporter, RunningFlag, Startable, Stoppable {

    /**
     * Wires the service against the layered configuration. Called once before the first start.
     *
     * @return {@code false} if the service cannot operate with this configuration
     */
    boolean initialize(LayeredConfiguration configuration);

    /**
     * Runs one control step. Called once per loop cycle while running.
     */
    void update();

    /**
     * @return the latest sensor snapshot in flat or nested shape; empty if nothing was read yet
     */
    Map<String, Object> getSensorData();

    ServiceStatus getSystemStatus();

    @Override
    default ServiceStatus getStatus() {
        return getSystemStatus();
    }

    /**
     * Stops the service and releases what it holds. The service is not reused afterwards.
     */
    default void cleanup() {
        stop();
    }
}
