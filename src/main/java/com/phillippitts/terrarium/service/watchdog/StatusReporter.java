package com.phillippitts.terrarium.service.watchdog;

/**
 * Health capability: the service reports a status whose running flag decides its health.
 * Takes precedence over {@link RunningFlag} when a service implements both.
 */
public interface StatusReporter extends Supervisable {

    /**
     * @return current status, or {@code null} if the service cannot tell yet
     */
    ServiceStatus getStatus();
}
