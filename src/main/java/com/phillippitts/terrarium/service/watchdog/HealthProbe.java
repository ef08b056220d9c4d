package com.phillippitts.terrarium.service.watchdog;

/**
 * How the watchdog decides whether a supervised service is healthy. Resolved once, when the
 * service is registered, from the capabilities it implements.
 */
sealed interface HealthProbe permits HealthProbe.HasStatus, HealthProbe.HasRunningFlag, HealthProbe.Unknown {

    /**
     * @return {@code true} if healthy; may throw, which callers treat as unhealthy
     */
    boolean isHealthy();

    static HealthProbe resolve(Supervisable service) {
        RunningFlag flag = service instanceof RunningFlag f ? f : null;
        if (service instanceof StatusReporter reporter) {
            return new HasStatus(reporter, flag);
        }
        if (flag != null) {
            return new HasRunningFlag(flag);
        }
        return new Unknown();
    }

    /**
     * Uses {@link StatusReporter#getStatus()}; a {@code null} status falls back to the running
     * flag when there is one, otherwise counts as healthy.
     */
    record HasStatus(StatusReporter reporter, RunningFlag fallback) implements HealthProbe {
        @Override
        public boolean isHealthy() {
            ServiceStatus status = reporter.getStatus();
            if (status != null) {
                return status.running();
            }
            return fallback == null || fallback.isRunning();
        }
    }

    record HasRunningFlag(RunningFlag flag) implements HealthProbe {
        @Override
        public boolean isHealthy() {
            return flag.isRunning();
        }
    }

    /** No health capability: assumed healthy, judged by heartbeats only. */
    record Unknown() implements HealthProbe {
        @Override
        public boolean isHealthy() {
            return true;
        }
    }
}
