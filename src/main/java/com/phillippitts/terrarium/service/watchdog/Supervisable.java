package com.phillippitts.terrarium.service.watchdog;

/**
 * A service the {@link Watchdog} can supervise.
 *
 * <p>Capabilities are opted into by also implementing {@link StatusReporter}, {@link RunningFlag},
 * {@link Startable} and/or {@link Stoppable}. A service with no health capability is assumed
 * healthy and is only judged by its heartbeats; a service without {@link Startable} is never
 * restarted.
 */
public interface Supervisable {
}
