package com.phillippitts.terrarium.service.watchdog;

import java.time.Duration;

/**
 * Read-only view of one supervised service.
 *
 * @param name                  registration name
 * @param sinceLastHeartbeat    time elapsed since the last heartbeat (or registration, or restart)
 * @param timeout               heartbeat timeout
 * @param restartCount          successful restarts so far
 * @param maxRestarts           restart budget
 * @param healthy               result of the health probe at snapshot time
 * @param budgetExhausted       a restart was refused because the budget is spent; the service is no longer restarted
 */
public record MonitoredServiceSnapshot(
        String name,
        Duration sinceLastHeartbeat,
        Duration timeout,
        int restartCount,
        int maxRestarts,
        boolean healthy,
        boolean budgetExhausted
) {
}
