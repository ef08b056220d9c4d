package com.phillippitts.terrarium.service.loop;

import com.phillippitts.terrarium.service.watchdog.ServiceStatus;

import java.time.Duration;

/**
 * @param controlService status of the control collaborator, or null once it has been cleaned up
 */
public record MainLoopStatus(
        LoopState state,
        boolean running,
        Duration interval,
        LoopStats stats,
        ServiceStatus controlService
) {
}
