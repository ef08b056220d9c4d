package com.phillippitts.terrarium.service.loop;

import java.time.Instant;

/**
 * Payload of {@code main_loop_cycle}, published at the end of every successful cycle.
 *
 * @param cycle     1-based cycle number
 * @param timestamp time the cycle completed
 */
public record MainLoopCycleEvent(long cycle, Instant timestamp) {
}
