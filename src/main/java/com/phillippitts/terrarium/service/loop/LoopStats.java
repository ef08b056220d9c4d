package com.phillippitts.terrarium.service.loop;

import java.time.Instant;

/**
 * Control loop counters; reset only on process restart.
 *
 * @param cycles      cycles executed, failed ones included
 * @param errors      cycles that failed
 * @param startedAt   last successful start, or null
 * @param lastCycleAt start time of the latest cycle, or null
 */
public record LoopStats(long cycles, long errors, Instant startedAt, Instant lastCycleAt) {
}
