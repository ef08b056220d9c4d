package com.phillippitts.terrarium.service.watchdog;

import java.time.Instant;

/**
 * Watchdog counters. {@code startedAt} and {@code lastRestart} are null until the first
 * start and the first successful restart respectively.
 */
public record WatchdogStats(long restarts, long checks, Instant startedAt, Instant lastRestart) {
}
