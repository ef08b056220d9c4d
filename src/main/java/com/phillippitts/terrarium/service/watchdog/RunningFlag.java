package com.phillippitts.terrarium.service.watchdog;

/**
 * Health capability: a plain running flag.
 */
public interface RunningFlag extends Supervisable {

    boolean isRunning();
}
