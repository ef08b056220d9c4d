package com.phillippitts.terrarium.exception;

/**
 * Wraps a failure raised while executing one control-loop cycle.
 * Never fatal: the loop logs it, counts it and backs off before the next cycle.
 */
public class CycleExecutionException extends TerrariumException {

    private final long cycle;

    public CycleExecutionException(long cycle, Throwable cause) {
        super("Control loop cycle " + cycle + " failed: " + cause, cause);
        this.cycle = cycle;
    }

    public long getCycle() {
        return cycle;
    }
}
