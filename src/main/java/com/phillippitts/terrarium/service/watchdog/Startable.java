package com.phillippitts.terrarium.service.watchdog;

/**
 * Restart capability.
 */
public interface Startable extends Supervisable {

    /**
     * @return {@code true} if the service is running afterwards
     */
    boolean start();
}
