package com.phillippitts.terrarium.service.watchdog;

public interface Stoppable extends Supervisable {

    void stop();
}
