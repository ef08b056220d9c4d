package com.phillippitts.terrarium.service.loop;

import com.phillippitts.terrarium.bus.EventBus;
import com.phillippitts.terrarium.bus.EventHandler;
import com.phillippitts.terrarium.bus.EventTypes;
import com.phillippitts.terrarium.config.properties.MainLoopProperties;
import com.phillippitts.terrarium.config.properties.WatchdogProperties;
import com.phillippitts.terrarium.exception.ControlServiceException;
import com.phillippitts.terrarium.service.control.ControlService;
import com.phillippitts.terrarium.service.watchdog.Watchdog;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Wires supervision together once the context is up and then runs the control loop on the main
 * thread.
 *
 * <p>Order matters: the loop is started before the control service is handed to the watchdog, so
 * the watchdog's first (immediate) check does not see a not-yet-started service as unhealthy.
 * Every {@code main_loop_cycle} counts as a heartbeat of the control service, so a loop whose
 * cycles keep failing eventually gets its control service restarted.
 */
@Component
class MainLoopRunner implements ApplicationRunner {

    private static final Logger LOG = LogManager.getLogger(MainLoopRunner.class);

    static final String CONTROL_SERVICE_NAME = "control_service";

    private final MainLoop mainLoop;
    private final Watchdog watchdog;
    private final ControlService controlService;
    private final EventBus eventBus;
    private final MainLoopProperties loopProps;
    private final WatchdogProperties watchdogProps;

    MainLoopRunner(MainLoop mainLoop,
                   Watchdog watchdog,
                   ControlService controlService,
                   EventBus eventBus,
                   MainLoopProperties loopProps,
                   WatchdogProperties watchdogProps) {
        this.mainLoop = mainLoop;
        this.watchdog = watchdog;
        this.controlService = controlService;
        this.eventBus = eventBus;
        this.loopProps = loopProps;
        this.watchdogProps = watchdogProps;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!loopProps.isEnabled()) {
            LOG.info("Control loop disabled (terrarium.loop.enabled=false)");
            startWatchdog();
            return;
        }
        try {
            if (!mainLoop.start()) {
                LOG.error("Control loop failed to start; supervision not started");
                return;
            }
        } catch (ControlServiceException e) {
            LOG.error("Control loop failed to start: {}", e.getMessage(), e);
            return;
        }
        superviseControlService();
        startWatchdog();
        mainLoop.run();
    }

    private void superviseControlService() {
        if (!watchdogProps.isEnabled()) {
            return;
        }
        watchdog.addService(CONTROL_SERVICE_NAME, controlService);
        EventHandler heartbeat = payload -> watchdog.heartbeat(CONTROL_SERVICE_NAME);
        eventBus.subscribe(EventTypes.MAIN_LOOP_CYCLE, heartbeat);
    }

    private void startWatchdog() {
        if (watchdogProps.isEnabled()) {
            watchdog.start();
        } else {
            LOG.info("Watchdog disabled (terrarium.watchdog.enabled=false)");
        }
    }
}
