package com.phillippitts.terrarium.service.watchdog;

import java.time.Duration;
import java.util.List;

public record WatchdogStatus(
        boolean running,
        Duration defaultTimeout,
        Duration checkInterval,
        List<String> monitoredServices,
        WatchdogStats stats
) {
}
