package com.phillippitts.terrarium.service.watchdog;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Status reported by a supervised service.
 *
 * @param running whether the service considers itself running
 * @param details free-form diagnostics, not interpreted by the watchdog
 */
public record ServiceStatus(boolean running, Map<String, Object> details) {

    public ServiceStatus {
        details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public static ServiceStatus of(boolean running) {
        return new ServiceStatus(running, Map.of());
    }
}
