package com.phillippitts.terrarium.service.safety;

import java.util.Locale;

/**
 * Severity of a safety violation. Every violation currently detected is critical and arms the
 * emergency stop.
 */
public enum Severity {
    CRITICAL;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
