package com.phillippitts.terrarium.service.safety;

import java.time.Instant;

/**
 * Latched emergency-stop flag with the reason and time it was last armed.
 * {@code reason} and {@code armedAt} are null while the stop has never been armed.
 */
public record EmergencyStopState(boolean active, String reason, Instant armedAt) {

    static EmergencyStopState idle() {
        return new EmergencyStopState(false, null, null);
    }
}
