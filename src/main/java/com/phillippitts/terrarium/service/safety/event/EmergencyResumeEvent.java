package com.phillippitts.terrarium.service.safety.event;

import java.time.Instant;

/**
 * Payload of {@code emergency_resume}: published when an operator clears a latched emergency stop.
 */
public record EmergencyResumeEvent(Instant timestamp) {
}
