package com.phillippitts.terrarium.service.safety.event;

import com.phillippitts.terrarium.service.safety.SafetyViolation;

import java.time.Instant;

/**
 * Payload of {@code emergency_stop}: published once per danger episode, when the stop is armed.
 *
 * @param reason    message of the triggering violation
 * @param timestamp time the stop was armed
 * @param violation the triggering violation
 */
public record EmergencyStopEvent(String reason, Instant timestamp, SafetyViolation violation) {
}
