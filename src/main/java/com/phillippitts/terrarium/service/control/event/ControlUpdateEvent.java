package com.phillippitts.terrarium.service.control.event;

import java.time.Instant;

/**
 * Payload of {@code control_update}, published after each control step.
 *
 * @param update            1-based update number since startup
 * @param timestamp         time of the update
 * @param sensorDataPresent whether a sensor snapshot was available for this step
 */
public record ControlUpdateEvent(long update, Instant timestamp, boolean sensorDataPresent) {
}
