package com.phillippitts.terrarium.bus;

/**
 * Well-known event types exchanged over the {@link EventBus}.
 *
 * <p>Event types are free-form strings; this class only names the ones the supervision
 * runtime emits or consumes. Payload contracts:
 * <ul>
 *   <li>{@link #MAIN_LOOP_CYCLE} - {@code MainLoopCycleEvent}</li>
 *   <li>{@link #SAFETY_ALERT} - {@code SafetyViolation}</li>
 *   <li>{@link #EMERGENCY_STOP} - {@code EmergencyStopEvent}</li>
 *   <li>{@link #EMERGENCY_RESUME} - {@code EmergencyResumeEvent}</li>
 *   <li>{@link #SENSOR_DATA} - {@code Map<String, Object>} sensor snapshot, flat or nested</li>
 *   <li>{@link #CONTROL_UPDATE} - {@code ControlUpdateEvent}</li>
 * </ul>
 */
public final class EventTypes {

    public static final String MAIN_LOOP_CYCLE = "main_loop_cycle";
    public static final String SAFETY_ALERT = "safety_alert";
    public static final String EMERGENCY_STOP = "emergency_stop";
    public static final String EMERGENCY_RESUME = "emergency_resume";
    public static final String SENSOR_DATA = "sensor_data";
    public static final String CONTROL_UPDATE = "control_update";

    private EventTypes() {
        // Constants holder
    }
}
