package com.phillippitts.terrarium.service.loop;

/**
 * Lifecycle of the {@link MainLoop}: {@code STOPPED -> INITIALIZING -> RUNNING -> STOPPING -> STOPPED}.
 */
public enum LoopState {
    STOPPED,
    INITIALIZING,
    RUNNING,
    STOPPING
}
