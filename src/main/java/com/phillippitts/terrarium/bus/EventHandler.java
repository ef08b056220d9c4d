package com.phillippitts.terrarium.bus;

/**
 * Callback registered on the {@link EventBus} for one event type.
 *
 * <p>The payload shape is a per-type contract (see {@link EventTypes}); the bus does not
 * enforce it. Handlers run synchronously on the emitting thread. Anything thrown here is
 * caught, logged and counted by the bus and never reaches the emitter.
 */
@FunctionalInterface
public interface EventHandler {

    void onEvent(Object payload) throws Exception;
}
