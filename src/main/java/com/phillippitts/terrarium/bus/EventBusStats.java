package com.phillippitts.terrarium.bus;

import java.time.Duration;

/**
 * Point-in-time copy of the {@link EventBus} counters.
 *
 * @param eventsEmitted       total calls to {@code emit}
 * @param handlersInvoked     handler invocations that completed without throwing
 * @param handlersRegistered  total successful subscriptions since startup
 * @param errors              handler invocations that threw
 * @param uptime              time since the bus was created
 * @param registeredTypes     event types that currently have at least one handler
 * @param totalHandlers       handlers currently registered across all types
 */
public record EventBusStats(
        long eventsEmitted,
        long handlersInvoked,
        long handlersRegistered,
        long errors,
        Duration uptime,
        int registeredTypes,
        int totalHandlers
) {
}
