package com.phillippitts.terrarium.bus;

import com.phillippitts.terrarium.service.metrics.SupervisionMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class EventBusTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final EventBus bus = new EventBus(new SupervisionMetrics(registry));

    @Test
    void shouldInvokeHandlersInSubscriptionOrderEvenWhenOneThrows() {
        List<String> calls = new ArrayList<>();
        bus.subscribe("tick", p -> calls.add("first:" + p));
        bus.subscribe("tick", p -> {
            calls.add("second:" + p);
            throw new IllegalStateException("boom");
        });
        bus.subscribe("tick", p -> calls.add("third:" + p));

        bus.emit("tick", 7);

        assertThat(calls).containsExactly("first:7", "second:7", "third:7");
        assertThat(bus.getStats().errors()).isEqualTo(1);
        assertThat(bus.getStats().handlersInvoked()).isEqualTo(2);
        assertThat(registry.get("terrarium.bus.handler.failures").tag("type", "tick").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void errorThrownByHandlerShouldNotReachEmitterOrLaterHandlers() {
        List<String> calls = new ArrayList<>();
        bus.subscribe("tick", p -> {
            throw new StackOverflowError("deep");
        });
        bus.subscribe("tick", p -> calls.add("after:" + p));

        bus.emit("tick", 1);

        assertThat(calls).containsExactly("after:1");
        assertThat(bus.getStats().errors()).isEqualTo(1);
    }

    @Test
    void shouldInvokeDuplicateRegistrationsOncePerRegistration() {
        List<Object> calls = new ArrayList<>();
        EventHandler handler = calls::add;
        bus.subscribe("dup", handler);
        bus.subscribe("dup", handler);

        bus.emit("dup", "x");

        assertThat(calls).hasSize(2);

        assertThat(bus.unsubscribe("dup", handler)).isTrue();
        bus.emit("dup", "y");
        assertThat(calls).containsExactly("x", "x", "y");
    }

    @Test
    void shouldRemoveAllHandlersWhenUnsubscribingWithoutHandler() {
        List<Object> calls = new ArrayList<>();
        bus.subscribe("alert", calls::add);
        bus.subscribe("alert", calls::add);
        bus.subscribe("other", calls::add);

        assertThat(bus.unsubscribe("alert", null)).isTrue();
        bus.emit("alert", "ignored");

        assertThat(calls).isEmpty();
        assertThat(bus.getHandlerCount("alert")).isZero();
        assertThat(bus.getHandlerCount("other")).isEqualTo(1);
        assertThat(bus.getRegisteredEventTypes()).containsExactly("other");
    }

    @Test
    void shouldReturnFalseWhenUnsubscribingUnknownHandler() {
        assertThat(bus.unsubscribe("nothing", p -> { })).isFalse();
        assertThat(bus.unsubscribe("nothing")).isZero();
    }

    @Test
    void subscribeOnceShouldFireExactlyOnce() {
        List<Object> calls = new ArrayList<>();
        bus.subscribeOnce("once", calls::add);

        bus.emit("once", 1);
        bus.emit("once", 2);

        assertThat(calls).containsExactly(1);
        assertThat(bus.getHandlerCount("once")).isZero();
    }

    @Test
    void handlerMaySubscribeDuringDispatchWithoutDeadlock() {
        List<String> calls = new ArrayList<>();
        bus.subscribe("nested", p -> bus.subscribe("nested", q -> calls.add("late")));

        bus.emit("nested", null);
        assertThat(calls).isEmpty();

        bus.emit("nested", null);
        assertThat(calls).containsExactly("late");
    }

    @Test
    void waitForShouldReturnPayloadEmittedFromAnotherThread() throws Exception {
        CountDownLatch waiting = new CountDownLatch(1);
        Thread emitter = new Thread(() -> {
            try {
                while (bus.getHandlerCount("response") == 0) {
                    Thread.sleep(5);
                }
                waiting.countDown();
                bus.emit("response", "pong");
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        emitter.start();

        Optional<Object> result = bus.waitFor("response", Duration.ofSeconds(5));

        assertThat(waiting.await(1, TimeUnit.SECONDS)).isTrue();
        assertThat(result).contains("pong");
        emitter.join(1000);
        assertThat(bus.getHandlerCount("response")).isZero();
    }

    @Test
    void waitForShouldTimeOutAndUnregister() {
        Optional<Object> result = bus.waitFor("never", Duration.ofMillis(50));

        assertThat(result).isEmpty();
        assertThat(bus.getHandlerCount("never")).isZero();
    }

    @Test
    void statsShouldTrackCountersAndClearShouldDropHandlers() {
        bus.subscribe("a", p -> { });
        bus.subscribe("b", p -> { });
        bus.subscribe("b", p -> { });
        bus.emit("a", null);
        bus.emit("b", null);
        bus.emit("c", null);

        EventBusStats stats = bus.getStats();
        assertThat(stats.eventsEmitted()).isEqualTo(3);
        assertThat(stats.handlersInvoked()).isEqualTo(3);
        assertThat(stats.handlersRegistered()).isEqualTo(3);
        assertThat(stats.registeredTypes()).isEqualTo(2);
        assertThat(stats.totalHandlers()).isEqualTo(3);
        assertThat(stats.uptime().isNegative()).isFalse();

        bus.clear();

        assertThat(bus.getHandlerCount()).isZero();
        assertThat(bus.getRegisteredEventTypes()).isEmpty();
        assertThat(bus.getStats().eventsEmitted()).isEqualTo(3);
    }
}
