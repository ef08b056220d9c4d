package com.phillippitts.terrarium.bus;

import com.phillippitts.terrarium.service.metrics.SupervisionMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Thread-safe publish/subscribe dispatcher shared by every supervision component.
 *
 * <p><b>Dispatch model:</b> {@link #emit(String, Object)} is synchronous and blocking. Every
 * handler registered for the type runs on the caller's thread, in registration order, before
 * {@code emit} returns. A slow handler therefore stalls the emitter (including the control loop).
 *
 * <p><b>Isolation:</b> a handler that throws, an {@link Error} included, is logged and counted;
 * dispatch continues with the next handler and nothing propagates to the emitter.
 *
 * <p><b>Locking:</b> the handler map is guarded by a {@link ReentrantLock} held only while the
 * map is mutated or a handler list is copied. Handlers run with the lock released, so a
 * handler may subscribe or unsubscribe (including itself) without deadlocking the dispatch.
 * A handler removed during a dispatch still receives that in-flight event.
 */
@Component
public class EventBus {

    private static final Logger LOG = LogManager.getLogger(EventBus.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, List<EventHandler>> handlers = new LinkedHashMap<>();

    private final AtomicLong eventsEmitted = new AtomicLong();
    private final AtomicLong handlersInvoked = new AtomicLong();
    private final AtomicLong handlersRegistered = new AtomicLong();
    private final AtomicLong errors = new AtomicLong();
    private final Instant createdAt = Instant.now();

    private final SupervisionMetrics metrics;

    public EventBus() {
        this(SupervisionMetrics.standalone());
    }

    @Autowired
    public EventBus(SupervisionMetrics metrics) {
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Appends a handler to the ordered list for the given type. Duplicates are allowed and
     * are invoked once per registration.
     *
     * @return the registered handler, usable as a handle for {@link #unsubscribe(String, EventHandler)}
     */
    public EventHandler subscribe(String eventType, EventHandler handler) {
        Objects.requireNonNull(eventType, "eventType");
        Objects.requireNonNull(handler, "handler");
        lock.lock();
        try {
            handlers.computeIfAbsent(eventType, k -> new ArrayList<>()).add(handler);
        } finally {
            lock.unlock();
        }
        handlersRegistered.incrementAndGet();
        LOG.debug("Handler registered for {}", eventType);
        return handler;
    }

    /**
     * Registers a handler that removes itself before its first invocation, so it runs at most once
     * even if the type is emitted concurrently from several threads.
     *
     * @return the wrapping handle; pass it to {@link #unsubscribe(String, EventHandler)} to cancel
     *         the registration before it fires
     */
    public EventHandler subscribeOnce(String eventType, EventHandler handler) {
        Objects.requireNonNull(handler, "handler");
        AtomicBoolean fired = new AtomicBoolean(false);
        AtomicReference<EventHandler> self = new AtomicReference<>();
        EventHandler once = payload -> {
            if (!fired.compareAndSet(false, true)) {
                return;
            }
            unsubscribe(eventType, self.get());
            handler.onEvent(payload);
        };
        self.set(once);
        return subscribe(eventType, once);
    }

    /**
     * Removes one registration of {@code handler} (the earliest). A {@code null} handler removes
     * every handler for the type, same as {@link #unsubscribe(String)}.
     *
     * @return {@code true} if anything was removed
     */
    public boolean unsubscribe(String eventType, EventHandler handler) {
        if (handler == null) {
            return unsubscribe(eventType) > 0;
        }
        lock.lock();
        try {
            List<EventHandler> list = handlers.get(eventType);
            if (list == null) {
                return false;
            }
            boolean removed = false;
            for (int i = 0; i < list.size(); i++) {
                if (list.get(i) == handler) {
                    list.remove(i);
                    removed = true;
                    break;
                }
            }
            if (list.isEmpty()) {
                handlers.remove(eventType);
            }
            if (removed) {
                LOG.debug("Handler removed for {}", eventType);
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes every handler registered for the type.
     *
     * @return number of handlers removed
     */
    public int unsubscribe(String eventType) {
        lock.lock();
        try {
            List<EventHandler> removed = handlers.remove(eventType);
            int count = removed == null ? 0 : removed.size();
            if (count > 0) {
                LOG.debug("All {} handler(s) removed for {}", count, eventType);
            }
            return count;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Dispatches the payload to every handler registered for the type, synchronously, on the
     * calling thread, in registration order.
     */
    public void emit(String eventType, Object payload) {
        eventsEmitted.incrementAndGet();
        List<EventHandler> snapshot = snapshot(eventType);
        for (EventHandler handler : snapshot) {
            try {
                handler.onEvent(payload);
                handlersInvoked.incrementAndGet();
            } catch (Throwable t) { // errors too, e.g. StackOverflowError in one handler
                errors.incrementAndGet();
                metrics.incrementHandlerFailures(eventType);
                LOG.error("Handler failed for event type={}: {}", eventType, t.toString(), t);
            }
        }
        LOG.debug("Event emitted: {} ({} handler(s))", eventType, snapshot.size());
    }

    /**
     * Blocks the calling thread until the type is emitted or the timeout elapses.
     *
     * <p>Intended for request/response exchanges layered on the bus. The payload must be emitted
     * from another thread, since dispatch happens on the emitter's thread.
     *
     * @return the payload of the first matching event, or empty on timeout or interruption.
     *         A {@code null} payload is also reported as empty.
     */
    public Optional<Object> waitFor(String eventType, Duration timeout) {
        Objects.requireNonNull(timeout, "timeout");
        CountDownLatch received = new CountDownLatch(1);
        AtomicReference<Object> result = new AtomicReference<>();
        EventHandler handle = subscribeOnce(eventType, payload -> {
            result.set(payload);
            received.countDown();
        });
        try {
            if (received.await(timeout.toNanos(), TimeUnit.NANOSECONDS)) {
                return Optional.ofNullable(result.get());
            }
            LOG.warn("Timed out after {} waiting for event {}", timeout, eventType);
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while waiting for event {}", eventType);
            return Optional.empty();
        } finally {
            unsubscribe(eventType, handle);
        }
    }

    /**
     * @return handlers currently registered for the type
     */
    public int getHandlerCount(String eventType) {
        lock.lock();
        try {
            List<EventHandler> list = handlers.get(eventType);
            return list == null ? 0 : list.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return handlers currently registered across all types
     */
    public int getHandlerCount() {
        lock.lock();
        try {
            return handlers.values().stream().mapToInt(List::size).sum();
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return event types that currently have at least one handler, in first-registration order
     */
    public List<String> getRegisteredEventTypes() {
        lock.lock();
        try {
            return List.copyOf(handlers.keySet());
        } finally {
            lock.unlock();
        }
    }

    public EventBusStats getStats() {
        lock.lock();
        try {
            return new EventBusStats(
                    eventsEmitted.get(),
                    handlersInvoked.get(),
                    handlersRegistered.get(),
                    errors.get(),
                    Duration.between(createdAt, Instant.now()),
                    handlers.size(),
                    handlers.values().stream().mapToInt(List::size).sum());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes every handler for every type. Counters are kept.
     */
    public void clear() {
        lock.lock();
        try {
            handlers.clear();
        } finally {
            lock.unlock();
        }
        LOG.info("All event handlers cleared");
    }

    private List<EventHandler> snapshot(String eventType) {
        lock.lock();
        try {
            List<EventHandler> list = handlers.get(eventType);
            return list == null ? List.of() : List.copyOf(list);
        } finally {
            lock.unlock();
        }
    }
}
