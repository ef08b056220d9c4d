package com.phillippitts.terrarium.service.watchdog;

import com.phillippitts.terrarium.config.properties.WatchdogProperties;
import com.phillippitts.terrarium.exception.ServiceRestartException;
import com.phillippitts.terrarium.service.metrics.SupervisionMetrics;
import jakarta.annotation.PreDestroy;
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
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

/**
 * Polling supervisor that restarts services which stop sending heartbeats or report themselves
 * unhealthy, within a per-service restart budget.
 *
 * <p>Detection model, per registered service and per poll:
 * <ul>
 *   <li>no heartbeat for longer than the service's timeout: restart</li>
 *   <li>otherwise, the health probe resolved at registration (status, running flag, or none) says
 *       unhealthy, or throws: restart</li>
 * </ul>
 *
 * <p>Restart: stop (if {@link Stoppable}), wait the grace period, start. Only a successful start
 * consumes budget. Once {@code restartCount >= maxRestarts} the service stays registered but is
 * no longer restarted; each further detection is logged as an error.
 *
 * <p>All checks and restarts run on a single daemon thread, so restarts are serialized and a slow
 * restart delays the checks of the services after it. The registry lock is held only to copy or
 * mutate the registry, never during a probe or a restart.
 */
@Component
public class Watchdog {

    private static final Logger LOG = LogManager.getLogger(Watchdog.class);

    static final String THREAD_NAME = "watchdog";

    private final WatchdogProperties props;
    private final SupervisionMetrics metrics;
    private final LongSupplier nanoClock;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, MonitoredService> services = new LinkedHashMap<>();
    // One supervision pass at a time, even across overlapping start/stop runs
    private final ReentrantLock passLock = new ReentrantLock();

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile CountDownLatch stopSignal = new CountDownLatch(0);
    private volatile Thread pollThread;

    private final AtomicLong restarts = new AtomicLong();
    private final AtomicLong checks = new AtomicLong();
    private volatile Instant startedAt;
    private volatile Instant lastRestart;

    @Autowired
    public Watchdog(WatchdogProperties props, SupervisionMetrics metrics) {
        this(props, metrics, System::nanoTime);
    }

    // Visible for tests
    Watchdog(WatchdogProperties props, SupervisionMetrics metrics, LongSupplier nanoClock) {
        this.props = Objects.requireNonNull(props, "props");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock");
    }

    public void addService(String name, Supervisable service) {
        addService(name, service, props.getDefaultTimeout(), props.getMaxRestarts());
    }

    public void addService(String name, Supervisable service, Duration timeout) {
        addService(name, service, timeout, props.getMaxRestarts());
    }

    /**
     * Registers (or replaces) a supervised service. Its heartbeat clock starts now and its restart
     * count at zero.
     */
    public void addService(String name, Supervisable service, Duration timeout, int maxRestarts) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(service, "service");
        Duration effectiveTimeout = timeout == null ? props.getDefaultTimeout() : timeout;
        if (maxRestarts < 0) {
            throw new IllegalArgumentException("maxRestarts must not be negative: " + maxRestarts);
        }
        MonitoredService entry = new MonitoredService(name, service, HealthProbe.resolve(service),
                effectiveTimeout, maxRestarts, nanoClock.getAsLong());
        lock.lock();
        try {
            services.put(name, entry);
        } finally {
            lock.unlock();
        }
        LOG.info("Service {} added to watchdog (timeout={}, maxRestarts={}, probe={})",
                name, effectiveTimeout, maxRestarts, entry.probe.getClass().getSimpleName());
    }

    /**
     * @return {@code true} if the service was registered
     */
    public boolean removeService(String name) {
        MonitoredService removed;
        lock.lock();
        try {
            removed = services.remove(name);
        } finally {
            lock.unlock();
        }
        if (removed != null) {
            LOG.info("Service {} removed from watchdog", name);
        }
        return removed != null;
    }

    /**
     * Records that the service is alive. Ignored for names that are not registered.
     */
    public void heartbeat(String name) {
        MonitoredService entry = find(name);
        if (entry != null) {
            entry.lastHeartbeatNanos = nanoClock.getAsLong();
            LOG.debug("Heartbeat received for {}", name);
        }
    }

    /**
     * Starts the poll thread. The first check runs immediately.
     *
     * @return {@code true} if the watchdog is running afterwards
     */
    public boolean start() {
        if (!running.compareAndSet(false, true)) {
            LOG.warn("Watchdog already running");
            return true;
        }
        startedAt = Instant.now();
        CountDownLatch signal = new CountDownLatch(1);
        stopSignal = signal;
        Thread t = new Thread(() -> pollLoop(signal), THREAD_NAME);
        t.setDaemon(true);
        pollThread = t;
        t.start();
        LOG.info("Watchdog started (checkInterval={}, services={})", props.getCheckInterval(), serviceNames());
        return true;
    }

    /**
     * Signals the poll thread to exit and waits up to the configured join timeout. Idempotent.
     */
    @PreDestroy
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        LOG.info("Stopping watchdog...");
        stopSignal.countDown();
        Thread t = pollThread;
        if (t != null && t != Thread.currentThread()) {
            try {
                t.join(props.getJoinTimeout().toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.warn("Interrupted while waiting for the watchdog thread to exit");
            }
            if (t.isAlive()) {
                LOG.warn("Watchdog thread did not stop within {}", props.getJoinTimeout());
            }
        }
        pollThread = null;
        LOG.info("Watchdog stopped");
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Poll loop of one start/stop run. Exits once {@code signal} is counted down, even if a later
     * run has already replaced it.
     */
    private void pollLoop(CountDownLatch signal) {
        try {
            while (signal.getCount() > 0) {
                checkServices();
                if (signal.await(props.getCheckInterval().toNanos(), TimeUnit.NANOSECONDS)) {
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Watchdog thread interrupted");
        } catch (RuntimeException e) {
            LOG.error("Watchdog loop terminated unexpectedly: {}", e.toString(), e);
            if (stopSignal == signal) {
                running.set(false);
            }
        }
    }

    /**
     * Runs one supervision pass over every registered service. Called by the poll thread.
     */
    // Visible for tests
    void checkServices() {
        passLock.lock();
        try {
            runPass();
        } finally {
            passLock.unlock();
        }
    }

    private void runPass() {
        List<MonitoredService> snapshot;
        lock.lock();
        try {
            snapshot = new ArrayList<>(services.values());
        } finally {
            lock.unlock();
        }
        long now = nanoClock.getAsLong();
        for (MonitoredService entry : snapshot) {
            try {
                if (now - entry.lastHeartbeatNanos > entry.timeout.toNanos()) {
                    LOG.warn("Service {} missed its heartbeat (timeout {})", entry.name, entry.timeout);
                    restartIfAllowed(entry);
                } else if (!isHealthy(entry)) {
                    LOG.warn("Service {} reported unhealthy", entry.name);
                    restartIfAllowed(entry);
                } else {
                    LOG.debug("Service {} OK", entry.name);
                }
            } catch (ServiceRestartException e) {
                LOG.error("Restart failed: {}", e.getMessage(), e.getCause());
            } catch (RuntimeException e) {
                LOG.error("Error while checking service {}: {}", entry.name, e.toString(), e);
            }
        }
        checks.incrementAndGet();
    }

    private boolean isHealthy(MonitoredService entry) {
        try {
            return entry.probe.isHealthy();
        } catch (RuntimeException e) {
            LOG.error("Health probe for {} threw: {}", entry.name, e.toString());
            return false;
        }
    }

    private void restartIfAllowed(MonitoredService entry) {
        if (entry.restartCount >= entry.maxRestarts) {
            LOG.error("Service {} reached its restart budget ({}); no further restarts",
                    entry.name, entry.maxRestarts);
            if (!entry.exhaustionReported) {
                entry.exhaustionReported = true;
                metrics.incrementBudgetExhausted(entry.name);
            }
            return;
        }
        if (!(entry.service instanceof Startable startable)) {
            LOG.warn("Service {} cannot be restarted: it has no start()", entry.name);
            return;
        }
        restart(entry, startable);
    }

    /**
     * Stops, waits the grace period, then starts the service. Only a successful start consumes
     * restart budget and resets the heartbeat clock.
     *
     * @throws ServiceRestartException if stop/start throws, start returns false, or the wait is interrupted
     */
    private void restart(MonitoredService entry, Startable startable) {
        LOG.info("Restarting service {} (attempt {}/{})...",
                entry.name, entry.restartCount + 1, entry.maxRestarts);
        if (entry.service instanceof Stoppable stoppable) {
            try {
                stoppable.stop();
            } catch (RuntimeException e) {
                throw new ServiceRestartException(entry.name, "stop() failed", e);
            }
        }
        pauseForGracePeriod(entry.name);
        boolean started;
        try {
            started = startable.start();
        } catch (RuntimeException e) {
            throw new ServiceRestartException(entry.name, "start() failed", e);
        }
        if (!started) {
            throw new ServiceRestartException(entry.name, "start() returned false");
        }
        entry.restartCount++;
        entry.lastHeartbeatNanos = nanoClock.getAsLong();
        restarts.incrementAndGet();
        lastRestart = Instant.now();
        metrics.incrementRestarts(entry.name);
        LOG.info("Service {} restarted ({}/{})", entry.name, entry.restartCount, entry.maxRestarts);
    }

    private void pauseForGracePeriod(String name) {
        Duration grace = props.getRestartGracePeriod();
        if (grace.isZero() || grace.isNegative()) {
            return;
        }
        try {
            Thread.sleep(grace.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ServiceRestartException(name, "Interrupted during restart grace period", e);
        }
    }

    public WatchdogStatus getStatus() {
        return new WatchdogStatus(running.get(), props.getDefaultTimeout(), props.getCheckInterval(),
                serviceNames(), getStats());
    }

    public WatchdogStats getStats() {
        return new WatchdogStats(restarts.get(), checks.get(), startedAt, lastRestart);
    }

    /**
     * @return a snapshot of the named service (probing its health now), or empty if not registered
     */
    public Optional<MonitoredServiceSnapshot> getServiceStatus(String name) {
        MonitoredService entry = find(name);
        if (entry == null) {
            return Optional.empty();
        }
        return Optional.of(snapshot(entry));
    }

    /**
     * @return names of services that needed a restart after spending their budget and were
     *         refused one. A service that used its last restart and has stayed healthy since is
     *         not listed.
     */
    public List<String> getExhaustedServices() {
        List<String> exhausted = new ArrayList<>();
        lock.lock();
        try {
            for (MonitoredService entry : services.values()) {
                if (entry.exhaustionReported) {
                    exhausted.add(entry.name);
                }
            }
        } finally {
            lock.unlock();
        }
        return exhausted;
    }

    public List<String> serviceNames() {
        lock.lock();
        try {
            return List.copyOf(services.keySet());
        } finally {
            lock.unlock();
        }
    }

    private MonitoredServiceSnapshot snapshot(MonitoredService entry) {
        long elapsed = Math.max(0, nanoClock.getAsLong() - entry.lastHeartbeatNanos);
        return new MonitoredServiceSnapshot(entry.name, Duration.ofNanos(elapsed), entry.timeout,
                entry.restartCount, entry.maxRestarts, isHealthy(entry), entry.exhaustionReported);
    }

    private MonitoredService find(String name) {
        lock.lock();
        try {
            return services.get(name);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Registry entry. Restart bookkeeping is written only by the thread running
     * {@link #checkServices()}; heartbeats may arrive from any thread.
     */
    private static final class MonitoredService {
        final String name;
        final Supervisable service;
        final HealthProbe probe;
        final Duration timeout;
        final int maxRestarts;
        volatile long lastHeartbeatNanos;
        volatile int restartCount;
        volatile boolean exhaustionReported;

        MonitoredService(String name, Supervisable service, HealthProbe probe,
                         Duration timeout, int maxRestarts, long nowNanos) {
            this.name = name;
            this.service = service;
            this.probe = probe;
            this.timeout = timeout;
            this.maxRestarts = maxRestarts;
            this.lastHeartbeatNanos = nowNanos;
        }
    }
}
