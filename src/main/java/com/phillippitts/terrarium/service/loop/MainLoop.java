package com.phillippitts.terrarium.service.loop;

import com.phillippitts.terrarium.bus.EventBus;
import com.phillippitts.terrarium.bus.EventTypes;
import com.phillippitts.terrarium.config.LayeredConfiguration;
import com.phillippitts.terrarium.config.LayeredConfigurationLoader;
import com.phillippitts.terrarium.config.properties.MainLoopProperties;
import com.phillippitts.terrarium.exception.ConfigurationException;
import com.phillippitts.terrarium.exception.ControlServiceException;
import com.phillippitts.terrarium.exception.CycleExecutionException;
import com.phillippitts.terrarium.service.control.ControlService;
import com.phillippitts.terrarium.service.metrics.SupervisionMetrics;
import com.phillippitts.terrarium.service.safety.SafetyService;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

/**
 * Fixed-cadence control loop.
 *
 * <p>Scheduling is cooperative polling with coalescing: the loop wakes every poll tick and runs a
 * cycle only when at least one interval has elapsed since the previous cycle started. Cycles can
 * lag under load but never run more often than the interval; missed cycles are not replayed.
 * The first cycle runs one interval after {@link #start()}.
 *
 * <p>One cycle: {@link ControlService#update()}, then (when safety enforcement is present)
 * {@link SafetyService#checkSafetyLimits(java.util.Map)} on the control service's latest sensor
 * data, then {@code main_loop_cycle}. Bus handlers run inline, so a slow subscriber delays the
 * next cycle. A failing cycle is logged, counted and followed by an extra backoff sleep; it is
 * never fatal and publishes no cycle event.
 *
 * <p>{@link #stop()} is idempotent and may be called from any thread, including the JVM shutdown
 * hook that closes the application context on SIGINT/SIGTERM.
 */
@Component
public class MainLoop {

    private static final Logger LOG = LogManager.getLogger(MainLoop.class);

    static final String CYCLE_CONTEXT_KEY = "cycle";

    private final EventBus eventBus;
    private final ControlService controlService;
    private final Optional<SafetyService> safetyService;
    private final LayeredConfigurationLoader configLoader;
    private final MainLoopProperties props;
    private final SupervisionMetrics metrics;
    private final LongSupplier nanoClock;

    private final ReentrantLock lifecycleLock = new ReentrantLock();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile LoopState state = LoopState.STOPPED;
    private volatile CountDownLatch stopSignal = new CountDownLatch(0);
    private boolean initialized;
    private boolean cleanedUp;

    private final AtomicLong cycles = new AtomicLong();
    private final AtomicLong errors = new AtomicLong();
    private volatile Instant startedAt;
    private volatile Instant lastCycleAt;
    private long lastCycleNanos;

    @Autowired
    public MainLoop(EventBus eventBus,
                    ControlService controlService,
                    Optional<SafetyService> safetyService,
                    LayeredConfigurationLoader configLoader,
                    MainLoopProperties props,
                    SupervisionMetrics metrics) {
        this(eventBus, controlService, safetyService, configLoader, props, metrics, System::nanoTime);
    }

    // Visible for tests
    MainLoop(EventBus eventBus,
             ControlService controlService,
             Optional<SafetyService> safetyService,
             LayeredConfigurationLoader configLoader,
             MainLoopProperties props,
             SupervisionMetrics metrics,
             LongSupplier nanoClock) {
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus");
        this.controlService = Objects.requireNonNull(controlService, "controlService");
        this.safetyService = Objects.requireNonNull(safetyService, "safetyService");
        this.configLoader = Objects.requireNonNull(configLoader, "configLoader");
        this.props = Objects.requireNonNull(props, "props");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock");
    }

    /**
     * Loads the layered configuration and initializes the control service. A configuration that
     * cannot be loaded is not fatal: the control service is initialized with an empty one.
     *
     * @return {@code false} if the control service refused to initialize
     * @throws ControlServiceException if the control service threw while initializing
     */
    public boolean initialize() {
        lifecycleLock.lock();
        try {
            if (initialized) {
                return true;
            }
            LOG.info("Initializing control loop...");
            state = LoopState.INITIALIZING;
            LayeredConfiguration configuration = loadConfiguration();
            boolean ok;
            try {
                ok = controlService.initialize(configuration);
            } catch (RuntimeException e) {
                state = LoopState.STOPPED;
                throw new ControlServiceException("Control service failed to initialize", e);
            }
            if (!ok) {
                state = LoopState.STOPPED;
                LOG.error("Control service refused to initialize");
                return false;
            }
            initialized = true;
            LOG.info("Control loop initialized");
            return true;
        } finally {
            lifecycleLock.unlock();
        }
    }

    private LayeredConfiguration loadConfiguration() {
        try {
            return configLoader.load();
        } catch (ConfigurationException e) {
            LOG.warn("Layered configuration unusable, continuing with an empty one: {}", e.getMessage());
            return LayeredConfiguration.empty();
        }
    }

    /**
     * Initializes if needed, starts the control service and marks the loop running.
     *
     * @return {@code true} if the loop is running afterwards
     * @throws ControlServiceException if the control service threw while initializing or starting
     */
    public boolean start() {
        lifecycleLock.lock();
        try {
            if (state == LoopState.RUNNING) {
                return true;
            }
            if (cleanedUp) {
                LOG.error("Control loop cannot restart after cleanup");
                return false;
            }
            if (!initialize()) {
                return false;
            }
            LOG.info("Starting control loop...");
            boolean started;
            try {
                started = controlService.start();
            } catch (RuntimeException e) {
                state = LoopState.STOPPED;
                throw new ControlServiceException("Control service failed to start", e);
            }
            if (!started) {
                state = LoopState.STOPPED;
                LOG.error("Control service failed to start");
                return false;
            }
            stopSignal = new CountDownLatch(1);
            lastCycleNanos = nanoClock.getAsLong();
            startedAt = Instant.now();
            running.set(true);
            state = LoopState.RUNNING;
            LOG.info("Control loop started (interval={})", props.getInterval());
            return true;
        } finally {
            lifecycleLock.unlock();
        }
    }

    /**
     * Starts the loop and runs it on the calling thread until {@link #stop()} is called or the
     * thread is interrupted. Always leaves the loop stopped.
     */
    public void run() {
        try {
            if (!start()) {
                LOG.error("Unable to start the control loop");
                return;
            }
        } catch (ControlServiceException e) {
            LOG.error("Unable to start the control loop: {}", e.getMessage(), e);
            return;
        }
        LOG.info("Terrarium supervision running");
        try {
            while (running.get()) {
                boolean ok = tick();
                if (pause(props.getPollTick())) {
                    break;
                }
                if (!ok && pause(props.getErrorBackoff())) {
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.info("Control loop interrupted");
        } finally {
            stop();
        }
    }

    /**
     * One scheduling check: runs a cycle if at least one interval elapsed since the previous one.
     *
     * @return {@code false} only if a cycle ran and failed
     */
    // Visible for tests
    boolean tick() {
        if (!running.get()) {
            return true;
        }
        long now = nanoClock.getAsLong();
        if (now - lastCycleNanos < props.getInterval().toNanos()) {
            return true;
        }
        lastCycleNanos = now;
        return runCycle(cycles.incrementAndGet());
    }

    private boolean runCycle(long cycle) {
        ThreadContext.put(CYCLE_CONTEXT_KEY, Long.toString(cycle));
        lastCycleAt = Instant.now();
        metrics.incrementCycles();
        try {
            executeCycle(cycle);
            return true;
        } catch (CycleExecutionException e) {
            errors.incrementAndGet();
            metrics.incrementCycleErrors();
            LOG.error(e.getMessage(), e.getCause());
            return false;
        } finally {
            ThreadContext.remove(CYCLE_CONTEXT_KEY);
        }
    }

    private void executeCycle(long cycle) {
        try {
            controlService.update();
            if (safetyService.isPresent()) {
                safetyService.get().checkSafetyLimits(controlService.getSensorData());
            }
            eventBus.emit(EventTypes.MAIN_LOOP_CYCLE, new MainLoopCycleEvent(cycle, Instant.now()));
        } catch (RuntimeException e) {
            throw new CycleExecutionException(cycle, e);
        }
    }

    /**
     * @return {@code true} if a stop was requested while waiting
     */
    private boolean pause(Duration duration) throws InterruptedException {
        return stopSignal.await(duration.toNanos(), TimeUnit.NANOSECONDS);
    }

    /**
     * Stops the loop and the control service. Idempotent; safe from any thread.
     */
    public void stop() {
        lifecycleLock.lock();
        try {
            if (state == LoopState.STOPPED || state == LoopState.STOPPING) {
                running.set(false);
                return;
            }
            LOG.info("Stopping control loop...");
            state = LoopState.STOPPING;
            running.set(false);
            stopSignal.countDown();
            try {
                controlService.stop();
            } catch (RuntimeException e) {
                LOG.error("Control service failed to stop cleanly: {}", e.toString(), e);
            }
            state = LoopState.STOPPED;
            LOG.info("Control loop stopped");
        } finally {
            lifecycleLock.unlock();
        }
    }

    /**
     * Stops the loop and releases the control service. Called on application shutdown.
     */
    @PreDestroy
    public void cleanup() {
        stop();
        lifecycleLock.lock();
        try {
            if (cleanedUp) {
                return;
            }
            cleanedUp = true;
            try {
                controlService.cleanup();
            } catch (RuntimeException e) {
                LOG.error("Control service cleanup failed: {}", e.toString(), e);
            }
            LOG.info("Control loop cleaned up");
        } finally {
            lifecycleLock.unlock();
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public LoopState getState() {
        return state;
    }

    public LoopStats getStats() {
        return new LoopStats(cycles.get(), errors.get(), startedAt, lastCycleAt);
    }

    public MainLoopStatus getStatus() {
        boolean released;
        lifecycleLock.lock();
        try {
            released = cleanedUp;
        } finally {
            lifecycleLock.unlock();
        }
        return new MainLoopStatus(state, running.get(), props.getInterval(), getStats(),
                released ? null : controlService.getSystemStatus());
    }
}
