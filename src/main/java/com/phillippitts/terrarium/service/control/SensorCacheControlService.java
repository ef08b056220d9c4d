package com.phillippitts.terrarium.service.control;

import com.phillippitts.terrarium.bus.EventBus;
import com.phillippitts.terrarium.bus.EventHandler;
import com.phillippitts.terrarium.bus.EventTypes;
import com.phillippitts.terrarium.config.LayeredConfiguration;
import com.phillippitts.terrarium.exception.ControlServiceException;
import com.phillippitts.terrarium.service.control.event.ControlUpdateEvent;
import com.phillippitts.terrarium.service.watchdog.ServiceStatus;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Default {@link ControlService}: sensor drivers publish {@code sensor_data} on the bus and this
 * service keeps the most recent snapshot for the control loop. Each update publishes
 * {@code control_update}.
 */
@Service
public class SensorCacheControlService implements ControlService {

    private static final Logger LOG = LogManager.getLogger(SensorCacheControlService.class);

    private final EventBus eventBus;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong updates = new AtomicLong();
    private volatile LayeredConfiguration configuration;
    private volatile Map<String, Object> latestSnapshot = Map.of();
    private volatile Instant snapshotAt;
    private volatile EventHandler sensorHandler;

    @Autowired
    public SensorCacheControlService(EventBus eventBus) {
        this(eventBus, Clock.systemUTC());
    }

    // Visible for tests
    SensorCacheControlService(EventBus eventBus, Clock clock) {
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public synchronized boolean initialize(LayeredConfiguration configuration) {
        this.configuration = configuration == null ? LayeredConfiguration.empty() : configuration;
        if (sensorHandler == null) {
            sensorHandler = eventBus.subscribe(EventTypes.SENSOR_DATA, this::onSensorData);
        }
        LOG.info("Control service initialized (terrariums={}, species={})",
                this.configuration.terrariums().keySet(), this.configuration.species().size());
        return true;
    }

    @Override
    public boolean start() {
        if (configuration == null) {
            LOG.error("Control service cannot start before initialize()");
            return false;
        }
        if (running.compareAndSet(false, true)) {
            LOG.info("Control service started");
        }
        return true;
    }

    @Override
    public void stop() {
        if (running.compareAndSet(true, false)) {
            LOG.info("Control service stopped");
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    /**
     * @throws ControlServiceException if the service is not running
     */
    @Override
    public void update() {
        if (!running.get()) {
            throw new ControlServiceException("Control service is not running");
        }
        long n = updates.incrementAndGet();
        eventBus.emit(EventTypes.CONTROL_UPDATE,
                new ControlUpdateEvent(n, clock.instant(), !latestSnapshot.isEmpty()));
    }

    @Override
    public Map<String, Object> getSensorData() {
        return latestSnapshot;
    }

    @Override
    public ServiceStatus getSystemStatus() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("initialized", configuration != null);
        details.put("updates", updates.get());
        Instant at = snapshotAt;
        details.put("sensor_data_age_ms", at == null ? null : Duration.between(at, clock.instant()).toMillis());
        return new ServiceStatus(running.get(), details);
    }

    @Override
    public synchronized void cleanup() {
        stop();
        EventHandler handler = sensorHandler;
        if (handler != null) {
            eventBus.unsubscribe(EventTypes.SENSOR_DATA, handler);
            sensorHandler = null;
        }
        latestSnapshot = Map.of();
        snapshotAt = null;
        LOG.info("Control service cleaned up");
    }

    void onSensorData(Object payload) {
        if (!(payload instanceof Map<?, ?> raw)) {
            LOG.warn("Ignoring sensor_data payload of type {}",
                    payload == null ? "null" : payload.getClass().getName());
            return;
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        raw.forEach((k, v) -> copy.put(String.valueOf(k), v));
        latestSnapshot = Collections.unmodifiableMap(copy);
        snapshotAt = clock.instant();
    }
}
