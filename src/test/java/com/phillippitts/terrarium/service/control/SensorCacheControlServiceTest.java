package com.phillippitts.terrarium.service.control;

import com.phillippitts.terrarium.bus.EventBus;
import com.phillippitts.terrarium.bus.EventTypes;
import com.phillippitts.terrarium.config.LayeredConfiguration;
import com.phillippitts.terrarium.exception.ControlServiceException;
import com.phillippitts.terrarium.service.control.event.ControlUpdateEvent;
import com.phillippitts.terrarium.service.watchdog.ServiceStatus;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SensorCacheControlServiceTest {

    private final EventBus bus = new EventBus();
    private final SensorCacheControlService service = new SensorCacheControlService(
            bus, Clock.fixed(Instant.parse("2024-05-01T12:00:00Z"), ZoneOffset.UTC));

    @Test
    void shouldNotStartBeforeInitialize() {
        assertThat(service.start()).isFalse();
        assertThat(service.isRunning()).isFalse();
    }

    @Test
    void shouldCacheLatestSensorSnapshotFromBus() {
        service.initialize(LayeredConfiguration.empty());

        bus.emit(EventTypes.SENSOR_DATA, Map.of("temperature", 21.0));
        bus.emit(EventTypes.SENSOR_DATA, Map.of("temperature", 23.5, "humidity", 70.0));

        assertThat(service.getSensorData())
                .containsEntry("temperature", 23.5)
                .containsEntry("humidity", 70.0);
    }

    @Test
    void shouldIgnoreNonMapPayloads() {
        service.initialize(LayeredConfiguration.empty());
        bus.emit(EventTypes.SENSOR_DATA, Map.of("temperature", 21.0));

        bus.emit(EventTypes.SENSOR_DATA, "garbage");

        assertThat(service.getSensorData()).containsEntry("temperature", 21.0);
    }

    @Test
    void updateShouldPublishControlUpdate() {
        List<ControlUpdateEvent> updates = new ArrayList<>();
        bus.subscribe(EventTypes.CONTROL_UPDATE, p -> updates.add((ControlUpdateEvent) p));
        service.initialize(LayeredConfiguration.empty());
        service.start();

        service.update();
        bus.emit(EventTypes.SENSOR_DATA, Map.of("water_level", 40.0));
        service.update();

        assertThat(updates).extracting(ControlUpdateEvent::update).containsExactly(1L, 2L);
        assertThat(updates).extracting(ControlUpdateEvent::sensorDataPresent).containsExactly(false, true);
    }

    @Test
    void updateShouldFailWhenStopped() {
        service.initialize(LayeredConfiguration.empty());

        assertThatThrownBy(service::update).isInstanceOf(ControlServiceException.class);
    }

    @Test
    void statusShouldReflectRunningFlagAndCounters() {
        service.initialize(LayeredConfiguration.empty());
        service.start();
        service.update();
        bus.emit(EventTypes.SENSOR_DATA, Map.of("temperature", 21.0));

        ServiceStatus status = service.getStatus();

        assertThat(status.running()).isTrue();
        assertThat(status.details()).containsEntry("updates", 1L).containsEntry("sensor_data_age_ms", 0L);

        service.stop();
        assertThat(service.getSystemStatus().running()).isFalse();
    }

    @Test
    void cleanupShouldUnsubscribeAndDropSnapshot() {
        service.initialize(LayeredConfiguration.empty());
        service.initialize(LayeredConfiguration.empty());
        assertThat(bus.getHandlerCount(EventTypes.SENSOR_DATA)).isEqualTo(1);
        bus.emit(EventTypes.SENSOR_DATA, Map.of("temperature", 21.0));

        service.cleanup();

        assertThat(bus.getHandlerCount(EventTypes.SENSOR_DATA)).isZero();
        assertThat(service.getSensorData()).isEmpty();
        assertThat(service.isRunning()).isFalse();
    }
}
