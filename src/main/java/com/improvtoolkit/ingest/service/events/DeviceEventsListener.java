package com.improvtoolkit.ingest.service.events;

import com.improvtoolkit.ingest.domain.DeviceStatus;
import com.improvtoolkit.ingest.service.metrics.PipelineMetrics;
import com.improvtoolkit.ingest.service.session.SessionState;
import com.improvtoolkit.ingest.service.session.event.DeviceStateChangedEvent;
import com.improvtoolkit.ingest.service.session.event.DeviceStatusEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Operator-facing log lines and metrics for device session events. Repeated connect/disconnect
 * lines are throttled per device and status to avoid log spam during a reconnect storm.
 */
@Component
class DeviceEventsListener {
    private static final Logger LOG = LogManager.getLogger(DeviceEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    private final PipelineMetrics metrics;

    DeviceEventsListener(PipelineMetrics metrics) {
        this.metrics = metrics;
    }

    @EventListener
    void onDeviceStatus(DeviceStatusEvent e) {
        if (e.status() == DeviceStatus.DEAD) {
            LOG.error("{} '{}' is dead ({}). Check cabling and restart the ingest service.",
                    e.kind(), e.deviceId(), e.reason());
            return;
        }
        if (shouldLog(e.deviceId() + '-' + e.status())) {
            if (e.status() == DeviceStatus.CONNECTED) {
                LOG.info("{} '{}' connected", e.kind(), e.deviceId());
            } else {
                LOG.warn("{} '{}' disconnected: {}", e.kind(), e.deviceId(), e.reason());
            }
        }
    }

    @EventListener
    void onStateChanged(DeviceStateChangedEvent e) {
        if (e.to() == SessionState.DISCONNECTED) {
            metrics.incrementReconnectAttempt(e.deviceId());
        } else if (e.to() == SessionState.DEGRADED) {
            metrics.incrementStreamRestart(e.deviceId(), e.reason());
        } else if (e.to() == SessionState.PERMANENTLY_FAILED) {
            metrics.incrementDeadDevice(e.deviceId());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
