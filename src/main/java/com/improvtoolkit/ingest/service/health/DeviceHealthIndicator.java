package com.improvtoolkit.ingest.service.health;

import com.improvtoolkit.ingest.service.pipeline.IngestPipeline;
import com.improvtoolkit.ingest.service.session.DeviceSession;
import com.improvtoolkit.ingest.service.session.SessionState;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Health indicator for device sessions.
 *
 * <ul>
 *   <li>UP: every device session is ACTIVE</li>
 *   <li>DEGRADED: some device is connecting, restarting or reconnecting, none is dead</li>
 *   <li>DOWN: at least one device exhausted its retry budget</li>
 *   <li>UNKNOWN: pipeline not running</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class DeviceHealthIndicator implements HealthIndicator {

    private final IngestPipeline pipeline;

    public DeviceHealthIndicator(IngestPipeline pipeline) {
        this.pipeline = pipeline;
    }

    @Override
    public Health health() {
        List<DeviceSession<?>> sessions = pipeline.sessions();
        if (sessions.isEmpty()) {
            return Health.unknown().withDetail("status", "Pipeline not running").build();
        }

        Map<String, String> devices = new LinkedHashMap<>();
        boolean anyDead = false;
        boolean allActive = true;
        for (DeviceSession<?> session : sessions) {
            SessionState state = session.state();
            devices.put(session.deviceId(), describe(session));
            anyDead |= state == SessionState.PERMANENTLY_FAILED;
            allActive &= state == SessionState.ACTIVE;
        }

        Health.Builder builder = new Health.Builder();
        if (anyDead) {
            builder.down().withDetail("status", "Device permanently failed");
        } else if (allActive) {
            builder.up().withDetail("status", "All devices operational");
        } else {
            builder.status("DEGRADED").withDetail("status", "Devices recovering");
        }
        return builder.withDetail("devices", devices).build();
    }

    private static String describe(DeviceSession<?> session) {
        int attempts = session.health().reconnectAttempts();
        String state = session.state().name().toLowerCase(Locale.ROOT);
        return attempts == 0 ? state : state + " (attempt " + attempts + "/" + session.health().maxReconnectAttempts() + ")";
    }
}
