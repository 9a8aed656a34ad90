package com.improvtoolkit.ingest.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Pipeline lifecycle settings.
 */
@Validated
@ConfigurationProperties(prefix = "ingest.pipeline")
public class PipelineProperties {

    /** Start device sessions and stages together with the application context. */
    private boolean autoStart = true;

    /** How long stop() waits for device and stage tasks to exit. */
    @Positive
    private long shutdownTimeoutMs = 2_000;

    public boolean isAutoStart() {
        return autoStart;
    }

    public void setAutoStart(boolean autoStart) {
        this.autoStart = autoStart;
    }

    public long getShutdownTimeoutMs() {
        return shutdownTimeoutMs;
    }

    public void setShutdownTimeoutMs(long shutdownTimeoutMs) {
        this.shutdownTimeoutMs = shutdownTimeoutMs;
    }
}
