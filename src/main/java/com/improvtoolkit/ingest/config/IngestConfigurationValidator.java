package com.improvtoolkit.ingest.config;

import com.improvtoolkit.ingest.config.properties.AudioCaptureProperties;
import com.improvtoolkit.ingest.config.properties.AudioProcessingProperties;
import com.improvtoolkit.ingest.config.properties.ButtonProperties;
import com.improvtoolkit.ingest.config.properties.ShowProperties;
import com.improvtoolkit.ingest.config.properties.ThreadPoolProperties;
import com.improvtoolkit.ingest.domain.ButtonAction;
import com.improvtoolkit.ingest.exception.InvalidConfigurationException;
import jakarta.annotation.PostConstruct;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Cross-property checks that bean validation cannot express. Runs at startup, before any device is
 * opened, and fails fast with actionable messages.
 */
@Component
class IngestConfigurationValidator {

    /** Processing, audio forwarding and dispatch. */
    private static final int STAGE_TASKS = 3;
    private static final int MICROPHONES = 1;

    private final ShowProperties show;
    private final AudioCaptureProperties capture;
    private final AudioProcessingProperties processing;
    private final ButtonProperties buttons;
    private final ThreadPoolProperties threadPool;

    IngestConfigurationValidator(ShowProperties show,
                                 AudioCaptureProperties capture,
                                 AudioProcessingProperties processing,
                                 ButtonProperties buttons,
                                 ThreadPoolProperties threadPool) {
        this.show = show;
        this.capture = capture;
        this.processing = processing;
        this.buttons = buttons;
        this.threadPool = threadPool;
    }

    @PostConstruct
    void validate() {
        validateVadFrame();
        validateDevices();
        validateResetDevice();
        validateAvatars();
        validateActorCounts();
        validateThreadPool();
    }

    private void validateVadFrame() {
        int ms = processing.getVadFrameMs();
        if (ms != 10 && ms != 20 && ms != 30) {
            throw new InvalidConfigurationException("ingest.audio.processing.vad-frame-ms",
                    "must be 10, 20 or 30, got: " + ms);
        }
    }

    private void validateDevices() {
        Set<String> ids = new HashSet<>();
        Set<String> paths = new HashSet<>();
        for (ButtonProperties.Device device : buttons.allDevices()) {
            if (device.getId() == null || device.getId().isBlank()) {
                throw new InvalidConfigurationException("ingest.buttons", "every device needs an id");
            }
            if (device.getPath() == null || device.getPath().isBlank()) {
                throw new InvalidConfigurationException("ingest.buttons",
                        "device '" + device.getId() + "' needs a path");
            }
            if (!ids.add(device.getId())) {
                throw new InvalidConfigurationException("ingest.buttons",
                        "duplicate device id '" + device.getId() + "'");
            }
            if (!paths.add(device.getPath())) {
                throw new InvalidConfigurationException("ingest.buttons",
                        "device path '" + device.getPath() + "' is configured more than once");
            }
            if (device.getKeys().isEmpty()) {
                throw new InvalidConfigurationException("ingest.buttons",
                        "device '" + device.getId() + "' has no key mappings");
            }
        }
    }

    private void validateResetDevice() {
        ButtonProperties.Device reset = buttons.getReset();
        if (reset == null) {
            throw new InvalidConfigurationException("ingest.buttons.reset", "a reset device is required");
        }
        if (!reset.getKeys().containsValue(ButtonAction.RESET)) {
            throw new InvalidConfigurationException("ingest.buttons.reset.keys",
                    "reset device '" + reset.getId() + "' must map at least one key to 'reset'");
        }
    }

    private void validateAvatars() {
        for (ButtonProperties.Device avatar : buttons.getAvatars()) {
            if (avatar.getKeys().containsValue(ButtonAction.RESET)) {
                throw new InvalidConfigurationException("ingest.buttons.avatars",
                        "avatar device '" + avatar.getId() + "' must not map 'reset'; use the reset device");
            }
        }
    }

    private void validateActorCounts() {
        int actors = show.getActorsCount();
        List<ButtonProperties.Device> avatars = buttons.getAvatars();
        if (actors != avatars.size()) {
            throw new InvalidConfigurationException("ingest.show.actors-count",
                    "declares " + actors + " actor(s) but " + avatars.size() + " avatar button device(s) are configured");
        }
        if (actors != MICROPHONES) {
            throw new InvalidConfigurationException("ingest.show.actors-count",
                    "declares " + actors + " actor(s) but " + MICROPHONES + " microphone is configured"
                            + " (mic '" + capture.getMicName() + "'); only single-actor shows are supported");
        }
    }

    private void validateThreadPool() {
        int needed = MICROPHONES + buttons.allDevices().size() + STAGE_TASKS;
        if (threadPool.getPoolSize() < needed) {
            throw new InvalidConfigurationException("ingest.threadpool.pool-size",
                    "needs at least " + needed + " threads (one per device plus " + STAGE_TASKS
                            + " stages), got: " + threadPool.getPoolSize());
        }
    }
}
