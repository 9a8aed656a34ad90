package com.improvtoolkit.ingest.config.properties;

import com.improvtoolkit.ingest.domain.ButtonAction;
import com.improvtoolkit.ingest.service.button.KeyCode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Physical button devices and their key to action maps.
 *
 * <p>Key codes are the closed {@link KeyCode} set; an unknown key fails binding at startup.
 * In YAML, wrap map keys in brackets so underscores survive relaxed binding:
 * <pre>
 * keys:
 *   "[KEY_R]": reset
 * </pre>
 */
@Validated
@ConfigurationProperties(prefix = "ingest.buttons")
public class ButtonProperties {

    public enum Backend { EVDEV, NATIVE_HOOK }

    @NotNull
    private Backend backend = Backend.EVDEV;

    /** Minimum time between accepted events of one device, in milliseconds. */
    @Positive(message = "Debounce window must be positive")
    private int debounceMs = 300;

    /** Read timeout used so monitors notice cancellation promptly. */
    @Positive
    private int pollTimeoutMs = 200;

    /** Capacity of the priority dispatch queue. */
    @Positive
    private int dispatchCapacity = 256;

    @Valid
    private Device reset;

    @Valid
    private List<Device> avatars = new ArrayList<>();

    /** One physical control device. */
    public static class Device {

        /** Source id carried in emitted events (avatar id, or "reset"). */
        @NotBlank
        private String id;

        /** Device path (e.g. /dev/input/by-id/...-event-kbd). */
        @NotBlank
        private String path;

        /** Take exclusive access while open, where the backend supports it. */
        private boolean grab = true;

        private Map<KeyCode, ButtonAction> keys = new EnumMap<>(KeyCode.class);

        public Device() {
        }

        public Device(String id, String path, boolean grab, Map<KeyCode, ButtonAction> keys) {
            this.id = id;
            this.path = path;
            this.grab = grab;
            setKeys(keys);
        }

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }

        public boolean isGrab() {
            return grab;
        }

        public void setGrab(boolean grab) {
            this.grab = grab;
        }

        public Map<KeyCode, ButtonAction> getKeys() {
            return keys;
        }

        public void setKeys(Map<KeyCode, ButtonAction> keys) {
            this.keys = (keys == null || keys.isEmpty()) ? new EnumMap<>(KeyCode.class) : new EnumMap<>(keys);
        }
    }

    /** Reset device first, then avatars in configured order. */
    public List<Device> allDevices() {
        List<Device> all = new ArrayList<>();
        if (reset != null) {
            all.add(reset);
        }
        all.addAll(avatars);
        return all;
    }

    public Backend getBackend() {
        return backend;
    }

    public void setBackend(Backend backend) {
        this.backend = backend;
    }

    public int getDebounceMs() {
        return debounceMs;
    }

    public void setDebounceMs(int debounceMs) {
        this.debounceMs = debounceMs;
    }

    public int getPollTimeoutMs() {
        return pollTimeoutMs;
    }

    public void setPollTimeoutMs(int pollTimeoutMs) {
        this.pollTimeoutMs = pollTimeoutMs;
    }

    public int getDispatchCapacity() {
        return dispatchCapacity;
    }

    public void setDispatchCapacity(int dispatchCapacity) {
        this.dispatchCapacity = dispatchCapacity;
    }

    public Device getReset() {
        return reset;
    }

    public void setReset(Device reset) {
        this.reset = reset;
    }

    public List<Device> getAvatars() {
        return avatars;
    }

    public void setAvatars(List<Device> avatars) {
        this.avatars = avatars == null ? new ArrayList<>() : avatars;
    }
}
