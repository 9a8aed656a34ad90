package com.improvtoolkit.ingest.service.button.nativehook;

import com.improvtoolkit.ingest.service.button.ButtonInputEvent;

import java.util.function.Consumer;

/**
 * Abstraction over a process-wide keyboard hook (e.g., JNativeHook).
 *
 * Provides a test seam so unit tests can inject a fake implementation
 * and remain hermetic (no OS-level hooks required in CI).
 */
public interface KeyboardHook {

    /**
     * Subscribes to key transitions. The native hook is registered with the first listener.
     *
     * @throws SecurityException if the OS refuses the hook (missing permission or native library)
     */
    void addListener(Consumer<ButtonInputEvent> listener);

    /** Unsubscribes; the native hook is unregistered after the last listener leaves. */
    void removeListener(Consumer<ButtonInputEvent> listener);
}
