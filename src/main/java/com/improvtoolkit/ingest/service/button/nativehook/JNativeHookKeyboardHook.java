package com.improvtoolkit.ingest.service.button.nativehook;

import com.github.kwhat.jnativehook.GlobalScreen;
import com.github.kwhat.jnativehook.NativeHookException;
import com.github.kwhat.jnativehook.keyboard.NativeKeyEvent;
import com.github.kwhat.jnativehook.keyboard.NativeKeyListener;
import com.improvtoolkit.ingest.service.button.ButtonInputEvent;
import com.improvtoolkit.ingest.service.button.KeyCode;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Production {@link KeyboardHook} backed by JNativeHook.
 * Converts {@link NativeKeyEvent} into {@link ButtonInputEvent}; a press of a key that is already
 * down is reported as {@link ButtonInputEvent.State#REPEAT} (OS auto-repeat).
 */
public class JNativeHookKeyboardHook implements KeyboardHook, NativeKeyListener {

    private static final Logger LOG = LogManager.getLogger(JNativeHookKeyboardHook.class);

    private final Object lock = new Object();
    private final List<Consumer<ButtonInputEvent>> listeners = new CopyOnWriteArrayList<>();
    private final Set<Integer> keysDown = ConcurrentHashMap.newKeySet();
    private boolean registered;

    @Override
    public void addListener(Consumer<ButtonInputEvent> listener) {
        synchronized (lock) {
            if (!registered) {
                try {
                    GlobalScreen.registerNativeHook();
                    GlobalScreen.addNativeKeyListener(this);
                    registered = true;
                    LOG.info("Registered JNativeHook global key listener");
                } catch (NativeHookException | UnsatisfiedLinkError e) {
                    throw new SecurityException("Failed to register global key hook: " + e.getMessage(), e);
                }
            }
            listeners.add(listener);
        }
    }

    @Override
    public void removeListener(Consumer<ButtonInputEvent> listener) {
        synchronized (lock) {
            listeners.remove(listener);
            if (!registered || !listeners.isEmpty()) {
                return;
            }
            try {
                GlobalScreen.removeNativeKeyListener(this);
                GlobalScreen.unregisterNativeHook();
                LOG.info("Unregistered JNativeHook global key listener");
            } catch (NativeHookException e) {
                LOG.debug("Error unregistering native hook", e);
            } finally {
                registered = false;
                keysDown.clear();
            }
        }
    }

    @Override
    public void nativeKeyPressed(NativeKeyEvent nativeEvent) {
        boolean firstPress = keysDown.add(nativeEvent.getKeyCode());
        emit(nativeEvent, firstPress ? ButtonInputEvent.State.DOWN : ButtonInputEvent.State.REPEAT);
    }

    @Override
    public void nativeKeyReleased(NativeKeyEvent nativeEvent) {
        keysDown.remove(nativeEvent.getKeyCode());
        emit(nativeEvent, ButtonInputEvent.State.UP);
    }

    @Override
    public void nativeKeyTyped(NativeKeyEvent nativeEvent) { /* ignore */ }

    private void emit(NativeKeyEvent nativeEvent, ButtonInputEvent.State state) {
        int code = NativeKeyCodes.translate(nativeEvent.getKeyCode()).map(KeyCode::code).orElse(-1);
        ButtonInputEvent e = new ButtonInputEvent(code, state, System.currentTimeMillis());
        for (Consumer<ButtonInputEvent> l : listeners) {
            try {
                l.accept(e);
            } catch (RuntimeException ex) {
                LOG.warn("Listener error for {}: {}", e, ex.toString());
            }
        }
    }
}
