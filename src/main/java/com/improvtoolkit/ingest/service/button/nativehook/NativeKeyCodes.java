package com.improvtoolkit.ingest.service.button.nativehook;

import com.github.kwhat.jnativehook.keyboard.NativeKeyEvent;
import com.improvtoolkit.ingest.service.button.KeyCode;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Translation from JNativeHook virtual key codes into {@link KeyCode}. Keypad keys are not
 * distinguished by the hook on every platform and are left out.
 */
final class NativeKeyCodes {

    private static final Map<Integer, KeyCode> BY_VIRTUAL_CODE = new HashMap<>();

    static {
        put(NativeKeyEvent.VC_ESCAPE, KeyCode.KEY_ESC);
        put(NativeKeyEvent.VC_1, KeyCode.KEY_1);
        put(NativeKeyEvent.VC_2, KeyCode.KEY_2);
        put(NativeKeyEvent.VC_3, KeyCode.KEY_3);
        put(NativeKeyEvent.VC_4, KeyCode.KEY_4);
        put(NativeKeyEvent.VC_5, KeyCode.KEY_5);
        put(NativeKeyEvent.VC_6, KeyCode.KEY_6);
        put(NativeKeyEvent.VC_7, KeyCode.KEY_7);
        put(NativeKeyEvent.VC_8, KeyCode.KEY_8);
        put(NativeKeyEvent.VC_9, KeyCode.KEY_9);
        put(NativeKeyEvent.VC_0, KeyCode.KEY_0);
        put(NativeKeyEvent.VC_MINUS, KeyCode.KEY_MINUS);
        put(NativeKeyEvent.VC_EQUALS, KeyCode.KEY_EQUAL);
        put(NativeKeyEvent.VC_BACKSPACE, KeyCode.KEY_BACKSPACE);
        put(NativeKeyEvent.VC_TAB, KeyCode.KEY_TAB);
        put(NativeKeyEvent.VC_Q, KeyCode.KEY_Q);
        put(NativeKeyEvent.VC_W, KeyCode.KEY_W);
        put(NativeKeyEvent.VC_E, KeyCode.KEY_E);
        put(NativeKeyEvent.VC_R, KeyCode.KEY_R);
        put(NativeKeyEvent.VC_T, KeyCode.KEY_T);
        put(NativeKeyEvent.VC_Y, KeyCode.KEY_Y);
        put(NativeKeyEvent.VC_U, KeyCode.KEY_U);
        put(NativeKeyEvent.VC_I, KeyCode.KEY_I);
        put(NativeKeyEvent.VC_O, KeyCode.KEY_O);
        put(NativeKeyEvent.VC_P, KeyCode.KEY_P);
        put(NativeKeyEvent.VC_OPEN_BRACKET, KeyCode.KEY_LEFTBRACE);
        put(NativeKeyEvent.VC_CLOSE_BRACKET, KeyCode.KEY_RIGHTBRACE);
        put(NativeKeyEvent.VC_ENTER, KeyCode.KEY_ENTER);
        put(NativeKeyEvent.VC_A, KeyCode.KEY_A);
        put(NativeKeyEvent.VC_S, KeyCode.KEY_S);
        put(NativeKeyEvent.VC_D, KeyCode.KEY_D);
        put(NativeKeyEvent.VC_F, KeyCode.KEY_F);
        put(NativeKeyEvent.VC_G, KeyCode.KEY_G);
        put(NativeKeyEvent.VC_H, KeyCode.KEY_H);
        put(NativeKeyEvent.VC_J, KeyCode.KEY_J);
        put(NativeKeyEvent.VC_K, KeyCode.KEY_K);
        put(NativeKeyEvent.VC_L, KeyCode.KEY_L);
        put(NativeKeyEvent.VC_SEMICOLON, KeyCode.KEY_SEMICOLON);
        put(NativeKeyEvent.VC_QUOTE, KeyCode.KEY_APOSTROPHE);
        put(NativeKeyEvent.VC_BACKQUOTE, KeyCode.KEY_GRAVE);
        put(NativeKeyEvent.VC_BACK_SLASH, KeyCode.KEY_BACKSLASH);
        put(NativeKeyEvent.VC_Z, KeyCode.KEY_Z);
        put(NativeKeyEvent.VC_X, KeyCode.KEY_X);
        put(NativeKeyEvent.VC_C, KeyCode.KEY_C);
        put(NativeKeyEvent.VC_V, KeyCode.KEY_V);
        put(NativeKeyEvent.VC_B, KeyCode.KEY_B);
        put(NativeKeyEvent.VC_N, KeyCode.KEY_N);
        put(NativeKeyEvent.VC_M, KeyCode.KEY_M);
        put(NativeKeyEvent.VC_COMMA, KeyCode.KEY_COMMA);
        put(NativeKeyEvent.VC_PERIOD, KeyCode.KEY_DOT);
        put(NativeKeyEvent.VC_SLASH, KeyCode.KEY_SLASH);
        put(NativeKeyEvent.VC_SPACE, KeyCode.KEY_SPACE);
        put(NativeKeyEvent.VC_F1, KeyCode.KEY_F1);
        put(NativeKeyEvent.VC_F2, KeyCode.KEY_F2);
        put(NativeKeyEvent.VC_F3, KeyCode.KEY_F3);
        put(NativeKeyEvent.VC_F4, KeyCode.KEY_F4);
        put(NativeKeyEvent.VC_F5, KeyCode.KEY_F5);
        put(NativeKeyEvent.VC_F6, KeyCode.KEY_F6);
        put(NativeKeyEvent.VC_F7, KeyCode.KEY_F7);
        put(NativeKeyEvent.VC_F8, KeyCode.KEY_F8);
        put(NativeKeyEvent.VC_F9, KeyCode.KEY_F9);
        put(NativeKeyEvent.VC_F10, KeyCode.KEY_F10);
        put(NativeKeyEvent.VC_F11, KeyCode.KEY_F11);
        put(NativeKeyEvent.VC_F12, KeyCode.KEY_F12);
        put(NativeKeyEvent.VC_HOME, KeyCode.KEY_HOME);
        put(NativeKeyEvent.VC_UP, KeyCode.KEY_UP);
        put(NativeKeyEvent.VC_PAGE_UP, KeyCode.KEY_PAGEUP);
        put(NativeKeyEvent.VC_LEFT, KeyCode.KEY_LEFT);
        put(NativeKeyEvent.VC_RIGHT, KeyCode.KEY_RIGHT);
        put(NativeKeyEvent.VC_END, KeyCode.KEY_END);
        put(NativeKeyEvent.VC_DOWN, KeyCode.KEY_DOWN);
        put(NativeKeyEvent.VC_PAGE_DOWN, KeyCode.KEY_PAGEDOWN);
        put(NativeKeyEvent.VC_INSERT, KeyCode.KEY_INSERT);
        put(NativeKeyEvent.VC_DELETE, KeyCode.KEY_DELETE);
    }

    private NativeKeyCodes() {}

    private static void put(int virtualCode, KeyCode key) {
        BY_VIRTUAL_CODE.put(virtualCode, key);
    }

    static Optional<KeyCode> translate(int virtualCode) {
        return Optional.ofNullable(BY_VIRTUAL_CODE.get(virtualCode));
    }
}
