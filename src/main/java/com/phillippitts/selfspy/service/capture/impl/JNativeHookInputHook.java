package com.phillippitts.selfspy.service.capture.impl;

import com.github.kwhat.jnativehook.GlobalScreen;
import com.github.kwhat.jnativehook.NativeHookException;
import com.github.kwhat.jnativehook.NativeInputEvent;
import com.github.kwhat.jnativehook.keyboard.NativeKeyEvent;
import com.github.kwhat.jnativehook.keyboard.NativeKeyListener;
import com.github.kwhat.jnativehook.mouse.NativeMouseEvent;
import com.github.kwhat.jnativehook.mouse.NativeMouseInputListener;
import com.github.kwhat.jnativehook.mouse.NativeMouseWheelEvent;
import com.github.kwhat.jnativehook.mouse.NativeMouseWheelListener;
import com.phillippitts.selfspy.domain.PointerEventType;
import com.phillippitts.selfspy.service.capture.InputHook;
import com.phillippitts.selfspy.service.capture.KeyNameMapper;
import com.phillippitts.selfspy.service.capture.NormalizedKeyEvent;
import com.phillippitts.selfspy.service.capture.NormalizedPointerEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.logging.Level;

/**
 * Production InputHook backed by JNativeHook.
 *
 * Keyboard: printable characters come from key-typed callbacks; special keys and
 * shortcuts (a key pressed with CONTROL, META or ALT) come from key-pressed callbacks and
 * are recorded as bracketed names. Standalone modifier presses are not recorded.
 *
 * Pointer: presses become clicks, motion and drags become moves, wheel rotation
 * becomes scrolls.
 */
@Component
public class JNativeHookInputHook implements InputHook, NativeKeyListener, NativeMouseInputListener,
        NativeMouseWheelListener {

    private static final Logger LOG = LogManager.getLogger(JNativeHookInputHook.class);

    private volatile Consumer<NormalizedKeyEvent> keyListener;
    private volatile Consumer<NormalizedPointerEvent> pointerListener;
    private final AtomicBoolean registered = new AtomicBoolean(false);

    @Override
    public void register() {
        if (registered.get()) {
            return;
        }
        try {
            // JNativeHook logs every native event through java.util.logging
            java.util.logging.Logger.getLogger(GlobalScreen.class.getPackage().getName()).setLevel(Level.WARNING);
            GlobalScreen.registerNativeHook();
            GlobalScreen.addNativeKeyListener(this);
            GlobalScreen.addNativeMouseListener(this);
            GlobalScreen.addNativeMouseMotionListener(this);
            GlobalScreen.addNativeMouseWheelListener(this);
            registered.set(true);
            LOG.info("Registered JNativeHook keyboard and pointer listeners");
        } catch (NativeHookException | UnsatisfiedLinkError e) {
            throw new SecurityException("Failed to register global input hook: " + e.getMessage(), e);
        }
    }

    @Override
    public void unregister() {
        if (!registered.get()) {
            return;
        }
        try {
            GlobalScreen.removeNativeKeyListener(this);
            GlobalScreen.removeNativeMouseListener(this);
            GlobalScreen.removeNativeMouseMotionListener(this);
            GlobalScreen.removeNativeMouseWheelListener(this);
            GlobalScreen.unregisterNativeHook();
        } catch (NativeHookException e) {
            LOG.debug("Error unregistering native hook", e);
        } finally {
            registered.set(false);
        }
    }

    @Override
    public void setKeyListener(Consumer<NormalizedKeyEvent> listener) {
        this.keyListener = listener;
    }

    @Override
    public void setPointerListener(Consumer<NormalizedPointerEvent> listener) {
        this.pointerListener = listener;
    }

    // NativeKeyListener callbacks
    @Override
    public void nativeKeyTyped(NativeKeyEvent ne) {
        char c = ne.getKeyChar();
        Set<String> mods = extractModifiers(ne);
        if (c == NativeKeyEvent.CHAR_UNDEFINED || Character.isISOControl(c) || KeyNameMapper.isShortcut(mods)) {
            return;
        }
        emitKey(String.valueOf(c), mods);
    }

    @Override
    public void nativeKeyPressed(NativeKeyEvent ne) {
        String key = KeyNameMapper.normalizeKey(NativeKeyEvent.getKeyText(ne.getKeyCode()));
        if (KeyNameMapper.isModifierKey(key)) {
            return;
        }
        Set<String> mods = extractModifiers(ne);
        if (KeyNameMapper.isSpecialKey(key) || KeyNameMapper.isShortcut(mods)) {
            emitKey(KeyNameMapper.keyText(key), mods);
        }
    }

    @Override
    public void nativeKeyReleased(NativeKeyEvent ne) {
        // text is recorded on press/typed only
    }

    // NativeMouseInputListener callbacks
    @Override
    public void nativeMousePressed(NativeMouseEvent e) {
        emitPointer(PointerEventType.CLICK, e.getX(), e.getY(), KeyNameMapper.buttonName(e.getButton()));
    }

    @Override
    public void nativeMouseClicked(NativeMouseEvent e) {
        // press already recorded
    }

    @Override
    public void nativeMouseReleased(NativeMouseEvent e) {
        // press already recorded
    }

    @Override
    public void nativeMouseMoved(NativeMouseEvent e) {
        emitPointer(PointerEventType.MOVE, e.getX(), e.getY(), "");
    }

    @Override
    public void nativeMouseDragged(NativeMouseEvent e) {
        emitPointer(PointerEventType.MOVE, e.getX(), e.getY(), "");
    }

    @Override
    public void nativeMouseWheelMoved(NativeMouseWheelEvent e) {
        String direction = e.getWheelRotation() < 0 ? "WHEEL_UP" : "WHEEL_DOWN";
        emitPointer(PointerEventType.SCROLL, e.getX(), e.getY(), direction);
    }

    private void emitKey(String text, Set<String> mods) {
        Consumer<NormalizedKeyEvent> l = this.keyListener;
        if (l == null) {
            return;
        }
        try {
            l.accept(new NormalizedKeyEvent(text, mods, System.currentTimeMillis()));
        } catch (RuntimeException ex) {
            LOG.warn("Key listener error: {}", ex.toString());
        }
    }

    private void emitPointer(PointerEventType type, int x, int y, String button) {
        Consumer<NormalizedPointerEvent> l = this.pointerListener;
        if (l == null) {
            return;
        }
        try {
            l.accept(new NormalizedPointerEvent(type, x, y, button, System.currentTimeMillis()));
        } catch (RuntimeException ex) {
            LOG.warn("Pointer listener error for {}: {}", type, ex.toString());
        }
    }

    private static Set<String> extractModifiers(NativeInputEvent e) {
        int m = e.getModifiers();
        Set<String> mods = new HashSet<>();
        if ((m & NativeInputEvent.SHIFT_MASK) != 0) {
            mods.add("SHIFT");
        }
        if ((m & NativeInputEvent.CTRL_MASK) != 0) {
            mods.add("CONTROL");
        }
        if ((m & NativeInputEvent.ALT_MASK) != 0) {
            mods.add("ALT");
        }
        if ((m & NativeInputEvent.META_MASK) != 0) {
            mods.add("META");
        }
        return mods;
    }
}
