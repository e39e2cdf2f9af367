package com.phillippitts.voiceinput.service.hotkey.impl;

import com.github.kwhat.jnativehook.GlobalScreen;
import com.github.kwhat.jnativehook.NativeHookException;
import com.github.kwhat.jnativehook.NativeInputEvent;
import com.github.kwhat.jnativehook.keyboard.NativeKeyEvent;
import com.github.kwhat.jnativehook.keyboard.NativeKeyListener;
import com.github.kwhat.jnativehook.mouse.NativeMouseEvent;
import com.github.kwhat.jnativehook.mouse.NativeMouseMotionListener;
import com.phillippitts.voiceinput.service.hotkey.GlobalKeyHook;
import com.phillippitts.voiceinput.service.hotkey.KeyNameMapper;
import com.phillippitts.voiceinput.service.hotkey.NormalizedKeyEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Production {@link GlobalKeyHook} backed by JNativeHook.
 *
 * <p>Some platforms (macOS) never report standalone modifier presses as key events. Modifier
 * edges are therefore also derived from the modifier mask carried by every key and mouse
 * motion event, so the router sees CONTROL go down even when the OS stays silent about it.
 */
public class JNativeHookGlobalKeyHook implements GlobalKeyHook, NativeKeyListener, NativeMouseMotionListener {

    private static final Logger LOG = LogManager.getLogger(JNativeHookGlobalKeyHook.class);

    private static final int RAW_RIGHT_META = 0x36;
    private static final int RAW_LEFT_META = 0x37;

    private static final Map<String, Integer> SIDED_MASKS = Map.of(
            "LEFT_SHIFT", NativeInputEvent.SHIFT_L_MASK,
            "RIGHT_SHIFT", NativeInputEvent.SHIFT_R_MASK,
            "LEFT_CONTROL", NativeInputEvent.CTRL_L_MASK,
            "RIGHT_CONTROL", NativeInputEvent.CTRL_R_MASK,
            "LEFT_ALT", NativeInputEvent.ALT_L_MASK,
            "RIGHT_ALT", NativeInputEvent.ALT_R_MASK,
            "LEFT_META", NativeInputEvent.META_L_MASK,
            "RIGHT_META", NativeInputEvent.META_R_MASK);

    private volatile Consumer<NormalizedKeyEvent> listener;
    private final AtomicBoolean registered = new AtomicBoolean(false);

    // Written only from the JNativeHook dispatch thread
    private final Map<String, Boolean> modifierStates = new ConcurrentHashMap<>();

    @Override
    public void register() {
        if (registered.get()) {
            return;
        }
        try {
            GlobalScreen.registerNativeHook();
            GlobalScreen.addNativeKeyListener(this);
            GlobalScreen.addNativeMouseMotionListener(this);
            registered.set(true);
            LOG.info("Registered JNativeHook global key listener");
        } catch (NativeHookException | UnsatisfiedLinkError e) {
            throw new SecurityException("Failed to register global key hook: " + e.getMessage(), e);
        }
    }

    @Override
    public void unregister() {
        if (!registered.getAndSet(false)) {
            return;
        }
        GlobalScreen.removeNativeKeyListener(this);
        GlobalScreen.removeNativeMouseMotionListener(this);
        try {
            GlobalScreen.unregisterNativeHook();
            LOG.info("Unregistered JNativeHook global key listener");
        } catch (NativeHookException e) {
            LOG.warn("Failed to unregister native hook: {}", e.getMessage());
        }
    }

    @Override
    public void addListener(Consumer<NormalizedKeyEvent> listener) {
        this.listener = listener;
    }

    @Override
    public void nativeKeyPressed(NativeKeyEvent nativeEvent) {
        trackModifiers(nativeEvent);
        emit(nativeEvent, NormalizedKeyEvent.Type.PRESSED);
    }

    @Override
    public void nativeKeyReleased(NativeKeyEvent nativeEvent) {
        trackModifiers(nativeEvent);
        emit(nativeEvent, NormalizedKeyEvent.Type.RELEASED);
    }

    @Override
    public void nativeKeyTyped(NativeKeyEvent nativeEvent) {
        // typed characters are irrelevant to gestures
    }

    @Override
    public void nativeMouseMoved(NativeMouseEvent e) {
        trackModifiers(e);
    }

    @Override
    public void nativeMouseDragged(NativeMouseEvent e) {
        trackModifiers(e);
    }

    private void emit(NativeKeyEvent ne, NormalizedKeyEvent.Type type) {
        String key = KeyNameMapper.normalizeKey(NativeKeyEvent.getKeyText(ne.getKeyCode()));
        // JNativeHook reports "Meta" for both Command keys; the raw code tells them apart
        if ("META".equals(key)) {
            if (ne.getRawCode() == RAW_RIGHT_META) {
                key = "RIGHT_META";
            } else if (ne.getRawCode() == RAW_LEFT_META) {
                key = "LEFT_META";
            }
        }
        deliver(new NormalizedKeyEvent(type, key, extractModifiers(ne), System.currentTimeMillis()));
    }

    private void trackModifiers(NativeInputEvent source) {
        if (listener == null) {
            return;
        }
        int mask = source.getModifiers();
        for (Map.Entry<String, Integer> entry : SIDED_MASKS.entrySet()) {
            String name = entry.getKey();
            boolean down = (mask & entry.getValue()) != 0;
            Boolean previous = modifierStates.put(name, down);
            boolean changed = previous == null ? down : previous != down;
            if (changed) {
                NormalizedKeyEvent.Type type = down ? NormalizedKeyEvent.Type.PRESSED : NormalizedKeyEvent.Type.RELEASED;
                deliver(new NormalizedKeyEvent(type, name, extractModifiers(source), System.currentTimeMillis()));
            }
        }
    }

    private void deliver(NormalizedKeyEvent event) {
        Consumer<NormalizedKeyEvent> l = this.listener;
        if (l == null) {
            return;
        }
        try {
            l.accept(event);
        } catch (RuntimeException ex) {
            LOG.warn("Listener error for {}: {}", event, ex.toString());
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
