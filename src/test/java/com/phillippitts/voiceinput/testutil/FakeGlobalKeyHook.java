package com.phillippitts.voiceinput.testutil;

import com.phillippitts.voiceinput.service.hotkey.GlobalKeyHook;
import com.phillippitts.voiceinput.service.hotkey.NormalizedKeyEvent;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/** Global hook without a native library; tests push key edges through {@link #emit}. */
public class FakeGlobalKeyHook implements GlobalKeyHook {

    private final List<Consumer<NormalizedKeyEvent>> listeners = new CopyOnWriteArrayList<>();
    private volatile boolean registered;

    @Override
    public void register() {
        registered = true;
    }

    @Override
    public void unregister() {
        registered = false;
    }

    @Override
    public void addListener(Consumer<NormalizedKeyEvent> listener) {
        listeners.add(listener);
    }

    public boolean isRegistered() {
        return registered;
    }

    public void emit(NormalizedKeyEvent event) {
        listeners.forEach(l -> l.accept(event));
    }
}
