package com.phillippitts.voiceinput.service.hotkey;

import java.util.function.Consumer;

/**
 * Raw input source: a global keyboard hook delivering press/release edges.
 *
 * Tests inject a fake implementation so no OS-level hook is needed.
 */
public interface GlobalKeyHook {

    /**
     * Register the global hook. Idempotent.
     *
     * @throws SecurityException when the OS refuses the hook (e.g. missing accessibility permission)
     */
    void register();

    /** Unregister the global hook. Idempotent. */
    void unregister();

    /**
     * Subscribe to normalized key events. Callbacks arrive on the hook's own thread and
     * must return quickly.
     */
    void addListener(Consumer<NormalizedKeyEvent> listener);
}
