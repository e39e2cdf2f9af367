package com.phillippitts.voiceinput.service.hotkey;

import com.phillippitts.voiceinput.config.hotkey.HotkeyProperties;
import com.phillippitts.voiceinput.domain.event.AppEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.time.Duration;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.function.Consumer;

/**
 * Registers the global key hook and turns raw key edges into semantic events.
 *
 * <p>The hook callback only enqueues. A dedicated {@code event-router} thread owns the
 * {@link GestureTracker} and emits {@code LanguageDetected} followed by
 * {@code StartRecording} when a gesture begins, {@code StopRecording} when it ends and
 * {@code ToggleTranslate} for the translate chord. Events go to {@code sink}, normally
 * the state machine's submit.
 *
 * <p>Tests inject a fake {@link GlobalKeyHook} and push {@link NormalizedKeyEvent}s
 * through the registered listener.
 */
public class HotkeyEventRouter {

    private static final Logger LOG = LogManager.getLogger(HotkeyEventRouter.class);

    public static final String COMPONENT = "event-router";

    private final GlobalKeyHook hook;
    private final HotkeyProperties props;
    private final LanguageDetector languageDetector;
    private final Consumer<AppEvent> sink;
    private final GestureTracker tracker;
    private final BlockingQueue<NormalizedKeyEvent> inbound = new LinkedBlockingQueue<>();

    private volatile Thread thread;
    private volatile boolean hookRegistered;

    public HotkeyEventRouter(GlobalKeyHook hook,
                             HotkeyProperties props,
                             LanguageDetector languageDetector,
                             Consumer<AppEvent> sink) {
        this.hook = Objects.requireNonNull(hook, "hook");
        this.props = Objects.requireNonNull(props, "props");
        this.languageDetector = Objects.requireNonNull(languageDetector, "languageDetector");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.tracker = new GestureTracker(props.getModifier(), props.getTrigger(), props.getTranslateModifier());
    }

    /**
     * Starts the router thread and registers the hook. A refused hook is logged and the
     * application keeps running without a keyboard gesture.
     */
    public synchronized void start() {
        if (thread != null) {
            return;
        }
        Thread t = new Thread(this::runLoop, COMPONENT);
        t.setDaemon(true);
        thread = t;
        t.start();
        hook.addListener(inbound::offer);
        try {
            hook.register();
            hookRegistered = true;
            LOG.info("Hotkey router started with gesture {}", tracker.describe());
            detectReservedConflict();
        } catch (SecurityException se) {
            LOG.warn("Global key hook permission denied: {}", se.getMessage());
        }
    }

    public synchronized void stop(Duration timeout) {
        if (hookRegistered) {
            hook.unregister();
            hookRegistered = false;
        }
        Thread t = thread;
        if (t == null) {
            return;
        }
        t.interrupt();
        try {
            t.join(timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (t.isAlive()) {
            LOG.warn("Router thread did not stop within {}ms", timeout.toMillis());
        }
    }

    public boolean isRunning() {
        Thread t = thread;
        return t != null && t.isAlive();
    }

    public boolean isHookRegistered() {
        return hookRegistered;
    }

    private void runLoop() {
        ThreadContext.put("component", COMPONENT);
        try {
            while (!Thread.currentThread().isInterrupted()) {
                route(inbound.take());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (Throwable t) {
            LOG.error("Router failed", t);
            sink.accept(new AppEvent.WorkerFailed(COMPONENT, t.getClass().getSimpleName() + ": " + t.getMessage()));
        } finally {
            LOG.info("Router stopped");
            ThreadContext.clearAll();
        }
    }

    // Package-private for tests: same thread confinement as runLoop
    void route(NormalizedKeyEvent event) {
        switch (tracker.onEvent(event)) {
            case BEGIN -> {
                sink.accept(new AppEvent.LanguageDetected(languageDetector.detect()));
                sink.accept(new AppEvent.StartRecording());
                LOG.debug("Gesture began");
            }
            case END -> {
                sink.accept(new AppEvent.StopRecording());
                LOG.debug("Gesture ended");
            }
            case TOGGLE_TRANSLATE -> sink.accept(new AppEvent.ToggleTranslate());
            case NONE -> { }
        }
    }

    private void detectReservedConflict() {
        Set<String> mods = Set.of(KeyNameMapper.normalizeModifier(props.getModifier()));
        for (String shortcut : props.getReserved()) {
            if (KeyNameMapper.matchesReserved(mods, props.getTrigger(), shortcut)) {
                LOG.warn("Configured hotkey {} conflicts with reserved shortcut '{}'", tracker.describe(), shortcut);
                break;
            }
        }
    }
}
