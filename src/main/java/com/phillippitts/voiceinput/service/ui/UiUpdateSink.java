package com.phillippitts.voiceinput.service.ui;

import com.phillippitts.voiceinput.domain.AppState;
import com.phillippitts.voiceinput.domain.ui.UiUpdate;
import com.phillippitts.voiceinput.service.channel.UiUpdateChannel;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.time.Duration;
import java.util.Objects;

/**
 * Drains the UI channel on its own {@code ui-sink} thread and hands every update to the
 * {@link PresentationSink}. A non-blank {@link UiUpdate.TranscriptionResult} is also inserted
 * as text. A failing render is logged and the sink carries on; it exits after rendering
 * {@code StateChanged(Shutdown)}.
 */
public class UiUpdateSink {

    private static final Logger LOG = LogManager.getLogger(UiUpdateSink.class);

    public static final String COMPONENT = "ui-sink";

    private final UiUpdateChannel updates;
    private final PresentationSink presentation;

    private volatile Thread thread;

    public UiUpdateSink(UiUpdateChannel updates, PresentationSink presentation) {
        this.updates = Objects.requireNonNull(updates, "updates");
        this.presentation = Objects.requireNonNull(presentation, "presentation");
    }

    public synchronized void start() {
        if (thread != null) {
            return;
        }
        Thread t = new Thread(this::runLoop, COMPONENT);
        t.setDaemon(true);
        thread = t;
        t.start();
    }

    public boolean awaitTermination(Duration timeout) {
        Thread t = thread;
        if (t == null) {
            return true;
        }
        try {
            t.join(timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return !t.isAlive();
    }

    public boolean isRunning() {
        Thread t = thread;
        return t != null && t.isAlive();
    }

    private void runLoop() {
        ThreadContext.put("component", COMPONENT);
        try {
            while (true) {
                UiUpdate update = updates.take();
                deliver(update);
                if (update instanceof UiUpdate.StateChanged changed && changed.state().is(AppState.Kind.SHUTDOWN)) {
                    LOG.info("Shutdown rendered; UI sink exiting");
                    return;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.info("UI sink interrupted; exiting");
        } finally {
            ThreadContext.clearAll();
        }
    }

    // Package-private for tests
    void deliver(UiUpdate update) {
        try {
            presentation.render(update);
            if (update instanceof UiUpdate.TranscriptionResult result && !result.text().isBlank()) {
                presentation.insertText(result.text());
            }
        } catch (RuntimeException e) {
            LOG.error("Presentation failed for {}", update.getClass().getSimpleName(), e);
        }
    }
}
