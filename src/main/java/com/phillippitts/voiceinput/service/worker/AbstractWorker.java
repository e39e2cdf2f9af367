package com.phillippitts.voiceinput.service.worker;

import com.phillippitts.voiceinput.domain.event.AppEvent;
import com.phillippitts.voiceinput.service.channel.CommandChannel;
import com.phillippitts.voiceinput.service.channel.EventChannel;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.time.Duration;
import java.util.Objects;

/**
 * Template for a single-threaded worker that consumes its own command channel and reports
 * back to the state machine through the event channel.
 *
 * <p>Each worker owns exactly one dedicated daemon thread named after its component. The
 * thread tags its log lines with {@code component} in the Log4j {@link ThreadContext}.
 * Subclasses convert every expected failure of a command into a typed event themselves;
 * anything that still escapes {@link #handle} ends the thread and is reported as
 * {@link AppEvent.WorkerFailed}.
 *
 * <p>Template methods:
 * <ul>
 *   <li>{@link #handle(Object)} - process one command; return false to exit the loop</li>
 *   <li>{@link #nextCommand()} - override to serve internally queued commands first</li>
 *   <li>{@link #onExit()} - release resources on the worker thread before it ends</li>
 * </ul>
 *
 * @param <C> command type
 */
public abstract class AbstractWorker<C> {

    private static final Logger LOG = LogManager.getLogger(AbstractWorker.class);

    private final String component;
    private final CommandChannel<C> commands;
    private final EventChannel events;

    private volatile Thread thread;

    protected AbstractWorker(String component, CommandChannel<C> commands, EventChannel events) {
        this.component = Objects.requireNonNull(component, "component");
        this.commands = Objects.requireNonNull(commands, "commands");
        this.events = Objects.requireNonNull(events, "events");
    }

    /** Starts the worker thread. Idempotent. */
    public final synchronized void start() {
        if (thread != null) {
            return;
        }
        Thread t = new Thread(this::runLoop, component);
        t.setDaemon(true);
        thread = t;
        t.start();
    }

    /** @return true if the thread ended within {@code timeout} (or never started) */
    public final boolean awaitTermination(Duration timeout) {
        Thread t = thread;
        if (t == null) {
            return true;
        }
        try {
            t.join(timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (t.isAlive()) {
            LOG.warn("Worker '{}' did not terminate within {}ms", component, timeout.toMillis());
            return false;
        }
        return true;
    }

    public final boolean isAlive() {
        Thread t = thread;
        return t != null && t.isAlive();
    }

    public final String component() {
        return component;
    }

    protected final CommandChannel<C> commands() {
        return commands;
    }

    protected final void emit(AppEvent event) {
        events.send(event);
    }

    protected C nextCommand() throws InterruptedException {
        return commands.take();
    }

    /**
     * @return false when the worker should exit (shutdown)
     */
    protected abstract boolean handle(C command) throws Exception;

    protected void onExit() {
    }

    private void runLoop() {
        ThreadContext.put("component", component);
        LOG.info("Worker started");
        try {
            boolean running = true;
            while (running) {
                C command = nextCommand();
                LOG.debug("Handling {}", command);
                running = handle(command);
            }
            LOG.info("Worker stopped");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.info("Worker interrupted; exiting");
        } catch (Throwable t) {
            LOG.error("Worker failed", t);
            events.send(new AppEvent.WorkerFailed(component, t.getClass().getSimpleName() + ": " + t.getMessage()));
        } finally {
            try {
                onExit();
            } catch (Throwable t) {
                LOG.warn("Worker cleanup failed: {}", t.toString());
            }
            ThreadContext.clearAll();
        }
    }
}
