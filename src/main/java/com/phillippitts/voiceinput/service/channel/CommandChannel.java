package com.phillippitts.voiceinput.service.channel;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Bounded single-consumer channel carrying commands to one worker.
 *
 * <p>Commands are consumed in send order. The sender never blocks: on overflow
 * {@link #send} logs and returns false so the caller can turn the refusal into a failure.
 *
 * @param <C> command type of the receiving worker
 */
public final class CommandChannel<C> {

    private static final Logger LOG = LogManager.getLogger(CommandChannel.class);

    private final String name;
    private final BlockingQueue<C> queue;

    public CommandChannel(String name, int capacity) {
        this.name = Objects.requireNonNull(name, "name");
        this.queue = new ArrayBlockingQueue<>(capacity);
    }

    public String name() {
        return name;
    }

    /** @return false if the channel is full and the command was not enqueued */
    public boolean send(C command) {
        Objects.requireNonNull(command, "command");
        boolean accepted = queue.offer(command);
        if (!accepted) {
            LOG.error("Command channel '{}' full (capacity={}); rejected {}", name,
                    queue.size() + queue.remainingCapacity(), command);
        }
        return accepted;
    }

    /**
     * Enqueues a command that must get through, evicting queued commands if needed.
     * Used for shutdown, which supersedes anything still waiting.
     */
    public void sendUrgent(C command) {
        Objects.requireNonNull(command, "command");
        while (!queue.offer(command)) {
            C evicted = queue.poll();
            LOG.warn("Command channel '{}' full; evicted {} for {}", name, evicted, command);
        }
    }

    public C take() throws InterruptedException {
        return queue.take();
    }

    /** Non-blocking; null when empty. */
    public C poll() {
        return queue.poll();
    }

    public C poll(long timeout, TimeUnit unit) throws InterruptedException {
        return queue.poll(timeout, unit);
    }

    public int size() {
        return queue.size();
    }
}
