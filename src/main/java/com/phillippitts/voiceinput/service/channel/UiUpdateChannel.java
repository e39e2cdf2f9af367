package com.phillippitts.voiceinput.service.channel;

import com.phillippitts.voiceinput.domain.ui.UiUpdate;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Iterator;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Bounded channel from the state machine to the UI sink.
 *
 * <p>Overflow policy: evict the oldest droppable update (progress) to make room. If none is
 * queued, a droppable update is itself dropped; any other update waits up to
 * {@code offerTimeoutMs} for the sink and is dropped with an error log only if the sink is stuck.
 */
public final class UiUpdateChannel {

    private static final Logger LOG = LogManager.getLogger(UiUpdateChannel.class);

    private final BlockingQueue<UiUpdate> queue;
    private final long offerTimeoutMs;
    private final Consumer<UiUpdate> onDrop;

    public UiUpdateChannel(int capacity, long offerTimeoutMs, Consumer<UiUpdate> onDrop) {
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.offerTimeoutMs = offerTimeoutMs;
        this.onDrop = Objects.requireNonNull(onDrop, "onDrop");
    }

    public UiUpdateChannel(int capacity) {
        this(capacity, 0, u -> { });
    }

    /** @return false if {@code update} was dropped */
    public boolean send(UiUpdate update) {
        Objects.requireNonNull(update, "update");
        if (queue.offer(update)) {
            return true;
        }
        UiUpdate evicted = evictOldestDroppable();
        if (evicted != null) {
            LOG.info("UI channel full; dropped {} to make room", evicted);
            onDrop.accept(evicted);
            if (queue.offer(update)) {
                return true;
            }
        }
        if (update.isDroppable()) {
            LOG.info("UI channel full; dropped {}", update);
            onDrop.accept(update);
            return false;
        }
        try {
            if (queue.offer(update, offerTimeoutMs, TimeUnit.MILLISECONDS)) {
                return true;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        LOG.error("UI channel full and sink not draining; dropped {}", update);
        onDrop.accept(update);
        return false;
    }

    private UiUpdate evictOldestDroppable() {
        Iterator<UiUpdate> it = queue.iterator();
        while (it.hasNext()) {
            UiUpdate candidate = it.next();
            if (candidate.isDroppable()) {
                it.remove();
                return candidate;
            }
        }
        return null;
    }

    public UiUpdate take() throws InterruptedException {
        return queue.take();
    }

    public UiUpdate poll(long timeout, TimeUnit unit) throws InterruptedException {
        return queue.poll(timeout, unit);
    }

    public UiUpdate poll() {
        return queue.poll();
    }

    public int size() {
        return queue.size();
    }
}
