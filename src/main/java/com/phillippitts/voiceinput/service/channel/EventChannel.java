package com.phillippitts.voiceinput.service.channel;

import com.phillippitts.voiceinput.domain.event.AppEvent;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.PriorityBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Unbounded, multi-producer single-consumer channel into the state machine.
 *
 * <p>Events leave in arrival order, except that system events ({@link AppEvent#isSystem()})
 * overtake every queued non-system event. Sending never blocks and never drops.
 */
public final class EventChannel {

    private final PriorityBlockingQueue<Envelope> queue = new PriorityBlockingQueue<>();
    private final AtomicLong sequence = new AtomicLong();

    public void send(AppEvent event) {
        Objects.requireNonNull(event, "event");
        queue.put(new Envelope(event, event.isSystem() ? 0 : 1, sequence.getAndIncrement()));
    }

    /** Blocks until an event is available. */
    public AppEvent take() throws InterruptedException {
        return queue.take().event();
    }

    /** @return the next event, or null once the timeout elapses */
    public AppEvent poll(long timeout, TimeUnit unit) throws InterruptedException {
        Envelope e = queue.poll(timeout, unit);
        return e == null ? null : e.event();
    }

    public AppEvent poll() {
        Envelope e = queue.poll();
        return e == null ? null : e.event();
    }

    /** Removes and returns everything queued, in delivery order. */
    public List<AppEvent> drain() {
        List<Envelope> envelopes = new ArrayList<>();
        queue.drainTo(envelopes);
        envelopes.sort(null);
        return envelopes.stream().map(Envelope::event).toList();
    }

    public int size() {
        return queue.size();
    }

    private record Envelope(AppEvent event, int priority, long seq) implements Comparable<Envelope> {
        @Override
        public int compareTo(Envelope o) {
            int c = Integer.compare(priority, o.priority);
            return c != 0 ? c : Long.compare(seq, o.seq);
        }
    }
}
