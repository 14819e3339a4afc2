package in.mockbroker.infrastructure.scheduling;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.PriorityQueue;

/**
 * Deterministic scheduler driven by a virtual clock.
 *
 * Nothing runs until the caller moves time forward. Events run in due-time order,
 * ties broken by scheduling order. Events scheduled while advancing run in the same
 * advance if they fall due before the target time.
 *
 * Usage:
 * <pre>
 * VirtualEventScheduler scheduler = new VirtualEventScheduler(Instant.parse("2024-01-02T04:00:00Z"));
 * gateway.submit(order);
 * scheduler.advanceBy(Duration.ofMillis(100));   // fire what is due within 100ms
 * scheduler.runAll();                            // drain everything
 * </pre>
 */
public class VirtualEventScheduler implements EventScheduler {

    private static final Logger log = LoggerFactory.getLogger(VirtualEventScheduler.class);

    private static final int MAX_EVENTS_PER_DRAIN = 1_000_000;

    private final PriorityQueue<VirtualEvent> queue = new PriorityQueue<>();
    private Instant now;
    private long sequence = 0;

    public VirtualEventScheduler() {
        this(Instant.EPOCH);
    }

    public VirtualEventScheduler(Instant start) {
        this.now = start;
    }

    @Override
    public synchronized ScheduledEvent schedule(Runnable task, Duration delay) {
        Duration effective = delay.isNegative() ? Duration.ZERO : delay;
        VirtualEvent event = new VirtualEvent(now.plus(effective), sequence++, task);
        queue.add(event);
        return event;
    }

    @Override
    public synchronized Instant now() {
        return now;
    }

    /**
     * Move the clock forward, running every event that falls due on the way.
     */
    public void advanceBy(Duration duration) {
        if (duration.isNegative()) {
            throw new IllegalArgumentException("Cannot move virtual time backwards");
        }
        advanceTo(now().plus(duration));
    }

    /**
     * Move the clock to the target time, running every event due at or before it.
     */
    public void advanceTo(Instant target) {
        synchronized (this) {
            if (target.isBefore(now)) {
                throw new IllegalArgumentException("Cannot move virtual time backwards");
            }
        }
        int executed = 0;
        VirtualEvent next;
        while ((next = pollDue(target)) != null) {
            runEvent(next);
            if (++executed > MAX_EVENTS_PER_DRAIN) {
                throw new IllegalStateException("Event storm: more than " + MAX_EVENTS_PER_DRAIN + " events");
            }
        }
        synchronized (this) {
            now = target;
        }
    }

    /**
     * Run events until none are pending, moving the clock to each one's due time.
     *
     * @return number of events executed
     */
    public int runAll() {
        int executed = 0;
        VirtualEvent next;
        while ((next = pollDue(null)) != null) {
            runEvent(next);
            if (++executed > MAX_EVENTS_PER_DRAIN) {
                throw new IllegalStateException("Event storm: more than " + MAX_EVENTS_PER_DRAIN + " events");
            }
        }
        return executed;
    }

    /**
     * Number of events scheduled and not yet run or cancelled.
     */
    public synchronized int pendingCount() {
        return (int) queue.stream().filter(e -> !e.cancelled).count();
    }

    private synchronized VirtualEvent pollDue(Instant target) {
        while (!queue.isEmpty()) {
            VirtualEvent head = queue.peek();
            if (head.cancelled) {
                queue.poll();
                continue;
            }
            if (target != null && head.dueAt.isAfter(target)) {
                return null;
            }
            queue.poll();
            if (head.dueAt.isAfter(now)) {
                now = head.dueAt;
            }
            return head;
        }
        return null;
    }

    private void runEvent(VirtualEvent event) {
        try {
            event.task.run();
        } catch (Exception e) {
            log.error("[VirtualEventScheduler] Event due at {} threw exception", event.dueAt, e);
        }
    }

    private static final class VirtualEvent implements ScheduledEvent, Comparable<VirtualEvent> {
        private final Instant dueAt;
        private final long sequence;
        private final Runnable task;
        private volatile boolean cancelled;

        private VirtualEvent(Instant dueAt, long sequence, Runnable task) {
            this.dueAt = dueAt;
            this.sequence = sequence;
            this.task = task;
        }

        @Override
        public void cancel() {
            cancelled = true;
        }

        @Override
        public boolean isCancelled() {
            return cancelled;
        }

        @Override
        public int compareTo(VirtualEvent other) {
            int byTime = dueAt.compareTo(other.dueAt);
            return byTime != 0 ? byTime : Long.compare(sequence, other.sequence);
        }
    }
}
