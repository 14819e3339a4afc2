package in.mockbroker.infrastructure.scheduling;

import java.time.Duration;
import java.time.Instant;

/**
 * Delayed-event scheduler plus the clock the events run against.
 *
 * Business logic schedules through this seam so tests can swap wall-clock timers for
 * {@link VirtualEventScheduler} and replay exact timing.
 */
public interface EventScheduler {

    /**
     * Run the task once after the delay. Negative delays run as soon as possible.
     */
    ScheduledEvent schedule(Runnable task, Duration delay);

    /**
     * Current time on this scheduler's clock.
     */
    Instant now();
}
