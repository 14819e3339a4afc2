package in.mockbroker.infrastructure.scheduling;

/**
 * Handle to a delayed event.
 */
public interface ScheduledEvent {

    /**
     * Prevent the event from running if it has not started yet. Idempotent.
     */
    void cancel();

    boolean isCancelled();
}
