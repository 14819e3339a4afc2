package in.mockbroker.infrastructure.scheduling;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Wall-clock scheduler on a single daemon thread.
 *
 * Features:
 * - One thread runs every event, so callbacks never overlap each other
 * - A task that throws is logged; the thread keeps serving other events
 * - Graceful shutdown with a bounded wait
 *
 * Usage:
 * <pre>
 * ExecutorEventScheduler scheduler = new ExecutorEventScheduler("MockBroker");
 * ScheduledEvent event = scheduler.schedule(() -> fireSlice(), Duration.ofMillis(180));
 * event.cancel();       // if no longer needed
 * scheduler.shutdown();
 * </pre>
 */
public class ExecutorEventScheduler implements EventScheduler, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ExecutorEventScheduler.class);

    private final String name;
    private final Clock clock;
    private final ScheduledExecutorService executor;
    private volatile boolean running = true;

    public ExecutorEventScheduler(String name) {
        this(name, Clock.systemUTC());
    }

    public ExecutorEventScheduler(String name, Clock clock) {
        this.name = name;
        this.clock = clock;
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "EventScheduler-" + name);
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public ScheduledEvent schedule(Runnable task, Duration delay) {
        if (!running) {
            throw new IllegalStateException("Scheduler " + name + " is shut down");
        }
        long delayMillis = Math.max(0, delay.toMillis());
        ScheduledFuture<?> future = executor.schedule(() -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("[{}] Scheduled event threw exception", name, e);
            }
        }, delayMillis, TimeUnit.MILLISECONDS);
        return new FutureEvent(future);
    }

    @Override
    public Instant now() {
        return clock.instant();
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Stop accepting events, drop pending ones and wait briefly for a running one to finish.
     */
    public synchronized void shutdown() {
        if (!running) {
            return;
        }
        log.info("[{}] Stopping event scheduler", name);
        running = false;

        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("[{}] Event scheduler did not terminate within 5s", name);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        shutdown();
    }

    private record FutureEvent(ScheduledFuture<?> future) implements ScheduledEvent {
        @Override
        public void cancel() {
            future.cancel(false);
        }

        @Override
        public boolean isCancelled() {
            return future.isCancelled();
        }
    }
}
