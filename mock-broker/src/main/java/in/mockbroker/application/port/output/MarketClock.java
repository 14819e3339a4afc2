package in.mockbroker.application.port.output;

import java.time.Instant;

/**
 * Market-hours calendar.
 */
@FunctionalInterface
public interface MarketClock {

    boolean isOpen(Instant timestamp);
}
