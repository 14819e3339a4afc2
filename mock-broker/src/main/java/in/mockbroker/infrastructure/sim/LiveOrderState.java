package in.mockbroker.infrastructure.sim;

import in.mockbroker.domain.order.Order;
import in.mockbroker.infrastructure.scheduling.ScheduledEvent;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Mutable state of an accepted, not yet terminal order.
 *
 * Owned by the gateway and only touched while holding the gateway lock.
 * Invariant: remaining + filled == order quantity.
 */
final class LiveOrderState {

    private final Order order;
    private final Instant acceptedAt;
    private final List<ScheduledEvent> pendingEvents = new ArrayList<>();

    private BigDecimal remaining;
    private BigDecimal filled = BigDecimal.ZERO;
    private BigDecimal notional = BigDecimal.ZERO;     // sum(price * qty)
    private boolean cancelled = false;

    LiveOrderState(Order order, Instant acceptedAt) {
        this.order = order;
        this.acceptedAt = acceptedAt;
        this.remaining = order.quantity();
    }

    /**
     * Apply one execution.
     *
     * @return quantity actually executed, min(remaining, requested)
     */
    BigDecimal applyFill(BigDecimal requestedQty, BigDecimal price) {
        BigDecimal executed = requestedQty.min(remaining);
        remaining = remaining.subtract(executed);
        filled = filled.add(executed);
        notional = notional.add(price.multiply(executed));
        return executed;
    }

    /**
     * Volume-weighted average fill price, 0 when nothing has filled.
     */
    BigDecimal avgPx(int scale) {
        if (filled.signum() == 0) {
            return BigDecimal.ZERO;
        }
        return notional.divide(filled, scale, RoundingMode.HALF_EVEN);
    }

    void addPendingEvent(ScheduledEvent event) {
        pendingEvents.add(event);
    }

    /**
     * Cancel every pending slice or cancel event of this order.
     */
    void cancelPendingEvents() {
        for (ScheduledEvent event : pendingEvents) {
            event.cancel();
        }
        pendingEvents.clear();
    }

    void markCancelled() {
        cancelled = true;
    }

    boolean isCancelled() {
        return cancelled;
    }

    boolean isFullyFilled() {
        return remaining.signum() == 0;
    }

    Order order() {
        return order;
    }

    String clientOrderId() {
        return order.clientOrderId();
    }

    Instant acceptedAt() {
        return acceptedAt;
    }

    BigDecimal remaining() {
        return remaining;
    }

    BigDecimal filled() {
        return filled;
    }

    int pendingEventCount() {
        return pendingEvents.size();
    }
}
