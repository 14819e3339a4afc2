package in.mockbroker.application.port.output;

import in.mockbroker.domain.order.Order;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Boundary to a real execution venue.
 *
 * Implementations own the venue protocol (REST, WebSocket, FIX) and translate venue order
 * events into {@link VenueOrderUpdate}s. The live gateway turns those into execution reports
 * with the same shape and terminal guarantees as the simulator.
 */
public interface VenueOrderClient {

    /**
     * Place an order at the venue.
     *
     * @return future with the venue's order id; completes exceptionally if the venue refuses the order
     */
    CompletableFuture<String> placeOrder(Order order);

    /**
     * Ask the venue to cancel an order. The terminal outcome still comes through the update stream.
     */
    CompletableFuture<Void> cancelOrder(String venueOrderId);

    /**
     * Register the consumer for venue order updates.
     */
    void onOrderUpdate(Consumer<VenueOrderUpdate> listener);

    /**
     * Venue-side order state.
     */
    enum VenueOrderState {
        OPEN,
        PARTIALLY_FILLED,
        FILLED,
        CANCELLED,
        REJECTED
    }

    /**
     * Order event pushed by the venue. Quantities and prices are cumulative for the order.
     */
    record VenueOrderUpdate(
        String venueOrderId,
        String clientOrderId,
        VenueOrderState state,
        BigDecimal cumulativeQty,
        BigDecimal averagePrice,
        String message,
        Instant timestamp
    ) {}
}
