package in.mockbroker.application.port.input;

import in.mockbroker.domain.order.Order;

/**
 * Entry point strategies use to trade.
 *
 * CONTRACT (every implementation, simulated or venue-backed):
 * - submit() and cancel() never block; outcomes arrive later as execution reports
 * - submit() with an already-seen clientOrderId is silently dropped
 * - a malformed order fails fast with InvalidOrderException, no report
 * - business failures (closed market, risk reject, unfillable limit, no price) are REJECTED reports
 * - exactly one terminal report (FILLED, REJECTED or CANCELLED) per clientOrderId, nothing after it
 * - reports of one order may arrive out of slice order; consumers rebuild state from
 *   cumulative fields (sum of filledQty, avgPx), never from arrival order
 */
public interface ExecutionGateway extends AutoCloseable {

    /**
     * Submit an order for execution.
     *
     * @param order order to execute
     * @throws in.mockbroker.domain.order.InvalidOrderException if the order is malformed
     */
    void submit(Order order);

    /**
     * Request cancellation of a live order. Unknown or finished ids are ignored.
     * Cancellation is best-effort: fills that already happened are not retracted.
     *
     * @param clientOrderId id used at submission
     */
    void cancel(String clientOrderId);

    /**
     * Release threads owned by the gateway. No-op unless the gateway owns resources.
     */
    @Override
    default void close() {
    }
}
