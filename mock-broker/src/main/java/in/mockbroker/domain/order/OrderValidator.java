package in.mockbroker.domain.order;

/**
 * Structural checks every gateway applies before accepting an order.
 *
 * Rules:
 * - clientOrderId and symbol: non-blank
 * - side: present
 * - quantity: present and strictly positive
 * - limit price: absent, or strictly positive
 */
public final class OrderValidator {

    private OrderValidator() {}

    /**
     * @throws InvalidOrderException on the first violated rule
     */
    public static void validate(Order order) {
        if (order == null) {
            throw new InvalidOrderException(null, "order cannot be null");
        }
        String id = order.clientOrderId();
        if (id == null || id.isBlank()) {
            throw new InvalidOrderException(id, "clientOrderId cannot be null or empty");
        }
        if (order.symbol() == null || order.symbol().isBlank()) {
            throw new InvalidOrderException(id, "symbol cannot be null or empty");
        }
        if (order.side() == null) {
            throw new InvalidOrderException(id, "side cannot be null");
        }
        if (order.quantity() == null || order.quantity().signum() <= 0) {
            throw new InvalidOrderException(id, "quantity must be positive");
        }
        if (order.limitPrice() != null && order.limitPrice().signum() <= 0) {
            throw new InvalidOrderException(id, "limit price must be positive");
        }
    }
}
