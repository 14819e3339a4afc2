package in.mockbroker.domain.order;

/**
 * Thrown by {@code submit} for a malformed order. This is a caller bug, not a business reject:
 * no report is emitted and the order id is not recorded.
 */
public class InvalidOrderException extends IllegalArgumentException {

    private final String clientOrderId;

    public InvalidOrderException(String clientOrderId, String message) {
        super(String.format("Invalid order %s: %s", clientOrderId, message));
        this.clientOrderId = clientOrderId;
    }

    public String getClientOrderId() {
        return clientOrderId;
    }
}
