package in.mockbroker.domain.order;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Order submitted by a strategy. Immutable.
 *
 * Field-level checks (blank id, non-positive quantity) are done by the gateway at submit time
 * so that a malformed order fails with {@link InvalidOrderException} at the point of use.
 *
 * @param clientOrderId caller-assigned unique id, the idempotency key
 * @param symbol        instrument symbol
 * @param side          BUY or SELL
 * @param quantity      quantity to execute (must be > 0)
 * @param limitPrice    limit price, or null for a market order
 * @param timestamp     submission time
 */
public record Order(
    String clientOrderId,
    String symbol,
    Side side,
    BigDecimal quantity,
    BigDecimal limitPrice,
    Instant timestamp
) {

    public static Order market(String clientOrderId, String symbol, Side side, BigDecimal quantity) {
        return new Order(clientOrderId, symbol, side, quantity, null, Instant.now());
    }

    public static Order limit(String clientOrderId, String symbol, Side side,
                              BigDecimal quantity, BigDecimal limitPrice) {
        return new Order(clientOrderId, symbol, side, quantity, limitPrice, Instant.now());
    }

    public boolean hasLimit() {
        return limitPrice != null;
    }
}
