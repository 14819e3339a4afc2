package in.mockbroker.infrastructure.sim;

import in.mockbroker.domain.order.Side;

import java.math.BigDecimal;

/**
 * Turns a market price into the price a slice executes at.
 *
 * 1. A limit order whose market price is already through the limit cannot fill.
 * 2. Slippage moves the price against the taker: px = mkt * (1 + sign * slippageBps / 10000).
 * 3. Fee is baked into the price the same way on top of the slipped price.
 * 4. With a limit, the result is capped at the limit (BUY) or floored at it (SELL),
 *    so a reported fill never crosses the limit.
 * 5. Prices never go below {@link #MIN_PRICE}.
 */
final class ExecutionPricing {

    static final BigDecimal MIN_PRICE = new BigDecimal("0.0001");

    private final BigDecimal slippageRate;
    private final BigDecimal feeRate;

    ExecutionPricing(double slippageBps, double feeBps) {
        this.slippageRate = BigDecimal.valueOf(slippageBps).movePointLeft(4);
        this.feeRate = BigDecimal.valueOf(feeBps).movePointLeft(4);
    }

    PriceDecision price(Side side, BigDecimal marketPrice, BigDecimal limitPrice) {
        if (limitPrice != null && isThroughLimit(side, marketPrice, limitPrice)) {
            return PriceDecision.unfillable();
        }
        BigDecimal sign = BigDecimal.valueOf(side.sign());

        BigDecimal slipped = marketPrice.add(marketPrice.multiply(slippageRate).multiply(sign));
        slipped = capAtLimit(side, slipped, limitPrice);

        BigDecimal withFee = slipped.add(slipped.multiply(feeRate).multiply(sign));
        withFee = withFee.max(MIN_PRICE);
        withFee = capAtLimit(side, withFee, limitPrice);

        return PriceDecision.fill(withFee);
    }

    private static boolean isThroughLimit(Side side, BigDecimal marketPrice, BigDecimal limitPrice) {
        return side == Side.BUY
            ? marketPrice.compareTo(limitPrice) > 0
            : marketPrice.compareTo(limitPrice) < 0;
    }

    private static BigDecimal capAtLimit(Side side, BigDecimal price, BigDecimal limitPrice) {
        if (limitPrice == null) {
            return price;
        }
        return side == Side.BUY ? price.min(limitPrice) : price.max(limitPrice);
    }

    record PriceDecision(boolean fillable, BigDecimal price) {
        static PriceDecision fill(BigDecimal price) {
            return new PriceDecision(true, price);
        }

        static PriceDecision unfillable() {
            return new PriceDecision(false, null);
        }
    }
}
