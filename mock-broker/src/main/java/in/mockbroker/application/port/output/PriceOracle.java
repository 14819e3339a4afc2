package in.mockbroker.application.port.output;

import java.math.BigDecimal;

/**
 * Last tradable price lookup. Read concurrently by slices of different orders.
 */
@FunctionalInterface
public interface PriceOracle {

    /**
     * @param symbol instrument symbol
     * @return last tradable price (> 0), or null / a non-positive value when no price is available
     */
    BigDecimal lastPrice(String symbol);
}
