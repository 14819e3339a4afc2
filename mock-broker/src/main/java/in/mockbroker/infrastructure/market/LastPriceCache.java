package in.mockbroker.infrastructure.market;

import in.mockbroker.application.port.output.PriceOracle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Price oracle fed by a market data callback.
 *
 * - Only positive prices are stored; "no price" is a symbol that was never priced or was halted
 * - A tick older than the stored one is ignored, so late feed deliveries cannot roll a price back
 * - Safe for concurrent feed writers and slice readers
 */
public final class LastPriceCache implements PriceOracle {
    private static final Logger log = LoggerFactory.getLogger(LastPriceCache.class);

    private final ConcurrentHashMap<String, PricePoint> latest = new ConcurrentHashMap<>();

    /**
     * Record a traded price.
     *
     * @throws IllegalArgumentException for a blank symbol or a null / non-positive price
     */
    public void updatePrice(String symbol, BigDecimal price, Instant timestamp) {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("symbol cannot be blank");
        }
        if (price == null || price.signum() <= 0) {
            throw new IllegalArgumentException("price must be positive for " + symbol + ", use halt() to withdraw it");
        }
        PricePoint tick = new PricePoint(price, Objects.requireNonNull(timestamp, "timestamp"));
        PricePoint stored = latest.merge(symbol, tick, (old, next) -> next.timestamp().isBefore(old.timestamp()) ? old : next);
        if (stored != tick) {
            log.debug("[PriceCache:{}] Out-of-order tick {} @ {} ignored", symbol, price, timestamp);
        }
    }

    /**
     * Withdraw the price of a symbol. Slices firing afterwards find no price.
     */
    public void halt(String symbol) {
        if (symbol != null && latest.remove(symbol) != null) {
            log.info("[PriceCache:{}] Price withdrawn", symbol);
        }
    }

    /**
     * @return last price, or null if the symbol has no price
     */
    @Override
    public BigDecimal lastPrice(String symbol) {
        PricePoint last = symbol == null ? null : latest.get(symbol);
        return last != null ? last.price() : null;
    }

    private record PricePoint(BigDecimal price, Instant timestamp) {}
}
