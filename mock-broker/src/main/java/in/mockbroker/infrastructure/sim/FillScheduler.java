package in.mockbroker.infrastructure.sim;

import in.mockbroker.application.port.output.PriceOracle;
import in.mockbroker.config.SimulatorConfig;
import in.mockbroker.domain.order.Order;
import in.mockbroker.domain.order.RejectReason;
import in.mockbroker.infrastructure.scheduling.EventScheduler;
import in.mockbroker.infrastructure.scheduling.ScheduledEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Random;

/**
 * Schedules the execution slices of an accepted order.
 *
 * Each slice gets its own delay, venueLatency + uniform(-jitter, +jitter) floored at zero,
 * so slices can fire out of planning order. When a slice fires it:
 * 1. Skips if the order was cancelled, is no longer live, or has nothing left
 * 2. Reads the price oracle; no price rejects the order
 * 3. Prices the slice (slippage, fee, limit); an unfillable limit rejects the order
 * 4. Executes min(remaining, sliceQty) and hands the result to the outcome listener
 *
 * All slice callbacks run under the gateway lock.
 */
final class FillScheduler {
    private static final Logger log = LoggerFactory.getLogger(FillScheduler.class);

    private final SimulatorConfig config;
    private final EventScheduler scheduler;
    private final Random random;
    private final PriceOracle priceOracle;
    private final InflightRegistry registry;
    private final Object lock;
    private final SliceOutcomeListener outcomes;
    private final SlicePlanner planner;
    private final ExecutionPricing pricing;

    FillScheduler(SimulatorConfig config, EventScheduler scheduler, Random random,
                  PriceOracle priceOracle, InflightRegistry registry, Object lock,
                  SliceOutcomeListener outcomes) {
        this.config = config;
        this.scheduler = scheduler;
        this.random = random;
        this.priceOracle = priceOracle;
        this.registry = registry;
        this.lock = lock;
        this.outcomes = outcomes;
        this.planner = new SlicePlanner(config, random);
        this.pricing = new ExecutionPricing(config.slippageBps(), config.feeBps());
    }

    /**
     * Plan the order's remaining quantity into slices and schedule one event per slice.
     * Caller holds the gateway lock.
     *
     * @return planned slice quantities, in planning order
     */
    List<BigDecimal> schedule(LiveOrderState state) {
        List<BigDecimal> slices = planner.plan(state.remaining());
        for (int i = 0; i < slices.size(); i++) {
            BigDecimal sliceQty = slices.get(i);
            int sliceNo = i + 1;
            Duration delay = nextDelay();
            ScheduledEvent event = scheduler.schedule(() -> fire(state, sliceQty, sliceNo), delay);
            state.addPendingEvent(event);
            log.debug("[MockBroker:{}] Slice {}/{} qty={} in {}ms",
                state.clientOrderId(), sliceNo, slices.size(), sliceQty.toPlainString(), delay.toMillis());
        }
        return slices;
    }

    Duration nextDelay() {
        long jitter = config.latencyJitterMs();
        double offset = jitter == 0 ? 0.0 : (random.nextDouble() * 2.0 - 1.0) * jitter;
        long delayMillis = Math.max(0L, Math.round(config.venueLatencyMs() + offset));
        return Duration.ofMillis(delayMillis);
    }

    private void fire(LiveOrderState state, BigDecimal sliceQty, int sliceNo) {
        synchronized (lock) {
            String id = state.clientOrderId();
            if (state.isCancelled()) {
                log.debug("[MockBroker:{}] Slice {} skipped, cancel pending", id, sliceNo);
                return;
            }
            if (!registry.isLive(state) || state.isFullyFilled()) {
                log.debug("[MockBroker:{}] Slice {} skipped, order no longer live", id, sliceNo);
                return;
            }

            Order order = state.order();
            BigDecimal marketPrice = readPrice(order);
            if (marketPrice == null || marketPrice.signum() <= 0) {
                outcomes.onReject(state, RejectReason.NO_PRICE);
                return;
            }

            ExecutionPricing.PriceDecision decision =
                pricing.price(order.side(), marketPrice, order.limitPrice());
            if (!decision.fillable()) {
                log.debug("[MockBroker:{}] {} limit {} unfillable at market {}",
                    id, order.side(), order.limitPrice(), marketPrice);
                outcomes.onReject(state, RejectReason.LIMIT_UNFILLABLE);
                return;
            }

            BigDecimal executed = state.applyFill(sliceQty, decision.price());
            outcomes.onFill(state, executed, decision.price());
        }
    }

    private BigDecimal readPrice(Order order) {
        try {
            return priceOracle.lastPrice(order.symbol());
        } catch (RuntimeException e) {
            log.error("[MockBroker:{}] Price oracle failed for {}", order.clientOrderId(), order.symbol(), e);
            return null;
        }
    }

    /**
     * Receives slice results. Called under the gateway lock.
     */
    interface SliceOutcomeListener {

        void onFill(LiveOrderState state, BigDecimal executedQty, BigDecimal price);

        void onReject(LiveOrderState state, RejectReason reason);
    }
}
