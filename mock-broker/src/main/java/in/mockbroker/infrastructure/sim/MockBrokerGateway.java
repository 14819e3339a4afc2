package in.mockbroker.infrastructure.sim;

import in.mockbroker.application.port.input.ExecutionGateway;
import in.mockbroker.application.port.output.ExecReportListener;
import in.mockbroker.application.port.output.MarketClock;
import in.mockbroker.application.port.output.PriceOracle;
import in.mockbroker.config.SimulatorConfig;
import in.mockbroker.domain.order.ExecReport;
import in.mockbroker.domain.order.ExecStatus;
import in.mockbroker.domain.order.Order;
import in.mockbroker.domain.order.OrderValidator;
import in.mockbroker.domain.order.RejectReason;
import in.mockbroker.infrastructure.metrics.ExecutionMetrics;
import in.mockbroker.infrastructure.metrics.ExecutionMetrics.SubmissionOutcome;
import in.mockbroker.infrastructure.scheduling.EventScheduler;
import in.mockbroker.infrastructure.scheduling.ExecutorEventScheduler;
import in.mockbroker.infrastructure.scheduling.ScheduledEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Simulated broker: accepts orders and produces realistic execution reports asynchronously.
 *
 * Per-order state machine:
 * <pre>
 * NEW ──► REJECTED                              (market closed / random risk reject)
 *  └────► ACCEPTED ──► PARTIAL* ──► FILLED      (remaining reached zero)
 *                              ├──► CANCELLED   (cancel honored after cancel latency)
 *                              └──► REJECTED    (no price / limit unfillable)
 * </pre>
 *
 * Threading:
 * - submit() and cancel() return immediately; only gate rejects are reported on the caller's thread
 * - registry and live-state mutations, including every scheduled callback, run under one lock
 * - reports are emitted under that lock, so one order's reports never interleave
 *
 * Usage:
 * <pre>
 * MockBrokerGateway gateway = MockBrokerGateway.builder()
 *     .priceOracle(priceCache)
 *     .listener(report -> engine.onExec(report))
 *     .config(SimulatorConfig.defaults())
 *     .build();
 *
 * gateway.submit(Order.market("o1", "NIFTY", Side.BUY, new BigDecimal("100")));
 * gateway.cancel("o1");
 * gateway.close();
 * </pre>
 */
public class MockBrokerGateway implements ExecutionGateway {
    private static final Logger log = LoggerFactory.getLogger(MockBrokerGateway.class);

    public static final String GATEWAY_CODE = "MOCK";

    private final SimulatorConfig config;
    private final PriceOracle priceOracle;
    private final ExecReportListener listener;
    private final MarketClock marketClock;
    private final EventScheduler scheduler;
    private final Random random;
    private final ExecutionMetrics metrics;
    private final ExecutorEventScheduler ownedScheduler;

    private volatile boolean closed = false;

    private final Object lock = new Object();
    private final InflightRegistry registry = new InflightRegistry();
    private final FillScheduler fillScheduler;

    private MockBrokerGateway(Builder builder, EventScheduler scheduler, ExecutorEventScheduler ownedScheduler) {
        this.config = builder.config;
        this.priceOracle = builder.priceOracle;
        this.listener = builder.listener;
        this.marketClock = builder.marketClock;
        this.scheduler = scheduler;
        this.random = builder.random;
        this.metrics = builder.metrics;
        this.ownedScheduler = ownedScheduler;
        this.fillScheduler = new FillScheduler(config, scheduler, random, priceOracle,
            registry, lock, new SliceOutcomes());

        if (config.respectMarketHours() && marketClock == null) {
            log.warn("[MockBroker] respectMarketHours is set but no MarketClock was given, gate disabled");
        }
        log.info("[MockBroker] Initialized: {}", config);
    }

    @Override
    public void submit(Order order) {
        OrderValidator.validate(order);
        if (closed) {
            throw new IllegalStateException("MockBroker gateway is closed");
        }
        String id = order.clientOrderId();

        synchronized (lock) {
            if (!registry.markSeen(id)) {
                log.debug("[MockBroker:{}] Duplicate submit dropped", id);
                metrics.recordSubmission(GATEWAY_CODE, SubmissionOutcome.DUPLICATE);
                return;
            }

            Instant now = scheduler.now();
            if (config.respectMarketHours() && marketClock != null && !marketClock.isOpen(now)) {
                rejectAtGate(order, RejectReason.MARKET_CLOSED, now);
                return;
            }
            if (random.nextDouble() < config.rejectRate()) {
                rejectAtGate(order, RejectReason.RISK_REJECT, now);
                return;
            }

            LiveOrderState state = new LiveOrderState(order, now);
            registry.register(state);
            List<BigDecimal> slices;
            try {
                slices = fillScheduler.schedule(state);
            } catch (RuntimeException e) {
                // Undo so the id can be resubmitted once the scheduler is usable
                registry.cleanup(id);
                registry.forget(id);
                log.error("[MockBroker:{}] Could not schedule fills, submit rolled back", id, e);
                throw e;
            }
            metrics.recordSubmission(GATEWAY_CODE, SubmissionOutcome.ACCEPTED);
            metrics.updateInflight(GATEWAY_CODE, registry.inflightCount());
            log.info("[MockBroker:{}] Accepted {} {} {}{} in {} slice(s)",
                id, order.side(), order.quantity().toPlainString(), order.symbol(),
                order.hasLimit() ? " @ " + order.limitPrice().toPlainString() : "", slices.size());
        }
    }

    @Override
    public void cancel(String clientOrderId) {
        synchronized (lock) {
            LiveOrderState state = clientOrderId == null ? null : registry.get(clientOrderId);
            if (state == null) {
                log.debug("[MockBroker:{}] Cancel ignored, order not live", clientOrderId);
                metrics.recordCancelRequest(GATEWAY_CODE, false);
                return;
            }
            if (state.isCancelled()) {
                log.debug("[MockBroker:{}] Cancel already pending", clientOrderId);
                return;
            }

            ScheduledEvent event = scheduler.schedule(() -> completeCancel(state),
                Duration.ofMillis(config.cancelLatencyMs()));
            state.markCancelled();
            state.addPendingEvent(event);
            metrics.recordCancelRequest(GATEWAY_CODE, true);
            log.info("[MockBroker:{}] Cancel requested, filled so far {}",
                clientOrderId, state.filled().toPlainString());
        }
    }

    /**
     * Stop accepting orders and stop the internal scheduler if this gateway created it.
     * Pending events of an owned scheduler are dropped.
     */
    @Override
    public void close() {
        closed = true;
        if (ownedScheduler != null) {
            ownedScheduler.shutdown();
        }
    }

    public boolean isInflight(String clientOrderId) {
        synchronized (lock) {
            return registry.get(clientOrderId) != null;
        }
    }

    public boolean hasSeen(String clientOrderId) {
        synchronized (lock) {
            return registry.hasSeen(clientOrderId);
        }
    }

    public int inflightCount() {
        synchronized (lock) {
            return registry.inflightCount();
        }
    }

    public List<String> inflightOrderIds() {
        synchronized (lock) {
            return registry.inflightIds();
        }
    }

    private void completeCancel(LiveOrderState state) {
        synchronized (lock) {
            if (!registry.isLive(state)) {
                return;
            }
            finish(state);
            log.info("[MockBroker:{}] Cancelled, filled {} of {}", state.clientOrderId(),
                state.filled().toPlainString(), state.order().quantity().toPlainString());
            emit(ExecReport.cancelled(state.clientOrderId(), state.order().symbol(),
                state.avgPx(config.priceScale()), scheduler.now()));
        }
    }

    private void rejectAtGate(Order order, RejectReason reason, Instant now) {
        log.warn("[MockBroker:{}] Rejected at submit: {}", order.clientOrderId(), reason);
        metrics.recordSubmission(GATEWAY_CODE, SubmissionOutcome.REJECTED);
        metrics.recordReject(GATEWAY_CODE, reason);
        emit(ExecReport.rejected(order.clientOrderId(), order.symbol(), BigDecimal.ZERO, now));
    }

    private void finish(LiveOrderState state) {
        registry.cleanup(state.clientOrderId());
        metrics.updateInflight(GATEWAY_CODE, registry.inflightCount());
    }

    private void emit(ExecReport report) {
        metrics.recordReport(GATEWAY_CODE, report.status());
        try {
            listener.onExec(report);
        } catch (Exception e) {
            log.error("[MockBroker:{}] Report listener threw exception on {}",
                report.clientOrderId(), report.status(), e);
        }
    }

    /**
     * Slice results from the fill scheduler, already under the gateway lock.
     */
    private final class SliceOutcomes implements FillScheduler.SliceOutcomeListener {

        @Override
        public void onFill(LiveOrderState state, BigDecimal executedQty, BigDecimal price) {
            metrics.recordFill(GATEWAY_CODE, Duration.between(state.acceptedAt(), scheduler.now()));

            // Terminal strictly from remaining == 0: slices can fire out of planning order
            ExecStatus status = state.isFullyFilled() ? ExecStatus.FILLED : ExecStatus.PARTIAL;
            if (status == ExecStatus.FILLED) {
                finish(state);
                log.info("[MockBroker:{}] Filled {} avgPx {}", state.clientOrderId(),
                    state.filled().toPlainString(), state.avgPx(config.priceScale()).toPlainString());
            } else {
                log.debug("[MockBroker:{}] Partial {} @ {}, remaining {}", state.clientOrderId(),
                    executedQty.toPlainString(), price.toPlainString(), state.remaining().toPlainString());
            }
            emit(new ExecReport(state.clientOrderId(), state.order().symbol(), executedQty,
                state.avgPx(config.priceScale()), status, scheduler.now()));
        }

        @Override
        public void onReject(LiveOrderState state, RejectReason reason) {
            finish(state);
            log.warn("[MockBroker:{}] Rejected while filling: {}, filled {} of {}", state.clientOrderId(),
                reason, state.filled().toPlainString(), state.order().quantity().toPlainString());
            metrics.recordReject(GATEWAY_CODE, reason);
            emit(ExecReport.rejected(state.clientOrderId(), state.order().symbol(),
                state.avgPx(config.priceScale()), scheduler.now()));
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for MockBrokerGateway. Without an explicit scheduler the gateway creates
     * and owns a wall-clock {@link ExecutorEventScheduler}, stopped by {@link #close()}.
     */
    public static class Builder {
        private PriceOracle priceOracle;
        private ExecReportListener listener;
        private MarketClock marketClock;
        private SimulatorConfig config = SimulatorConfig.defaults();
        private EventScheduler scheduler;
        private Random random = new Random();
        private ExecutionMetrics metrics = ExecutionMetrics.NOOP;

        public Builder priceOracle(PriceOracle priceOracle) {
            this.priceOracle = priceOracle;
            return this;
        }

        public Builder listener(ExecReportListener listener) {
            this.listener = listener;
            return this;
        }

        public Builder marketClock(MarketClock marketClock) {
            this.marketClock = marketClock;
            return this;
        }

        public Builder config(SimulatorConfig config) {
            this.config = config;
            return this;
        }

        public Builder scheduler(EventScheduler scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        public Builder random(Random random) {
            this.random = random;
            return this;
        }

        public Builder metrics(ExecutionMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public MockBrokerGateway build() {
            Objects.requireNonNull(priceOracle, "priceOracle");
            Objects.requireNonNull(listener, "listener");
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(random, "random");
            Objects.requireNonNull(metrics, "metrics");
            if (scheduler != null) {
                return new MockBrokerGateway(this, scheduler, null);
            }
            ExecutorEventScheduler owned = new ExecutorEventScheduler("MockBroker");
            return new MockBrokerGateway(this, owned, owned);
        }
    }
}
