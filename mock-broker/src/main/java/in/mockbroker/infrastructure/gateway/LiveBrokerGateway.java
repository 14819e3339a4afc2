package in.mockbroker.infrastructure.gateway;

import in.mockbroker.application.port.input.ExecutionGateway;
import in.mockbroker.application.port.output.ExecReportListener;
import in.mockbroker.application.port.output.VenueOrderClient;
import in.mockbroker.application.port.output.VenueOrderClient.VenueOrderUpdate;
import in.mockbroker.domain.order.ExecReport;
import in.mockbroker.domain.order.ExecStatus;
import in.mockbroker.domain.order.Order;
import in.mockbroker.domain.order.OrderValidator;
import in.mockbroker.domain.order.RejectReason;
import in.mockbroker.infrastructure.metrics.ExecutionMetrics;
import in.mockbroker.infrastructure.metrics.ExecutionMetrics.SubmissionOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Gateway backed by a real venue through {@link VenueOrderClient}.
 *
 * Gives strategies the same report stream as the simulator:
 * - submit() is idempotent by clientOrderId and validated the same way
 * - a refused placement becomes one REJECTED report
 * - cumulative venue updates become per-report fill quantities; stale updates are dropped
 * - exactly one terminal report per order, later venue updates are ignored
 *
 * A cancel that arrives before the venue has assigned its order id is held and forwarded
 * once placement succeeds.
 *
 * Placement outcomes are handled on the callback executor, never on the thread calling submit(),
 * even when the client fails synchronously. Without an explicit executor the gateway owns a
 * single daemon thread, stopped by {@link #close()}.
 */
public class LiveBrokerGateway implements ExecutionGateway {
    private static final Logger log = LoggerFactory.getLogger(LiveBrokerGateway.class);

    public static final String GATEWAY_CODE = "LIVE";

    private final VenueOrderClient client;
    private final ExecReportListener listener;
    private final ExecutionMetrics metrics;
    private final Clock clock;
    private final Executor callbackExecutor;
    private final ExecutorService ownedExecutor;
    private volatile boolean closed = false;

    private final Object lock = new Object();
    private final Map<String, VenueOrder> ordersByClientId = new HashMap<>();
    private final Map<String, VenueOrder> ordersByVenueId = new HashMap<>();

    public LiveBrokerGateway(VenueOrderClient client, ExecReportListener listener, ExecutionMetrics metrics) {
        this(client, listener, metrics, Clock.systemUTC());
    }

    public LiveBrokerGateway(VenueOrderClient client, ExecReportListener listener,
                             ExecutionMetrics metrics, Clock clock) {
        this(client, listener, metrics, clock, newCallbackExecutor(), true);
    }

    public LiveBrokerGateway(VenueOrderClient client, ExecReportListener listener,
                             ExecutionMetrics metrics, Clock clock, Executor callbackExecutor) {
        this(client, listener, metrics, clock, callbackExecutor, false);
    }

    private LiveBrokerGateway(VenueOrderClient client, ExecReportListener listener, ExecutionMetrics metrics,
                              Clock clock, Executor callbackExecutor, boolean ownsExecutor) {
        this.client = Objects.requireNonNull(client, "client");
        this.listener = Objects.requireNonNull(listener, "listener");
        this.metrics = metrics != null ? metrics : ExecutionMetrics.NOOP;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.callbackExecutor = Objects.requireNonNull(callbackExecutor, "callbackExecutor");
        this.ownedExecutor = ownsExecutor ? (ExecutorService) callbackExecutor : null;
        client.onOrderUpdate(this::onVenueUpdate);
    }

    private static ExecutorService newCallbackExecutor() {
        return Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "LiveBroker-callbacks");
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public void submit(Order order) {
        OrderValidator.validate(order);
        if (closed) {
            throw new IllegalStateException("LiveBroker gateway is closed");
        }
        String id = order.clientOrderId();

        VenueOrder venueOrder;
        synchronized (lock) {
            if (ordersByClientId.containsKey(id)) {
                log.debug("[LiveBroker:{}] Duplicate submit dropped", id);
                metrics.recordSubmission(GATEWAY_CODE, SubmissionOutcome.DUPLICATE);
                return;
            }
            venueOrder = new VenueOrder(order, clock.instant());
            ordersByClientId.put(id, venueOrder);
            metrics.recordSubmission(GATEWAY_CODE, SubmissionOutcome.ACCEPTED);
            metrics.updateInflight(GATEWAY_CODE, countOpen());
        }

        log.info("[LiveBroker:{}] Placing {} {} {}", id, order.side(),
            order.quantity().toPlainString(), order.symbol());

        CompletableFuture<String> placement;
        try {
            placement = client.placeOrder(order);
        } catch (RuntimeException e) {
            placement = CompletableFuture.failedFuture(e);
        }
        placement.whenCompleteAsync((venueOrderId, error) -> onPlaced(venueOrder, venueOrderId, error),
            callbackExecutor);
    }

    @Override
    public void cancel(String clientOrderId) {
        String forwardTo;
        synchronized (lock) {
            VenueOrder venueOrder = clientOrderId == null ? null : ordersByClientId.get(clientOrderId);
            if (venueOrder == null || venueOrder.terminal) {
                log.debug("[LiveBroker:{}] Cancel ignored, order not live", clientOrderId);
                metrics.recordCancelRequest(GATEWAY_CODE, false);
                return;
            }
            if (venueOrder.cancelRequested) {
                return;
            }
            venueOrder.cancelRequested = true;
            metrics.recordCancelRequest(GATEWAY_CODE, true);
            if (venueOrder.venueOrderId == null) {
                log.info("[LiveBroker:{}] Cancel held until venue acknowledges placement", clientOrderId);
                return;
            }
            forwardTo = venueOrder.venueOrderId;
        }
        forwardCancel(clientOrderId, forwardTo);
    }

    /**
     * Stop accepting orders and stop the callback thread if this gateway created it.
     * Placements still pending at the venue get no further reports.
     */
    @Override
    public void close() {
        closed = true;
        if (ownedExecutor == null) {
            return;
        }
        ownedExecutor.shutdown();
        try {
            if (!ownedExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("[LiveBroker] Callback executor did not terminate within 5s");
                ownedExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public boolean isOpen(String clientOrderId) {
        synchronized (lock) {
            VenueOrder venueOrder = ordersByClientId.get(clientOrderId);
            return venueOrder != null && !venueOrder.terminal;
        }
    }

    public String venueOrderId(String clientOrderId) {
        synchronized (lock) {
            VenueOrder venueOrder = ordersByClientId.get(clientOrderId);
            return venueOrder != null ? venueOrder.venueOrderId : null;
        }
    }

    private void onPlaced(VenueOrder venueOrder, String venueOrderId, Throwable error) {
        String id = venueOrder.order.clientOrderId();
        boolean forward;
        synchronized (lock) {
            if (error != null || venueOrderId == null) {
                Throwable cause = error instanceof CompletionException && error.getCause() != null
                    ? error.getCause() : error;
                log.warn("[LiveBroker:{}] Venue refused order: {}", id,
                    cause != null ? cause.getMessage() : "no venue order id");
                if (!venueOrder.terminal) {
                    metrics.recordReject(GATEWAY_CODE, RejectReason.VENUE_REJECT);
                    terminate(venueOrder, ExecReport.rejected(id, venueOrder.order.symbol(),
                        venueOrder.avgPx, clock.instant()));
                }
                return;
            }

            venueOrder.venueOrderId = venueOrderId;
            ordersByVenueId.put(venueOrderId, venueOrder);
            log.info("[LiveBroker:{}] Venue acknowledged as {}", id, venueOrderId);
            forward = venueOrder.cancelRequested && !venueOrder.terminal;
        }
        if (forward) {
            forwardCancel(id, venueOrderId);
        }
    }

    private void forwardCancel(String clientOrderId, String venueOrderId) {
        CompletableFuture<Void> request;
        try {
            request = client.cancelOrder(venueOrderId);
        } catch (RuntimeException e) {
            request = CompletableFuture.failedFuture(e);
        }
        request.whenComplete((ignored, error) -> {
            if (error != null) {
                log.warn("[LiveBroker:{}] Cancel of venue order {} failed: {}",
                    clientOrderId, venueOrderId, error.getMessage());
            }
        });
    }

    private void onVenueUpdate(VenueOrderUpdate update) {
        if (update == null || update.state() == null) {
            log.warn("[LiveBroker] Venue update without state ignored: {}", update);
            return;
        }
        synchronized (lock) {
            VenueOrder venueOrder = update.clientOrderId() != null
                ? ordersByClientId.get(update.clientOrderId()) : null;
            if (venueOrder == null && update.venueOrderId() != null) {
                venueOrder = ordersByVenueId.get(update.venueOrderId());
            }
            if (venueOrder == null) {
                log.debug("[LiveBroker] Update for unknown order {} / {} ignored",
                    update.clientOrderId(), update.venueOrderId());
                return;
            }
            if (venueOrder.terminal) {
                log.debug("[LiveBroker:{}] Update after terminal report ignored: {}",
                    venueOrder.order.clientOrderId(), update.state());
                return;
            }
            if (venueOrder.venueOrderId == null && update.venueOrderId() != null) {
                venueOrder.venueOrderId = update.venueOrderId();
                ordersByVenueId.put(update.venueOrderId(), venueOrder);
            }
            apply(venueOrder, update);
        }
    }

    private void apply(VenueOrder venueOrder, VenueOrderUpdate update) {
        String id = venueOrder.order.clientOrderId();
        String symbol = venueOrder.order.symbol();
        Instant ts = update.timestamp() != null ? update.timestamp() : clock.instant();

        BigDecimal cumulative = update.cumulativeQty() != null ? update.cumulativeQty() : venueOrder.reportedQty;
        BigDecimal delta = cumulative.subtract(venueOrder.reportedQty);
        if (delta.signum() > 0) {
            venueOrder.reportedQty = cumulative;
            if (update.averagePrice() != null) {
                venueOrder.avgPx = update.averagePrice();
            }
        }

        switch (update.state()) {
            case OPEN, PARTIALLY_FILLED -> {
                if (delta.signum() <= 0) {
                    log.debug("[LiveBroker:{}] Stale update dropped, cumulative {}", id, cumulative.toPlainString());
                    return;
                }
                metrics.recordFill(GATEWAY_CODE, Duration.between(venueOrder.acceptedAt, ts));
                emit(new ExecReport(id, symbol, delta, venueOrder.avgPx, ExecStatus.PARTIAL, ts));
            }
            case FILLED -> {
                BigDecimal last = delta.signum() > 0 ? delta : BigDecimal.ZERO;
                log.info("[LiveBroker:{}] Filled {} avgPx {}", id,
                    venueOrder.reportedQty.toPlainString(), venueOrder.avgPx.toPlainString());
                terminate(venueOrder, new ExecReport(id, symbol, last, venueOrder.avgPx, ExecStatus.FILLED, ts));
            }
            case CANCELLED, REJECTED -> {
                if (delta.signum() > 0) {
                    emit(new ExecReport(id, symbol, delta, venueOrder.avgPx, ExecStatus.PARTIAL, ts));
                }
                if (update.state() == VenueOrderClient.VenueOrderState.CANCELLED) {
                    log.info("[LiveBroker:{}] Cancelled at venue, filled {}", id, venueOrder.reportedQty.toPlainString());
                    terminate(venueOrder, ExecReport.cancelled(id, symbol, venueOrder.avgPx, ts));
                } else {
                    log.warn("[LiveBroker:{}] Rejected at venue: {}", id, update.message());
                    metrics.recordReject(GATEWAY_CODE, RejectReason.VENUE_REJECT);
                    terminate(venueOrder, ExecReport.rejected(id, symbol, venueOrder.avgPx, ts));
                }
            }
        }
    }

    private void terminate(VenueOrder venueOrder, ExecReport report) {
        venueOrder.terminal = true;
        metrics.updateInflight(GATEWAY_CODE, countOpen());
        emit(report);
    }

    private int countOpen() {
        return (int) ordersByClientId.values().stream().filter(o -> !o.terminal).count();
    }

    private void emit(ExecReport report) {
        metrics.recordReport(GATEWAY_CODE, report.status());
        try {
            listener.onExec(report);
        } catch (Exception e) {
            log.error("[LiveBroker:{}] Report listener threw exception on {}",
                report.clientOrderId(), report.status(), e);
        }
    }

    private static final class VenueOrder {
        private final Order order;
        private final Instant acceptedAt;
        private String venueOrderId;
        private boolean cancelRequested;
        private boolean terminal;
        private BigDecimal reportedQty = BigDecimal.ZERO;
        private BigDecimal avgPx = BigDecimal.ZERO;

        private VenueOrder(Order order, Instant acceptedAt) {
            this.order = order;
            this.acceptedAt = acceptedAt;
        }
    }
}
