package in.mockbroker.infrastructure.metrics;

import in.mockbroker.domain.order.ExecStatus;
import in.mockbroker.domain.order.RejectReason;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Prometheus implementation of ExecutionMetrics.
 *
 * Key Metrics:
 * - mock_broker_submissions_total{gateway, outcome}
 * - mock_broker_rejects_total{gateway, reason}
 * - mock_broker_reports_total{gateway, status}
 * - mock_broker_cancel_requests_total{gateway, outcome}
 * - mock_broker_fill_latency_seconds{gateway}
 * - mock_broker_inflight_orders{gateway}
 *
 * Usage:
 * <pre>
 * PrometheusExecutionMetrics metrics = new PrometheusExecutionMetrics();
 * ExecutionGateway gateway = ExecutionGateways.mockBroker(oracle, listener, clock, config,
 *     scheduler, new Random(), metrics);
 * // Scrape metrics.getRegistry() from the host application's /metrics endpoint
 * </pre>
 */
public class PrometheusExecutionMetrics implements ExecutionMetrics {
    private static final Logger log = LoggerFactory.getLogger(PrometheusExecutionMetrics.class);

    private final CollectorRegistry registry;

    private final Counter submissionCounter;
    private final Counter rejectCounter;
    private final Counter reportCounter;
    private final Counter cancelRequestCounter;
    private final Histogram fillLatency;
    private final Gauge inflightOrders;

    // In-memory state for snapshots
    private final Map<String, MetricsState> stateMap = new ConcurrentHashMap<>();

    public PrometheusExecutionMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusExecutionMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.submissionCounter = Counter.build()
            .name("mock_broker_submissions_total")
            .help("Order submissions that passed validation, by outcome")
            .labelNames("gateway", "outcome")
            .register(registry);

        this.rejectCounter = Counter.build()
            .name("mock_broker_rejects_total")
            .help("Orders ended REJECTED, by reason")
            .labelNames("gateway", "reason")
            .register(registry);

        this.reportCounter = Counter.build()
            .name("mock_broker_reports_total")
            .help("Execution reports emitted, by status")
            .labelNames("gateway", "status")
            .register(registry);

        this.cancelRequestCounter = Counter.build()
            .name("mock_broker_cancel_requests_total")
            .help("Cancel requests, by whether the order was live")
            .labelNames("gateway", "outcome")
            .register(registry);

        this.fillLatency = Histogram.build()
            .name("mock_broker_fill_latency_seconds")
            .help("Time from order acceptance to each fill in seconds")
            .labelNames("gateway")
            .buckets(0.05, 0.1, 0.2, 0.3, 0.5, 1.0, 2.0, 5.0)
            .register(registry);

        this.inflightOrders = Gauge.build()
            .name("mock_broker_inflight_orders")
            .help("Orders accepted and not yet terminal")
            .labelNames("gateway")
            .register(registry);

        log.info("[PrometheusExecutionMetrics] Initialized");
    }

    @Override
    public void recordSubmission(String gateway, SubmissionOutcome outcome) {
        submissionCounter.labels(gateway, outcome.name().toLowerCase()).inc();
        getState(gateway).recordSubmission(outcome);
    }

    @Override
    public void recordReject(String gateway, RejectReason reason) {
        rejectCounter.labels(gateway, reason.name()).inc();
        getState(gateway).recordReject();
    }

    @Override
    public void recordReport(String gateway, ExecStatus status) {
        reportCounter.labels(gateway, status.name()).inc();
        getState(gateway).recordReport(status);
    }

    @Override
    public void recordCancelRequest(String gateway, boolean known) {
        cancelRequestCounter.labels(gateway, known ? "accepted" : "unknown").inc();
        getState(gateway).recordCancelRequest();
    }

    @Override
    public void recordFill(String gateway, Duration sinceAccept) {
        fillLatency.labels(gateway).observe(sinceAccept.toMillis() / 1000.0);
    }

    @Override
    public void updateInflight(String gateway, int count) {
        inflightOrders.labels(gateway).set(count);
        getState(gateway).inflight = count;
    }

    @Override
    public Map<String, Object> getMetrics(String gateway) {
        MetricsState state = stateMap.get(gateway);
        if (state == null) {
            return new HashMap<>();
        }
        return state.toMap();
    }

    @Override
    public void resetAll() {
        stateMap.clear();
        log.info("[PrometheusExecutionMetrics] Reset all metrics");
    }

    /**
     * Get Prometheus CollectorRegistry for a /metrics endpoint.
     */
    public CollectorRegistry getRegistry() {
        return registry;
    }

    private MetricsState getState(String gateway) {
        return stateMap.computeIfAbsent(gateway, k -> new MetricsState(gateway));
    }

    /**
     * In-memory state for aggregated metrics.
     */
    private static class MetricsState {
        private final String gateway;
        private long accepted = 0;
        private long duplicates = 0;
        private long rejectedAtSubmit = 0;
        private long rejects = 0;
        private long partials = 0;
        private long fills = 0;
        private long cancels = 0;
        private long cancelRequests = 0;
        private volatile int inflight = 0;

        MetricsState(String gateway) {
            this.gateway = gateway;
        }

        synchronized void recordSubmission(SubmissionOutcome outcome) {
            switch (outcome) {
                case ACCEPTED -> accepted++;
                case DUPLICATE -> duplicates++;
                case REJECTED -> rejectedAtSubmit++;
            }
        }

        synchronized void recordReject() {
            rejects++;
        }

        synchronized void recordReport(ExecStatus status) {
            switch (status) {
                case PARTIAL -> partials++;
                case FILLED -> fills++;
                case CANCELLED -> cancels++;
                case REJECTED -> { }
            }
        }

        synchronized void recordCancelRequest() {
            cancelRequests++;
        }

        synchronized Map<String, Object> toMap() {
            Map<String, Object> map = new HashMap<>();
            map.put("gateway", gateway);
            map.put("accepted", accepted);
            map.put("duplicates", duplicates);
            map.put("rejectedAtSubmit", rejectedAtSubmit);
            map.put("rejects", rejects);
            map.put("partialReports", partials);
            map.put("filledOrders", fills);
            map.put("cancelledOrders", cancels);
            map.put("cancelRequests", cancelRequests);
            map.put("inflight", inflight);
            long submitted = accepted + rejectedAtSubmit;
            map.put("fillRate", submitted > 0 ? (double) fills / submitted : 0.0);
            return map;
        }
    }
}
