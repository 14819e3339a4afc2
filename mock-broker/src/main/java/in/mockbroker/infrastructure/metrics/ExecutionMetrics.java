package in.mockbroker.infrastructure.metrics;

import in.mockbroker.domain.order.ExecStatus;
import in.mockbroker.domain.order.RejectReason;

import java.time.Duration;
import java.util.Map;

/**
 * Execution metrics for monitoring and alerting.
 *
 * Implementations can publish to Prometheus, Grafana, CloudWatch, etc.
 * Every call is labelled with the gateway code (e.g. "MOCK", "LIVE").
 *
 * Key metrics:
 * - Submissions by outcome (accepted, duplicate, rejected)
 * - Rejects by reason
 * - Reports by status
 * - Cancel requests
 * - Accept-to-fill latency
 * - Live order count
 */
public interface ExecutionMetrics {

    /**
     * Metrics sink that records nothing.
     */
    ExecutionMetrics NOOP = new Noop();

    /**
     * Record the outcome of a submit() call that passed validation.
     */
    void recordSubmission(String gateway, SubmissionOutcome outcome);

    /**
     * Record why an order ended REJECTED.
     */
    void recordReject(String gateway, RejectReason reason);

    /**
     * Record an emitted report.
     */
    void recordReport(String gateway, ExecStatus status);

    /**
     * Record a cancel() call.
     *
     * @param known whether the id matched a live order
     */
    void recordCancelRequest(String gateway, boolean known);

    /**
     * Record one executed slice.
     *
     * @param sinceAccept time from order acceptance to this fill
     */
    void recordFill(String gateway, Duration sinceAccept);

    /**
     * Update the number of live orders.
     */
    void updateInflight(String gateway, int count);

    /**
     * Get current metrics snapshot for a gateway.
     *
     * @return Map of metric names to values
     */
    Map<String, Object> getMetrics(String gateway);

    /**
     * Reset all metrics.
     */
    void resetAll();

    enum SubmissionOutcome {
        ACCEPTED,
        DUPLICATE,
        REJECTED
    }

    final class Noop implements ExecutionMetrics {
        private Noop() {}

        @Override public void recordSubmission(String gateway, SubmissionOutcome outcome) {}
        @Override public void recordReject(String gateway, RejectReason reason) {}
        @Override public void recordReport(String gateway, ExecStatus status) {}
        @Override public void recordCancelRequest(String gateway, boolean known) {}
        @Override public void recordFill(String gateway, Duration sinceAccept) {}
        @Override public void updateInflight(String gateway, int count) {}
        @Override public Map<String, Object> getMetrics(String gateway) { return Map.of(); }
        @Override public void resetAll() {}
    }
}
