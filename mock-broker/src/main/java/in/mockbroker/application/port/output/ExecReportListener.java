package in.mockbroker.application.port.output;

import in.mockbroker.domain.order.ExecReport;

/**
 * Consumer of execution reports (strategy engine, journal, UI).
 * Invoked once per order state transition, never batched.
 */
@FunctionalInterface
public interface ExecReportListener {

    void onExec(ExecReport report);
}
