package in.mockbroker.infrastructure.sink;

import in.mockbroker.application.port.output.ExecReportListener;
import in.mockbroker.domain.order.ExecReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Report listener that writes one JSON line per execution report to the log,
 * then hands the report on to an optional downstream listener.
 *
 * Diagnostic only; the line format is not a persistence contract.
 */
public class LoggingReportSink implements ExecReportListener {
    private static final Logger log = LoggerFactory.getLogger(LoggingReportSink.class);

    private final ExecReportListener downstream;

    public LoggingReportSink() {
        this(null);
    }

    public LoggingReportSink(ExecReportListener downstream) {
        this.downstream = downstream;
    }

    @Override
    public void onExec(ExecReport report) {
        if (report.isTerminal()) {
            log.info("[ExecReport] {}", ExecReportJsonMapper.toJson(report));
        } else if (log.isDebugEnabled()) {
            log.debug("[ExecReport] {}", ExecReportJsonMapper.toJson(report));
        }
        if (downstream != null) {
            downstream.onExec(report);
        }
    }
}
