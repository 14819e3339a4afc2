package in.mockbroker.domain.order;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Execution report emitted for every order state transition.
 *
 * @param clientOrderId order the report belongs to
 * @param symbol        instrument symbol
 * @param filledQty     quantity executed by this report only (0 for REJECTED / CANCELLED)
 * @param avgPx         cumulative volume-weighted average price over all fills so far, 0 if nothing filled
 * @param status        report status
 * @param timestamp     emission time
 */
public record ExecReport(
    String clientOrderId,
    String symbol,
    BigDecimal filledQty,
    BigDecimal avgPx,
    ExecStatus status,
    Instant timestamp
) {
    public ExecReport {
        if (clientOrderId == null || status == null) {
            throw new IllegalArgumentException("clientOrderId and status cannot be null");
        }
        if (filledQty == null) {
            filledQty = BigDecimal.ZERO;
        }
        if (avgPx == null) {
            avgPx = BigDecimal.ZERO;
        }
    }

    public static ExecReport rejected(String clientOrderId, String symbol, BigDecimal avgPx, Instant timestamp) {
        return new ExecReport(clientOrderId, symbol, BigDecimal.ZERO, avgPx, ExecStatus.REJECTED, timestamp);
    }

    public static ExecReport cancelled(String clientOrderId, String symbol, BigDecimal avgPx, Instant timestamp) {
        return new ExecReport(clientOrderId, symbol, BigDecimal.ZERO, avgPx, ExecStatus.CANCELLED, timestamp);
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }
}
