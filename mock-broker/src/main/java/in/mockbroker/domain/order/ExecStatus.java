package in.mockbroker.domain.order;

/**
 * Status carried by an execution report.
 */
public enum ExecStatus {
    PARTIAL,    // Some quantity executed, order still live
    FILLED,     // Remaining quantity reached zero
    REJECTED,   // Rejected at the gate or while filling
    CANCELLED;  // Cancel honored, no further fills

    public boolean isTerminal() {
        return this != PARTIAL;
    }
}
