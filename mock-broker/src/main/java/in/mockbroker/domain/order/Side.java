package in.mockbroker.domain.order;

/**
 * Order side.
 */
public enum Side {
    BUY,
    SELL;

    /**
     * Direction of an unfavorable price move for the taker: +1 for BUY (pays up), -1 for SELL.
     */
    public int sign() {
        return this == BUY ? 1 : -1;
    }
}
