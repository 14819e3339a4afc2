package in.mockbroker.domain.order;

/**
 * Why an order ended REJECTED. Used for logging and metrics, never part of the report itself.
 */
public enum RejectReason {
    MARKET_CLOSED,
    RISK_REJECT,
    NO_PRICE,
    LIMIT_UNFILLABLE,
    VENUE_REJECT
}
