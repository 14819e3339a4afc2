package in.mockbroker.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Configuration for the simulated broker.
 *
 * Controls venue latency, partial-fill slicing, random rejects, cancel latency,
 * slippage and fee adjustments, and market-hours gating.
 */
public record SimulatorConfig(
    @JsonProperty("venueLatencyMs")
    long venueLatencyMs,            // Base delay before each slice executes

    @JsonProperty("latencyJitterMs")
    long latencyJitterMs,           // +/- uniform jitter per slice

    @JsonProperty("partialFill")
    boolean partialFill,            // false = one slice for the whole quantity

    @JsonProperty("minSlices")
    int minSlices,

    @JsonProperty("maxSlices")
    int maxSlices,

    @JsonProperty("minSliceFraction")
    double minSliceFraction,        // Share of current leftover taken by a non-final slice (e.g., 0.10 = 10%)

    @JsonProperty("maxSliceFraction")
    double maxSliceFraction,

    @JsonProperty("rejectRate")
    double rejectRate,              // Probability of an immediate risk reject, clamped to [0, 0.25]

    @JsonProperty("cancelLatencyMs")
    long cancelLatencyMs,

    @JsonProperty("feeBps")
    double feeBps,                  // Fee baked into the fill price (BUY pays up, SELL receives less)

    @JsonProperty("slippageBps")
    double slippageBps,             // Price moved against the taker

    @JsonProperty("respectMarketHours")
    boolean respectMarketHours,

    @JsonProperty("quantityScale")
    int quantityScale,              // Decimal places of slice quantities (2 = 0.01 minimum slice)

    @JsonProperty("priceScale")
    int priceScale                  // Decimal places of reported avgPx
) {
    private static final Logger log = LoggerFactory.getLogger(SimulatorConfig.class);

    public static final double MAX_REJECT_RATE = 0.25;

    public SimulatorConfig {
        if (venueLatencyMs < 0 || latencyJitterMs < 0 || cancelLatencyMs < 0) {
            throw new IllegalArgumentException("Latencies cannot be negative");
        }
        if (minSlices < 1) {
            throw new IllegalArgumentException("minSlices must be at least 1");
        }
        if (minSlices > maxSlices) {
            throw new IllegalArgumentException("minSlices cannot exceed maxSlices");
        }
        if (!Double.isFinite(minSliceFraction) || !Double.isFinite(maxSliceFraction)) {
            throw new IllegalArgumentException("Slice fractions must be finite numbers");
        }
        if (minSliceFraction <= 0 || maxSliceFraction >= 1) {
            throw new IllegalArgumentException("Slice fractions must be within (0, 1)");
        }
        if (minSliceFraction > maxSliceFraction) {
            throw new IllegalArgumentException("minSliceFraction cannot exceed maxSliceFraction");
        }
        if (!Double.isFinite(feeBps) || !Double.isFinite(slippageBps)) {
            throw new IllegalArgumentException("feeBps and slippageBps must be finite numbers");
        }
        if (feeBps < 0 || slippageBps < 0) {
            throw new IllegalArgumentException("feeBps and slippageBps cannot be negative");
        }
        if (quantityScale < 0 || priceScale < 0) {
            throw new IllegalArgumentException("Scales cannot be negative");
        }
        if (Double.isNaN(rejectRate)) {
            throw new IllegalArgumentException("rejectRate cannot be NaN");
        }
        double clamped = Math.max(0.0, Math.min(MAX_REJECT_RATE, rejectRate));
        if (clamped != rejectRate) {
            log.warn("[SimulatorConfig] rejectRate {} outside [0, {}], using {}", rejectRate, MAX_REJECT_RATE, clamped);
            rejectRate = clamped;
        }
    }

    /**
     * Default simulator settings.
     */
    public static SimulatorConfig defaults() {
        return new SimulatorConfig(
            180,    // 180ms venue latency
            120,    // +/-120ms jitter
            true,   // Partial fills on
            2,      // 2..5 slices
            5,
            0.10,   // Non-final slice takes 10%..35% of leftover
            0.35,
            0.01,   // 1% random reject
            80,     // 80ms to honor a cancel
            1.0,    // 1 bps fee
            2.0,    // 2 bps slippage
            false,  // Market hours not enforced
            2,      // Quantities to 0.01
            6       // avgPx to 6 decimals
        );
    }

    public static Builder builder() {
        return new Builder(defaults());
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    /**
     * Builder for SimulatorConfig. Starts from the given values, validation runs in build().
     */
    public static class Builder {
        private long venueLatencyMs;
        private long latencyJitterMs;
        private boolean partialFill;
        private int minSlices;
        private int maxSlices;
        private double minSliceFraction;
        private double maxSliceFraction;
        private double rejectRate;
        private long cancelLatencyMs;
        private double feeBps;
        private double slippageBps;
        private boolean respectMarketHours;
        private int quantityScale;
        private int priceScale;

        private Builder(SimulatorConfig base) {
            this.venueLatencyMs = base.venueLatencyMs;
            this.latencyJitterMs = base.latencyJitterMs;
            this.partialFill = base.partialFill;
            this.minSlices = base.minSlices;
            this.maxSlices = base.maxSlices;
            this.minSliceFraction = base.minSliceFraction;
            this.maxSliceFraction = base.maxSliceFraction;
            this.rejectRate = base.rejectRate;
            this.cancelLatencyMs = base.cancelLatencyMs;
            this.feeBps = base.feeBps;
            this.slippageBps = base.slippageBps;
            this.respectMarketHours = base.respectMarketHours;
            this.quantityScale = base.quantityScale;
            this.priceScale = base.priceScale;
        }

        public Builder venueLatencyMs(long venueLatencyMs) {
            this.venueLatencyMs = venueLatencyMs;
            return this;
        }

        public Builder latencyJitterMs(long latencyJitterMs) {
            this.latencyJitterMs = latencyJitterMs;
            return this;
        }

        public Builder partialFill(boolean partialFill) {
            this.partialFill = partialFill;
            return this;
        }

        public Builder slices(int minSlices, int maxSlices) {
            this.minSlices = minSlices;
            this.maxSlices = maxSlices;
            return this;
        }

        public Builder sliceFractions(double minSliceFraction, double maxSliceFraction) {
            this.minSliceFraction = minSliceFraction;
            this.maxSliceFraction = maxSliceFraction;
            return this;
        }

        public Builder rejectRate(double rejectRate) {
            this.rejectRate = rejectRate;
            return this;
        }

        public Builder cancelLatencyMs(long cancelLatencyMs) {
            this.cancelLatencyMs = cancelLatencyMs;
            return this;
        }

        public Builder feeBps(double feeBps) {
            this.feeBps = feeBps;
            return this;
        }

        public Builder slippageBps(double slippageBps) {
            this.slippageBps = slippageBps;
            return this;
        }

        public Builder respectMarketHours(boolean respectMarketHours) {
            this.respectMarketHours = respectMarketHours;
            return this;
        }

        public Builder quantityScale(int quantityScale) {
            this.quantityScale = quantityScale;
            return this;
        }

        public Builder priceScale(int priceScale) {
            this.priceScale = priceScale;
            return this;
        }

        public SimulatorConfig build() {
            return new SimulatorConfig(
                venueLatencyMs, latencyJitterMs, partialFill, minSlices, maxSlices,
                minSliceFraction, maxSliceFraction, rejectRate, cancelLatencyMs,
                feeBps, slippageBps, respectMarketHours, quantityScale, priceScale);
        }
    }
}
