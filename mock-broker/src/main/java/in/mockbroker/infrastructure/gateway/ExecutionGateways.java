package in.mockbroker.infrastructure.gateway;

import in.mockbroker.application.port.input.ExecutionGateway;
import in.mockbroker.application.port.output.ExecReportListener;
import in.mockbroker.application.port.output.MarketClock;
import in.mockbroker.application.port.output.PriceOracle;
import in.mockbroker.application.port.output.VenueOrderClient;
import in.mockbroker.config.SimulatorConfig;
import in.mockbroker.infrastructure.metrics.ExecutionMetrics;
import in.mockbroker.infrastructure.scheduling.EventScheduler;
import in.mockbroker.infrastructure.sim.MockBrokerGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Random;

/**
 * ExecutionGateways - Central factory for execution gateways.
 *
 * Strategies only see {@link ExecutionGateway}; which one backs them is decided here:
 * - MOCK: simulated venue with latency, partial fills, slippage and fees
 * - LIVE: real venue behind a {@link VenueOrderClient}
 *
 * Usage:
 * <pre>
 * ExecutionGateway gateway = ExecutionGateways.withDedupe(
 *     ExecutionGateways.mockBroker(priceCache, listener, SessionMarketClock.nse(), SimulatorConfigLoader.load()));
 * </pre>
 */
public final class ExecutionGateways {
    private static final Logger log = LoggerFactory.getLogger(ExecutionGateways.class);

    private ExecutionGateways() {}

    /**
     * Simulated gateway running on its own wall-clock scheduler thread. Close it to stop the thread.
     *
     * @param marketClock session clock, nullable (no market-hours gate)
     */
    public static MockBrokerGateway mockBroker(PriceOracle priceOracle,
                                               ExecReportListener listener,
                                               MarketClock marketClock,
                                               SimulatorConfig config) {
        log.info("[ExecutionGateways] Creating MOCK gateway with owned scheduler");
        return MockBrokerGateway.builder()
            .priceOracle(priceOracle)
            .listener(listener)
            .marketClock(marketClock)
            .config(config != null ? config : SimulatorConfig.defaults())
            .build();
    }

    /**
     * Simulated gateway with every collaborator injected. Used for deterministic runs
     * (virtual scheduler, seeded random).
     */
    public static MockBrokerGateway mockBroker(PriceOracle priceOracle,
                                               ExecReportListener listener,
                                               MarketClock marketClock,
                                               SimulatorConfig config,
                                               EventScheduler scheduler,
                                               Random random,
                                               ExecutionMetrics metrics) {
        log.info("[ExecutionGateways] Creating MOCK gateway on injected scheduler");
        return MockBrokerGateway.builder()
            .priceOracle(priceOracle)
            .listener(listener)
            .marketClock(marketClock)
            .config(config != null ? config : SimulatorConfig.defaults())
            .scheduler(scheduler)
            .random(random != null ? random : new Random())
            .metrics(metrics != null ? metrics : ExecutionMetrics.NOOP)
            .build();
    }

    public static LiveBrokerGateway liveBroker(VenueOrderClient client,
                                               ExecReportListener listener,
                                               ExecutionMetrics metrics) {
        log.info("[ExecutionGateways] Creating LIVE gateway");
        return new LiveBrokerGateway(client, listener, metrics);
    }

    /**
     * Wrap a gateway so a repeated clientOrderId never reaches it twice.
     */
    public static ExecutionGateway withDedupe(ExecutionGateway gateway) {
        if (gateway instanceof DedupGateway) {
            return gateway;
        }
        return new DedupGateway(gateway);
    }
}
