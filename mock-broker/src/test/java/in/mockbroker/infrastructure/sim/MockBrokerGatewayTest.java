package in.mockbroker.infrastructure.sim;

import in.mockbroker.config.SimulatorConfig;
import in.mockbroker.domain.order.ExecReport;
import in.mockbroker.domain.order.ExecStatus;
import in.mockbroker.domain.order.InvalidOrderException;
import in.mockbroker.domain.order.Order;
import in.mockbroker.domain.order.Side;
import in.mockbroker.infrastructure.market.LastPriceCache;
import in.mockbroker.infrastructure.market.SessionMarketClock;
import in.mockbroker.infrastructure.metrics.PrometheusExecutionMetrics;
import in.mockbroker.infrastructure.scheduling.ExecutorEventScheduler;
import in.mockbroker.infrastructure.scheduling.VirtualEventScheduler;
import io.prometheus.client.CollectorRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Simulated broker behaviour on a virtual clock.
 *
 * Scripted nextDouble() draws per submit with the two-slice config:
 * reject draw, slice-1 fraction, slice-1 jitter, slice-2 jitter.
 * The slice count comes from nextInt and is fixed at 2 by the config.
 * Fraction draw 0.0 gives slice 1 = 10% of 100 = 10; jitter draw 0.0 fires at +0ms, 0.99 at +198ms.
 */
@DisplayName("Mock Broker Gateway Tests")
class MockBrokerGatewayTest {

    // Tuesday 09:30 IST
    private static final Instant OPEN = Instant.parse("2024-01-02T04:00:00Z");
    // Saturday 10:30 IST
    private static final Instant WEEKEND = Instant.parse("2024-01-06T05:00:00Z");

    private static final SimulatorConfig TWO_SLICES = SimulatorConfig.builder()
        .venueLatencyMs(100)
        .latencyJitterMs(100)
        .slices(2, 2)
        .rejectRate(0.0)
        .feeBps(0)
        .slippageBps(0)
        .cancelLatencyMs(80)
        .build();

    private VirtualEventScheduler scheduler;
    private LastPriceCache prices;
    private List<ExecReport> reports;
    private PrometheusExecutionMetrics metrics;

    @BeforeEach
    void setUp() {
        scheduler = new VirtualEventScheduler(OPEN);
        prices = new LastPriceCache();
        reports = new ArrayList<>();
        metrics = new PrometheusExecutionMetrics(new CollectorRegistry());
        prices.updatePrice("X", new BigDecimal("50"), OPEN);
        prices.updatePrice("NIFTY", new BigDecimal("100"), OPEN);
    }

    private MockBrokerGateway gateway(SimulatorConfig config, Random random) {
        return MockBrokerGateway.builder()
            .priceOracle(prices)
            .listener(reports::add)
            .config(config)
            .scheduler(scheduler)
            .random(random)
            .metrics(metrics)
            .build();
    }

    private static Order buy(String id, String qty) {
        return Order.market(id, "NIFTY", Side.BUY, new BigDecimal(qty));
    }

    private List<ExecReport> reportsFor(String id) {
        return reports.stream().filter(r -> r.clientOrderId().equals(id)).collect(Collectors.toList());
    }

    private static BigDecimal totalFilled(List<ExecReport> list) {
        return list.stream().map(ExecReport::filledQty).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    @Test
    @DisplayName("Single-slice market order fills once at slipped and fee-adjusted price")
    void testSingleSliceFill() {
        SimulatorConfig config = SimulatorConfig.builder().partialFill(false).rejectRate(0.0).build();
        MockBrokerGateway gateway = gateway(config, new Random(42));

        gateway.submit(Order.market("o1", "X", Side.BUY, new BigDecimal("100")));
        assertTrue(reports.isEmpty(), "Fills arrive asynchronously");

        scheduler.runAll();

        assertEquals(1, reports.size());
        ExecReport report = reports.get(0);
        assertEquals(ExecStatus.FILLED, report.status());
        assertEquals("X", report.symbol());
        assertEquals(0, new BigDecimal("100").compareTo(report.filledQty()));
        // 50 * 1.0002 = 50.01, * 1.0001 = 50.015001
        assertEquals(0, new BigDecimal("50.015001").compareTo(report.avgPx()));
        assertFalse(gateway.isInflight("o1"));
    }

    @Test
    @DisplayName("Cancel before any slice fires yields only CANCELLED")
    void testCancelBeforeAnySlice() {
        MockBrokerGateway gateway = gateway(TWO_SLICES, new ScriptedRandom().draws(0.5, 0.0, 0.6, 0.6));

        gateway.submit(buy("o1", "100"));
        gateway.cancel("o1");
        scheduler.runAll();

        assertEquals(1, reports.size());
        ExecReport report = reports.get(0);
        assertEquals(ExecStatus.CANCELLED, report.status());
        assertEquals(0, BigDecimal.ZERO.compareTo(report.filledQty()));
        assertEquals(0, BigDecimal.ZERO.compareTo(report.avgPx()));
        assertEquals(0, scheduler.pendingCount());
    }

    @Test
    @DisplayName("Cancel after one slice keeps the partial fill")
    void testCancelAfterPartialFill() {
        MockBrokerGateway gateway = gateway(TWO_SLICES, new ScriptedRandom().draws(0.5, 0.0, 0.0, 0.99));

        gateway.submit(buy("o1", "100"));
        scheduler.advanceBy(Duration.ZERO);

        assertEquals(1, reports.size());
        assertEquals(ExecStatus.PARTIAL, reports.get(0).status());
        assertEquals(0, new BigDecimal("10").compareTo(reports.get(0).filledQty()));

        gateway.cancel("o1");
        scheduler.advanceBy(Duration.ofMillis(79));
        assertEquals(1, reports.size(), "Cancel is honored only after the cancel latency");

        scheduler.advanceBy(Duration.ofMillis(1));
        scheduler.runAll();

        assertEquals(2, reports.size());
        ExecReport cancelled = reports.get(1);
        assertEquals(ExecStatus.CANCELLED, cancelled.status());
        assertEquals(0, BigDecimal.ZERO.compareTo(cancelled.filledQty()));
        assertEquals(0, new BigDecimal("100").compareTo(cancelled.avgPx()));
        assertEquals(OPEN.plusMillis(80), cancelled.timestamp());
    }

    @Test
    @DisplayName("Terminal status comes from remaining quantity, not slice order")
    void testOutOfOrderSlices() {
        // Slice 1 (10) fires late, slice 2 (90) fires first
        MockBrokerGateway gateway = gateway(TWO_SLICES, new ScriptedRandom().draws(0.5, 0.0, 0.99, 0.0));

        gateway.submit(buy("o1", "100"));
        scheduler.runAll();

        assertEquals(2, reports.size());
        assertEquals(ExecStatus.PARTIAL, reports.get(0).status());
        assertEquals(0, new BigDecimal("90").compareTo(reports.get(0).filledQty()));
        assertEquals(ExecStatus.FILLED, reports.get(1).status());
        assertEquals(0, new BigDecimal("10").compareTo(reports.get(1).filledQty()));
        assertEquals(OPEN.plusMillis(198), reports.get(1).timestamp());
    }

    @Test
    @DisplayName("Average price is the running VWAP")
    void testVwapAcrossPriceChanges() {
        MockBrokerGateway gateway = gateway(TWO_SLICES, new ScriptedRandom().draws(0.5, 0.0, 0.0, 0.99));

        gateway.submit(buy("o1", "100"));
        scheduler.advanceBy(Duration.ZERO);
        assertEquals(0, new BigDecimal("100").compareTo(reports.get(0).avgPx()));

        prices.updatePrice("NIFTY", new BigDecimal("110"), OPEN.plusMillis(100));
        scheduler.runAll();

        ExecReport filled = reports.get(1);
        assertEquals(ExecStatus.FILLED, filled.status());
        // (10 * 100 + 90 * 110) / 100
        assertEquals(new BigDecimal("109.000000"), filled.avgPx());
    }

    @Test
    @DisplayName("Duplicate submit is silently dropped")
    void testIdempotentSubmit() {
        MockBrokerGateway gateway = gateway(SimulatorConfig.builder().rejectRate(0.0).build(), new Random(7));

        gateway.submit(buy("o1", "100"));
        gateway.submit(buy("o1", "100"));
        scheduler.runAll();
        gateway.submit(buy("o1", "100"));
        scheduler.runAll();

        List<ExecReport> forO1 = reportsFor("o1");
        assertEquals(1, forO1.stream().filter(ExecReport::isTerminal).count());
        assertEquals(0, new BigDecimal("100").compareTo(totalFilled(forO1)));
        assertTrue(gateway.hasSeen("o1"));

        Map<String, Object> snapshot = metrics.getMetrics(MockBrokerGateway.GATEWAY_CODE);
        assertEquals(1L, snapshot.get("accepted"));
        assertEquals(2L, snapshot.get("duplicates"));
    }

    @Test
    @DisplayName("Fills conserve quantity and end with exactly one FILLED")
    void testQuantityConservation() {
        SimulatorConfig config = SimulatorConfig.builder().rejectRate(0.0).build();

        for (long seed = 0; seed < 50; seed++) {
            setUp();
            MockBrokerGateway gateway = gateway(config, new Random(seed));

            gateway.submit(buy("o" + seed, "37.5"));
            scheduler.runAll();

            assertEquals(0, new BigDecimal("37.5").compareTo(totalFilled(reports)), "seed " + seed);
            assertEquals(1, reports.stream().filter(ExecReport::isTerminal).count(), "seed " + seed);
            assertEquals(ExecStatus.FILLED, reports.get(reports.size() - 1).status(), "seed " + seed);
            reports.forEach(r -> assertTrue(r.filledQty().signum() > 0));
            assertEquals(0, gateway.inflightCount());
        }
    }

    @Test
    @DisplayName("No report follows a terminal report")
    void testNothingAfterTerminal() {
        MockBrokerGateway gateway = gateway(TWO_SLICES, new ScriptedRandom().draws(0.5, 0.0, 0.0, 0.0));

        gateway.submit(buy("o1", "100"));
        scheduler.runAll();
        assertEquals(ExecStatus.FILLED, reports.get(reports.size() - 1).status());
        int count = reports.size();

        gateway.cancel("o1");
        scheduler.runAll();

        assertEquals(count, reports.size());
    }

    @Test
    @DisplayName("Second cancel while one is pending is ignored")
    void testDoubleCancel() {
        MockBrokerGateway gateway = gateway(TWO_SLICES, new ScriptedRandom().draws(0.5, 0.0, 0.6, 0.6));

        gateway.submit(buy("o1", "100"));
        gateway.cancel("o1");
        gateway.cancel("o1");
        gateway.cancel("unknown");
        scheduler.runAll();

        assertEquals(1, reports.size());
        assertEquals(ExecStatus.CANCELLED, reports.get(0).status());
        assertEquals(1L, metrics.getMetrics(MockBrokerGateway.GATEWAY_CODE).get("cancelledOrders"));
    }

    @Test
    @DisplayName("Closed market rejects synchronously with zero fill")
    void testMarketClosedGate() {
        SimulatorConfig config = SimulatorConfig.builder().respectMarketHours(true).rejectRate(0.0).build();
        MockBrokerGateway gateway = MockBrokerGateway.builder()
            .priceOracle(prices)
            .listener(reports::add)
            .marketClock(SessionMarketClock.alwaysClosed())
            .config(config)
            .scheduler(scheduler)
            .random(new Random(1))
            .build();

        gateway.submit(buy("o1", "100"));

        assertEquals(1, reports.size(), "Reject is reported before submit returns");
        assertEquals(ExecStatus.REJECTED, reports.get(0).status());
        assertEquals(0, BigDecimal.ZERO.compareTo(reports.get(0).filledQty()));
        assertEquals(0, scheduler.runAll());

        // Gate-rejected id stays seen
        gateway.submit(buy("o1", "100"));
        assertEquals(1, reports.size());
    }

    @Test
    @DisplayName("Session clock gate follows the virtual clock")
    void testSessionClockGate() {
        scheduler = new VirtualEventScheduler(WEEKEND);
        SimulatorConfig config = SimulatorConfig.builder().respectMarketHours(true).rejectRate(0.0).build();
        MockBrokerGateway gateway = MockBrokerGateway.builder()
            .priceOracle(prices)
            .listener(reports::add)
            .marketClock(SessionMarketClock.nse())
            .config(config)
            .scheduler(scheduler)
            .random(new Random(1))
            .build();

        gateway.submit(buy("o1", "100"));

        assertEquals(ExecStatus.REJECTED, reports.get(0).status());
    }

    @Test
    @DisplayName("Market hours are ignored without a clock")
    void testNoClockSkipsGate() {
        SimulatorConfig config = SimulatorConfig.builder().respectMarketHours(true).rejectRate(0.0).build();
        MockBrokerGateway gateway = gateway(config, new Random(1));

        gateway.submit(buy("o1", "100"));
        scheduler.runAll();

        assertEquals(ExecStatus.FILLED, reports.get(reports.size() - 1).status());
    }

    @Test
    @DisplayName("BUY limit never reports a price above the limit")
    void testBuyLimitRespected() {
        SimulatorConfig config = SimulatorConfig.builder().rejectRate(0.0).build();
        BigDecimal limit = new BigDecimal("100.02");

        for (long seed = 0; seed < 20; seed++) {
            setUp();
            MockBrokerGateway gateway = gateway(config, new Random(seed));
            gateway.submit(Order.limit("b" + seed, "NIFTY", Side.BUY, new BigDecimal("10"), limit));
            scheduler.runAll();

            assertEquals(ExecStatus.FILLED, reports.get(reports.size() - 1).status());
            reports.forEach(r -> assertTrue(r.avgPx().compareTo(limit) <= 0, "avgPx " + r.avgPx()));
        }
    }

    @Test
    @DisplayName("SELL limit above the market is rejected without fills")
    void testSellLimitUnfillable() {
        MockBrokerGateway gateway = gateway(TWO_SLICES, new ScriptedRandom().draws(0.5, 0.0, 0.0, 0.99));

        gateway.submit(Order.limit("s1", "NIFTY", Side.SELL, new BigDecimal("100"), new BigDecimal("101")));
        scheduler.runAll();

        assertEquals(1, reports.size());
        assertEquals(ExecStatus.REJECTED, reports.get(0).status());
        assertEquals(0, BigDecimal.ZERO.compareTo(reports.get(0).filledQty()));
        assertFalse(gateway.isInflight("s1"));
        assertEquals(0, scheduler.pendingCount());
    }

    @Test
    @DisplayName("Price moving through the limit rejects the rest of the order")
    void testLimitRejectAfterPartial() {
        MockBrokerGateway gateway = gateway(TWO_SLICES, new ScriptedRandom().draws(0.5, 0.0, 0.0, 0.99));

        gateway.submit(Order.limit("b1", "NIFTY", Side.BUY, new BigDecimal("100"), new BigDecimal("105")));
        scheduler.advanceBy(Duration.ZERO);
        prices.updatePrice("NIFTY", new BigDecimal("106"), OPEN.plusMillis(50));
        scheduler.runAll();

        assertEquals(2, reports.size());
        assertEquals(ExecStatus.PARTIAL, reports.get(0).status());
        ExecReport rejected = reports.get(1);
        assertEquals(ExecStatus.REJECTED, rejected.status());
        assertEquals(0, BigDecimal.ZERO.compareTo(rejected.filledQty()));
        assertEquals(0, new BigDecimal("100").compareTo(rejected.avgPx()));
        assertEquals(1L, metrics.getMetrics(MockBrokerGateway.GATEWAY_CODE).get("rejects"));
    }

    @Test
    @DisplayName("Missing price rejects the order")
    void testMissingPrice() {
        MockBrokerGateway gateway = gateway(TWO_SLICES, new Random(3));

        gateway.submit(Order.market("u1", "UNPRICED", Side.BUY, new BigDecimal("5")));
        scheduler.runAll();

        assertEquals(1, reports.size());
        assertEquals(ExecStatus.REJECTED, reports.get(0).status());
        assertEquals(0, gateway.inflightCount());
    }

    @Test
    @DisplayName("Price withdrawn mid-order rejects the rest with the partial VWAP")
    void testHaltedPriceAfterPartial() {
        MockBrokerGateway gateway = gateway(TWO_SLICES, new ScriptedRandom().draws(0.5, 0.0, 0.0, 0.99));

        gateway.submit(buy("h1", "100"));
        scheduler.advanceBy(Duration.ZERO);
        prices.halt("NIFTY");
        scheduler.runAll();

        List<ExecReport> h1 = reportsFor("h1");
        assertEquals(2, h1.size());
        assertEquals(ExecStatus.PARTIAL, h1.get(0).status());
        assertEquals(0, new BigDecimal("10").compareTo(h1.get(0).filledQty()));
        assertEquals(ExecStatus.REJECTED, h1.get(1).status());
        assertEquals(0, new BigDecimal("100").compareTo(h1.get(1).avgPx()));
        assertFalse(gateway.isInflight("h1"));
    }

    @Test
    @DisplayName("Throwing price oracle is treated as no price")
    void testOracleException() {
        MockBrokerGateway gateway = MockBrokerGateway.builder()
            .priceOracle(symbol -> { throw new IllegalStateException("feed down"); })
            .listener(reports::add)
            .config(TWO_SLICES)
            .scheduler(scheduler)
            .random(new Random(3))
            .build();

        gateway.submit(buy("o1", "100"));
        scheduler.runAll();

        assertEquals(1, reports.size());
        assertEquals(ExecStatus.REJECTED, reports.get(0).status());
    }

    @Test
    @DisplayName("Throwing listener does not break the order")
    void testListenerException() {
        MockBrokerGateway gateway = MockBrokerGateway.builder()
            .priceOracle(prices)
            .listener(report -> {
                reports.add(report);
                if (report.status() == ExecStatus.PARTIAL) {
                    throw new IllegalStateException("consumer bug");
                }
            })
            .config(TWO_SLICES)
            .scheduler(scheduler)
            .random(new ScriptedRandom().draws(0.5, 0.0, 0.0, 0.99))
            .build();

        gateway.submit(buy("o1", "100"));
        scheduler.runAll();

        assertEquals(2, reports.size());
        assertEquals(ExecStatus.FILLED, reports.get(1).status());
        assertEquals(0, gateway.inflightCount());
    }

    @Test
    @DisplayName("Random risk reject uses the configured rate")
    void testRiskReject() {
        SimulatorConfig config = TWO_SLICES.toBuilder().rejectRate(0.2).build();
        MockBrokerGateway gateway = gateway(config, new ScriptedRandom().draws(0.1, 0.3));

        gateway.submit(buy("r1", "100"));
        assertEquals(1, reports.size());
        assertEquals(ExecStatus.REJECTED, reports.get(0).status());
        assertFalse(gateway.isInflight("r1"));

        gateway.submit(buy("r2", "100"));
        assertTrue(gateway.isInflight("r2"));
        assertEquals(List.of("r2"), gateway.inflightOrderIds());

        Map<String, Object> snapshot = metrics.getMetrics(MockBrokerGateway.GATEWAY_CODE);
        assertEquals(1L, snapshot.get("rejectedAtSubmit"));
        assertEquals(1L, snapshot.get("accepted"));
    }

    @Test
    @DisplayName("Submit after close is refused before the id is consumed")
    void testSubmitAfterClose() {
        MockBrokerGateway gateway = MockBrokerGateway.builder()
            .priceOracle(prices)
            .listener(reports::add)
            .config(TWO_SLICES)
            .metrics(metrics)
            .build();
        gateway.close();

        assertThrows(IllegalStateException.class, () -> gateway.submit(buy("o1", "100")));

        assertFalse(gateway.hasSeen("o1"));
        assertFalse(gateway.isInflight("o1"));
        assertEquals(0, gateway.inflightCount());
        assertTrue(reports.isEmpty());
    }

    @Test
    @DisplayName("Scheduling failure rolls the accept back")
    void testSchedulingFailureRollsBack() {
        ExecutorEventScheduler stopped = new ExecutorEventScheduler("Stopped");
        stopped.shutdown();
        MockBrokerGateway gateway = MockBrokerGateway.builder()
            .priceOracle(prices)
            .listener(reports::add)
            .config(TWO_SLICES)
            .scheduler(stopped)
            .random(new ScriptedRandom())
            .metrics(metrics)
            .build();

        assertThrows(IllegalStateException.class, () -> gateway.submit(buy("o1", "100")));

        assertFalse(gateway.hasSeen("o1"));
        assertEquals(0, gateway.inflightCount());
        assertTrue(reports.isEmpty());
        assertNull(metrics.getMetrics(MockBrokerGateway.GATEWAY_CODE).get("accepted"));
    }

    @Test
    @DisplayName("Malformed order fails fast and does not consume the id")
    void testInvalidOrder() {
        MockBrokerGateway gateway = gateway(SimulatorConfig.builder().rejectRate(0.0).build(), new Random(5));

        assertThrows(InvalidOrderException.class, () -> gateway.submit(buy("o1", "0")));
        assertTrue(reports.isEmpty());
        assertFalse(gateway.hasSeen("o1"));

        gateway.submit(buy("o1", "1"));
        scheduler.runAll();
        assertEquals(ExecStatus.FILLED, reports.get(reports.size() - 1).status());
    }

    @Test
    @DisplayName("Orders are independent of each other")
    void testOrdersIndependent() {
        SimulatorConfig config = SimulatorConfig.builder().rejectRate(0.0).build();
        MockBrokerGateway gateway = gateway(config, new Random(9));

        gateway.submit(buy("a", "10"));
        gateway.submit(Order.market("b", "UNPRICED", Side.SELL, new BigDecimal("10")));
        gateway.submit(buy("c", "10"));
        gateway.cancel("c");
        scheduler.runAll();

        assertEquals(ExecStatus.FILLED, reportsFor("a").get(reportsFor("a").size() - 1).status());
        assertEquals(ExecStatus.REJECTED, reportsFor("b").get(0).status());
        assertEquals(ExecStatus.CANCELLED, reportsFor("c").get(reportsFor("c").size() - 1).status());
        assertEquals(0, gateway.inflightCount());
    }
}
