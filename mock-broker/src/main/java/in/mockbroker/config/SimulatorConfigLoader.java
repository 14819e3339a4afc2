package in.mockbroker.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.ValueInstantiationException;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.mockbroker.util.Env;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads {@link SimulatorConfig} from JSON and environment overrides.
 *
 * JSON fields that are absent keep their default; unknown fields are rejected.
 *
 * Environment overrides (env var or system property):
 * MOCK_BROKER_CONFIG (path to a JSON file), MOCK_BROKER_VENUE_LATENCY_MS, MOCK_BROKER_LATENCY_JITTER_MS,
 * MOCK_BROKER_PARTIAL_FILL, MOCK_BROKER_MIN_SLICES, MOCK_BROKER_MAX_SLICES, MOCK_BROKER_REJECT_RATE,
 * MOCK_BROKER_CANCEL_LATENCY_MS, MOCK_BROKER_FEE_BPS, MOCK_BROKER_SLIPPAGE_BPS,
 * MOCK_BROKER_RESPECT_MARKET_HOURS.
 */
public final class SimulatorConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(SimulatorConfigLoader.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private SimulatorConfigLoader() {}

    /**
     * Resolve the effective configuration: JSON file named by MOCK_BROKER_CONFIG (if set),
     * else defaults, then environment overrides on top.
     */
    public static SimulatorConfig load() throws IOException {
        String path = Env.get("MOCK_BROKER_CONFIG", null);
        SimulatorConfig base = path != null ? fromFile(Path.of(path)) : SimulatorConfig.defaults();
        SimulatorConfig effective = withEnvOverrides(base);
        log.info("[SimulatorConfigLoader] Effective config: {}", effective);
        return effective;
    }

    public static SimulatorConfig fromJson(String json) throws IOException {
        return merge(MAPPER.readTree(json));
    }

    public static SimulatorConfig fromFile(Path path) throws IOException {
        log.info("[SimulatorConfigLoader] Reading simulator config from {}", path);
        try (InputStream in = Files.newInputStream(path)) {
            return fromStream(in);
        }
    }

    public static SimulatorConfig fromResource(String resource) throws IOException {
        try (InputStream in = SimulatorConfigLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IOException("Config resource not found: " + resource);
            }
            return fromStream(in);
        }
    }

    public static SimulatorConfig fromStream(InputStream in) throws IOException {
        return merge(MAPPER.readTree(in));
    }

    /**
     * Apply MOCK_BROKER_* overrides on top of the given config.
     */
    public static SimulatorConfig withEnvOverrides(SimulatorConfig base) {
        return base.toBuilder()
            .venueLatencyMs(Env.getLong("MOCK_BROKER_VENUE_LATENCY_MS", base.venueLatencyMs()))
            .latencyJitterMs(Env.getLong("MOCK_BROKER_LATENCY_JITTER_MS", base.latencyJitterMs()))
            .partialFill(Env.getBool("MOCK_BROKER_PARTIAL_FILL", base.partialFill()))
            .slices(Env.getInt("MOCK_BROKER_MIN_SLICES", base.minSlices()),
                    Env.getInt("MOCK_BROKER_MAX_SLICES", base.maxSlices()))
            .rejectRate(Env.getDouble("MOCK_BROKER_REJECT_RATE", base.rejectRate()))
            .cancelLatencyMs(Env.getLong("MOCK_BROKER_CANCEL_LATENCY_MS", base.cancelLatencyMs()))
            .feeBps(Env.getDouble("MOCK_BROKER_FEE_BPS", base.feeBps()))
            .slippageBps(Env.getDouble("MOCK_BROKER_SLIPPAGE_BPS", base.slippageBps()))
            .respectMarketHours(Env.getBool("MOCK_BROKER_RESPECT_MARKET_HOURS", base.respectMarketHours()))
            .build();
    }

    private static SimulatorConfig merge(JsonNode overrides) throws IOException {
        if (overrides == null || !overrides.isObject()) {
            throw new IOException("Simulator config must be a JSON object");
        }
        ObjectNode merged = MAPPER.valueToTree(SimulatorConfig.defaults());
        merged.setAll((ObjectNode) overrides);
        try {
            return MAPPER.treeToValue(merged, SimulatorConfig.class);
        } catch (ValueInstantiationException e) {
            // Surface validation failures from the record constructor as-is
            if (e.getCause() instanceof IllegalArgumentException iae) {
                throw iae;
            }
            throw e;
        }
    }
}
