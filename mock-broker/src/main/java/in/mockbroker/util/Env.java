package in.mockbroker.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Function;

/**
 * Environment variable utilities. System properties are consulted when the variable is unset,
 * which lets tests override settings without touching the process environment.
 *
 * Unparsable numbers fall back to the default with a warning.
 */
public final class Env {
    private static final Logger log = LoggerFactory.getLogger(Env.class);

    public static String get(String key, String defaultValue) {
        String value = System.getenv(key);
        if (value == null || value.isEmpty()) {
            value = System.getProperty(key);
        }
        return value != null && !value.isEmpty() ? value : defaultValue;
    }

    public static int getInt(String key, int defaultValue) {
        return parse(key, defaultValue, Integer::parseInt);
    }

    public static long getLong(String key, long defaultValue) {
        return parse(key, defaultValue, Long::parseLong);
    }

    public static double getDouble(String key, double defaultValue) {
        return parse(key, defaultValue, Double::parseDouble);
    }

    public static boolean getBool(String key, boolean defaultValue) {
        String value = get(key, null);
        if (value == null) return defaultValue;
        return "true".equalsIgnoreCase(value.trim()) || "1".equals(value.trim());
    }

    private static <T> T parse(String key, T defaultValue, Function<String, T> parser) {
        String value = get(key, null);
        if (value == null) return defaultValue;
        try {
            return parser.apply(value.trim());
        } catch (NumberFormatException e) {
            log.warn("[Env] Ignoring {}={}: not a number, using {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    private Env() {}
}
