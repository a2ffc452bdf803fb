package org.javai.retry.config;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

import org.javai.retry.RetryConfig;
import org.javai.retry.backoff.Backoff;
import org.javai.retry.backoff.ExponentialBackoff;
import org.javai.retry.backoff.FixedBackoff;
import org.javai.retry.backoff.LinearBackoff;

/**
 * Builds a {@link RetryConfig} from key/value settings.
 *
 * <p>Each key is resolved from the supplied {@link Properties}, then the JVM system property of
 * the same name, then an environment variable (upper case, dots and camel case turned into
 * underscores). Unset keys keep the defaults of {@link RetryConfig#defaults()}.</p>
 *
 * <table>
 *   <caption>Recognised keys</caption>
 *   <tr><th>Property</th><th>Environment</th><th>Meaning</th></tr>
 *   <tr><td>javai.retry.maxAttempts</td><td>JAVAI_RETRY_MAX_ATTEMPTS</td><td>attempt limit, 0 = unbounded</td></tr>
 *   <tr><td>javai.retry.backoff</td><td>JAVAI_RETRY_BACKOFF</td><td>fixed, linear or exponential</td></tr>
 *   <tr><td>javai.retry.interval</td><td>JAVAI_RETRY_INTERVAL</td><td>fixed delay</td></tr>
 *   <tr><td>javai.retry.base</td><td>JAVAI_RETRY_BASE</td><td>first delay (linear, exponential)</td></tr>
 *   <tr><td>javai.retry.step</td><td>JAVAI_RETRY_STEP</td><td>increment (linear)</td></tr>
 *   <tr><td>javai.retry.factor</td><td>JAVAI_RETRY_FACTOR</td><td>multiplier (exponential)</td></tr>
 *   <tr><td>javai.retry.max</td><td>JAVAI_RETRY_MAX</td><td>delay cap, 0 = none</td></tr>
 *   <tr><td>javai.retry.jitter</td><td>JAVAI_RETRY_JITTER</td><td>jitter fraction</td></tr>
 * </table>
 *
 * <p>When {@code javai.retry.backoff} is unset but other backoff keys are, the type follows from
 * them: {@code interval} selects fixed, {@code factor} selects exponential, anything else linear.</p>
 *
 * <p>Durations are ISO-8601 ({@code PT1.5S}) or a whole number of milliseconds.</p>
 */
public final class RetryConfigLoader {

    public static final String PREFIX = "javai.retry.";

    static final String MAX_ATTEMPTS = "maxAttempts";
    static final String BACKOFF = "backoff";
    static final String INTERVAL = "interval";
    static final String BASE = "base";
    static final String STEP = "step";
    static final String FACTOR = "factor";
    static final String MAX = "max";
    static final String JITTER = "jitter";

    private static final Duration DEFAULT_DELAY = Duration.ofSeconds(1);
    private static final Duration DEFAULT_MAX = Duration.ofSeconds(10);
    private static final double DEFAULT_FACTOR = 2.0;
    private static final double DEFAULT_JITTER = 0.1;

    private final Properties properties;
    private final UnaryOperator<String> environment;

    private RetryConfigLoader(Properties properties, UnaryOperator<String> environment) {
        this.properties = Objects.requireNonNull(properties, "properties must not be null");
        this.environment = Objects.requireNonNull(environment, "environment must not be null");
    }

    /**
     * A loader reading only system properties and environment variables.
     */
    public static RetryConfigLoader fromSystem() {
        return new RetryConfigLoader(new Properties(), System::getenv);
    }

    /**
     * A loader reading {@code properties} first, then system properties and environment variables.
     */
    public static RetryConfigLoader from(Properties properties) {
        return new RetryConfigLoader(properties, System::getenv);
    }

    /**
     * Package-private for testing: replaces the environment lookup.
     */
    static RetryConfigLoader from(Properties properties, UnaryOperator<String> environment) {
        return new RetryConfigLoader(properties, environment);
    }

    /**
     * Resolves all keys into a policy.
     *
     * @return the configured policy
     * @throws IllegalArgumentException if a value is malformed or out of range
     */
    public RetryConfig load() {
        RetryConfig.Builder builder = RetryConfig.builder();
        String maxAttempts = resolve(MAX_ATTEMPTS);
        if (maxAttempts != null) {
            builder.maxAttempts(parseInt(MAX_ATTEMPTS, maxAttempts));
        }
        Backoff backoff = loadBackoff();
        if (backoff != null) {
            builder.backoff(backoff);
        }
        try {
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid retry configuration: " + e.getMessage(), e);
        }
    }

    private Backoff loadBackoff() {
        String type = resolve(BACKOFF);
        if (type == null) {
            type = inferBackoffType();
            if (type == null) {
                return null;
            }
        }
        double jitter = doubleOrDefault(JITTER, DEFAULT_JITTER);
        switch (type.trim().toLowerCase(Locale.ROOT)) {
            case "fixed": {
                Duration interval = durationOrDefault(INTERVAL, DEFAULT_DELAY);
                return construct(type, () -> new FixedBackoff(interval, jitter));
            }
            case "linear": {
                Duration base = durationOrDefault(BASE, DEFAULT_DELAY);
                Duration step = durationOrDefault(STEP, DEFAULT_DELAY);
                Duration max = durationOrDefault(MAX, DEFAULT_MAX);
                return construct(type, () -> new LinearBackoff(base, step, max, jitter));
            }
            case "exponential": {
                Duration base = durationOrDefault(BASE, DEFAULT_DELAY);
                double factor = doubleOrDefault(FACTOR, DEFAULT_FACTOR);
                Duration max = durationOrDefault(MAX, DEFAULT_MAX);
                return construct(type, () -> new ExponentialBackoff(base, factor, max, jitter));
            }
            default:
                throw new IllegalArgumentException("Unknown backoff '" + type + "' for " + PREFIX + BACKOFF
                        + ", expected fixed, linear or exponential");
        }
    }

    /**
     * Picks a backoff type from the parameter keys that are set when {@code backoff} itself is not.
     *
     * @return the inferred type, or null if no backoff key is set
     */
    private String inferBackoffType() {
        boolean interval = resolve(INTERVAL) != null;
        boolean factor = resolve(FACTOR) != null;
        if (interval && factor) {
            throw new IllegalArgumentException("Both " + PREFIX + INTERVAL + " and " + PREFIX + FACTOR
                    + " are set; set " + PREFIX + BACKOFF + " to choose between fixed and exponential");
        }
        if (interval) {
            return "fixed";
        }
        if (factor) {
            return "exponential";
        }
        if (resolve(BASE) != null || resolve(STEP) != null || resolve(MAX) != null || resolve(JITTER) != null) {
            return "linear";
        }
        return null;
    }

    private static Backoff construct(String type, Supplier<Backoff> constructor) {
        try {
            return constructor.get();
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid " + type + " backoff: " + e.getMessage(), e);
        }
    }

    /**
     * Resolves a key from properties, then system properties, then the environment.
     *
     * @return the value, or null if the key is set nowhere
     */
    String resolve(String key) {
        String name = PREFIX + key;
        String value = properties.getProperty(name);
        if (isBlank(value)) {
            value = System.getProperty(name);
        }
        if (isBlank(value)) {
            value = environment.apply(envVarName(key));
        }
        return isBlank(value) ? null : value.trim();
    }

    /**
     * {@code maxAttempts} becomes {@code JAVAI_RETRY_MAX_ATTEMPTS}.
     */
    static String envVarName(String key) {
        String snake = key.replaceAll("([a-z0-9])([A-Z])", "$1_$2").replace('.', '_');
        return (PREFIX.replace('.', '_') + snake).toUpperCase(Locale.ROOT);
    }

    private Duration durationOrDefault(String key, Duration defaultValue) {
        String value = resolve(key);
        return value == null ? defaultValue : parseDuration(key, value);
    }

    private double doubleOrDefault(String key, double defaultValue) {
        String value = resolve(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw invalid(key, value, "a number", e);
        }
    }

    static Duration parseDuration(String key, String value) {
        if (value.chars().allMatch(Character::isDigit)) {
            try {
                return Duration.ofMillis(Long.parseLong(value));
            } catch (NumberFormatException e) {
                throw invalid(key, value, "a duration", e);
            }
        }
        try {
            return Duration.parse(value);
        } catch (DateTimeParseException e) {
            throw invalid(key, value, "a duration", e);
        }
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw invalid(key, value, "an integer", e);
        }
    }

    private static IllegalArgumentException invalid(String key, String value, String expected, Exception cause) {
        return new IllegalArgumentException(
                "Invalid value '" + value + "' for " + PREFIX + key + ": expected " + expected, cause);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
