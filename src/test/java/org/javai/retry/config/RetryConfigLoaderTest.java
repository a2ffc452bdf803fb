package org.javai.retry.config;

import org.javai.retry.RetryConfig;
import org.javai.retry.backoff.ExponentialBackoff;
import org.javai.retry.backoff.FixedBackoff;
import org.javai.retry.backoff.LinearBackoff;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;

import static org.assertj.core.api.Assertions.*;

class RetryConfigLoaderTest {

    private Properties properties;
    private Map<String, String> environment;

    @BeforeEach
    void setUp() {
        properties = new Properties();
        environment = new HashMap<>();
    }

    private RetryConfig load() {
        return RetryConfigLoader.from(properties, environment::get).load();
    }

    @Test
    void nothingSet_yieldsDefaults() {
        RetryConfig config = load();

        assertThat(config.maxAttempts()).isEqualTo(3);
        assertThat(config.backoff()).isEqualTo(LinearBackoff.defaults());
    }

    @Test
    void readsFixedBackoffFromProperties() {
        properties.setProperty("javai.retry.maxAttempts", "5");
        properties.setProperty("javai.retry.backoff", "fixed");
        properties.setProperty("javai.retry.interval", "PT0.25S");
        properties.setProperty("javai.retry.jitter", "0");

        RetryConfig config = load();

        assertThat(config.maxAttempts()).isEqualTo(5);
        assertThat(config.backoff()).isEqualTo(new FixedBackoff(Duration.ofMillis(250), 0));
    }

    @Test
    void readsExponentialBackoffWithMillisecondDurations() {
        properties.setProperty("javai.retry.backoff", "Exponential");
        properties.setProperty("javai.retry.base", "100");
        properties.setProperty("javai.retry.factor", "1.5");
        properties.setProperty("javai.retry.max", "5000");

        RetryConfig config = load();

        assertThat(config.backoff()).isEqualTo(
                new ExponentialBackoff(Duration.ofMillis(100), 1.5, Duration.ofSeconds(5), 0.1));
    }

    @Test
    void linearBackoff_usesDefaultsForUnsetKeys() {
        properties.setProperty("javai.retry.backoff", "linear");
        properties.setProperty("javai.retry.step", "PT2S");

        RetryConfig config = load();

        assertThat(config.backoff()).isEqualTo(
                new LinearBackoff(Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(10), 0.1));
    }

    @Test
    void fallsBackToEnvironment() {
        environment.put("JAVAI_RETRY_MAX_ATTEMPTS", "0");

        RetryConfig config = load();

        assertThat(config.maxAttempts()).isZero();
        assertThat(config.isBounded()).isFalse();
    }

    @Test
    void propertiesWinOverEnvironment() {
        properties.setProperty("javai.retry.maxAttempts", "7");
        environment.put("JAVAI_RETRY_MAX_ATTEMPTS", "2");

        assertThat(load().maxAttempts()).isEqualTo(7);
    }

    @Test
    void blankValuesAreIgnored() {
        properties.setProperty("javai.retry.maxAttempts", "  ");
        environment.put("JAVAI_RETRY_MAX_ATTEMPTS", "4");

        assertThat(load().maxAttempts()).isEqualTo(4);
    }

    @Test
    void backoffKeysWithoutType_selectLinear() {
        properties.setProperty("javai.retry.jitter", "0");
        properties.setProperty("javai.retry.max", "PT30S");

        assertThat(load().backoff()).isEqualTo(
                new LinearBackoff(Duration.ofSeconds(1), Duration.ofSeconds(1), Duration.ofSeconds(30), 0));
    }

    @Test
    void intervalWithoutType_selectsFixed() {
        environment.put("JAVAI_RETRY_INTERVAL", "200");

        assertThat(load().backoff()).isEqualTo(new FixedBackoff(Duration.ofMillis(200), 0.1));
    }

    @Test
    void factorWithoutType_selectsExponential() {
        properties.setProperty("javai.retry.factor", "3");

        assertThat(load().backoff()).isEqualTo(
                new ExponentialBackoff(Duration.ofSeconds(1), 3.0, Duration.ofSeconds(10), 0.1));
    }

    @Test
    void intervalAndFactorWithoutType_isAmbiguous() {
        properties.setProperty("javai.retry.interval", "100");
        properties.setProperty("javai.retry.factor", "2");

        assertThatThrownBy(this::load)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("javai.retry.backoff");
    }

    @Test
    void envVarName_convertsCamelCase() {
        assertThat(RetryConfigLoader.envVarName("maxAttempts")).isEqualTo("JAVAI_RETRY_MAX_ATTEMPTS");
        assertThat(RetryConfigLoader.envVarName("jitter")).isEqualTo("JAVAI_RETRY_JITTER");
    }

    @Test
    void malformedInteger_namesTheKey() {
        properties.setProperty("javai.retry.maxAttempts", "three");

        assertThatThrownBy(this::load)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("javai.retry.maxAttempts")
                .hasMessageContaining("three");
    }

    @Test
    void negativeMaxAttempts_isRejected() {
        properties.setProperty("javai.retry.maxAttempts", "-1");

        assertThatThrownBy(this::load)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxAttempts");
    }

    @Test
    void malformedDuration_namesTheKey() {
        properties.setProperty("javai.retry.backoff", "fixed");
        properties.setProperty("javai.retry.interval", "soon");

        assertThatThrownBy(this::load)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("javai.retry.interval");
    }

    @Test
    void unknownBackoff_isRejected() {
        properties.setProperty("javai.retry.backoff", "fibonacci");

        assertThatThrownBy(this::load)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("fibonacci")
                .hasMessageContaining("javai.retry.backoff");
    }

    @Test
    void invalidBackoffParameters_areReported() {
        properties.setProperty("javai.retry.backoff", "exponential");
        properties.setProperty("javai.retry.factor", "-3");

        assertThatThrownBy(this::load)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("exponential backoff")
                .hasMessageContaining("factor");
    }

    @Test
    void parseDuration_acceptsIsoAndMillis() {
        assertThat(RetryConfigLoader.parseDuration("interval", "1500")).isEqualTo(Duration.ofMillis(1500));
        assertThat(RetryConfigLoader.parseDuration("interval", "PT1M")).isEqualTo(Duration.ofMinutes(1));
    }
}
