package com.fleetload.scaler.config;

import com.fleetload.scaler.query.LoadMetric;
import lombok.Builder;
import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Configuration for the fleet load scaler, loaded from environment variables.
 * <p>
 * Immutable after startup; changing any value requires a restart.
 * </p>
 */
@Value
@Builder(toBuilder = true)
public class ScalerConfig {
    private static final Logger log = LoggerFactory.getLogger(ScalerConfig.class);

    String nodeId;

    // Fleet subject the refresh loop collects from
    String monitoredComponent;
    String monitoredEndpoint;

    // Listeners
    String grpcHost;
    int grpcPort;
    int httpPort;

    // Scaling parameters
    double defaultThreshold;
    Duration refreshInterval;
    Duration collectTimeout;
    @Builder.Default
    Set<LoadMetric> supportedMetrics = Collections.unmodifiableSet(EnumSet.of(LoadMetric.LOAD_AVG));

    // Prometheus configuration
    String prometheusHost;
    int prometheusPort;
    String workerLabel;

    public static ScalerConfig fromEnv() {
        return fromSource(System::getenv);
    }

    /**
     * Builds and validates a configuration from a key lookup.
     *
     * @param env lookup returning the raw value for a key, or null when unset
     * @return validated configuration
     * @throws IllegalArgumentException if a value is malformed or out of range
     */
    public static ScalerConfig fromSource(UnaryOperator<String> env) {
        ScalerConfig config = ScalerConfig.builder()
            .nodeId(getEnv(env, "NODE_ID", "fleet-load-scaler-1"))
            .monitoredComponent(getEnv(env, "COMPONENT_NAME", "llm-worker"))
            .monitoredEndpoint(getEnv(env, "ENDPOINT_NAME", "kv-metrics"))
            .grpcHost(getEnv(env, "GRPC_HOST", "0.0.0.0"))
            .grpcPort(parseInt(env, "GRPC_PORT", "9090"))
            .httpPort(parseInt(env, "HTTP_PORT", "8080"))
            .defaultThreshold(parseDouble(env, "LOAD_THRESHOLD", "0.7"))
            .refreshInterval(Duration.ofSeconds(parseInt(env, "CHECK_INTERVAL_SEC", "5")))
            .collectTimeout(Duration.ofMillis(parseInt(env, "COLLECT_TIMEOUT_MS", "300")))
            .supportedMetrics(parseMetrics(getEnv(env, "SUPPORTED_METRICS", LoadMetric.LOAD_AVG.getMetricName())))
            .prometheusHost(getEnv(env, "PROMETHEUS_HOST", "prometheus"))
            .prometheusPort(parseInt(env, "PROMETHEUS_PORT", "9090"))
            .workerLabel(getEnv(env, "WORKER_LABEL", "worker_id"))
            .build();
        config.validate();
        return config;
    }

    /**
     * Checks ranges and cross-field constraints.
     *
     * @throws IllegalArgumentException on the first violated constraint
     */
    public void validate() {
        requireText(monitoredComponent, "COMPONENT_NAME");
        requireText(monitoredEndpoint, "ENDPOINT_NAME");
        requireText(workerLabel, "WORKER_LABEL");
        requirePort(grpcPort, "GRPC_PORT");
        requirePort(httpPort, "HTTP_PORT");
        requirePort(prometheusPort, "PROMETHEUS_PORT");

        if (!Double.isFinite(defaultThreshold) || defaultThreshold < 0) {
            throw new IllegalArgumentException("LOAD_THRESHOLD must be a finite non-negative number, got " + defaultThreshold);
        }
        if (refreshInterval == null || refreshInterval.isZero() || refreshInterval.isNegative()) {
            throw new IllegalArgumentException("CHECK_INTERVAL_SEC must be positive, got " + refreshInterval);
        }
        if (collectTimeout == null || collectTimeout.isZero() || collectTimeout.isNegative()) {
            throw new IllegalArgumentException("COLLECT_TIMEOUT_MS must be positive, got " + collectTimeout);
        }
        if (supportedMetrics == null || supportedMetrics.isEmpty()) {
            throw new IllegalArgumentException("SUPPORTED_METRICS must name at least one metric");
        }
        if (collectTimeout.compareTo(refreshInterval) >= 0) {
            log.warn("Collect timeout {} is not shorter than refresh interval {}; slow collections will skip ticks",
                collectTimeout, refreshInterval);
        }
    }

    private static Set<LoadMetric> parseMetrics(String value) {
        Set<LoadMetric> metrics = Arrays.stream(value.split(","))
            .map(String::trim)
            .filter(name -> !name.isEmpty())
            .map(name -> LoadMetric.fromName(name)
                .orElseThrow(() -> new IllegalArgumentException("SUPPORTED_METRICS names unknown metric: " + name)))
            .collect(Collectors.toCollection(() -> EnumSet.noneOf(LoadMetric.class)));
        return Collections.unmodifiableSet(metrics);
    }

    private static int parseInt(UnaryOperator<String> env, String key, String defaultValue) {
        String value = getEnv(env, key, defaultValue);
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer, got '" + value + "'", e);
        }
    }

    private static double parseDouble(UnaryOperator<String> env, String key, String defaultValue) {
        String value = getEnv(env, key, defaultValue);
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be a number, got '" + value + "'", e);
        }
    }

    private static void requireText(String value, String key) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(key + " must not be empty");
        }
    }

    private static void requirePort(int port, String key) {
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException(key + " must be a valid port, got " + port);
        }
    }

    private static String getEnv(UnaryOperator<String> env, String key, String defaultValue) {
        String value = env.apply(key);
        return value != null ? value : defaultValue;
    }
}
