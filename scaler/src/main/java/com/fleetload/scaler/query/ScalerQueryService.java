package com.fleetload.scaler.query;

import com.fleetload.core.metrics.MetricsNames;
import com.fleetload.core.metrics.MetricsTags;
import com.fleetload.core.model.LoadSnapshot;
import com.fleetload.scaler.config.ScalerConfig;
import com.fleetload.scaler.snapshot.ISnapshotStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Server side of the external scaler protocol, independent of its wire encoding.
 * <p>
 * Answers come from the snapshot store only; no call ever waits on the fleet.
 * <ul>
 *   <li>{@link ScalerOperation#IS_ACTIVE}: always active, the fleet is never scaled to zero</li>
 *   <li>{@link ScalerOperation#STREAM_IS_ACTIVE}: rejected, scaling is pull-based</li>
 *   <li>{@link ScalerOperation#GET_METRIC_SPEC}: one spec per supported metric, target from metadata</li>
 *   <li>{@link ScalerOperation#GET_METRICS}: cached value, zero load before the first refresh</li>
 * </ul>
 * </p>
 */
public class ScalerQueryService {
    private static final Logger log = LoggerFactory.getLogger(ScalerQueryService.class);

    // Plain decimal literal: no surrounding whitespace, type suffix or hex form
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private final ScalerConfig config;
    private final ISnapshotStore store;

    private final Map<ScalerOperation, Counter> accepted = new EnumMap<>(ScalerOperation.class);
    private final Map<ScalerOperation, Counter> rejected = new EnumMap<>(ScalerOperation.class);

    public ScalerQueryService(ScalerConfig config, ISnapshotStore store, MeterRegistry meterRegistry) {
        this.config = config;
        this.store = store;

        for (ScalerOperation operation : ScalerOperation.values()) {
            accepted.put(operation, requestCounter(meterRegistry, operation, "ok"));
            rejected.put(operation, requestCounter(meterRegistry, operation, "rejected"));
        }
    }

    /**
     * Activity check. Always true: a fleet scaled to zero could not serve the next request.
     *
     * @param ref scaled object, may be null or empty
     * @return Mono of true
     */
    public Mono<Boolean> isActive(ScaledObjectRef ref) {
        return Mono.fromSupplier(() -> {
            log.debug("IsActive check for {} - always returning true to prevent scaling to zero", ref);
            accepted.get(ScalerOperation.IS_ACTIVE).increment();
            return true;
        });
    }

    /**
     * Push-based activity stream. Not supported.
     *
     * @param ref scaled object, ignored
     * @return Flux failing with {@link ScalerException.Reason#UNIMPLEMENTED}
     */
    public Flux<Boolean> streamIsActive(ScaledObjectRef ref) {
        return Flux.defer(() -> {
            log.debug("StreamIsActive called for {} but not implemented", ref);
            rejected.get(ScalerOperation.STREAM_IS_ACTIVE).increment();
            return Flux.error(ScalerException.unimplemented(
                ScalerOperation.STREAM_IS_ACTIVE, "Use pull-based scaling instead."));
        });
    }

    /**
     * Metric specs for a scaled object, one per supported metric.
     *
     * @param ref scaled object whose metadata may override the target thresholds
     * @return Mono of the specs
     */
    public Mono<List<MetricSpec>> getMetricSpec(ScaledObjectRef ref) {
        return Mono.fromSupplier(() -> {
            Map<String, String> metadata = ref != null && ref.getScalerMetadata() != null
                ? ref.getScalerMetadata()
                : Map.of();

            List<MetricSpec> specs = config.getSupportedMetrics().stream()
                .map(metric -> new MetricSpec(metric.getMetricName(), threshold(metadata, metric)))
                .toList();

            log.debug("Providing metric specs for scaled object {}: {}", ref, specs);
            accepted.get(ScalerOperation.GET_METRIC_SPEC).increment();
            return specs;
        });
    }

    /**
     * Current value of a supported metric.
     * <p>
     * The name is validated before the store is touched. Before the first successful refresh
     * the value reads as zero load.
     * </p>
     *
     * @param query requested metric
     * @return Mono of the values, or {@link ScalerException.Reason#INVALID_ARGUMENT} for an unknown name
     */
    public Mono<List<MetricValue>> getMetrics(MetricsQuery query) {
        return Mono.defer(() -> {
            String metricName = query != null ? query.metricName() : null;
            Optional<LoadMetric> metric = LoadMetric.fromName(metricName)
                .filter(config.getSupportedMetrics()::contains);

            if (metric.isEmpty()) {
                log.debug("Rejecting metrics request for unknown metric '{}'", metricName);
                rejected.get(ScalerOperation.GET_METRICS).increment();
                return Mono.error(ScalerException.unknownMetric(metricName));
            }

            LoadSnapshot snapshot = store.read().orElseGet(() -> {
                log.debug("No metrics snapshot available, returning default metrics");
                return LoadSnapshot.empty();
            });

            accepted.get(ScalerOperation.GET_METRICS).increment();
            return Mono.just(List.of(new MetricValue(metric.get().getMetricName(), metric.get().extract(snapshot))));
        });
    }

    /**
     * Target for a metric: the metadata override when it is a plain decimal literal for a
     * finite, non-negative number, otherwise the configured default.
     */
    double threshold(Map<String, String> metadata, LoadMetric metric) {
        String raw = metadata.get(metric.getThresholdKey());
        if (raw == null) {
            return config.getDefaultThreshold();
        }
        if (!DECIMAL.matcher(raw).matches()) {
            log.debug("Ignoring malformed {}='{}'", metric.getThresholdKey(), raw);
            return config.getDefaultThreshold();
        }

        double value = Double.parseDouble(raw);
        if (Double.isFinite(value) && value >= 0) {
            return value;
        }

        log.debug("Ignoring out-of-range {}='{}'", metric.getThresholdKey(), raw);
        return config.getDefaultThreshold();
    }

    private static Counter requestCounter(MeterRegistry meterRegistry, ScalerOperation operation, String outcome) {
        return Counter.builder(MetricsNames.SCALER_REQUESTS_TOTAL)
            .tag(MetricsTags.OPERATION, operation.getRpcMethod())
            .tag(MetricsTags.OUTCOME, outcome)
            .register(meterRegistry);
    }
}
