package com.fleetload.scaler.query;

import com.fleetload.core.metrics.MetricsNames;
import com.fleetload.core.metrics.MetricsTags;
import com.fleetload.core.model.LoadSnapshot;
import com.fleetload.scaler.config.ScalerConfig;
import com.fleetload.scaler.snapshot.ISnapshotStore;
import com.fleetload.scaler.snapshot.SnapshotStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ScalerQueryServiceTest {

    private CountingStore store;
    private SimpleMeterRegistry meterRegistry;
    private ScalerQueryService queryService;

    @BeforeEach
    void setUp() {
        ScalerConfig config = ScalerConfig.builder()
            .nodeId("scaler-test")
            .monitoredComponent("llm-worker")
            .monitoredEndpoint("kv-metrics")
            .grpcHost("localhost")
            .grpcPort(0)
            .httpPort(0)
            .defaultThreshold(0.7)
            .refreshInterval(Duration.ofSeconds(5))
            .collectTimeout(Duration.ofMillis(300))
            .prometheusHost("prometheus")
            .prometheusPort(9090)
            .workerLabel("worker_id")
            .build();

        store = new CountingStore();
        meterRegistry = new SimpleMeterRegistry();
        queryService = new ScalerQueryService(config, store, meterRegistry);
    }

    // ========== IsActive ==========

    @Test
    @DisplayName("Activity check is always true, whatever the input")
    void testIsActiveAlwaysTrue() {
        List<ScaledObjectRef> refs = new ArrayList<>();
        refs.add(null);
        refs.add(ScaledObjectRef.builder().build());
        refs.add(ScaledObjectRef.builder().namespace("").name("").scalerMetadata(Map.of("junk", "???")).build());
        refs.add(ref(Map.of()));

        for (ScaledObjectRef ref : refs) {
            StepVerifier.create(queryService.isActive(ref))
                .expectNext(true)
                .verifyComplete();
        }
        assertEquals(0, store.reads.get());
    }

    // ========== StreamIsActive ==========

    @Test
    void testStreamIsActiveIsUnimplemented() {
        for (ScaledObjectRef ref : new ScaledObjectRef[]{null, ref(Map.of())}) {
            StepVerifier.create(queryService.streamIsActive(ref))
                .expectErrorMatches(err -> err instanceof ScalerException scalerException
                    && scalerException.getReason() == ScalerException.Reason.UNIMPLEMENTED
                    && err.getMessage().contains("pull-based"))
                .verify();
        }
        assertEquals(2.0, requestCount(ScalerOperation.STREAM_IS_ACTIVE, "rejected"));
    }

    // ========== GetMetricSpec ==========

    @Test
    void testMetricSpecUsesDefaultWithoutOverride() {
        StepVerifier.create(queryService.getMetricSpec(ref(Map.of())))
            .expectNext(List.of(new MetricSpec("llm_load_avg", 0.7)))
            .verifyComplete();
    }

    @Test
    void testMetricSpecUsesValidOverride() {
        StepVerifier.create(queryService.getMetricSpec(ref(Map.of("loadAvgThreshold", "0.55"))))
            .expectNext(List.of(new MetricSpec("llm_load_avg", 0.55)))
            .verifyComplete();
    }

    @Test
    @DisplayName("Unusable overrides fall back to the default instead of failing")
    void testMetricSpecFallsBackOnInvalidOverride() {
        for (String raw : List.of("high", "", "NaN", "Infinity", "-0.3", "1e999",
                "0.5f", "0.5d", "0.5F", " 0.5 ", "0.5\n", "0x1p-1", "0x0.8p0")) {
            StepVerifier.create(queryService.getMetricSpec(ref(Map.of("loadAvgThreshold", raw))))
                .expectNext(List.of(new MetricSpec("llm_load_avg", 0.7)))
                .verifyComplete();
        }
    }

    @Test
    void testMetricSpecAcceptsPlainDecimalForms() {
        Map<String, Double> accepted = Map.of("0.5", 0.5, ".5", 0.5, "5.", 5.0, "+0.25", 0.25, "2.5e-1", 0.25, "0", 0.0);

        accepted.forEach((raw, expected) ->
            StepVerifier.create(queryService.getMetricSpec(ref(Map.of("loadAvgThreshold", raw))))
                .expectNext(List.of(new MetricSpec("llm_load_avg", expected)))
                .verifyComplete());
    }

    @Test
    void testMetricSpecWithNullRefUsesDefault() {
        StepVerifier.create(queryService.getMetricSpec(null))
            .expectNext(List.of(new MetricSpec("llm_load_avg", 0.7)))
            .verifyComplete();
    }

    @Test
    void testMetricSpecIsIdempotentAndNeverReadsStore() {
        store.publish(snapshot(0.9));
        ScaledObjectRef ref = ref(Map.of("loadAvgThreshold", "0.4"));

        List<MetricSpec> first = queryService.getMetricSpec(ref).block();
        List<MetricSpec> second = queryService.getMetricSpec(ref).block();

        assertEquals(first, second);
        assertEquals(0, store.reads.get());
        assertEquals(1, store.publishes.get());
    }

    // ========== GetMetrics ==========

    @Test
    @DisplayName("Unknown metric is rejected without touching the store")
    void testUnknownMetricRejectedWithoutStoreRead() {
        StepVerifier.create(queryService.getMetrics(new MetricsQuery(ref(Map.of()), "unsupported-name")))
            .expectErrorMatches(err -> err instanceof ScalerException scalerException
                && scalerException.getReason() == ScalerException.Reason.INVALID_ARGUMENT
                && err.getMessage().equals("Unknown metric: unsupported-name"))
            .verify();

        assertEquals(0, store.reads.get());
        assertEquals(1.0, requestCount(ScalerOperation.GET_METRICS, "rejected"));
    }

    @Test
    void testNullQueryRejected() {
        StepVerifier.create(queryService.getMetrics(null))
            .expectError(ScalerException.class)
            .verify();

        assertEquals(0, store.reads.get());
    }

    @Test
    @DisplayName("No snapshot yet reads as zero load, not as an error")
    void testMetricsBeforeFirstRefreshAreZero() {
        StepVerifier.create(queryService.getMetrics(new MetricsQuery(null, "llm_load_avg")))
            .expectNext(List.of(new MetricValue("llm_load_avg", 0.0)))
            .verifyComplete();

        assertEquals(1, store.reads.get());
    }

    @Test
    void testMetricsServeLatestSnapshot() {
        store.publish(snapshot(0.42));

        StepVerifier.create(queryService.getMetrics(new MetricsQuery(ref(Map.of()), "llm_load_avg")))
            .expectNext(List.of(new MetricValue("llm_load_avg", 0.42)))
            .verifyComplete();

        store.publish(snapshot(0.61));

        StepVerifier.create(queryService.getMetrics(new MetricsQuery(ref(Map.of()), "llm_load_avg")))
            .expectNext(List.of(new MetricValue("llm_load_avg", 0.61)))
            .verifyComplete();

        assertEquals(2.0, requestCount(ScalerOperation.GET_METRICS, "ok"));
    }

    @Test
    void testStoreIsReadAtSubscriptionNotAssembly() {
        Mono<List<MetricValue>> pending = queryService.getMetrics(new MetricsQuery(null, "llm_load_avg"));
        store.publish(snapshot(0.33));

        StepVerifier.create(pending)
            .expectNext(List.of(new MetricValue("llm_load_avg", 0.33)))
            .verifyComplete();
    }

    private static ScaledObjectRef ref(Map<String, String> metadata) {
        return ScaledObjectRef.builder()
            .namespace("inference")
            .name("llm-worker")
            .scalerMetadata(new HashMap<>(metadata))
            .build();
    }

    private static LoadSnapshot snapshot(double loadAverage) {
        return LoadSnapshot.builder()
            .loadAverage(loadAverage)
            .endpointCount(1)
            .endpointLoads(Map.of("w1", loadAverage))
            .collectedAtMs(1L)
            .build();
    }

    private double requestCount(ScalerOperation operation, String outcome) {
        return meterRegistry.get(MetricsNames.SCALER_REQUESTS_TOTAL)
            .tag(MetricsTags.OPERATION, operation.getRpcMethod())
            .tag(MetricsTags.OUTCOME, outcome)
            .counter()
            .count();
    }

    /**
     * Store wrapper counting accesses.
     */
    private static class CountingStore implements ISnapshotStore {
        private final SnapshotStore delegate = new SnapshotStore();
        private final AtomicInteger reads = new AtomicInteger();
        private final AtomicInteger publishes = new AtomicInteger();

        @Override
        public void publish(LoadSnapshot snapshot) {
            publishes.incrementAndGet();
            delegate.publish(snapshot);
        }

        @Override
        public Optional<LoadSnapshot> read() {
            reads.incrementAndGet();
            return delegate.read();
        }
    }
}
