package com.fleetload.scaler.metrics;

import com.fleetload.core.model.EndpointReport;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.QueryStringDecoder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;
import reactor.netty.http.server.HttpServer;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the source against a throwaway HTTP server answering like the Prometheus query API.
 */
class PrometheusFleetMetricsSourceTest {

    private static final String SELECTOR = "{component=\"llm-worker\",endpoint=\"kv-metrics\"}";

    private final Map<String, String> bodiesByMetric = new ConcurrentHashMap<>();
    private final Map<String, String> queriesSeen = new ConcurrentHashMap<>();
    private volatile HttpResponseStatus status = HttpResponseStatus.OK;
    private volatile Duration delay = Duration.ZERO;

    private DisposableServer prometheus;
    private PrometheusFleetMetricsSource source;

    @BeforeEach
    void setUp() {
        prometheus = HttpServer.create()
            .port(0)
            .handle((req, res) -> {
                String query = new QueryStringDecoder(req.uri()).parameters().get("query").get(0);
                String metric = query.substring(0, query.indexOf('{'));
                queriesSeen.put(metric, query);
                String body = bodiesByMetric.getOrDefault(metric, emptyVector());
                return Mono.delay(delay)
                    .then(res.status(status)
                        .header("Content-Type", "application/json")
                        .sendString(Mono.just(body))
                        .then());
            })
            .bindNow();

        PrometheusQueryService queryService = new PrometheusQueryService("localhost", prometheus.port(), Duration.ofSeconds(5));
        source = new PrometheusFleetMetricsSource(queryService, "worker_id");
    }

    @AfterEach
    void tearDown() {
        prometheus.disposeNow();
    }

    @Test
    void testCollectBuildsOneReportPerWorkerWithCapacity() {
        bodiesByMetric.put(PrometheusFleetMetricsSource.KV_ACTIVE_BLOCKS, vector(Map.of("w1", "40", "w2", "10")));
        bodiesByMetric.put(PrometheusFleetMetricsSource.KV_TOTAL_BLOCKS, vector(Map.of("w1", "100", "w2", "50")));
        bodiesByMetric.put(PrometheusFleetMetricsSource.REQUEST_ACTIVE_SLOTS, vector(Map.of("w1", "3")));
        bodiesByMetric.put(PrometheusFleetMetricsSource.REQUEST_TOTAL_SLOTS, vector(Map.of("w1", "8", "w2", "8")));

        List<EndpointReport> reports = source.collect("llm-worker", "kv-metrics", Duration.ofSeconds(5))
            .block(Duration.ofSeconds(10));

        assertNotNull(reports);
        assertEquals(2, reports.size());

        EndpointReport w1 = reports.get(0);
        assertEquals("w1", w1.getWorkerId());
        assertEquals(40, w1.getKvActiveBlocks());
        assertEquals(100, w1.getKvTotalBlocks());
        assertEquals(3, w1.getRequestActiveSlots());
        assertEquals(8, w1.getRequestTotalSlots());

        EndpointReport w2 = reports.get(1);
        assertEquals("w2", w2.getWorkerId());
        assertEquals(0, w2.getRequestActiveSlots());

        assertEquals(PrometheusFleetMetricsSource.KV_TOTAL_BLOCKS + SELECTOR,
            queriesSeen.get(PrometheusFleetMetricsSource.KV_TOTAL_BLOCKS));
    }

    @Test
    void testWorkerWithoutUsableActiveSampleIsLeftOut() {
        bodiesByMetric.put(PrometheusFleetMetricsSource.KV_ACTIVE_BLOCKS, vector(Map.of("w1", "80", "w2", "NaN")));
        bodiesByMetric.put(PrometheusFleetMetricsSource.KV_TOTAL_BLOCKS, vector(Map.of("w1", "100", "w2", "100")));

        List<EndpointReport> reports = source.collect("llm-worker", "kv-metrics", Duration.ofSeconds(5))
            .block(Duration.ofSeconds(10));

        assertNotNull(reports);
        assertEquals(1, reports.size());
        assertEquals("w1", reports.get(0).getWorkerId());
        assertEquals(0.8, new EndpointLoadReducer().reduce(reports).getLoadAverage(), 1e-9);
    }

    @Test
    void testDuplicateWorkerSeriesFailCollection() {
        bodiesByMetric.put(PrometheusFleetMetricsSource.KV_TOTAL_BLOCKS,
            "{\"status\":\"success\",\"data\":{\"resultType\":\"vector\",\"result\":["
                + "{\"metric\":{\"worker_id\":\"w1\",\"instance\":\"a\"},\"value\":[1700000000.0,\"100\"]},"
                + "{\"metric\":{\"worker_id\":\"w1\",\"instance\":\"b\"},\"value\":[1700000000.0,\"100\"]}]}}");

        StepVerifier.create(source.collect("llm-worker", "kv-metrics", Duration.ofSeconds(5)))
            .expectError(PrometheusQueryException.class)
            .verify(Duration.ofSeconds(10));
    }

    @Test
    void testNoWorkersYieldsEmptyList() {
        StepVerifier.create(source.collect("llm-worker", "kv-metrics", Duration.ofSeconds(5)))
            .expectNext(List.of())
            .verifyComplete();
    }

    @Test
    void testHttpErrorPropagates() {
        status = HttpResponseStatus.SERVICE_UNAVAILABLE;

        StepVerifier.create(source.collect("llm-worker", "kv-metrics", Duration.ofSeconds(5)))
            .expectError(PrometheusQueryException.class)
            .verify(Duration.ofSeconds(10));
    }

    @Test
    void testPrometheusErrorStatusPropagates() {
        bodiesByMetric.put(PrometheusFleetMetricsSource.KV_TOTAL_BLOCKS,
            "{\"status\":\"error\",\"errorType\":\"bad_data\",\"error\":\"parse error\"}");

        StepVerifier.create(source.collect("llm-worker", "kv-metrics", Duration.ofSeconds(5)))
            .expectErrorMatches(err -> err instanceof PrometheusQueryException
                && err.getMessage().contains("parse error"))
            .verify(Duration.ofSeconds(10));
    }

    @Test
    void testSlowPrometheusHitsCollectTimeout() {
        delay = Duration.ofSeconds(3);

        StepVerifier.create(source.collect("llm-worker", "kv-metrics", Duration.ofMillis(200)))
            .expectError(TimeoutException.class)
            .verify(Duration.ofSeconds(10));
    }

    @Test
    void testSelectorEscapesQuotes() {
        assertEquals("{component=\"a\\\"b\",endpoint=\"c\\\\d\"}",
            PrometheusFleetMetricsSource.selector("a\"b", "c\\d"));
    }

    private static String emptyVector() {
        return "{\"status\":\"success\",\"data\":{\"resultType\":\"vector\",\"result\":[]}}";
    }

    private static String vector(Map<String, String> valuesByWorker) {
        StringBuilder series = new StringBuilder();
        valuesByWorker.forEach((worker, value) -> {
            if (series.length() > 0) {
                series.append(',');
            }
            series.append("{\"metric\":{\"worker_id\":\"").append(worker)
                .append("\"},\"value\":[1700000000.0,\"").append(value).append("\"]}");
        });
        return "{\"status\":\"success\",\"data\":{\"resultType\":\"vector\",\"result\":[" + series + "]}}";
    }
}
