package com.fleetload.scaler.metrics;

import com.fleetload.core.model.EndpointReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Collects per-worker load reports from the gauges the workers export to Prometheus.
 * <p>
 * Workers of a component endpoint are identified by a configurable label (e.g. {@code worker_id});
 * a worker is part of the fleet when it reports both {@value #KV_TOTAL_BLOCKS} and
 * {@value #KV_ACTIVE_BLOCKS}. A worker without a usable active-blocks sample is left out of the
 * cycle instead of being counted as idle.
 * </p>
 */
public class PrometheusFleetMetricsSource implements IFleetMetricsSource {
    private static final Logger log = LoggerFactory.getLogger(PrometheusFleetMetricsSource.class);

    static final String KV_ACTIVE_BLOCKS = "llm_kv_blocks_active";
    static final String KV_TOTAL_BLOCKS = "llm_kv_blocks_total";
    static final String REQUEST_ACTIVE_SLOTS = "llm_requests_active_slots";
    static final String REQUEST_TOTAL_SLOTS = "llm_requests_total_slots";

    private final PrometheusQueryService queryService;
    private final String workerLabel;

    public PrometheusFleetMetricsSource(PrometheusQueryService queryService, String workerLabel) {
        this.queryService = queryService;
        this.workerLabel = workerLabel;
    }

    @Override
    public Mono<List<EndpointReport>> collect(String component, String endpoint, Duration timeout) {
        String selector = selector(component, endpoint);

        return Mono.zip(
                byWorker(KV_ACTIVE_BLOCKS + selector),
                byWorker(KV_TOTAL_BLOCKS + selector),
                byWorker(REQUEST_ACTIVE_SLOTS + selector),
                byWorker(REQUEST_TOTAL_SLOTS + selector)
        ).map(tuple -> {
            Map<String, Double> kvActive = tuple.getT1();
            Map<String, Double> kvTotal = tuple.getT2();
            Map<String, Double> slotsActive = tuple.getT3();
            Map<String, Double> slotsTotal = tuple.getT4();

            List<EndpointReport> reports = new ArrayList<>();
            for (String workerId : new TreeSet<>(kvTotal.keySet())) {
                Double active = kvActive.get(workerId);
                if (active == null) {
                    log.debug("Worker {} has no usable {} sample, leaving it out", workerId, KV_ACTIVE_BLOCKS);
                    continue;
                }
                reports.add(EndpointReport.builder()
                        .workerId(workerId)
                        .kvActiveBlocks(active.longValue())
                        .kvTotalBlocks(kvTotal.get(workerId).longValue())
                        .requestActiveSlots(slotsActive.getOrDefault(workerId, 0.0).longValue())
                        .requestTotalSlots(slotsTotal.getOrDefault(workerId, 0.0).longValue())
                        .build());
            }

            log.debug("Collected {} endpoint reports for {}/{}", reports.size(), component, endpoint);
            return reports;
        }).timeout(timeout);
    }

    private Mono<Map<String, Double>> byWorker(String query) {
        return queryService.query(query)
                .map(result -> result.getValuesByLabel(workerLabel));
    }

    static String selector(String component, String endpoint) {
        return "{component=\"" + escape(component) + "\",endpoint=\"" + escape(endpoint) + "\"}";
    }

    private static String escape(String labelValue) {
        return labelValue.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
