package com.fleetload.scaler.metrics;

import com.fleetload.core.model.EndpointReport;
import com.fleetload.core.model.LoadSnapshot;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reduces endpoint reports to KV cache utilization statistics.
 * <p>
 * Formula:
 * <pre>
 *   load_i   = kv_active_blocks_i / kv_total_blocks_i
 *   load_avg = mean(load_i)
 *   load_std = sqrt(mean((load_i - load_avg)^2))
 * </pre>
 * </p>
 */
public class EndpointLoadReducer implements ILoadReducer {

    private final Clock clock;

    public EndpointLoadReducer() {
        this(Clock.systemUTC());
    }

    public EndpointLoadReducer(Clock clock) {
        this.clock = clock;
    }

    @Override
    public LoadSnapshot reduce(List<EndpointReport> reports) {
        if (reports == null || reports.isEmpty()) {
            throw new ReductionException("No endpoints reported load");
        }

        Map<String, Double> loads = new LinkedHashMap<>();
        for (EndpointReport report : reports) {
            validate(report);
            double load = (double) report.getKvActiveBlocks() / report.getKvTotalBlocks();
            if (loads.putIfAbsent(report.getWorkerId(), load) != null) {
                throw new ReductionException("Duplicate report for worker " + report.getWorkerId());
            }
        }

        double avg = loads.values().stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        double variance = loads.values().stream()
            .mapToDouble(load -> (load - avg) * (load - avg))
            .average()
            .orElse(0.0);

        return LoadSnapshot.builder()
            .loadAverage(avg)
            .loadStdDev(Math.sqrt(variance))
            .endpointCount(loads.size())
            .endpointLoads(loads)
            .collectedAtMs(clock.millis())
            .build();
    }

    private static void validate(EndpointReport report) {
        if (report == null || report.getWorkerId() == null || report.getWorkerId().isEmpty()) {
            throw new ReductionException("Report without worker id: " + report);
        }
        if (report.getKvTotalBlocks() <= 0) {
            throw new ReductionException("Worker " + report.getWorkerId() + " reports no KV capacity");
        }
        if (report.getKvActiveBlocks() < 0 || report.getRequestActiveSlots() < 0 || report.getRequestTotalSlots() < 0) {
            throw new ReductionException("Worker " + report.getWorkerId() + " reports negative counts: " + report);
        }
    }
}
