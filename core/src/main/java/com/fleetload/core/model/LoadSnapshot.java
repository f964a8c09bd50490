package com.fleetload.core.model;

import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable result of one fleet load reduction.
 * <p>
 * A snapshot is either fully formed or not visible at all: it is built once by the reducer
 * and then only ever handed around by reference.
 * </p>
 */
@Value
public class LoadSnapshot {
    private static final LoadSnapshot EMPTY = LoadSnapshot.builder()
        .loadAverage(0.0)
        .loadStdDev(0.0)
        .endpointCount(0)
        .endpointLoads(Map.of())
        .collectedAtMs(0L)
        .build();

    /**
     * Aggregate load across the fleet (opaque scalar, 0.0 and up).
     */
    double loadAverage;

    /**
     * Population standard deviation of the per-endpoint load. Informational only.
     */
    double loadStdDev;

    /**
     * Number of fleet members that contributed to this reduction.
     */
    int endpointCount;

    /**
     * Per-endpoint load keyed by worker id, in the order the reducer saw the workers.
     */
    Map<String, Double> endpointLoads;

    /**
     * Time the reduction was produced (milliseconds since epoch), 0 for the default snapshot.
     */
    long collectedAtMs;

    // The map is copied so a published snapshot cannot change behind its readers
    @Builder(toBuilder = true)
    private LoadSnapshot(double loadAverage,
                         double loadStdDev,
                         int endpointCount,
                         Map<String, Double> endpointLoads,
                         long collectedAtMs) {
        this.loadAverage = loadAverage;
        this.loadStdDev = loadStdDev;
        this.endpointCount = endpointCount;
        this.endpointLoads = endpointLoads == null || endpointLoads.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(endpointLoads));
        this.collectedAtMs = collectedAtMs;
    }

    /**
     * Snapshot served while no refresh has ever succeeded: no load, no endpoints.
     *
     * @return the shared default snapshot
     */
    public static LoadSnapshot empty() {
        return EMPTY;
    }

    @Override
    public String toString() {
        return String.format("LoadSnapshot{loadAvg=%.4f, loadStd=%.4f, endpoints=%d, collectedAtMs=%d}",
            loadAverage, loadStdDev, endpointCount, collectedAtMs);
    }
}
