package com.fleetload.scaler.query;

import com.fleetload.core.model.LoadSnapshot;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.Optional;
import java.util.function.ToDoubleFunction;

/**
 * Metrics this scaler can serve, with the ScaledObject metadata key carrying each target.
 */
@Getter
@RequiredArgsConstructor
public enum LoadMetric {
    LOAD_AVG("llm_load_avg", "loadAvgThreshold", LoadSnapshot::getLoadAverage);

    /**
     * Name the autoscaler uses in metric specs and metric requests.
     */
    private final String metricName;

    /**
     * ScaledObject metadata key overriding the target value.
     */
    private final String thresholdKey;

    private final ToDoubleFunction<LoadSnapshot> extractor;

    public double extract(LoadSnapshot snapshot) {
        return extractor.applyAsDouble(snapshot);
    }

    public static Optional<LoadMetric> fromName(String name) {
        return Arrays.stream(values())
            .filter(metric -> metric.metricName.equals(name))
            .findFirst();
    }
}
