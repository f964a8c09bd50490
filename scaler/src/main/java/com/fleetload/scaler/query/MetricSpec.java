package com.fleetload.scaler.query;

/**
 * Metric the autoscaler should track, with its per-replica target.
 */
public record MetricSpec(String metricName, double targetSize) {
}
