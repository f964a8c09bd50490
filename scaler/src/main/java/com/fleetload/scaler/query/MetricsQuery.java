package com.fleetload.scaler.query;

/**
 * Request for the current value of a metric.
 *
 * @param scaledObjectRef object the value is requested for, may be null
 * @param metricName      metric to read
 */
public record MetricsQuery(ScaledObjectRef scaledObjectRef, String metricName) {
}
