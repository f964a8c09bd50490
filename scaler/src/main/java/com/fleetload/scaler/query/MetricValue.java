package com.fleetload.scaler.query;

public record MetricValue(String metricName, double value) {
}
