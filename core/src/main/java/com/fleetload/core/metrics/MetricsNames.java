package com.fleetload.core.metrics;

/**
 * Micrometer metric names used across the system.
 * <p>
 * <b>Naming convention:</b> {@code fleetload.<area>.<metric>}
 * <ul>
 *   <li>Counters: {@code .total} suffix</li>
 *   <li>Gauges: current value (no suffix)</li>
 *   <li>Timers: {@code .latency} suffix</li>
 * </ul>
 * </p>
 */
public final class MetricsNames {
    private MetricsNames() {
    }

    /**
     * Counter: Completed refresh cycles.
     * <p>
     * Tags: outcome (success/failure)
     * </p>
     */
    public static final String REFRESH_TOTAL = "fleetload.refresh.total";

    /**
     * Timer: Duration of one collect + reduce cycle.
     */
    public static final String REFRESH_LATENCY = "fleetload.refresh.latency";

    /**
     * Gauge: Load average of the cached snapshot.
     */
    public static final String LOAD_AVG = "fleetload.load.avg";

    /**
     * Gauge: Load standard deviation of the cached snapshot.
     */
    public static final String LOAD_STD = "fleetload.load.std";

    /**
     * Gauge: Number of endpoints in the cached snapshot.
     */
    public static final String ENDPOINTS = "fleetload.endpoints";

    /**
     * Gauge: Seconds since the cached snapshot was collected (0 while none exists).
     */
    public static final String SNAPSHOT_AGE = "fleetload.snapshot.age.seconds";

    /**
     * Counter: Scaler protocol requests.
     * <p>
     * Tags: operation, outcome (ok/rejected)
     * </p>
     */
    public static final String SCALER_REQUESTS_TOTAL = "fleetload.scaler.requests.total";
}
