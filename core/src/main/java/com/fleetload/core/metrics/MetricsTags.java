package com.fleetload.core.metrics;

/**
 * Standard tag keys for Micrometer metrics.
 */
public final class MetricsTags {
    private MetricsTags() {
    }

    /**
     * Tag key for the scaler instance identifier.
     */
    public static final String NODE_ID = "node_id";

    /**
     * Tag key for a success/failure outcome.
     */
    public static final String OUTCOME = "outcome";

    /**
     * Tag key for the scaler protocol operation.
     */
    public static final String OPERATION = "operation";
}
