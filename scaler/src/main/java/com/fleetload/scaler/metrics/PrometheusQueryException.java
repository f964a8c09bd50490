package com.fleetload.scaler.metrics;

/**
 * Raised when Prometheus cannot be reached or answers with an error.
 */
public class PrometheusQueryException extends RuntimeException {

    public PrometheusQueryException(String message) {
        super(message);
    }

    public PrometheusQueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
