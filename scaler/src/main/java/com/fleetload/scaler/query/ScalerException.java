package com.fleetload.scaler.query;

import lombok.Getter;

/**
 * Request-level rejection of a scaler protocol call. Never signals a fault of the service itself.
 */
@Getter
public class ScalerException extends RuntimeException {

    public enum Reason {
        /**
         * The request names something this scaler does not serve.
         */
        INVALID_ARGUMENT,
        /**
         * The operation is permanently unsupported.
         */
        UNIMPLEMENTED
    }

    private final Reason reason;

    public ScalerException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public static ScalerException unknownMetric(String metricName) {
        return new ScalerException(Reason.INVALID_ARGUMENT, "Unknown metric: " + metricName);
    }

    public static ScalerException unimplemented(ScalerOperation operation, String hint) {
        return new ScalerException(Reason.UNIMPLEMENTED,
            operation.getRpcMethod() + " is not implemented for this external scaler. " + hint);
    }
}
