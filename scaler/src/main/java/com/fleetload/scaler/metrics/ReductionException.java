package com.fleetload.scaler.metrics;

/**
 * Raised when a set of endpoint reports cannot be reduced to a load snapshot.
 */
public class ReductionException extends RuntimeException {

    public ReductionException(String message) {
        super(message);
    }
}
