package com.fleetload.scaler.query;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.Optional;

/**
 * The closed set of operations of the external scaler protocol, keyed by RPC method name.
 */
@Getter
@RequiredArgsConstructor
public enum ScalerOperation {
    IS_ACTIVE("IsActive"),
    STREAM_IS_ACTIVE("StreamIsActive"),
    GET_METRIC_SPEC("GetMetricSpec"),
    GET_METRICS("GetMetrics");

    private final String rpcMethod;

    public static Optional<ScalerOperation> fromRpcMethod(String rpcMethod) {
        return Arrays.stream(values())
            .filter(operation -> operation.rpcMethod.equals(rpcMethod))
            .findFirst();
    }
}
