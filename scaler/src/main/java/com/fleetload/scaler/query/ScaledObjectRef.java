package com.fleetload.scaler.query;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Reference to the autoscaling object a query is made for, with its scaler metadata.
 */
@Value
@Builder(toBuilder = true)
public class ScaledObjectRef {
    String namespace;
    String name;

    /**
     * Free-form key/value metadata configured on the autoscaling object.
     */
    @Builder.Default
    Map<String, String> scalerMetadata = Map.of();

    @Override
    public String toString() {
        return namespace + "/" + name;
    }
}
