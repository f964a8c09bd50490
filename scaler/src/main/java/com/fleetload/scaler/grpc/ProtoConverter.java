package com.fleetload.scaler.grpc;

import com.fleetload.scaler.grpc.externalscaler.GetMetricSpecResponse;
import com.fleetload.scaler.grpc.externalscaler.GetMetricsRequest;
import com.fleetload.scaler.grpc.externalscaler.GetMetricsResponse;
import com.fleetload.scaler.grpc.externalscaler.IsActiveResponse;
import com.fleetload.scaler.query.MetricSpec;
import com.fleetload.scaler.query.MetricValue;
import com.fleetload.scaler.query.MetricsQuery;
import com.fleetload.scaler.query.ScaledObjectRef;

import java.util.List;

/**
 * Maps between the generated external scaler messages and the query service types.
 * <p>
 * The deprecated integer fields ({@code targetSize}, {@code metricValue}) are left at zero;
 * only their floating-point replacements are populated.
 * </p>
 */
final class ProtoConverter {
    private ProtoConverter() {
    }

    static ScaledObjectRef toDomain(com.fleetload.scaler.grpc.externalscaler.ScaledObjectRef ref) {
        return ScaledObjectRef.builder()
            .namespace(ref.getNamespace())
            .name(ref.getName())
            .scalerMetadata(ref.getScalerMetadataMap())
            .build();
    }

    static MetricsQuery toDomain(GetMetricsRequest request) {
        ScaledObjectRef ref = request.hasScaledObjectRef() ? toDomain(request.getScaledObjectRef()) : null;
        return new MetricsQuery(ref, request.getMetricName());
    }

    static IsActiveResponse toIsActiveResponse(boolean active) {
        return IsActiveResponse.newBuilder().setResult(active).build();
    }

    static GetMetricSpecResponse toMetricSpecResponse(List<MetricSpec> specs) {
        GetMetricSpecResponse.Builder response = GetMetricSpecResponse.newBuilder();
        for (MetricSpec spec : specs) {
            response.addMetricSpecs(com.fleetload.scaler.grpc.externalscaler.MetricSpec.newBuilder()
                .setMetricName(spec.metricName())
                .setTargetSizeFloat(spec.targetSize())
                .build());
        }
        return response.build();
    }

    static GetMetricsResponse toMetricsResponse(List<MetricValue> values) {
        GetMetricsResponse.Builder response = GetMetricsResponse.newBuilder();
        for (MetricValue value : values) {
            response.addMetricValues(com.fleetload.scaler.grpc.externalscaler.MetricValue.newBuilder()
                .setMetricName(value.metricName())
                .setMetricValueFloat(value.value())
                .build());
        }
        return response.build();
    }
}
