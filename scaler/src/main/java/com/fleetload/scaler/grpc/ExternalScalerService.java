package com.fleetload.scaler.grpc;

import com.fleetload.scaler.grpc.externalscaler.ExternalScalerGrpc;
import com.fleetload.scaler.grpc.externalscaler.GetMetricSpecResponse;
import com.fleetload.scaler.grpc.externalscaler.GetMetricsRequest;
import com.fleetload.scaler.grpc.externalscaler.GetMetricsResponse;
import com.fleetload.scaler.grpc.externalscaler.IsActiveResponse;
import com.fleetload.scaler.grpc.externalscaler.ScaledObjectRef;
import com.fleetload.scaler.query.ScalerException;
import com.fleetload.scaler.query.ScalerOperation;
import com.fleetload.scaler.query.ScalerQueryService;
import io.grpc.Status;
import io.grpc.stub.StreamObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * gRPC binding of the external scaler contract onto {@link ScalerQueryService}.
 */
public class ExternalScalerService extends ExternalScalerGrpc.ExternalScalerImplBase {
    private static final Logger log = LoggerFactory.getLogger(ExternalScalerService.class);

    private final ScalerQueryService queryService;

    public ExternalScalerService(ScalerQueryService queryService) {
        this.queryService = queryService;
    }

    @Override
    public void isActive(ScaledObjectRef request, StreamObserver<IsActiveResponse> responseObserver) {
        unary(ScalerOperation.IS_ACTIVE,
            queryService.isActive(ProtoConverter.toDomain(request)).map(ProtoConverter::toIsActiveResponse),
            responseObserver);
    }

    @Override
    public void streamIsActive(ScaledObjectRef request, StreamObserver<IsActiveResponse> responseObserver) {
        queryService.streamIsActive(ProtoConverter.toDomain(request))
            .map(ProtoConverter::toIsActiveResponse)
            .subscribe(
                responseObserver::onNext,
                err -> responseObserver.onError(toStatus(ScalerOperation.STREAM_IS_ACTIVE, err).asRuntimeException()),
                responseObserver::onCompleted
            );
    }

    @Override
    public void getMetricSpec(ScaledObjectRef request, StreamObserver<GetMetricSpecResponse> responseObserver) {
        unary(ScalerOperation.GET_METRIC_SPEC,
            queryService.getMetricSpec(ProtoConverter.toDomain(request)).map(ProtoConverter::toMetricSpecResponse),
            responseObserver);
    }

    @Override
    public void getMetrics(GetMetricsRequest request, StreamObserver<GetMetricsResponse> responseObserver) {
        unary(ScalerOperation.GET_METRICS,
            queryService.getMetrics(ProtoConverter.toDomain(request)).map(ProtoConverter::toMetricsResponse),
            responseObserver);
    }

    private static <T> void unary(ScalerOperation operation, Mono<T> response, StreamObserver<T> responseObserver) {
        response.subscribe(
            value -> {
                responseObserver.onNext(value);
                responseObserver.onCompleted();
            },
            err -> responseObserver.onError(toStatus(operation, err).asRuntimeException())
        );
    }

    static Status toStatus(ScalerOperation operation, Throwable err) {
        if (err instanceof ScalerException scalerException) {
            Status status = switch (scalerException.getReason()) {
                case INVALID_ARGUMENT -> Status.INVALID_ARGUMENT;
                case UNIMPLEMENTED -> Status.UNIMPLEMENTED;
            };
            return status.withDescription(err.getMessage());
        }

        log.error("Unexpected failure handling {}", operation.getRpcMethod(), err);
        return Status.INTERNAL.withDescription("Internal scaler error").withCause(err);
    }
}
