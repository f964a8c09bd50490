package com.fleetload.scaler.grpc;

import com.fleetload.scaler.config.ScalerConfig;
import io.grpc.BindableService;
import io.grpc.Server;
import io.grpc.netty.shaded.io.grpc.netty.NettyServerBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.concurrent.TimeUnit;

/**
 * gRPC server the autoscaling controller connects to.
 */
public class GrpcServer {
    private static final Logger log = LoggerFactory.getLogger(GrpcServer.class);

    private static final long SHUTDOWN_GRACE_SECONDS = 20;

    private final ScalerConfig config;
    private final Server server;

    public GrpcServer(ScalerConfig config, BindableService service) {
        this.config = config;
        this.server = NettyServerBuilder
            .forAddress(new InetSocketAddress(config.getGrpcHost(), config.getGrpcPort()))
            .addService(service)
            .build();
    }

    /**
     * Binds the listener.
     *
     * @return the bound port
     * @throws IllegalStateException if the address cannot be bound
     */
    public int start() {
        try {
            server.start();
        } catch (IOException e) {
            throw new IllegalStateException(
                "Failed to start gRPC server on " + config.getGrpcHost() + ":" + config.getGrpcPort(), e);
        }
        log.info("Starting external scaler gRPC server on {}:{}", config.getGrpcHost(), server.getPort());
        return server.getPort();
    }

    public void stop() {
        server.shutdown();
        try {
            if (!server.awaitTermination(SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS)) {
                log.warn("gRPC server did not terminate within {}s, forcing shutdown", SHUTDOWN_GRACE_SECONDS);
                server.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            server.shutdownNow();
        }
    }

    public void awaitTermination() throws InterruptedException {
        server.awaitTermination();
    }
}
