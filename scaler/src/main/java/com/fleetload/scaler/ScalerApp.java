package com.fleetload.scaler;

import com.fleetload.scaler.config.ScalerConfig;
import com.fleetload.scaler.grpc.ExternalScalerService;
import com.fleetload.scaler.grpc.GrpcServer;
import com.fleetload.scaler.http.HttpServer;
import com.fleetload.scaler.metrics.EndpointLoadReducer;
import com.fleetload.scaler.metrics.PrometheusFleetMetricsSource;
import com.fleetload.scaler.metrics.PrometheusMetricsExporter;
import com.fleetload.scaler.metrics.PrometheusQueryService;
import com.fleetload.scaler.query.ScalerQueryService;
import com.fleetload.scaler.refresh.RefreshLoop;
import com.fleetload.scaler.snapshot.SnapshotStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Main entry point for the fleet load scaler.
 * <p>
 * Responsibilities:
 * <ul>
 *   <li>Refresh the fleet load snapshot in the background</li>
 *   <li>Serve the external scaler gRPC contract from the cached snapshot</li>
 *   <li>Expose /healthz, /metrics and /api/v1/snapshot endpoints</li>
 * </ul>
 * </p>
 */
public class ScalerApp {
    private static final Logger log = LoggerFactory.getLogger(ScalerApp.class);

    public static void main(String[] args) throws InterruptedException {
        ScalerConfig config = ScalerConfig.fromEnv();
        MDC.put("nodeId", config.getNodeId());

        log.info("Starting fleet load scaler: {}", config.getNodeId());
        log.info("  Monitoring: {}/{}", config.getMonitoredComponent(), config.getMonitoredEndpoint());
        log.info("  Prometheus: {}:{}", config.getPrometheusHost(), config.getPrometheusPort());
        log.info("  Refresh interval: {}, collect timeout: {}", config.getRefreshInterval(), config.getCollectTimeout());
        log.info("  Default threshold: {}, metrics: {}", config.getDefaultThreshold(), config.getSupportedMetrics());

        // Setup metrics
        PrometheusMetricsExporter metricsExporter = new PrometheusMetricsExporter(config.getNodeId());

        // Fleet collection
        PrometheusQueryService prometheusQueryService = new PrometheusQueryService(
            config.getPrometheusHost(), config.getPrometheusPort(), config.getCollectTimeout()
        );
        PrometheusFleetMetricsSource metricsSource = new PrometheusFleetMetricsSource(
            prometheusQueryService, config.getWorkerLabel()
        );

        SnapshotStore store = new SnapshotStore();
        RefreshLoop refreshLoop = new RefreshLoop(
            config,
            metricsSource,
            new EndpointLoadReducer(),
            store,
            metricsExporter.getRegistry()
        );

        ScalerQueryService queryService = new ScalerQueryService(config, store, metricsExporter.getRegistry());
        GrpcServer grpcServer = new GrpcServer(config, new ExternalScalerService(queryService));
        HttpServer httpServer = new HttpServer(config, metricsExporter, store, refreshLoop);

        refreshLoop.start();
        httpServer.start();
        grpcServer.start();

        log.info("Fleet load scaler is ready");

        handleShutDown(refreshLoop, grpcServer, httpServer);

        grpcServer.awaitTermination();
    }

    private static void handleShutDown(RefreshLoop refreshLoop, GrpcServer grpcServer, HttpServer httpServer) {
        // Graceful shutdown
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown signal received");

            grpcServer.stop();

            httpServer.stop();

            refreshLoop.stop();

            log.info("Shutdown complete");
        }));
    }
}
