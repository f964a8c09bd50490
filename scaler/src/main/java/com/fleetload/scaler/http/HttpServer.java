package com.fleetload.scaler.http;

import com.fleetload.core.model.LoadSnapshot;
import com.fleetload.core.util.JsonUtils;
import com.fleetload.scaler.config.ScalerConfig;
import com.fleetload.scaler.metrics.PrometheusMetricsExporter;
import com.fleetload.scaler.refresh.RefreshLoop;
import com.fleetload.scaler.snapshot.ISnapshotStore;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;
import reactor.netty.http.server.HttpServerRoutes;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * HTTP server for health, Prometheus scraping and snapshot diagnostics.
 */
public class HttpServer {
    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    private final ScalerConfig config;
    private final PrometheusMetricsExporter metricsExporter;
    private final ISnapshotStore store;
    private final RefreshLoop refreshLoop;

    private DisposableServer server;

    public HttpServer(
        ScalerConfig config,
        PrometheusMetricsExporter metricsExporter,
        ISnapshotStore store,
        RefreshLoop refreshLoop
    ) {
        this.config = config;
        this.metricsExporter = metricsExporter;
        this.store = store;
        this.refreshLoop = refreshLoop;
    }

    /**
     * Starts the HTTP server.
     *
     * @return the bound server
     */
    public DisposableServer start() {
        server = reactor.netty.http.server.HttpServer.create()
            .port(config.getHttpPort())
            .route(this::configureRoutes)
            .bind()
            .doOnNext(bound -> log.info("HTTP server started on port {}", bound.port()))
            .doOnError(err -> log.error("Failed to start HTTP server", err))
            .block(Duration.ofSeconds(45));

        return server;
    }

    public void stop() {
        if (server != null) {
            server.disposeNow(Duration.ofSeconds(20));
        }
    }

    private void configureRoutes(HttpServerRoutes routes) {
        routes
            // Health check
            .get("/healthz", (req, res) ->
                res.status(200).sendString(Mono.just("OK"))
            )
            // Metrics endpoint
            .get("/metrics", (req, res) ->
                res.addHeader("Content-Type", PrometheusMetricsExporter.CONTENT_TYPE)
                    .sendString(Mono.just(metricsExporter.scrape()))
                    .then()
            )
            // Cached snapshot as served to the autoscaler
            .get("/api/v1/snapshot", (req, res) ->
                Mono.fromCallable(() -> JsonUtils.writeValueAsString(describeSnapshot()))
                    .flatMap(json ->
                        res.header("Content-Type", "application/json")
                            .sendString(Mono.just(json)).then()
                    )
                    .onErrorResume(err -> {
                        log.error("Failed to render snapshot", err);
                        return res.status(HttpResponseStatus.INTERNAL_SERVER_ERROR)
                            .sendString(Mono.just("{\"error\":\"Serialization failed\"}")).then();
                    })
            );
    }

    Map<String, Object> describeSnapshot() {
        Optional<LoadSnapshot> snapshot = store.read();

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("available", snapshot.isPresent());
        response.put("snapshot", snapshot.orElse(LoadSnapshot.empty()));
        response.put("refreshState", refreshLoop.getState());
        response.put("lastSuccessMs", refreshLoop.getLastSuccessMs());
        response.put("consecutiveFailures", refreshLoop.getConsecutiveFailures());
        response.put("component", config.getMonitoredComponent());
        response.put("endpoint", config.getMonitoredEndpoint());
        return response;
    }
}
