package com.fleetload.scaler.metrics;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fleetload.core.util.JsonUtils;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import lombok.Data;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Thin client for the Prometheus instant-query HTTP API, built on reactor-netty HttpClient.
 * <p>
 * Unlike a dashboard client, failures are not masked as empty results: transport errors,
 * non-2xx responses and {@code status != success} all surface as {@link PrometheusQueryException}
 * so that callers can keep their last known-good data.
 * </p>
 */
public class PrometheusQueryService {
    private static final Logger log = LoggerFactory.getLogger(PrometheusQueryService.class);

    private final HttpClient httpClient;

    /**
     * Creates a Prometheus query service.
     *
     * @param prometheusHost  Prometheus host (e.g., "prometheus" or "prometheus-service.monitoring.svc.cluster.local")
     * @param prometheusPort  Prometheus port (typically 9090)
     * @param responseTimeout upper bound for a single HTTP exchange
     */
    public PrometheusQueryService(String prometheusHost, int prometheusPort, Duration responseTimeout) {
        this.httpClient = HttpClient.create()
                .host(prometheusHost)
                .port(prometheusPort)
                .headers(h -> h.set(HttpHeaderNames.ACCEPT, HttpHeaderValues.APPLICATION_JSON))
                .responseTimeout(responseTimeout);

        log.info("PrometheusQueryService initialized with {}:{}", prometheusHost, prometheusPort);
    }

    /**
     * Executes a PromQL instant query.
     *
     * @param query PromQL query string
     * @return Mono<PrometheusQueryResult> containing query results, or an error
     */
    public Mono<PrometheusQueryResult> query(String query) {
        String uri = "/api/v1/query?query=" + URLEncoder.encode(query, StandardCharsets.UTF_8);

        log.debug("Executing Prometheus query: {}", query);

        return httpClient.get()
                .uri(uri)
                .responseSingle((response, body) -> {
                    int code = response.status().code();
                    if (code < 200 || code >= 300) {
                        return Mono.error(new PrometheusQueryException(
                                "Prometheus returned HTTP " + code + " for query: " + query));
                    }
                    return body.asString(StandardCharsets.UTF_8);
                })
                .map(responseBody -> {
                    PrometheusResponse response;
                    try {
                        response = JsonUtils.readValue(responseBody, PrometheusResponse.class);
                    } catch (IllegalArgumentException e) {
                        throw new PrometheusQueryException("Malformed Prometheus response for query: " + query, e);
                    }

                    if (!"success".equalsIgnoreCase(response.getStatus())) {
                        throw new PrometheusQueryException("Prometheus query failed (" + response.getErrorType()
                                + "): " + response.getError());
                    }

                    PrometheusQueryResult result = PrometheusQueryResult.from(response);
                    log.debug("Prometheus query successful, result count: {}", result.size());
                    return result;
                })
                .doOnError(err -> log.debug("Failed to query Prometheus: {}", err.getMessage()));
    }

    /**
     * Data class for Prometheus API response.
     */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PrometheusResponse {
        private String status;
        private PrometheusData data;
        private String error;
        private String errorType;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PrometheusData {
        private String resultType;
        private List<PrometheusResult> result;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PrometheusResult {
        private Map<String, String> metric;
        private List<Object> value;
    }
}
