package com.fleetload.scaler.metrics;

import com.fleetload.core.model.EndpointReport;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

/**
 * Source of raw per-member load reports for a fleet subject (Dependency Inversion Principle).
 */
public interface IFleetMetricsSource {

    /**
     * Collects one report per live fleet member of the given component endpoint.
     *
     * @param component fleet component to inspect
     * @param endpoint  endpoint of that component whose members report load
     * @param timeout   upper bound for the whole collection
     * @return Mono of the raw reports; errors on transport failure or timeout
     */
    Mono<List<EndpointReport>> collect(String component, String endpoint, Duration timeout);
}
