package com.fleetload.core.model;

import lombok.Builder;
import lombok.Value;

/**
 * Raw load report of a single fleet member, as returned by the metrics source.
 */
@Value
@Builder(toBuilder = true)
public class EndpointReport {
    /**
     * Identifier of the worker process that produced this report.
     */
    String workerId;

    /**
     * KV cache blocks currently in use.
     */
    long kvActiveBlocks;

    /**
     * KV cache blocks available on the worker.
     */
    long kvTotalBlocks;

    /**
     * Request slots currently busy.
     */
    long requestActiveSlots;

    /**
     * Request slots the worker exposes.
     */
    long requestTotalSlots;
}
