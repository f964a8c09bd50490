package com.fleetload.scaler.metrics;

import com.fleetload.core.model.EndpointReport;
import com.fleetload.core.model.LoadSnapshot;

import java.util.List;

/**
 * Reduces raw per-member reports to a single fleet load snapshot.
 */
public interface ILoadReducer {

    /**
     * @param reports raw reports from one collection
     * @return the reduced snapshot
     * @throws ReductionException if the reports cannot be reduced (empty or malformed)
     */
    LoadSnapshot reduce(List<EndpointReport> reports);
}
