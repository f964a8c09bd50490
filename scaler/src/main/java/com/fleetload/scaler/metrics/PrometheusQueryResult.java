package com.fleetload.scaler.metrics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Wrapper for Prometheus query results with convenient accessors.
 */
public class PrometheusQueryResult {
    private static final Logger log = LoggerFactory.getLogger(PrometheusQueryResult.class);

    private final List<PrometheusQueryService.PrometheusResult> results;

    private PrometheusQueryResult(List<PrometheusQueryService.PrometheusResult> results) {
        this.results = results != null ? results : Collections.emptyList();
    }

    /**
     * Creates a PrometheusQueryResult from a Prometheus API response.
     *
     * @param response Prometheus API response
     * @return PrometheusQueryResult instance
     */
    public static PrometheusQueryResult from(PrometheusQueryService.PrometheusResponse response) {
        if (response == null || response.getData() == null) {
            return empty();
        }
        return new PrometheusQueryResult(response.getData().getResult());
    }

    /**
     * Creates an empty result.
     *
     * @return Empty PrometheusQueryResult
     */
    public static PrometheusQueryResult empty() {
        return new PrometheusQueryResult(Collections.emptyList());
    }

    /**
     * Gets values grouped by a label.
     * <p>
     * Series missing the label, carrying no sample, or carrying a non-finite sample
     * (NaN, +Inf, -Inf) are skipped: a worker with no usable sample is treated as absent
     * rather than as idle. Two usable series sharing a label value are ambiguous and
     * rejected.
     * </p>
     *
     * @param labelName The label to group by (e.g., "worker_id")
     * @return Map of label value -> metric value
     * @throws PrometheusQueryException if the label does not identify series uniquely
     */
    public Map<String, Double> getValuesByLabel(String labelName) {
        Map<String, Double> valuesByLabel = new HashMap<>();

        for (PrometheusQueryService.PrometheusResult result : results) {
            if (result.getMetric() == null || !result.getMetric().containsKey(labelName)) {
                log.debug("Result missing label '{}': {}", labelName, result.getMetric());
                continue;
            }

            OptionalDouble value = sampleValue(result);
            if (value.isEmpty()) {
                log.debug("Skipping series without a usable sample: {}", result.getMetric());
                continue;
            }

            String labelValue = result.getMetric().get(labelName);
            if (valuesByLabel.putIfAbsent(labelValue, value.getAsDouble()) != null) {
                throw new PrometheusQueryException(
                    "Several series share " + labelName + "=\"" + labelValue + "\"; narrow the selector or aggregate");
            }
        }

        return valuesByLabel;
    }

    /**
     * Gets the number of result series.
     *
     * @return Result count
     */
    public int size() {
        return results.size();
    }

    // Prometheus returns [timestamp, "value"]
    private static OptionalDouble sampleValue(PrometheusQueryService.PrometheusResult result) {
        if (result.getValue() == null || result.getValue().size() < 2) {
            return OptionalDouble.empty();
        }

        Object valueObj = result.getValue().get(1);
        double value;
        if (valueObj instanceof String valueStr) {
            try {
                value = Double.parseDouble(valueStr);
            } catch (NumberFormatException e) {
                log.warn("Received non-numeric value from Prometheus: {}", valueStr);
                return OptionalDouble.empty();
            }
        } else if (valueObj instanceof Number number) {
            value = number.doubleValue();
        } else {
            return OptionalDouble.empty();
        }

        return Double.isFinite(value) ? OptionalDouble.of(value) : OptionalDouble.empty();
    }
}
