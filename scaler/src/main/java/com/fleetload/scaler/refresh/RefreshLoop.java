package com.fleetload.scaler.refresh;

import com.fleetload.core.metrics.MetricsNames;
import com.fleetload.core.metrics.MetricsTags;
import com.fleetload.core.model.LoadSnapshot;
import com.fleetload.scaler.config.ScalerConfig;
import com.fleetload.scaler.metrics.IFleetMetricsSource;
import com.fleetload.scaler.metrics.ILoadReducer;
import com.fleetload.scaler.metrics.ReductionException;
import com.fleetload.scaler.snapshot.ISnapshotStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Background task that keeps the snapshot store fresh.
 * <p>
 * Every {@code refreshInterval} it collects raw reports from the fleet (bounded by
 * {@code collectTimeout}), reduces them and publishes the result. A failed cycle is logged and
 * leaves the previous snapshot in place; the loop itself never terminates on error, so losing
 * the fleet degrades freshness, not availability.
 * </p>
 * <p>
 * Ticks that fire while a cycle is still running are dropped.
 * </p>
 */
public class RefreshLoop {
    private static final Logger log = LoggerFactory.getLogger(RefreshLoop.class);

    private final ScalerConfig config;
    private final IFleetMetricsSource metricsSource;
    private final ILoadReducer reducer;
    private final ISnapshotStore store;
    private final Scheduler scheduler;
    private final Clock clock;

    private final Counter successCount;
    private final Counter failureCount;
    private final Timer refreshLatency;

    private final AtomicInteger consecutiveFailures = new AtomicInteger(0);
    private volatile long lastSuccessMs = 0;
    private volatile RefreshState state = RefreshState.IDLE;
    private Disposable task;

    public RefreshLoop(ScalerConfig config,
                       IFleetMetricsSource metricsSource,
                       ILoadReducer reducer,
                       ISnapshotStore store,
                       MeterRegistry meterRegistry) {
        this(config, metricsSource, reducer, store, meterRegistry, Schedulers.parallel(), Clock.systemUTC());
    }

    public RefreshLoop(ScalerConfig config,
                       IFleetMetricsSource metricsSource,
                       ILoadReducer reducer,
                       ISnapshotStore store,
                       MeterRegistry meterRegistry,
                       Scheduler scheduler,
                       Clock clock) {
        this.config = config;
        this.metricsSource = metricsSource;
        this.reducer = reducer;
        this.store = store;
        this.scheduler = scheduler;
        this.clock = clock;

        // Metrics
        successCount = Counter.builder(MetricsNames.REFRESH_TOTAL)
            .tag(MetricsTags.OUTCOME, "success")
            .register(meterRegistry);

        failureCount = Counter.builder(MetricsNames.REFRESH_TOTAL)
            .tag(MetricsTags.OUTCOME, "failure")
            .register(meterRegistry);

        refreshLatency = Timer.builder(MetricsNames.REFRESH_LATENCY)
            .register(meterRegistry);

        Gauge.builder(MetricsNames.LOAD_AVG, store, s -> currentOrEmpty(s).getLoadAverage())
            .register(meterRegistry);
        Gauge.builder(MetricsNames.LOAD_STD, store, s -> currentOrEmpty(s).getLoadStdDev())
            .register(meterRegistry);
        Gauge.builder(MetricsNames.ENDPOINTS, store, s -> currentOrEmpty(s).getEndpointCount())
            .register(meterRegistry);
        Gauge.builder(MetricsNames.SNAPSHOT_AGE, store, this::snapshotAgeSeconds)
            .register(meterRegistry);
    }

    /**
     * Starts the periodic refresh. The first cycle runs immediately. Calling start on a
     * running loop returns the existing subscription.
     *
     * @return Disposable cancelling the loop
     */
    public synchronized Disposable start() {
        if (task != null && !task.isDisposed()) {
            return task;
        }

        log.info("Starting refresh loop for {}/{} every {} (collect timeout {})",
            config.getMonitoredComponent(), config.getMonitoredEndpoint(),
            config.getRefreshInterval(), config.getCollectTimeout());

        task = Flux.interval(Duration.ZERO, config.getRefreshInterval(), scheduler)
            .onBackpressureDrop(tick -> log.debug("Refresh cycle still running, skipping tick {}", tick))
            .concatMap(tick -> refreshOnce(), 0)
            .subscribe(
                refreshed -> { },
                err -> log.error("Refresh loop terminated unexpectedly", err)
            );

        return task;
    }

    /**
     * Stops the periodic refresh. The current snapshot stays in the store.
     */
    public synchronized void stop() {
        if (task != null) {
            task.dispose();
            log.info("Refresh loop stopped");
        }
    }

    public synchronized boolean isRunning() {
        return task != null && !task.isDisposed();
    }

    /**
     * Runs a single collect/reduce/publish cycle.
     *
     * @return Mono emitting true if a new snapshot was published, false if the cycle failed;
     *         never errors
     */
    public Mono<Boolean> refreshOnce() {
        return Mono.defer(() -> {
            long startNanos = System.nanoTime();
            state = RefreshState.COLLECTING;

            return Mono.defer(() -> metricsSource.collect(
                    config.getMonitoredComponent(), config.getMonitoredEndpoint(), config.getCollectTimeout()))
                .timeout(config.getCollectTimeout(), scheduler)
                .switchIfEmpty(Mono.error(() -> new ReductionException("Metrics source returned no reports")))
                .map(reports -> {
                    state = RefreshState.REDUCING;
                    return reducer.reduce(reports);
                })
                .map(snapshot -> {
                    state = RefreshState.PUBLISHING;
                    store.publish(snapshot);
                    onSuccess(snapshot);
                    return true;
                })
                .onErrorResume(err -> {
                    onFailure(err);
                    return Mono.just(false);
                })
                .doFinally(signal -> {
                    state = RefreshState.IDLE;
                    refreshLatency.record(System.nanoTime() - startNanos, TimeUnit.NANOSECONDS);
                });
        });
    }

    public RefreshState getState() {
        return state;
    }

    /**
     * @return wall-clock time of the last published snapshot, 0 if none yet
     */
    public long getLastSuccessMs() {
        return lastSuccessMs;
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures.get();
    }

    private void onSuccess(LoadSnapshot snapshot) {
        lastSuccessMs = clock.millis();
        consecutiveFailures.set(0);
        successCount.increment();
        log.debug("Updated metrics snapshot: load_avg={}, load_std={}, endpoints={}",
            snapshot.getLoadAverage(), snapshot.getLoadStdDev(), snapshot.getEndpointCount());
    }

    private void onFailure(Throwable err) {
        int failures = consecutiveFailures.incrementAndGet();
        failureCount.increment();
        log.warn("Failed to refresh fleet load for {}/{} ({} consecutive), keeping last snapshot: {}",
            config.getMonitoredComponent(), config.getMonitoredEndpoint(), failures, describe(err));
    }

    private double snapshotAgeSeconds(ISnapshotStore s) {
        return s.read()
            .map(snapshot -> Math.max(0, clock.millis() - snapshot.getCollectedAtMs()) / 1000.0)
            .orElse(0.0);
    }

    private static LoadSnapshot currentOrEmpty(ISnapshotStore s) {
        return s.read().orElse(LoadSnapshot.empty());
    }

    private static String describe(Throwable err) {
        if (err instanceof TimeoutException) {
            return "collection timed out";
        }
        return err.getClass().getSimpleName() + ": " + err.getMessage();
    }
}
