package com.redzone.overweight.application;

import com.redzone.overweight.domain.ProductSeriesAggregator;
import com.redzone.overweight.domain.exception.SnapshotCorruptException;
import com.redzone.overweight.domain.model.CacheSnapshot;
import com.redzone.overweight.domain.model.MetricSample;
import com.redzone.overweight.domain.model.PersistedSnapshot;
import com.redzone.overweight.domain.model.ProductSeries;
import com.redzone.overweight.domain.model.RefreshOutcome;
import com.redzone.overweight.domain.port.out.MetricSampleSource;
import com.redzone.overweight.domain.port.out.SnapshotStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the in-memory overweight snapshot.
 * Refreshes may overlap (scheduled and forced); each publishes a complete snapshot and the last one wins.
 */
@Service
public class OverweightCacheService implements RefreshOverweights {

    private static final Logger logger = LoggerFactory.getLogger(OverweightCacheService.class);

    private final MetricSampleSource sampleSource;
    private final ProductSeriesAggregator aggregator;
    private final SnapshotStore snapshotStore;
    private final Clock clock;
    private final Executor refreshExecutor;

    private final AtomicReference<CacheSnapshot> current =
            new AtomicReference<>(CacheSnapshot.initializing());

    public OverweightCacheService(MetricSampleSource sampleSource,
                                  ProductSeriesAggregator aggregator,
                                  SnapshotStore snapshotStore,
                                  Clock clock,
                                  @Qualifier("refreshExecutor") Executor refreshExecutor) {
        this.sampleSource = sampleSource;
        this.aggregator = aggregator;
        this.snapshotStore = snapshotStore;
        this.clock = clock;
        this.refreshExecutor = refreshExecutor;
    }

    @Override
    public void refresh() {
        logger.info("Starting warehouse refresh...");
        CacheSnapshot next = resolve(fetchAndAggregate());
        current.set(next);

        switch (next.status()) {
            case OK -> logger.info("Cache refreshed - {} products loaded.", next.productCount());
            case STALE -> logger.warn("Loaded stale cache from {} ({} products)", next.refreshedAt(), next.productCount());
            default -> logger.error("Cache refresh failed and no persisted snapshot is available: {}", next.error());
        }
    }

    @Override
    public CompletableFuture<Void> forceRefresh() {
        logger.info("Forced refresh requested");
        return CompletableFuture.runAsync(this::refresh, refreshExecutor);
    }

    public CacheSnapshot currentSnapshot() {
        return current.get();
    }

    private RefreshOutcome fetchAndAggregate() {
        try {
            List<MetricSample> samples = sampleSource.fetchWeeklySamples().get();
            logger.debug("Fetched {} weekly rows from warehouse", samples.size());
            return new RefreshOutcome.Fetched(aggregator.aggregate(samples));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return sourceFailed(e);
        } catch (ExecutionException e) {
            return sourceFailed(e.getCause() != null ? e.getCause() : e);
        } catch (Exception e) {
            return sourceFailed(e);
        }
    }

    private RefreshOutcome sourceFailed(Throwable failure) {
        logger.error("Cache refresh error", failure);
        return new RefreshOutcome.SourceFailed(describe(failure), loadFallback());
    }

    /**
     * The only place a refresh result becomes a snapshot. A successful result is
     * handed to the durable store before it becomes visible to readers.
     */
    private CacheSnapshot resolve(RefreshOutcome outcome) {
        if (outcome instanceof RefreshOutcome.Fetched fetched) {
            ProductSeries series = fetched.series();
            Instant refreshedAt = clock.instant();
            snapshotStore.save(series, refreshedAt, series.productCount());
            return CacheSnapshot.ok(series, refreshedAt);
        }

        RefreshOutcome.SourceFailed failed = (RefreshOutcome.SourceFailed) outcome;
        return failed.fallback()
                .map(persisted -> CacheSnapshot.stale(persisted, failed.message()))
                .orElseGet(() -> CacheSnapshot.error(failed.message()));
    }

    private Optional<PersistedSnapshot> loadFallback() {
        try {
            return snapshotStore.load();
        } catch (SnapshotCorruptException e) {
            logger.error("Persisted snapshot is unusable, no fallback available", e);
            return Optional.empty();
        }
    }

    private static String describe(Throwable failure) {
        String message = failure.getMessage();
        return message != null && !message.isBlank() ? message : failure.getClass().getSimpleName();
    }
}
