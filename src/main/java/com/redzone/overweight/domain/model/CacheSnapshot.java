package com.redzone.overweight.domain.model;

import java.time.Instant;

/**
 * One complete version of the cached dataset plus its status.
 * The cache replaces snapshots wholesale, so readers never see a partial update.
 *
 * @param refreshedAt time of the refresh that produced {@code series}; null while
 *                    initializing or when no data is available at all
 * @param error       message of the failure that led to a STALE or ERROR snapshot
 */
public record CacheSnapshot(
        ProductSeries series,
        Instant refreshedAt,
        int productCount,
        CacheStatus status,
        String error
) {

    public static CacheSnapshot initializing() {
        return new CacheSnapshot(ProductSeries.empty(), null, 0, CacheStatus.INITIALIZING, null);
    }

    public static CacheSnapshot ok(ProductSeries series, Instant refreshedAt) {
        return new CacheSnapshot(series, refreshedAt, series.productCount(), CacheStatus.OK, null);
    }

    public static CacheSnapshot stale(PersistedSnapshot persisted, String error) {
        return new CacheSnapshot(
                persisted.series(), persisted.refreshedAt(), persisted.productCount(), CacheStatus.STALE, error);
    }

    public static CacheSnapshot error(String error) {
        return new CacheSnapshot(ProductSeries.empty(), null, 0, CacheStatus.ERROR, error);
    }

    public CacheHealth health() {
        return new CacheHealth(status, refreshedAt);
    }
}
