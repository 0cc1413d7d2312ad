package com.redzone.overweight.domain.model;

import java.time.Instant;

/**
 * Last successful refresh as read back from durable storage.
 */
public record PersistedSnapshot(
        ProductSeries series,
        Instant refreshedAt,
        int productCount
) {}
