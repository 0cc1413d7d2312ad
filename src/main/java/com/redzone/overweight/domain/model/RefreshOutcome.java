package com.redzone.overweight.domain.model;

import java.util.Optional;

/**
 * Result of one attempt to rebuild the dataset from the warehouse.
 */
public sealed interface RefreshOutcome {

    record Fetched(ProductSeries series) implements RefreshOutcome {}

    /**
     * The warehouse call or the aggregation failed.
     * {@code fallback} holds the durable snapshot when one could be read.
     */
    record SourceFailed(String message, Optional<PersistedSnapshot> fallback) implements RefreshOutcome {}
}
