package com.redzone.overweight.domain.port.out;

import com.redzone.overweight.domain.model.MetricSample;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Interface representing the warehouse that owns the raw weight samples.
 * Implementations carry their own timeout and report every failure through the returned future.
 */
public interface MetricSampleSource {

    /**
     * Fetches weekly averages per product, ordered by product then week.
     *
     * @return A CompletableFuture completing with the rows, or exceptionally when the warehouse is unavailable.
     */
    CompletableFuture<List<MetricSample>> fetchWeeklySamples();
}
