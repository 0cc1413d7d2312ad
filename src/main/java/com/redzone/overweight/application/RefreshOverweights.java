package com.redzone.overweight.application;

import java.util.concurrent.CompletableFuture;

/**
 * Interface for rebuilding the cached overweight metrics from the warehouse.
 */
public interface RefreshOverweights {

    /**
     * Runs one refresh cycle on the calling thread.
     * Failures are recorded on the resulting snapshot, never thrown.
     */
    void refresh();

    /**
     * Starts one extra refresh cycle in the background and returns without waiting for it.
     *
     * @return A CompletableFuture completing when that cycle has published its snapshot.
     */
    CompletableFuture<Void> forceRefresh();
}
