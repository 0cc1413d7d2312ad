package com.redzone.overweight.domain.port.out;

import com.redzone.overweight.domain.model.PersistedSnapshot;
import com.redzone.overweight.domain.model.ProductSeries;
import java.time.Instant;
import java.util.Optional;

/**
 * Durable copy of the last successful refresh
 * Used only to recover when the warehouse is unavailable
 */
public interface SnapshotStore {

    /**
     * Replace the durable copy as a whole
     * Failures are logged by the implementation, never thrown
     */
    void save(ProductSeries series, Instant refreshedAt, int productCount);

    /**
     * @return Optional.empty() if nothing was ever saved
     * @throws com.redzone.overweight.domain.exception.SnapshotCorruptException if the stored copy cannot be read
     */
    Optional<PersistedSnapshot> load();
}
