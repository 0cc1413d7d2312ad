package com.redzone.overweight.application;

import com.redzone.overweight.domain.model.CacheHealth;
import com.redzone.overweight.domain.model.CacheSnapshot;

/**
 * Read side of the overweight cache. Never waits for a refresh in progress.
 */
public interface FindOverweights {

    CacheSnapshot getMetrics();

    CacheHealth getHealth();
}
