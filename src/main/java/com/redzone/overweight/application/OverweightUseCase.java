package com.redzone.overweight.application;

import com.redzone.overweight.domain.model.CacheHealth;
import com.redzone.overweight.domain.model.CacheSnapshot;
import org.springframework.stereotype.Service;

@Service
public class OverweightUseCase implements FindOverweights {

    private final OverweightCacheService cacheService;

    public OverweightUseCase(OverweightCacheService cacheService) {
        this.cacheService = cacheService;
    }

    @Override
    public CacheSnapshot getMetrics() {
        return cacheService.currentSnapshot();
    }

    @Override
    public CacheHealth getHealth() {
        return cacheService.currentSnapshot().health();
    }
}
