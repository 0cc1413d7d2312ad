package com.redzone.overweight.infrastructure.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Durable snapshot settings. The refresh schedule itself is read by
 * {@code ScheduledCacheRefresher} from {@code overweight.cache.refresh-interval}
 * and {@code overweight.cache.initial-delay}.
 */
@Component
@Validated
@ConfigurationProperties(prefix = "overweight.cache")
public class OverweightCacheConfig {

    @NotBlank
    private String snapshotPath = "/tmp/overweight_cache.json";

    public String getSnapshotPath() {
        return snapshotPath;
    }

    public void setSnapshotPath(String snapshotPath) {
        this.snapshotPath = snapshotPath;
    }
}
