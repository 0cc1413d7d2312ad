package com.redzone.overweight.infrastructure.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.redzone.overweight.domain.port.out.SnapshotStore;
import com.redzone.overweight.infrastructure.persistence.FileSnapshotStore;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

@Configuration
public class SnapshotStoreConfig {

    @Bean
    public SnapshotStore snapshotStore(OverweightCacheConfig config, ObjectMapper objectMapper) {
        return new FileSnapshotStore(Path.of(config.getSnapshotPath()), objectMapper);
    }
}
