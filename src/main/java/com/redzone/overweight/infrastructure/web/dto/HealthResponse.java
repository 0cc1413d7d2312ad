package com.redzone.overweight.infrastructure.web.dto;

import com.redzone.overweight.domain.model.CacheHealth;
import java.time.Instant;
import java.util.Locale;

public record HealthResponse(
        String status,
        String cache,
        Instant refreshed_at
) {
    public static HealthResponse fromHealth(CacheHealth health) {
        return new HealthResponse("ok", health.status().name().toLowerCase(Locale.ROOT), health.refreshedAt());
    }
}
