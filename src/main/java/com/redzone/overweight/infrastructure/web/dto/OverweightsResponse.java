package com.redzone.overweight.infrastructure.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.redzone.overweight.domain.model.CacheSnapshot;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record OverweightsResponse(
        String status,
        String message,
        Instant refreshed_at,
        Integer product_count,
        String cache_status,
        Map<String, List<WeeklyMetricDto>> data
) {
    public static final String LOADING_MESSAGE =
            "Data is loading from Snowflake, please check back in 60 seconds.";

    public static OverweightsResponse fromSnapshot(CacheSnapshot snapshot) {
        Map<String, List<WeeklyMetricDto>> data = new LinkedHashMap<>();
        snapshot.series().products().forEach((product, weeks) ->
                data.put(product, weeks.stream().map(WeeklyMetricDto::fromWeeklyMetric).toList()));

        return new OverweightsResponse(
                "ok",
                null,
                snapshot.refreshedAt(),
                snapshot.productCount(),
                snapshot.status().name().toLowerCase(Locale.ROOT),
                data
        );
    }

    public static OverweightsResponse initializing() {
        return new OverweightsResponse("initializing", LOADING_MESSAGE, null, null, null, null);
    }

    public static OverweightsResponse error(String message) {
        return new OverweightsResponse("error", message != null ? message : "Unknown error", null, null, null, null);
    }
}
