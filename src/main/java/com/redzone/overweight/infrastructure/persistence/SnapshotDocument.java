package com.redzone.overweight.infrastructure.persistence;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.redzone.overweight.domain.model.PersistedSnapshot;
import com.redzone.overweight.domain.model.ProductSeries;
import com.redzone.overweight.domain.model.WeeklyMetric;

import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * On-disk layout of the durable snapshot: {@code {data, refreshed_at, product_count}}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SnapshotDocument(
        @JsonProperty("data")
        Map<String, List<Entry>> data,

        @JsonProperty("refreshed_at")
        Instant refreshedAt,

        @JsonProperty("product_count")
        int productCount
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Entry(
            @JsonProperty("week_start")
            LocalDate weekStart,

            @JsonProperty("avg_overweight")
            double avgOverweight,

            @JsonProperty("avg_value")
            double avgValue,

            @JsonProperty("avg_target")
            double avgTarget,

            @JsonProperty("count")
            long count
    ) {}

    public static SnapshotDocument from(ProductSeries series, Instant refreshedAt, int productCount) {
        Map<String, List<Entry>> data = new LinkedHashMap<>();
        series.products().forEach((product, weeks) -> data.put(product, weeks.stream()
                .map(week -> new Entry(week.weekStart(), week.avgOverweight(), week.avgValue(),
                        week.avgTarget(), week.count()))
                .toList()));
        return new SnapshotDocument(data, refreshedAt, productCount);
    }

    public PersistedSnapshot toPersistedSnapshot() {
        Map<String, List<WeeklyMetric>> products = new LinkedHashMap<>();
        data.forEach((product, entries) -> products.put(product, entries.stream()
                .map(entry -> new WeeklyMetric(entry.weekStart(), entry.avgOverweight(), entry.avgValue(),
                        entry.avgTarget(), entry.count()))
                .toList()));
        return new PersistedSnapshot(new ProductSeries(products), refreshedAt, productCount);
    }
}
