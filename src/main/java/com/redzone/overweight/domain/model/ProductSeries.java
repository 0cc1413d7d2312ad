package com.redzone.overweight.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Weekly metrics grouped by product, in the order the warehouse returned them.
 * Instances are immutable and only ever replaced as a whole.
 */
public record ProductSeries(Map<String, List<WeeklyMetric>> products) {

    private static final ProductSeries EMPTY = new ProductSeries(Map.of());

    public ProductSeries {
        Map<String, List<WeeklyMetric>> copy = new LinkedHashMap<>();
        products.forEach((product, weeks) -> copy.put(product, List.copyOf(weeks)));
        products = Collections.unmodifiableMap(copy);
    }

    public static ProductSeries empty() {
        return EMPTY;
    }

    public int productCount() {
        return products.size();
    }

    public boolean isEmpty() {
        return products.isEmpty();
    }
}
