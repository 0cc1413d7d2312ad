package com.redzone.overweight.domain;

import com.redzone.overweight.domain.model.MetricSample;
import com.redzone.overweight.domain.model.ProductSeries;
import com.redzone.overweight.domain.model.WeeklyMetric;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Groups warehouse rows into one weekly series per product.
 * Rows keep their input order; the warehouse query already sorts by product and week.
 */
@Component
public class ProductSeriesAggregator {

    public ProductSeries aggregate(List<MetricSample> samples) {
        Map<String, List<WeeklyMetric>> products = new LinkedHashMap<>();

        for (MetricSample sample : samples) {
            if (sample.productKey() == null) {
                throw new IllegalArgumentException("Sample for week " + sample.weekStart() + " has no product key");
            }
            products.computeIfAbsent(sample.productKey().strip(), k -> new ArrayList<>())
                    .add(toWeeklyMetric(sample));
        }

        return new ProductSeries(products);
    }

    private WeeklyMetric toWeeklyMetric(MetricSample sample) {
        return new WeeklyMetric(
                sample.weekStart(),
                orZero(sample.avgOverweight()),
                orZero(sample.avgValue()),
                orZero(sample.avgTarget()),
                sample.sampleCount()
        );
    }

    private static double orZero(Double value) {
        return value != null ? value : 0.0;
    }
}
