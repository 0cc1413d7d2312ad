package com.redzone.overweight.domain.model;

import java.time.LocalDate;

/**
 * One weekly row as returned by the warehouse.
 * Averages may be null when the warehouse had nothing to average.
 */
public record MetricSample(
        LocalDate weekStart,
        String productKey,
        Double avgOverweight,
        Double avgValue,
        Double avgTarget,
        long sampleCount
) {}
