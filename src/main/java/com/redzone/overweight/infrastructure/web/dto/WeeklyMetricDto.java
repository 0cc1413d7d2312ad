package com.redzone.overweight.infrastructure.web.dto;

import com.redzone.overweight.domain.model.WeeklyMetric;
import java.time.LocalDate;

public record WeeklyMetricDto(
        LocalDate week_start,
        double avg_overweight,
        double avg_value,
        double avg_target,
        long count
) {
    public static WeeklyMetricDto fromWeeklyMetric(WeeklyMetric metric) {
        return new WeeklyMetricDto(
                metric.weekStart(),
                metric.avgOverweight(),
                metric.avgValue(),
                metric.avgTarget(),
                metric.count()
        );
    }
}
