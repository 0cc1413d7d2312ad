package com.redzone.overweight.domain.model;

import java.time.LocalDate;

public record WeeklyMetric(
        LocalDate weekStart,
        double avgOverweight,
        double avgValue,
        double avgTarget,
        long count
) {}
