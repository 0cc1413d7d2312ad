package com.redzone.overweight.infrastructure.persistence;

import com.redzone.overweight.domain.model.MetricSample;
import org.springframework.jdbc.core.RowMapper;

import java.math.BigDecimal;
import java.sql.Date;
import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * Maps one row of the weekly overweight query.
 * Expects the columns week_start, product, avg_overweight, avg_value, avg_target and sample_count.
 */
public class MetricSampleRowMapper implements RowMapper<MetricSample> {

    @Override
    public MetricSample mapRow(ResultSet rs, int rowNum) throws SQLException {
        Date weekStart = rs.getDate("week_start");
        return new MetricSample(
                weekStart != null ? weekStart.toLocalDate() : null,
                rs.getString("product"),
                nullableDouble(rs, "avg_overweight"),
                nullableDouble(rs, "avg_value"),
                nullableDouble(rs, "avg_target"),
                rs.getLong("sample_count")
        );
    }

    private static Double nullableDouble(ResultSet rs, String column) throws SQLException {
        BigDecimal value = rs.getBigDecimal(column);
        return value != null ? value.doubleValue() : null;
    }
}
