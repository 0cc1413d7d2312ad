package com.redzone.overweight.infrastructure.persistence;

import com.redzone.overweight.domain.exception.SourceUnavailableException;
import com.redzone.overweight.domain.model.MetricSample;
import com.redzone.overweight.infrastructure.config.WarehouseQueryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Read-only access to the SPC samples in the warehouse
 * The weekly aggregation and all data-quality filtering happen in the query
 */
@Repository
public class WarehouseSampleRepository {

    private static final Logger logger = LoggerFactory.getLogger(WarehouseSampleRepository.class);

    private final JdbcTemplate jdbcTemplate;
    private final WarehouseQueryConfig config;
    private final String sql;

    public WarehouseSampleRepository(JdbcTemplate jdbcTemplate, WarehouseQueryConfig config) {
        this.jdbcTemplate = jdbcTemplate;
        this.config = config;
        this.sql = buildWeeklyOverweightQuery(config.getDatabase(), config.getSchema());
    }

    public List<MetricSample> findWeeklySamples() {
        int weeksBack = -config.getLookbackWeeks();
        try {
            return jdbcTemplate.query(sql, new MetricSampleRowMapper(),
                    weeksBack,
                    weeksBack,
                    config.getCharacteristicPattern());

        } catch (DataAccessException e) {
            logger.error("Warehouse error while querying weekly overweights", e);
            throw new SourceUnavailableException(
                    "Warehouse query failed: " + e.getMostSpecificCause().getMessage(), e);
        }
    }

    static String buildWeeklyOverweightQuery(String database, String schema) {
        String qualifiedSchema = quote(database) + "." + quote(schema);
        return """
            SELECT
                DATE_TRUNC('week', s."completeTime")::DATE              AS week_start,
                d."productName" || ' (' || d."productSku" || ')'        AS product,
                ROUND(AVG(s."value" - s."thresholdTarget"), 2)          AS avg_overweight,
                ROUND(AVG(s."value"), 2)                                AS avg_value,
                ROUND(AVG(s."thresholdTarget"), 2)                      AS avg_target,
                COUNT(*)                                                AS sample_count
            FROM %1$s."v_spcsample" s
            JOIN %1$s."v_completeddataitem" d
                ON s."runUUID" = d."runUUID"
                AND s."characteristicUUID" = d."characteristicUUID"
                AND d."completeTime" >= DATEADD(week, ?, CURRENT_DATE)
                AND d."void" = false
                AND d."productName" IS NOT NULL
                AND d."productSku" IS NOT NULL
            WHERE
                s."completeTime" >= DATEADD(week, ?, CURRENT_DATE)
                AND s."characteristicName" ILIKE ?
                AND s."thresholdTarget" IS NOT NULL
                AND s."deleted" = false
            GROUP BY 1, 2
            ORDER BY 2, 1
            """.formatted(qualifiedSchema);
    }

    private static String quote(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }
}
