package com.redzone.overweight.infrastructure.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Where the weight samples live in the warehouse and which of them are aggregated
 */
@Component
@Validated
@ConfigurationProperties(prefix = "overweight.warehouse")
public class WarehouseQueryConfig {

    @NotBlank
    private String database = "ZMDNZIEQEO_DB";

    @NotBlank
    private String schema = "tillamook-country-smoker-org";

    @Positive
    private int lookbackWeeks = 26;

    @NotBlank
    private String characteristicPattern = "%Product Weight%";

    public String getDatabase() {
        return database;
    }

    public void setDatabase(String database) {
        this.database = database;
    }

    public String getSchema() {
        return schema;
    }

    public void setSchema(String schema) {
        this.schema = schema;
    }

    public int getLookbackWeeks() {
        return lookbackWeeks;
    }

    public void setLookbackWeeks(int lookbackWeeks) {
        this.lookbackWeeks = lookbackWeeks;
    }

    public String getCharacteristicPattern() {
        return characteristicPattern;
    }

    public void setCharacteristicPattern(String characteristicPattern) {
        this.characteristicPattern = characteristicPattern;
    }
}
