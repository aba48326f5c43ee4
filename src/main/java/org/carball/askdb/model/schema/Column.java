package org.carball.askdb.model.schema;

import lombok.Builder;
import lombok.Data;

import java.util.Locale;
import java.util.Set;

@Data
@Builder
public class Column {

    private static final Set<String> TEMPORAL_TYPES = Set.of(
            "DATE", "TIMESTAMP", "TIMESTAMPTZ", "DATETIME", "DATETIME2", "TIME");

    private static final Set<String> NUMERIC_TYPES = Set.of(
            "INT", "INTEGER", "BIGINT", "SMALLINT", "NUMERIC", "DECIMAL", "REAL",
            "DOUBLE", "FLOAT", "FLOAT4", "FLOAT8", "INT4", "INT8", "SERIAL", "BIGSERIAL");

    private String name;
    private String dataType;
    private boolean nullable;
    private boolean primaryKey;
    private String defaultValue;

    public boolean isTemporal() {
        return dataType != null && TEMPORAL_TYPES.contains(baseType());
    }

    public boolean isNumeric() {
        return dataType != null && NUMERIC_TYPES.contains(baseType());
    }

    private String baseType() {
        return dataType.toUpperCase(Locale.ROOT).split("[\\s(]")[0];
    }
}
