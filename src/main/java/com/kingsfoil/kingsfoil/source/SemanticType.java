package com.kingsfoil.kingsfoil.source;

import java.sql.Types;

/**
 * Declared value type of a canonical column, with the SQL type used for its data table column.
 */
public enum SemanticType {
    TEXT("VARCHAR", Types.VARCHAR),
    INTEGER("BIGINT", Types.BIGINT),
    NUMERIC("NUMERIC(" + SourceConstants.NUMERIC_PRECISION + "," + SourceConstants.NUMERIC_SCALE + ")", Types.NUMERIC),
    DATE("DATE", Types.DATE),
    BOOLEAN("BOOLEAN", Types.BOOLEAN);

    private final String sqlDefinition;
    private final int jdbcType;

    SemanticType(String sqlDefinition, int jdbcType) {
        this.sqlDefinition = sqlDefinition;
        this.jdbcType = jdbcType;
    }

    public String sqlDefinition() {
        return sqlDefinition;
    }

    public int jdbcType() {
        return jdbcType;
    }
}
