package gr.imsi.athenarc.pipeline.domain;

import java.math.BigDecimal;
import java.sql.Types;
import java.time.Instant;

/**
 * Type tags attached to the columns of a {@link TabularResult}.
 * Each tag fixes the Java type its non-null values are normalized to.
 */
public enum ColumnType {
    STRING,     // String
    INTEGER,    // Long
    FLOAT,      // Double
    DECIMAL,    // BigDecimal
    BOOLEAN,    // Boolean
    TIMESTAMP,  // Instant
    UNKNOWN;    // any value, written as its string form

    public boolean isNumeric() {
        return this == INTEGER || this == FLOAT || this == DECIMAL;
    }

    public static ColumnType fromSqlType(int sqlType) {
        switch (sqlType) {
            case Types.CHAR:
            case Types.VARCHAR:
            case Types.LONGVARCHAR:
            case Types.NCHAR:
            case Types.NVARCHAR:
            case Types.LONGNVARCHAR:
            case Types.CLOB:
                return STRING;
            case Types.TINYINT:
            case Types.SMALLINT:
            case Types.INTEGER:
            case Types.BIGINT:
                return INTEGER;
            case Types.REAL:
            case Types.FLOAT:
            case Types.DOUBLE:
                return FLOAT;
            case Types.NUMERIC:
            case Types.DECIMAL:
                return DECIMAL;
            case Types.BIT:
            case Types.BOOLEAN:
                return BOOLEAN;
            case Types.DATE:
            case Types.TIMESTAMP:
            case Types.TIMESTAMP_WITH_TIMEZONE:
                return TIMESTAMP;
            default:
                return UNKNOWN;
        }
    }

    /**
     * Infers the tag of a single value, used when operations create new columns.
     */
    public static ColumnType ofValue(Object value) {
        if (value instanceof String) return STRING;
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) return INTEGER;
        if (value instanceof Double || value instanceof Float) return FLOAT;
        if (value instanceof BigDecimal) return DECIMAL;
        if (value instanceof Boolean) return BOOLEAN;
        if (value instanceof Instant) return TIMESTAMP;
        return UNKNOWN;
    }
}
