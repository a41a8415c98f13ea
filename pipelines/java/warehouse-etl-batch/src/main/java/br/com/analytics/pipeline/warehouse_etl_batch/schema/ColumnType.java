package br.com.analytics.pipeline.warehouse_etl_batch.schema;

import br.com.analytics.pipeline.warehouse_etl_batch.exception.ValidationException;
import org.apache.avro.Schema;
import org.jspecify.annotations.Nullable;

import java.math.BigDecimal;
import java.sql.Date;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * Logical column types of the star tables.
 * <p>
 * Silver files keep integers and booleans native and write decimals, dates and timestamps as ISO strings.
 * Warehouse binding uses the JDBC type of each column so that nulls are typed.
 */
public enum ColumnType {

    BIGINT(Schema.Type.LONG, Types.BIGINT),
    INTEGER(Schema.Type.INT, Types.INTEGER),
    DECIMAL(Schema.Type.STRING, Types.NUMERIC),
    VARCHAR(Schema.Type.STRING, Types.VARCHAR),
    BOOLEAN(Schema.Type.BOOLEAN, Types.BOOLEAN),
    DATE(Schema.Type.STRING, Types.DATE),
    TIMESTAMP(Schema.Type.STRING, Types.TIMESTAMP);

    private final Schema.Type avroType;
    private final int sqlType;

    ColumnType(Schema.Type avroType, int sqlType) {
        this.avroType = avroType;
        this.sqlType = sqlType;
    }

    public int sqlType() {
        return sqlType;
    }

    /**
     * Nullable Avro schema used for this column in silver files.
     */
    public Schema avroSchema() {
        return Schema.createUnion(List.of(Schema.create(Schema.Type.NULL), Schema.create(avroType)));
    }

    public @Nullable Object toSilver(@Nullable Object value) {
        if (value == null) {
            return null;
        }
        return switch (this) {
            case BIGINT -> ((Number) value).longValue();
            case INTEGER -> ((Number) value).intValue();
            case DECIMAL -> ((BigDecimal) value).toPlainString();
            case VARCHAR, DATE, TIMESTAMP -> value.toString();
            case BOOLEAN -> (Boolean) value;
        };
    }

    public @Nullable Object fromSilver(@Nullable Object value) {
        if (value == null) {
            return null;
        }
        try {
            return switch (this) {
                case BIGINT -> ((Number) value).longValue();
                case INTEGER -> ((Number) value).intValue();
                case DECIMAL -> new BigDecimal(value.toString());
                case VARCHAR -> value.toString();
                case BOOLEAN -> (Boolean) value;
                case DATE -> LocalDate.parse(value.toString());
                case TIMESTAMP -> LocalDateTime.parse(value.toString());
            };
        } catch (ClassCastException | NumberFormatException | DateTimeParseException e) {
            throw new ValidationException("Value '" + value + "' is not a valid " + name(), e);
        }
    }

    /**
     * Converts a row value to the object handed to the JDBC driver.
     */
    public @Nullable Object toJdbc(@Nullable Object value) {
        if (value == null) {
            return null;
        }
        return switch (this) {
            case DATE -> Date.valueOf((LocalDate) value);
            case TIMESTAMP -> Timestamp.valueOf((LocalDateTime) value);
            default -> value;
        };
    }
}
