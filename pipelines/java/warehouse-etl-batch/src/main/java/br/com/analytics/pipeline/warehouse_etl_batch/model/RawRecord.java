package br.com.analytics.pipeline.warehouse_etl_batch.model;

import br.com.analytics.pipeline.warehouse_etl_batch.exception.ValidationException;
import org.jspecify.annotations.Nullable;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * One raw row keyed by source column name. Values keep whatever type the snapshot carried;
 * the typed getters coerce them and fail with {@link ValidationException} when they cannot.
 */
public final class RawRecord {

    private final Map<String, @Nullable Object> values;

    public RawRecord(Map<String, ?> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static RawRecord of(Map<String, ?> values) {
        return new RawRecord(values);
    }

    public boolean has(String column) {
        return values.containsKey(column);
    }

    public @Nullable Object get(String column) {
        return values.get(column);
    }

    public Map<String, @Nullable Object> asMap() {
        return values;
    }

    public @Nullable String getString(String column) {
        Object value = values.get(column);
        return value == null ? null : value.toString();
    }

    public @Nullable Long getLong(String column) {
        Object value = values.get(column);
        if (value == null) {
            return null;
        }
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        String text = value.toString().trim();
        if (text.isEmpty()) {
            return null;
        }
        try {
            // floating values such as 3.0 are accepted, 2.7 is not
            BigDecimal decimal = value instanceof Double || value instanceof Float
                    ? BigDecimal.valueOf(((Number) value).doubleValue())
                    : new BigDecimal(text);
            return decimal.longValueExact();
        } catch (ArithmeticException | NumberFormatException e) {
            throw new ValidationException("Column '" + column + "' is not an integer: " + text, e);
        }
    }

    public @Nullable Integer getInteger(String column) {
        Long value = getLong(column);
        if (value == null) {
            return null;
        }
        try {
            return Math.toIntExact(value);
        } catch (ArithmeticException e) {
            throw new ValidationException("Column '" + column + "' overflows an int: " + value, e);
        }
    }

    public @Nullable BigDecimal getDecimal(String column) {
        Object value = values.get(column);
        if (value == null) {
            return null;
        }
        if (value instanceof BigDecimal decimal) {
            return decimal;
        }
        if (value instanceof Double || value instanceof Float) {
            return BigDecimal.valueOf(((Number) value).doubleValue());
        }
        if (value instanceof Number number) {
            return BigDecimal.valueOf(number.longValue());
        }
        String text = value.toString().trim();
        if (text.isEmpty()) {
            return null;
        }
        try {
            return new BigDecimal(text);
        } catch (NumberFormatException e) {
            throw new ValidationException("Column '" + column + "' is not numeric: " + text, e);
        }
    }

    public @Nullable Boolean getBoolean(String column) {
        Object value = values.get(column);
        if (value == null) {
            return null;
        }
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (value instanceof Number number) {
            return number.intValue() != 0;
        }
        String text = value.toString().trim().toLowerCase(Locale.ROOT);
        return switch (text) {
            case "true", "t", "1", "yes" -> Boolean.TRUE;
            case "false", "f", "0", "no" -> Boolean.FALSE;
            case "" -> null;
            default -> throw new ValidationException("Column '" + column + "' is not a boolean: " + text);
        };
    }

    /**
     * Nested line items. A missing or null column yields an empty list.
     */
    public List<RawRecord> getItems(String column) {
        Object value = values.get(column);
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> list)) {
            throw new ValidationException("Column '" + column + "' is not a list: " + value.getClass().getSimpleName());
        }
        List<RawRecord> items = new ArrayList<>(list.size());
        for (Object element : list) {
            if (!(element instanceof Map<?, ?> map)) {
                throw new ValidationException("Column '" + column + "' contains a non-record item: " + element);
            }
            Map<String, Object> item = new LinkedHashMap<>();
            map.forEach((k, v) -> item.put(String.valueOf(k), v));
            items.add(new RawRecord(item));
        }
        return items;
    }

    @Override
    public String toString() {
        return "RawRecord" + values;
    }
}
