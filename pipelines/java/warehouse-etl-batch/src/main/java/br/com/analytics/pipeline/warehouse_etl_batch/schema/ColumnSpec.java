package br.com.analytics.pipeline.warehouse_etl_batch.schema;

import org.jspecify.annotations.Nullable;

import java.util.function.Function;

/**
 * A star table column. {@code name} is the silver column, {@code warehouseName} the column it is merged into.
 */
public record ColumnSpec<T>(
        String name,
        String warehouseName,
        ColumnType type,
        Function<T, @Nullable Object> extractor
) {

    public static <T> ColumnSpec<T> of(String name, ColumnType type, Function<T, @Nullable Object> extractor) {
        return new ColumnSpec<>(name, name, type, extractor);
    }

    public static <T> ColumnSpec<T> mapped(String name, String warehouseName, ColumnType type,
                                           Function<T, @Nullable Object> extractor) {
        return new ColumnSpec<>(name, warehouseName, type, extractor);
    }
}
