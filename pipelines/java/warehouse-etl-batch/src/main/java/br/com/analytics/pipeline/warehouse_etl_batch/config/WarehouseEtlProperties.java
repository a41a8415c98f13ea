package br.com.analytics.pipeline.warehouse_etl_batch.config;

import org.apache.parquet.hadoop.metadata.CompressionCodecName;
import org.jspecify.annotations.Nullable;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.format.annotation.DateTimeFormat;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Settings bound from {@code warehouse-etl.*}.
 */
@ConfigurationProperties(prefix = "warehouse-etl")
public record WarehouseEtlProperties(
        @DefaultValue("data/bronze") String bronzeDir,
        @DefaultValue("data/silver") String silverDir,
        @DefaultValue("false") boolean mergeOnTransform,
        @DefaultValue("false") boolean failStepOnError,
        @DefaultValue("SNAPPY") CompressionCodecName compression,
        @DefaultValue Calendar calendar,
        @DefaultValue Merge merge,
        @DefaultValue Sales sales
) {

    /**
     * @param fallbackStart   first day of the calendar when no source date can be read
     * @param fallbackEnd     last fallback day, today when unset
     * @param temporalColumns raw entity to the columns scanned for the calendar range
     */
    public record Calendar(
            @DefaultValue("2023-01-01") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate fallbackStart,
            @Nullable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate fallbackEnd,
            @Nullable Map<String, List<String>> temporalColumns
    ) {

        public static final Map<String, List<String>> DEFAULT_TEMPORAL_COLUMNS = defaultTemporalColumns();

        public Calendar {
            if (temporalColumns == null || temporalColumns.isEmpty()) {
                temporalColumns = DEFAULT_TEMPORAL_COLUMNS;
            }
        }

        public static Calendar defaults() {
            return new Calendar(LocalDate.of(2023, 1, 1), null, null);
        }

        private static Map<String, List<String>> defaultTemporalColumns() {
            Map<String, List<String>> columns = new LinkedHashMap<>();
            columns.put("vendas", List.of("sale_date", "predicted_delivery", "delivered_at"));
            columns.put("distribuicao_interna", List.of("distribution_date"));
            columns.put("estoque", List.of("updated_at"));
            columns.put("entradas", List.of("entry_date"));
            return Collections.unmodifiableMap(columns);
        }
    }

    /**
     * @param schema    warehouse schema holding the star tables, none when blank
     * @param batchSize rows per upsert transaction
     */
    public record Merge(
            @DefaultValue("analytics") String schema,
            @DefaultValue("1000") int batchSize
    ) {
    }

    /**
     * @param itemCostField line item field read as the unit cost, falling back to the product's cost price
     */
    public record Sales(
            @DefaultValue("total_price") String itemCostField
    ) {
    }
}
