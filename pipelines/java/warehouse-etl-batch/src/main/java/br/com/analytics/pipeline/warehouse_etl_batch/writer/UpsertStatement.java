package br.com.analytics.pipeline.warehouse_etl_batch.writer;

import br.com.analytics.pipeline.warehouse_etl_batch.schema.ColumnSpec;
import br.com.analytics.pipeline.warehouse_etl_batch.schema.TableDefinition;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * {@code INSERT ... ON CONFLICT ... DO UPDATE} statement for one star table.
 * Tables with a load timestamp only accept updates carrying a strictly newer timestamp.
 */
public record UpsertStatement(String tableName, String sql, int[] argumentTypes, List<ColumnSpec<?>> columns) {

    public static UpsertStatement forTable(TableDefinition<?> definition, @Nullable String schema) {
        String table = definition.warehouseTable();
        String qualifiedTable = schema == null || schema.isBlank() ? table : schema + "." + table;

        List<ColumnSpec<?>> columns = new ArrayList<>(definition.columns());
        List<String> keyColumns = definition.naturalKey().stream()
                .map(key -> definition.column(key).warehouseName())
                .toList();

        String columnList = columns.stream().map(ColumnSpec::warehouseName).collect(Collectors.joining(", "));
        String placeholders = columns.stream().map(column -> "?").collect(Collectors.joining(", "));
        String updates = columns.stream()
                .map(ColumnSpec::warehouseName)
                .filter(column -> !keyColumns.contains(column))
                .map(column -> column + " = EXCLUDED." + column)
                .collect(Collectors.joining(", "));

        StringBuilder sql = new StringBuilder()
                .append("INSERT INTO ").append(qualifiedTable)
                .append(" (").append(columnList).append(") ")
                .append("VALUES (").append(placeholders).append(") ")
                .append("ON CONFLICT (").append(String.join(", ", keyColumns)).append(") ");

        if (updates.isEmpty()) {
            sql.append("DO NOTHING");
        } else {
            sql.append("DO UPDATE SET ").append(updates);
            String loadTimestamp = definition.loadTimestampColumn();
            if (loadTimestamp != null) {
                String guarded = definition.column(loadTimestamp).warehouseName();
                sql.append(" WHERE ").append(table).append('.').append(guarded)
                        .append(" < EXCLUDED.").append(guarded);
            }
        }

        int[] types = columns.stream().mapToInt(column -> column.type().sqlType()).toArray();
        return new UpsertStatement(qualifiedTable, sql.toString(), types, List.copyOf(columns));
    }

    /**
     * Converts a star table row into statement arguments.
     */
    public Object[] bind(@Nullable Object[] row) {
        Object[] arguments = new Object[columns.size()];
        for (int i = 0; i < columns.size(); i++) {
            arguments[i] = columns.get(i).type().toJdbc(row[i]);
        }
        return arguments;
    }
}
