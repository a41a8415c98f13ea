package br.com.analytics.pipeline.warehouse_etl_batch.schema;

import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rows of a star table, each an array ordered like {@link TableDefinition#columns()}.
 */
public record StarTable(TableDefinition<?> definition, List<@Nullable Object[]> rows) {

    public StarTable {
        rows = Collections.unmodifiableList(new ArrayList<>(rows));
    }

    public String name() {
        return definition.name();
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public @Nullable Object value(int row, String column) {
        return rows.get(row)[definition.indexOf(column)];
    }

    public List<@Nullable Object> columnValues(String column) {
        int index = definition.indexOf(column);
        List<@Nullable Object> values = new ArrayList<>(rows.size());
        for (Object[] row : rows) {
            values.add(row[index]);
        }
        return values;
    }

    public List<Map<String, @Nullable Object>> toMaps() {
        List<String> names = definition.columnNames();
        List<Map<String, @Nullable Object>> maps = new ArrayList<>(rows.size());
        for (Object[] row : rows) {
            Map<String, @Nullable Object> map = new LinkedHashMap<>();
            for (int i = 0; i < names.size(); i++) {
                map.put(names.get(i), row[i]);
            }
            maps.add(map);
        }
        return maps;
    }
}
