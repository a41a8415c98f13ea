package br.com.analytics.pipeline.warehouse_etl_batch.schema;

import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Describes one star table: its columns, where it is persisted, how it is keyed in the warehouse
 * and which column, if any, carries the load timestamp used by the recency guard.
 *
 * @param <T> row type produced by the builders
 */
public final class TableDefinition<T> {

    private final String name;
    private final String warehouseTable;
    private final TableKind kind;
    private final List<ColumnSpec<T>> columns;
    private final List<String> naturalKey;
    private final @Nullable String loadTimestampColumn;

    private TableDefinition(Builder<T> builder) {
        this.name = builder.name;
        this.warehouseTable = builder.warehouseTable;
        this.kind = builder.kind;
        this.columns = List.copyOf(builder.columns);
        this.naturalKey = List.copyOf(builder.naturalKey);
        this.loadTimestampColumn = builder.loadTimestampColumn;
        for (String key : naturalKey) {
            indexOf(key);
        }
        if (loadTimestampColumn != null) {
            indexOf(loadTimestampColumn);
        }
    }

    public static <T> Builder<T> dimension(String name, String warehouseTable) {
        return new Builder<>(name, warehouseTable, TableKind.DIMENSION);
    }

    public static <T> Builder<T> fact(String name, String warehouseTable) {
        return new Builder<>(name, warehouseTable, TableKind.FACT);
    }

    public String name() {
        return name;
    }

    public String warehouseTable() {
        return warehouseTable;
    }

    public TableKind kind() {
        return kind;
    }

    public List<ColumnSpec<T>> columns() {
        return columns;
    }

    public List<String> naturalKey() {
        return naturalKey;
    }

    public @Nullable String loadTimestampColumn() {
        return loadTimestampColumn;
    }

    public List<String> columnNames() {
        return columns.stream().map(ColumnSpec::name).toList();
    }

    public int indexOf(String column) {
        for (int i = 0; i < columns.size(); i++) {
            if (columns.get(i).name().equals(column)) {
                return i;
            }
        }
        throw new IllegalArgumentException("Table " + name + " has no column " + column);
    }

    public ColumnSpec<T> column(String column) {
        return columns.get(indexOf(column));
    }

    /**
     * Projects builder rows onto this table's columns.
     */
    public StarTable toTable(List<T> rows) {
        List<@Nullable Object[]> projected = new ArrayList<>(rows.size());
        for (T row : rows) {
            Object[] values = new Object[columns.size()];
            for (int i = 0; i < columns.size(); i++) {
                values[i] = columns.get(i).extractor().apply(row);
            }
            projected.add(values);
        }
        return new StarTable(this, projected);
    }

    @Override
    public String toString() {
        return name;
    }

    public static final class Builder<T> {

        private final String name;
        private final String warehouseTable;
        private final TableKind kind;
        private final List<ColumnSpec<T>> columns = new ArrayList<>();
        private final List<String> naturalKey = new ArrayList<>();
        private @Nullable String loadTimestampColumn;

        private Builder(String name, String warehouseTable, TableKind kind) {
            this.name = Objects.requireNonNull(name);
            this.warehouseTable = Objects.requireNonNull(warehouseTable);
            this.kind = kind;
        }

        public Builder<T> column(String column, ColumnType type, Function<T, @Nullable Object> extractor) {
            columns.add(ColumnSpec.of(column, type, extractor));
            return this;
        }

        public Builder<T> column(String column, String warehouseName, ColumnType type,
                                 Function<T, @Nullable Object> extractor) {
            columns.add(ColumnSpec.mapped(column, warehouseName, type, extractor));
            return this;
        }

        public Builder<T> naturalKey(String... keyColumns) {
            naturalKey.addAll(List.of(keyColumns));
            return this;
        }

        public Builder<T> loadTimestamp(String column) {
            this.loadTimestampColumn = column;
            return this;
        }

        public TableDefinition<T> build() {
            if (naturalKey.isEmpty()) {
                throw new IllegalStateException("Table " + name + " needs a natural key");
            }
            return new TableDefinition<>(this);
        }
    }
}
