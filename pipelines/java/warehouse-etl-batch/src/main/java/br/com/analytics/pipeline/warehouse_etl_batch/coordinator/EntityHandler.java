package br.com.analytics.pipeline.warehouse_etl_batch.coordinator;

import br.com.analytics.pipeline.warehouse_etl_batch.schema.StarTable;
import br.com.analytics.pipeline.warehouse_etl_batch.schema.TableDefinition;

import java.util.List;
import java.util.function.Supplier;

/**
 * Binds an entity name to the builder producing its rows and the table they are projected onto.
 */
public record EntityHandler<T>(String entityName, TableDefinition<T> definition, Supplier<List<T>> builder) {

    public StarTable build() {
        return definition.toTable(builder.get());
    }
}
