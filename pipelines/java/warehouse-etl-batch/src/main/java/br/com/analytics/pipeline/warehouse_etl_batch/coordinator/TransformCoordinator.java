package br.com.analytics.pipeline.warehouse_etl_batch.coordinator;

import br.com.analytics.pipeline.warehouse_etl_batch.processor.DimensionBuilder;
import br.com.analytics.pipeline.warehouse_etl_batch.processor.FactBuilder;
import br.com.analytics.pipeline.warehouse_etl_batch.schema.StarSchema;
import br.com.analytics.pipeline.warehouse_etl_batch.schema.StarTable;
import br.com.analytics.pipeline.warehouse_etl_batch.writer.MergeLoader;
import br.com.analytics.pipeline.warehouse_etl_batch.writer.MergeResult;
import br.com.analytics.pipeline.warehouse_etl_batch.writer.StarTableStore;
import br.com.analytics.pipeline.warehouse_etl_batch.writer.TableStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs the per-entity transform and load stages. One entity failing never stops the others:
 * the failure is logged, counted as zero rows and reported.
 */
public class TransformCoordinator {

    private static final Logger log = LoggerFactory.getLogger(TransformCoordinator.class);

    private final List<EntityHandler<?>> handlers;
    private final StarTableStore store;
    private final MergeLoader loader;
    private final boolean mergeOnTransform;

    public TransformCoordinator(List<EntityHandler<?>> handlers, StarTableStore store, MergeLoader loader,
                                boolean mergeOnTransform) {
        this.handlers = List.copyOf(handlers);
        this.store = store;
        this.loader = loader;
        this.mergeOnTransform = mergeOnTransform;
    }

    /**
     * Dimensions first, then facts.
     */
    public static List<EntityHandler<?>> standardHandlers(DimensionBuilder dimensions, FactBuilder facts) {
        return List.<EntityHandler<?>>of(
                new EntityHandler<>("clientes", StarSchema.DIM_CLIENTE, dimensions::buildClients),
                new EntityHandler<>("produtos", StarSchema.DIM_PRODUTO, dimensions::buildProducts),
                new EntityHandler<>("lojas", StarSchema.DIM_LOJA, dimensions::buildStores),
                new EntityHandler<>("tempo", StarSchema.DIM_TEMPO, dimensions::buildCalendar),
                new EntityHandler<>("vendas", StarSchema.FATO_VENDAS, facts::buildSales),
                new EntityHandler<>("estoque", StarSchema.FATO_ESTOQUE, facts::buildInventory),
                new EntityHandler<>("distribuicoes", StarSchema.FATO_DISTRIBUICOES, facts::buildDistributions)
        );
    }

    public List<String> entityNames() {
        return handlers.stream().map(EntityHandler::entityName).toList();
    }

    public TransformReport runAll() {
        log.info("Starting star schema transformation of {} entities", handlers.size());
        Map<String, Integer> rowCounts = new LinkedHashMap<>();
        Map<String, Throwable> failures = new LinkedHashMap<>();

        for (EntityHandler<?> handler : handlers) {
            try {
                rowCounts.put(handler.entityName(), process(handler).size());
            } catch (RuntimeException e) {
                log.error("Transformation of '{}' failed", handler.entityName(), e);
                rowCounts.put(handler.entityName(), 0);
                failures.put(handler.entityName(), e);
            }
        }

        TransformReport report = new TransformReport(rowCounts, failures);
        log.info("Transformation finished: {} of {} entities succeeded, {} rows", report.succeeded(),
                handlers.size(), report.totalRows());
        return report;
    }

    /**
     * Builds and persists a single entity, merging it too when merge-on-transform is enabled.
     *
     * @throws IllegalArgumentException for an unknown entity name
     */
    public StarTable transform(String entityName) {
        return process(handler(entityName));
    }

    private StarTable process(EntityHandler<?> handler) {
        StarTable table = handler.build();
        store.write(table);
        if (mergeOnTransform) {
            loader.merge(table);
        }
        log.info("Entity '{}' produced {} rows for {}", handler.entityName(), table.size(), table.name());
        return table;
    }

    /**
     * Merges every persisted table into the warehouse. Row counts are the rows submitted per entity.
     */
    public TransformReport loadAll() {
        log.info("Starting warehouse load of {} tables", handlers.size());
        Map<String, Integer> rowCounts = new LinkedHashMap<>();
        Map<String, Throwable> failures = new LinkedHashMap<>();

        for (EntityHandler<?> handler : handlers) {
            try {
                MergeResult result = loader.merge(store.read(handler.definition()));
                rowCounts.put(handler.entityName(), result.rowsSubmitted());
            } catch (RuntimeException e) {
                log.error("Load of '{}' into {} failed", handler.entityName(), handler.definition().warehouseTable(), e);
                rowCounts.put(handler.entityName(), 0);
                failures.put(handler.entityName(), e);
            }
        }

        TransformReport report = new TransformReport(rowCounts, failures);
        log.info("Warehouse load finished: {} of {} tables merged, {} rows", report.succeeded(),
                handlers.size(), report.totalRows());
        return report;
    }

    public List<TableStatistics> statistics() {
        List<TableStatistics> statistics = new ArrayList<>();
        for (EntityHandler<?> handler : handlers) {
            store.statistics(handler.definition()).ifPresent(statistics::add);
        }
        return statistics;
    }

    /**
     * Formats a report of the persisted tables and logs it.
     */
    public String describe() {
        List<TableStatistics> statistics = statistics();
        StringBuilder report = new StringBuilder("Star schema report\n");
        for (String kind : List.of("dims", "facts")) {
            report.append(kind.equals("dims") ? "Dimensions:\n" : "Facts:\n");
            statistics.stream()
                    .filter(table -> table.kind().equals(kind))
                    .forEach(table -> report.append(String.format("  %-20s %10d rows %4d columns %8.2f MB%n",
                            table.table(), table.rows(), table.columns(), table.sizeMegabytes())));
        }
        long totalRows = statistics.stream().mapToLong(TableStatistics::rows).sum();
        double totalSize = statistics.stream().mapToDouble(TableStatistics::sizeMegabytes).sum();
        report.append(String.format("Total: %d tables, %d rows, %.2f MB%n", statistics.size(), totalRows, totalSize));

        log.info("{}", report);
        return report.toString();
    }

    private EntityHandler<?> handler(String entityName) {
        Optional<EntityHandler<?>> handler = handlers.stream()
                .filter(candidate -> candidate.entityName().equals(entityName))
                .findFirst();
        return handler.orElseThrow(() -> new IllegalArgumentException(
                "Unknown entity '" + entityName + "', expected one of " + entityNames()));
    }
}
