package br.com.analytics.pipeline.warehouse_etl_batch.writer;

import br.com.analytics.pipeline.warehouse_etl_batch.exception.LoadException;
import br.com.analytics.pipeline.warehouse_etl_batch.schema.StarTable;
import br.com.analytics.pipeline.warehouse_etl_batch.schema.TableDefinition;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges star tables into the warehouse by natural key.
 * <p>
 * Rows are sent in batches, one transaction per batch. A failing batch is rolled back and surfaces as a
 * {@link LoadException}; batches committed before it stay in place.
 */
public class MergeLoader {

    private static final Logger log = LoggerFactory.getLogger(MergeLoader.class);

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final @Nullable String schema;
    private final int batchSize;

    public MergeLoader(DataSource dataSource, PlatformTransactionManager transactionManager,
                       @Nullable String schema, int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive: " + batchSize);
        }
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        // a batch commits on its own even when the caller already holds a transaction
        this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.schema = schema;
        this.batchSize = batchSize;
    }

    public MergeResult merge(StarTable table) {
        TableDefinition<?> definition = table.definition();
        UpsertStatement upsert = UpsertStatement.forTable(definition, schema);

        if (table.isEmpty()) {
            log.info("No rows to merge into {}", upsert.tableName());
            return MergeResult.empty(upsert.tableName());
        }

        List<Object[]> arguments = new ArrayList<>();
        for (Object[] row : deduplicate(table)) {
            arguments.add(upsert.bind(row));
        }

        int affected = 0;
        int batches = 0;
        for (int start = 0; start < arguments.size(); start += batchSize) {
            List<Object[]> batch = arguments.subList(start, Math.min(start + batchSize, arguments.size()));
            int batchNumber = ++batches;
            try {
                int[] counts = transactionTemplate.execute(status ->
                        jdbcTemplate.batchUpdate(upsert.sql(), batch, upsert.argumentTypes()));
                affected += countAffected(counts);
            } catch (DataAccessException | TransactionException e) {
                log.error("Batch {} of {} rolled back after {} committed rows", batchNumber, upsert.tableName(), start, e);
                throw new LoadException(upsert.tableName(), batchNumber, e);
            }
            log.debug("Committed batch {} of {} ({} rows)", batchNumber, upsert.tableName(), batch.size());
        }

        log.info("Merged {} rows into {} in {} batches, {} inserted or updated",
                arguments.size(), upsert.tableName(), batches, affected);
        return new MergeResult(upsert.tableName(), arguments.size(), affected, batches);
    }

    /**
     * Keeps the last row of each natural key, in the position of that last occurrence.
     */
    static List<Object[]> deduplicate(StarTable table) {
        TableDefinition<?> definition = table.definition();
        int[] keyIndexes = definition.naturalKey().stream().mapToInt(definition::indexOf).toArray();

        Map<List<Object>, Object[]> byKey = new LinkedHashMap<>();
        for (Object[] row : table.rows()) {
            List<Object> key = new ArrayList<>(keyIndexes.length);
            for (int index : keyIndexes) {
                key.add(row[index]);
            }
            byKey.remove(key);
            byKey.put(key, row);
        }
        if (byKey.size() < table.size()) {
            log.debug("Dropped {} duplicate natural keys from {}", table.size() - byKey.size(), definition.name());
        }
        return new ArrayList<>(byKey.values());
    }

    private static int countAffected(int @Nullable [] counts) {
        if (counts == null) {
            return 0;
        }
        return Arrays.stream(counts)
                .map(count -> count == Statement.SUCCESS_NO_INFO ? 1 : Math.max(count, 0))
                .sum();
    }
}
