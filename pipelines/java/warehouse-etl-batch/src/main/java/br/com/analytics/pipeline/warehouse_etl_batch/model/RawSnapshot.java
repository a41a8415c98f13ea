package br.com.analytics.pipeline.warehouse_etl_batch.model;

import org.jspecify.annotations.Nullable;

import java.nio.file.Path;
import java.util.List;

/**
 * The latest raw extraction of one entity. Never mutated after it is read.
 */
public record RawSnapshot(
        String entityName,
        @Nullable Path source,
        List<RawRecord> records
) {

    public RawSnapshot {
        records = List.copyOf(records);
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    public int size() {
        return records.size();
    }
}
