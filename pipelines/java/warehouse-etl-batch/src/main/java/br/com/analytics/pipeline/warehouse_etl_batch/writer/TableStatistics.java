package br.com.analytics.pipeline.warehouse_etl_batch.writer;

import java.nio.file.Path;
import java.time.Instant;

public record TableStatistics(
        String table,
        String kind,
        long rows,
        int columns,
        long sizeBytes,
        Instant modifiedAt,
        Path file
) {

    public double sizeMegabytes() {
        return sizeBytes / (1024.0 * 1024.0);
    }
}
