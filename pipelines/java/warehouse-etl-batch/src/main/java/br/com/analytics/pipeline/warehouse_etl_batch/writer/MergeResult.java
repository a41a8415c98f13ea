package br.com.analytics.pipeline.warehouse_etl_batch.writer;

/**
 * @param rowsSubmitted      rows sent to the warehouse after natural key deduplication
 * @param insertedOrUpdated  rows the driver reported as inserted or updated
 */
public record MergeResult(String table, int rowsSubmitted, int insertedOrUpdated, int batches) {

    public static MergeResult empty(String table) {
        return new MergeResult(table, 0, 0, 0);
    }
}
