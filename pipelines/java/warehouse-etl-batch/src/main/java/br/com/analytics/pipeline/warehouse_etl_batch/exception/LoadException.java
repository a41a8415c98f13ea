package br.com.analytics.pipeline.warehouse_etl_batch.exception;

/**
 * A merge batch was rejected by the warehouse. Batches committed before the failing one are kept.
 */
public class LoadException extends WarehouseEtlException {

    private final String tableName;
    private final int batchNumber;

    public LoadException(String tableName, int batchNumber, Throwable cause) {
        super("Failed to merge batch " + batchNumber + " into " + tableName + ": " + cause.getMessage(), cause);
        this.tableName = tableName;
        this.batchNumber = batchNumber;
    }

    public String getTableName() {
        return tableName;
    }

    public int getBatchNumber() {
        return batchNumber;
    }
}
