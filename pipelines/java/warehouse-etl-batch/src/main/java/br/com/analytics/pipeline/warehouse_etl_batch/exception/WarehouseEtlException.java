package br.com.analytics.pipeline.warehouse_etl_batch.exception;

/**
 * Base type for every failure raised while building or loading the star schema.
 */
public class WarehouseEtlException extends RuntimeException {

    public WarehouseEtlException(String message) {
        super(message);
    }

    public WarehouseEtlException(String message, Throwable cause) {
        super(message, cause);
    }
}
