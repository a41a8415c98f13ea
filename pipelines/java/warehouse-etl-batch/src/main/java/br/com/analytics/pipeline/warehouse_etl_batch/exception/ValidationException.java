package br.com.analytics.pipeline.warehouse_etl_batch.exception;

/**
 * Input is present but malformed.
 */
public class ValidationException extends WarehouseEtlException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
