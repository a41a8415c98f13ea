package br.com.analytics.pipeline.warehouse_etl_batch.exception;

public class TransformException extends WarehouseEtlException {

    public TransformException(String message) {
        super(message);
    }

    public TransformException(String message, Throwable cause) {
        super(message, cause);
    }
}
