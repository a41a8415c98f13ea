package br.com.analytics.pipeline.warehouse_etl_batch.exception;

/**
 * A required raw snapshot or persisted star table could not be found.
 */
public class MissingSourceException extends WarehouseEtlException {

    private final String sourceName;

    public MissingSourceException(String sourceName, String message) {
        super(message);
        this.sourceName = sourceName;
    }

    public String getSourceName() {
        return sourceName;
    }
}
