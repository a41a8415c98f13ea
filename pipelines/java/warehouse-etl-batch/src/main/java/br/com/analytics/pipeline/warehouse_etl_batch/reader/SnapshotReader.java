package br.com.analytics.pipeline.warehouse_etl_batch.reader;

import br.com.analytics.pipeline.warehouse_etl_batch.exception.MissingSourceException;
import br.com.analytics.pipeline.warehouse_etl_batch.model.RawSnapshot;

import java.util.Optional;

public interface SnapshotReader {

    /**
     * Loads the latest snapshot of a raw entity.
     *
     * @throws MissingSourceException when the entity has no snapshot
     */
    default RawSnapshot read(String entityName) {
        return find(entityName).orElseThrow(() ->
                new MissingSourceException(entityName, "No raw snapshot available for entity '" + entityName + "'"));
    }

    /**
     * Loads the latest snapshot of a raw entity, or nothing when there is none. Used for optional join inputs.
     */
    Optional<RawSnapshot> find(String entityName);
}
