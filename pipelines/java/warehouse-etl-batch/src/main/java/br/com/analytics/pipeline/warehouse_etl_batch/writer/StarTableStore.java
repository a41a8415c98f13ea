package br.com.analytics.pipeline.warehouse_etl_batch.writer;

import br.com.analytics.pipeline.warehouse_etl_batch.exception.MissingSourceException;
import br.com.analytics.pipeline.warehouse_etl_batch.exception.TransformException;
import br.com.analytics.pipeline.warehouse_etl_batch.exception.ValidationException;
import br.com.analytics.pipeline.warehouse_etl_batch.schema.ColumnSpec;
import br.com.analytics.pipeline.warehouse_etl_batch.schema.StarTable;
import br.com.analytics.pipeline.warehouse_etl_batch.schema.TableDefinition;
import org.apache.avro.Schema;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericRecord;
import org.apache.parquet.avro.AvroParquetReader;
import org.apache.parquet.avro.AvroParquetWriter;
import org.apache.parquet.hadoop.ParquetFileReader;
import org.apache.parquet.hadoop.ParquetReader;
import org.apache.parquet.hadoop.ParquetWriter;
import org.apache.parquet.hadoop.metadata.CompressionCodecName;
import org.apache.parquet.io.LocalInputFile;
import org.apache.parquet.io.LocalOutputFile;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persists star tables as parquet files under {@code <silverDir>/dims} and {@code <silverDir>/facts}.
 * Writing a table replaces the previous file of the same name.
 */
public class StarTableStore {

    private static final Logger log = LoggerFactory.getLogger(StarTableStore.class);

    private static final String NAMESPACE = "br.com.analytics.warehouse.silver";

    private final Path silverDir;
    private final CompressionCodecName compression;

    public StarTableStore(Path silverDir, CompressionCodecName compression) {
        this.silverDir = silverDir;
        this.compression = compression;
    }

    public Path pathOf(TableDefinition<?> definition) {
        return silverDir.resolve(definition.kind().directory()).resolve(definition.name() + ".parquet");
    }

    public boolean exists(TableDefinition<?> definition) {
        return Files.isRegularFile(pathOf(definition));
    }

    public Path write(StarTable table) {
        TableDefinition<?> definition = table.definition();
        Path target = pathOf(definition);
        Schema schema = avroSchema(definition);
        List<? extends ColumnSpec<?>> columns = definition.columns();

        try {
            Files.createDirectories(target.getParent());
            Files.deleteIfExists(target);
            try (ParquetWriter<GenericRecord> writer = AvroParquetWriter.<GenericRecord>builder(new LocalOutputFile(target))
                    .withSchema(schema)
                    .withCompressionCodec(compression)
                    .withExtraMetaData(Map.of("warehouse.table", definition.warehouseTable()))
                    .build()) {
                for (Object[] row : table.rows()) {
                    GenericData.Record record = new GenericData.Record(schema);
                    for (int i = 0; i < columns.size(); i++) {
                        record.put(i, columns.get(i).type().toSilver(row[i]));
                    }
                    writer.write(record);
                }
            }
        } catch (IOException e) {
            throw new TransformException("Failed to persist " + definition.name() + " to " + target, e);
        }

        log.info("Persisted {} rows of {} to {}", table.size(), definition.name(), target);
        return target;
    }

    /**
     * Reads a persisted table back.
     *
     * @throws MissingSourceException when the table was never persisted
     */
    public StarTable read(TableDefinition<?> definition) {
        Path source = pathOf(definition);
        if (!Files.isRegularFile(source)) {
            throw new MissingSourceException(definition.name(), "No persisted table " + definition.name() + " at " + source);
        }
        List<? extends ColumnSpec<?>> columns = definition.columns();
        List<@Nullable Object[]> rows = new ArrayList<>();
        try (ParquetReader<GenericRecord> reader = AvroParquetReader.<GenericRecord>builder(new LocalInputFile(source)).build()) {
            GenericRecord record;
            while ((record = reader.read()) != null) {
                Object[] row = new Object[columns.size()];
                for (int i = 0; i < columns.size(); i++) {
                    ColumnSpec<?> column = columns.get(i);
                    Object value = record.hasField(column.name()) ? record.get(column.name()) : null;
                    row[i] = column.type().fromSilver(value);
                }
                rows.add(row);
            }
        } catch (ValidationException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            throw new ValidationException("Persisted table " + source + " is not readable", e);
        }
        return new StarTable(definition, rows);
    }

    public Optional<TableStatistics> statistics(TableDefinition<?> definition) {
        Path file = pathOf(definition);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try (ParquetFileReader reader = ParquetFileReader.open(new LocalInputFile(file))) {
            int columns = reader.getFooter().getFileMetaData().getSchema().getFieldCount();
            return Optional.of(new TableStatistics(
                    definition.name(),
                    definition.kind().directory(),
                    reader.getRecordCount(),
                    columns,
                    Files.size(file),
                    Files.getLastModifiedTime(file).toInstant(),
                    file
            ));
        } catch (IOException e) {
            throw new ValidationException("Cannot read statistics of " + file, e);
        }
    }

    static Schema avroSchema(TableDefinition<?> definition) {
        List<Schema.Field> fields = new ArrayList<>();
        for (ColumnSpec<?> column : definition.columns()) {
            fields.add(new Schema.Field(column.name(), column.type().avroSchema(), null, Schema.Field.NULL_DEFAULT_VALUE));
        }
        return Schema.createRecord(definition.name(), null, NAMESPACE, false, fields);
    }
}
