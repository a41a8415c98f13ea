package br.com.analytics.pipeline.warehouse_etl_batch.reader;

import br.com.analytics.pipeline.warehouse_etl_batch.exception.ValidationException;
import br.com.analytics.pipeline.warehouse_etl_batch.model.RawRecord;
import br.com.analytics.pipeline.warehouse_etl_batch.model.RawSnapshot;
import org.apache.avro.Conversions;
import org.apache.avro.data.TimeConversions;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericRecord;
import org.apache.parquet.avro.AvroParquetReader;
import org.apache.parquet.hadoop.ParquetReader;
import org.apache.parquet.io.LocalInputFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Reads raw snapshots laid out as {@code <bronzeDir>/<entity>/*.parquet}.
 * The latest file wins: greatest modification time, then greatest file name.
 */
public class ParquetSnapshotReader implements SnapshotReader {

    private static final Logger log = LoggerFactory.getLogger(ParquetSnapshotReader.class);

    private static final String EXTENSION = ".parquet";

    private final Path bronzeDir;
    private final GenericData dataModel;

    public ParquetSnapshotReader(Path bronzeDir) {
        this.bronzeDir = bronzeDir;
        this.dataModel = createDataModel();
    }

    @Override
    public Optional<RawSnapshot> find(String entityName) {
        Path entityDir = bronzeDir.resolve(entityName);
        if (!Files.isDirectory(entityDir)) {
            log.warn("No snapshot directory for entity '{}' at {}", entityName, entityDir);
            return Optional.empty();
        }
        Optional<Path> latest = latestSnapshot(entityDir);
        if (latest.isEmpty()) {
            log.warn("Snapshot directory {} holds no {} files", entityDir, EXTENSION);
            return Optional.empty();
        }
        Path file = latest.get();
        List<RawRecord> records = readRecords(file);
        log.info("Loaded {} records of '{}' from {}", records.size(), entityName, file.getFileName());
        return Optional.of(new RawSnapshot(entityName, file, records));
    }

    Optional<Path> latestSnapshot(Path entityDir) {
        List<Candidate> candidates = new ArrayList<>();
        try (Stream<Path> files = Files.list(entityDir)) {
            for (Path file : (Iterable<Path>) files::iterator) {
                if (Files.isRegularFile(file) && file.getFileName().toString().endsWith(EXTENSION)) {
                    candidates.add(new Candidate(file, Files.getLastModifiedTime(file)));
                }
            }
        } catch (IOException e) {
            throw new ValidationException("Cannot list snapshot directory " + entityDir, e);
        }
        return candidates.stream()
                .max(Comparator.comparing(Candidate::modifiedAt)
                        .thenComparing(candidate -> candidate.file().getFileName().toString()))
                .map(Candidate::file);
    }

    private List<RawRecord> readRecords(Path file) {
        List<RawRecord> records = new ArrayList<>();
        try (ParquetReader<GenericRecord> reader = AvroParquetReader.<GenericRecord>builder(new LocalInputFile(file))
                .withDataModel(dataModel)
                .build()) {
            GenericRecord record;
            while ((record = reader.read()) != null) {
                records.add(new RawRecord(AvroValues.toMap(record)));
            }
        } catch (IOException | RuntimeException e) {
            throw new ValidationException("Snapshot " + file + " is not a readable parquet file", e);
        }
        return records;
    }

    private static GenericData createDataModel() {
        GenericData model = new GenericData();
        model.addLogicalTypeConversion(new TimeConversions.DateConversion());
        model.addLogicalTypeConversion(new TimeConversions.TimestampMillisConversion());
        model.addLogicalTypeConversion(new TimeConversions.TimestampMicrosConversion());
        model.addLogicalTypeConversion(new TimeConversions.LocalTimestampMillisConversion());
        model.addLogicalTypeConversion(new TimeConversions.LocalTimestampMicrosConversion());
        model.addLogicalTypeConversion(new Conversions.DecimalConversion());
        return model;
    }

    private record Candidate(Path file, FileTime modifiedAt) {
    }
}
