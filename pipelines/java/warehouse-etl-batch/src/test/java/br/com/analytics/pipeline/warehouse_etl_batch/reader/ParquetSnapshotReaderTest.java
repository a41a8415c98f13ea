package br.com.analytics.pipeline.warehouse_etl_batch.reader;

import br.com.analytics.pipeline.warehouse_etl_batch.exception.MissingSourceException;
import br.com.analytics.pipeline.warehouse_etl_batch.exception.ValidationException;
import br.com.analytics.pipeline.warehouse_etl_batch.model.RawRecord;
import br.com.analytics.pipeline.warehouse_etl_batch.model.RawSnapshot;
import org.apache.avro.Schema;
import org.apache.avro.SchemaBuilder;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericRecord;
import org.apache.parquet.avro.AvroParquetWriter;
import org.apache.parquet.hadoop.ParquetWriter;
import org.apache.parquet.hadoop.metadata.CompressionCodecName;
import org.apache.parquet.io.LocalOutputFile;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ParquetSnapshotReaderTest {

    private static final Schema ITEM = SchemaBuilder.record("item").fields()
            .requiredLong("product_id")
            .requiredInt("quantity")
            .optionalDouble("unit_price")
            .endRecord();

    private static final Schema SALE = SchemaBuilder.record("venda").fields()
            .requiredLong("id")
            .optionalString("sale_date")
            .optionalLong("store_id")
            .name("items").type().array().items(ITEM).noDefault()
            .endRecord();

    @TempDir
    Path bronzeDir;

    private ParquetSnapshotReader reader;

    @BeforeEach
    void setUp() {
        reader = new ParquetSnapshotReader(bronzeDir);
    }

    @Test
    void readsNestedLineItems() throws IOException {
        writeSales(bronzeDir.resolve("vendas/vendas_20240101.parquet"), 1L, 2L);

        RawSnapshot snapshot = reader.read("vendas");

        assertEquals("vendas", snapshot.entityName());
        assertEquals(2, snapshot.size());
        RawRecord sale = snapshot.records().get(1);
        assertEquals(2L, sale.getLong("id"));
        assertEquals("2024-01-15", sale.getString("sale_date"));
        assertNull(sale.get("store_id"));

        List<RawRecord> items = sale.getItems("items");
        assertEquals(2, items.size());
        assertEquals(20L, items.get(1).getLong("product_id"));
        assertEquals(4, items.get(1).getInteger("quantity"));
        assertInstanceOf(String.class, sale.get("sale_date"));
    }

    @Test
    void picksMostRecentlyModifiedSnapshot() throws IOException {
        Path older = bronzeDir.resolve("vendas/b_snapshot.parquet");
        Path newer = bronzeDir.resolve("vendas/a_snapshot.parquet");
        writeSales(older, 1L);
        writeSales(newer, 7L, 8L, 9L);
        Files.setLastModifiedTime(older, FileTime.fromMillis(1_700_000_000_000L));
        Files.setLastModifiedTime(newer, FileTime.fromMillis(1_700_000_100_000L));

        RawSnapshot snapshot = reader.read("vendas");

        assertEquals(newer, snapshot.source());
        assertEquals(3, snapshot.size());
    }

    @Test
    void breaksModificationTimeTiesByFileName() throws IOException {
        Path first = bronzeDir.resolve("vendas/vendas_20240101.parquet");
        Path second = bronzeDir.resolve("vendas/vendas_20240102.parquet");
        writeSales(first, 1L);
        writeSales(second, 2L);
        FileTime sameTime = FileTime.fromMillis(1_700_000_000_000L);
        Files.setLastModifiedTime(first, sameTime);
        Files.setLastModifiedTime(second, sameTime);

        assertEquals(Optional.of(second), reader.latestSnapshot(bronzeDir.resolve("vendas")));
    }

    @Test
    void ignoresFilesWithOtherExtensions() throws IOException {
        writeSales(bronzeDir.resolve("vendas/vendas.parquet"), 1L);
        Path json = bronzeDir.resolve("vendas/vendas.json");
        Files.writeString(json, "[]");
        Files.setLastModifiedTime(json, FileTime.fromMillis(System.currentTimeMillis() + 60_000));

        assertEquals(1, reader.read("vendas").size());
    }

    @Test
    void missingOrEmptyDirectoryMeansNotFound() throws IOException {
        Files.createDirectories(bronzeDir.resolve("lojas"));

        assertTrue(reader.find("clientes").isEmpty());
        assertTrue(reader.find("lojas").isEmpty());
        MissingSourceException error = assertThrows(MissingSourceException.class, () -> reader.read("lojas"));
        assertEquals("lojas", error.getSourceName());
    }

    @Test
    void unreadableFileIsAValidationError() throws IOException {
        Path broken = bronzeDir.resolve("clientes/clientes.parquet");
        Files.createDirectories(broken.getParent());
        Files.write(broken, "not a parquet file".getBytes(StandardCharsets.UTF_8));

        assertThrows(ValidationException.class, () -> reader.read("clientes"));
    }

    @Test
    void unlistableSnapshotDirectoryIsAValidationError() throws IOException {
        Path notADirectory = bronzeDir.resolve("vendas.parquet");
        Files.createDirectories(bronzeDir);
        Files.writeString(notADirectory, "x");

        assertThrows(ValidationException.class, () -> reader.latestSnapshot(notADirectory));
    }

    private static void writeSales(Path file, long... saleIds) throws IOException {
        Files.createDirectories(file.getParent());
        try (ParquetWriter<GenericRecord> writer = AvroParquetWriter.<GenericRecord>builder(new LocalOutputFile(file))
                .withSchema(SALE)
                .withCompressionCodec(CompressionCodecName.UNCOMPRESSED)
                .build()) {
            for (long saleId : saleIds) {
                GenericData.Record sale = new GenericData.Record(SALE);
                sale.put("id", saleId);
                sale.put("sale_date", "2024-01-15");
                sale.put("store_id", null);
                GenericData.Array<GenericRecord> items = new GenericData.Array<>(2, SALE.getField("items").schema());
                items.add(item(saleId * 10, 1));
                items.add(item(20L, 4));
                sale.put("items", items);
                writer.write(sale);
            }
        }
    }

    private static GenericRecord item(long productId, int quantity) {
        GenericData.Record item = new GenericData.Record(ITEM);
        item.put("product_id", productId);
        item.put("quantity", quantity);
        item.put("unit_price", 9.5);
        return item;
    }
}
