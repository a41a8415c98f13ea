package br.com.analytics.pipeline.warehouse_etl_batch.writer;

import br.com.analytics.pipeline.warehouse_etl_batch.exception.MissingSourceException;
import br.com.analytics.pipeline.warehouse_etl_batch.model.CalendarDay;
import br.com.analytics.pipeline.warehouse_etl_batch.model.ProductDimension;
import br.com.analytics.pipeline.warehouse_etl_batch.schema.StarSchema;
import br.com.analytics.pipeline.warehouse_etl_batch.schema.StarTable;
import org.apache.parquet.hadoop.metadata.CompressionCodecName;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StarTableStoreTest {

    private static final LocalDateTime LOADED_AT = LocalDateTime.of(2024, 3, 5, 12, 0, 0, 123_456_000);

    @TempDir
    Path silverDir;

    private StarTableStore store;

    @BeforeEach
    void setUp() {
        store = new StarTableStore(silverDir, CompressionCodecName.UNCOMPRESSED);
    }

    @Test
    void persistsTablesUnderTheirKindDirectory() {
        store.write(StarSchema.DIM_TEMPO.toTable(List.of(CalendarDay.of(LocalDate.of(2024, 1, 1)))));

        assertTrue(Files.isRegularFile(silverDir.resolve("dims/dim_tempo.parquet")));
        assertEquals(silverDir.resolve("facts/fato_vendas.parquet"), store.pathOf(StarSchema.FATO_VENDAS));
    }

    @Test
    void readsBackWhatWasWritten() {
        StarTable written = StarSchema.DIM_PRODUTO.toTable(List.of(
                new ProductDimension(1L, "Caneta", "Azul", 10L, new BigDecimal("2.50"), new BigDecimal("1.1000"),
                        true, "Papelaria", null, LOADED_AT),
                new ProductDimension(2L, "Caderno", null, null, null, null, null, null, null, LOADED_AT)));

        store.write(written);
        StarTable read = store.read(StarSchema.DIM_PRODUTO);

        assertEquals(written.size(), read.size());
        assertEquals(StarSchema.DIM_PRODUTO.columnNames(), read.definition().columnNames());
        for (int i = 0; i < written.size(); i++) {
            assertArrayEquals(written.rows().get(i), read.rows().get(i));
        }
    }

    @Test
    void keepsDatesOfCalendarRows() {
        store.write(StarSchema.DIM_TEMPO.toTable(List.of(
                CalendarDay.of(LocalDate.of(2024, 2, 28)), CalendarDay.of(LocalDate.of(2024, 2, 29)))));

        StarTable read = store.read(StarSchema.DIM_TEMPO);

        assertEquals(List.of(LocalDate.of(2024, 2, 28), LocalDate.of(2024, 2, 29)), read.columnValues("data_completa"));
        assertEquals(List.of(false, false), read.columnValues("eh_fim_semana"));
    }

    @Test
    void rewritingReplacesThePreviousFile() {
        store.write(StarSchema.DIM_TEMPO.toTable(List.of(
                CalendarDay.of(LocalDate.of(2024, 1, 1)), CalendarDay.of(LocalDate.of(2024, 1, 2)))));
        store.write(StarSchema.DIM_TEMPO.toTable(List.of(CalendarDay.of(LocalDate.of(2025, 1, 1)))));

        StarTable read = store.read(StarSchema.DIM_TEMPO);

        assertEquals(1, read.size());
        assertEquals(20250101, read.value(0, "id_tempo"));
    }

    @Test
    void emptyTablesArePersisted() {
        store.write(StarSchema.FATO_VENDAS.toTable(List.of()));

        assertTrue(store.exists(StarSchema.FATO_VENDAS));
        assertTrue(store.read(StarSchema.FATO_VENDAS).isEmpty());
    }

    @Test
    void readingAnAbsentTableFails() {
        assertFalse(store.exists(StarSchema.FATO_ESTOQUE));
        assertThrows(MissingSourceException.class, () -> store.read(StarSchema.FATO_ESTOQUE));
        assertTrue(store.statistics(StarSchema.FATO_ESTOQUE).isEmpty());
    }

    @Test
    void reportsStatistics() {
        store.write(StarSchema.DIM_TEMPO.toTable(List.of(
                CalendarDay.of(LocalDate.of(2024, 1, 1)), CalendarDay.of(LocalDate.of(2024, 1, 2)),
                CalendarDay.of(LocalDate.of(2024, 1, 3)))));

        TableStatistics statistics = store.statistics(StarSchema.DIM_TEMPO).orElseThrow();

        assertEquals("dim_tempo", statistics.table());
        assertEquals("dims", statistics.kind());
        assertEquals(3, statistics.rows());
        assertEquals(9, statistics.columns());
        assertTrue(statistics.sizeBytes() > 0);
    }
}
