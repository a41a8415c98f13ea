package br.com.analytics.pipeline.warehouse_etl_batch.processor;

import br.com.analytics.pipeline.warehouse_etl_batch.exception.MissingSourceException;
import br.com.analytics.pipeline.warehouse_etl_batch.exception.TransformException;
import br.com.analytics.pipeline.warehouse_etl_batch.exception.ValidationException;
import br.com.analytics.pipeline.warehouse_etl_batch.model.DistributionLine;
import br.com.analytics.pipeline.warehouse_etl_batch.model.InventorySnapshotDelta;
import br.com.analytics.pipeline.warehouse_etl_batch.model.SalesLine;
import br.com.analytics.pipeline.warehouse_etl_batch.reader.InMemorySnapshotReader;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static br.com.analytics.pipeline.warehouse_etl_batch.reader.InMemorySnapshotReader.row;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FactBuilderTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-05T12:00:00Z"), ZoneOffset.UTC);

    private FactBuilder builder(InMemorySnapshotReader reader) {
        return new FactBuilder(reader, "total_price", CLOCK);
    }

    private static void assertAmount(String expected, BigDecimal actual) {
        assertEquals(0, new BigDecimal(expected).compareTo(actual), () -> "expected " + expected + " but was " + actual);
    }

    @Test
    void derivesSalesMetricsFromLineItems() {
        InMemorySnapshotReader reader = new InMemorySnapshotReader().with("vendas",
                row("id", 100L, "sale_date", "2024-01-15T14:30:00", "store_id", 1L, "client_id", 7L,
                        "items", List.of(row("product_id", 5L, "quantity", 3, "unit_price", 10.0, "total_price", 6.0))));

        List<SalesLine> lines = builder(reader).buildSales();

        assertEquals(1, lines.size());
        SalesLine line = lines.get(0);
        assertEquals(100L, line.idVenda());
        assertEquals(1, line.numeroItem());
        assertEquals(20240115, line.idTempo());
        assertEquals(1L, line.idLoja());
        assertEquals(7L, line.idCliente());
        assertEquals(5L, line.idProduto());
        assertEquals(3, line.quantidade());
        assertAmount("30.0", line.valorTotal());
        assertAmount("18.0", line.custoTotal());
        assertAmount("12.0", line.lucro());
        assertEquals(new BigDecimal("0.4000"), line.margemLucro());
    }

    @Test
    void explodesItemsAndFallsBackToProductPrices() {
        InMemorySnapshotReader reader = new InMemorySnapshotReader()
                .with("vendas",
                        row("id", 1L, "sale_date", "2024-02-01", "store_id", 2L, "client_id", 3L, "items", List.of(
                                row("product_id", 10L, "quantity", 2),
                                row("product_id", 11L, "quantity", 1, "unit_price", 4.0, "total_price", null),
                                row("product_id", 12L, "quantity", 1))))
                .with("produtos",
                        row("id", 10L, "sale_price", 5.5, "cost_price", 2.0),
                        row("id", 11L, "sale_price", 9.0, "cost_price", 3.0));

        List<SalesLine> lines = builder(reader).buildSales();

        assertEquals(List.of(1, 2, 3), lines.stream().map(SalesLine::numeroItem).toList());

        SalesLine first = lines.get(0);
        assertAmount("5.5", first.valorUnitario());
        assertAmount("11.0", first.valorTotal());
        assertAmount("4.0", first.custoTotal());

        SalesLine second = lines.get(1);
        assertAmount("4.0", second.valorUnitario());
        assertAmount("3.0", second.custoUnitario());
        assertAmount("1.0", second.lucro());

        SalesLine unknownProduct = lines.get(2);
        assertNull(unknownProduct.valorTotal());
        assertNull(unknownProduct.lucro());
        assertNull(unknownProduct.margemLucro());
    }

    @Test
    void marginIsNullWhenTotalIsNotPositive() {
        InMemorySnapshotReader reader = new InMemorySnapshotReader().with("vendas",
                row("id", 1L, "items", List.of(row("product_id", 1L, "quantity", 0, "unit_price", 10.0, "total_price", 1.0))));

        SalesLine line = builder(reader).buildSales().get(0);

        assertAmount("0", line.valorTotal());
        assertNull(line.margemLucro());
        assertNull(line.idTempo());
    }

    @Test
    void salesWithoutItemsProduceNoLines() {
        InMemorySnapshotReader reader = new InMemorySnapshotReader().with("vendas",
                row("id", 1L, "items", null),
                row("id", 2L, "items", List.of()));

        assertTrue(builder(reader).buildSales().isEmpty());
    }

    @Test
    void nonListItemsAreRejected() {
        InMemorySnapshotReader reader = new InMemorySnapshotReader().with("vendas",
                row("id", 1L, "items", "[{\"product_id\": 1}]"));

        assertThrows(ValidationException.class, () -> builder(reader).buildSales());
    }

    @Test
    void configuredItemCostFieldIsUsed() {
        InMemorySnapshotReader reader = new InMemorySnapshotReader().with("vendas",
                row("id", 1L, "items", List.of(row("product_id", 1L, "quantity", 2, "unit_price", 10.0,
                        "total_price", 20.0, "unit_cost", 4.0))));

        SalesLine line = new FactBuilder(reader, "unit_cost", CLOCK).buildSales().get(0);

        assertAmount("4.0", line.custoUnitario());
        assertAmount("12.0", line.lucro());
    }

    @Test
    void computesInventoryDeltasPerStoreAndProduct() {
        InMemorySnapshotReader reader = new InMemorySnapshotReader()
                .with("estoque",
                        row("id", 1L, "store_id", 1L, "product_id", 9L, "updated_at", "2024-01-02T10:00:00", "quantity", 15),
                        row("id", 2L, "store_id", 1L, "product_id", 9L, "updated_at", "2024-01-01T10:00:00", "quantity", 10),
                        row("id", 3L, "store_id", 2L, "product_id", 9L, "updated_at", "2024-01-01T09:00:00", "quantity", 4),
                        row("id", 4L, "store_id", 1L, "product_id", 9L, "updated_at", "2024-01-03T10:00:00", "quantity", 7))
                .with("produtos", row("id", 9L, "cost_price", "2.50"));

        List<InventorySnapshotDelta> deltas = builder(reader).buildInventory();

        assertEquals(List.of(1L, 2L, 3L, 4L), deltas.stream().map(InventorySnapshotDelta::idEstoque).toList());

        InventorySnapshotDelta firstReading = deltas.get(1);
        assertEquals(0, firstReading.quantidadeInicial());
        assertEquals(10, firstReading.quantidadeFinal());
        assertEquals(10, firstReading.entradas());
        assertEquals(0, firstReading.saidas());
        assertEquals(20240101, firstReading.idTempo());

        InventorySnapshotDelta secondReading = deltas.get(0);
        assertEquals(10, secondReading.quantidadeInicial());
        assertEquals(15, secondReading.quantidadeFinal());
        assertAmount("25.0", secondReading.valorEstoqueInicial());
        assertAmount("37.5", secondReading.valorEstoqueFinal());

        InventorySnapshotDelta thirdReading = deltas.get(3);
        assertEquals(15, thirdReading.quantidadeInicial());
        assertEquals(-8, thirdReading.deltaQuantidade());
        assertEquals(0, thirdReading.entradas());
        assertEquals(8, thirdReading.saidas());

        InventorySnapshotDelta otherStore = deltas.get(2);
        assertEquals(0, otherStore.quantidadeInicial());
        assertEquals(4, otherStore.quantidadeFinal());
    }

    @Test
    void inventoryDeltasConserveQuantities() {
        InMemorySnapshotReader reader = new InMemorySnapshotReader().with("estoque",
                row("id", 1L, "store_id", 1L, "product_id", 1L, "updated_at", "2024-01-01", "quantity", 5),
                row("id", 2L, "store_id", 1L, "product_id", 1L, "updated_at", "2024-01-02", "quantity", 3),
                row("id", 3L, "store_id", 1L, "product_id", 1L, "updated_at", "2024-01-03", "quantity", 9),
                row("id", 4L, "store_id", 1L, "product_id", 1L, "updated_at", "2024-01-04", "quantity", 9));

        List<InventorySnapshotDelta> deltas = builder(reader).buildInventory();

        for (int i = 0; i < deltas.size(); i++) {
            InventorySnapshotDelta delta = deltas.get(i);
            assertEquals(delta.quantidadeFinal() - delta.quantidadeInicial(), delta.entradas() - delta.saidas());
            if (i > 0) {
                assertEquals(deltas.get(i - 1).quantidadeFinal(), delta.quantidadeInicial());
            }
        }
    }

    @Test
    void equalTimestampsKeepInputOrderAndMissingProductCostsZero() {
        InMemorySnapshotReader reader = new InMemorySnapshotReader().with("estoque",
                row("id", 1L, "store_id", 1L, "product_id", 1L, "updated_at", "2024-01-01", "quantity", 5),
                row("id", 2L, "store_id", 1L, "product_id", 1L, "updated_at", "2024-01-01", "quantity", 8),
                row("id", 3L, "store_id", 1L, "product_id", 1L, "updated_at", null, "quantity", 2));

        List<InventorySnapshotDelta> deltas = builder(reader).buildInventory();

        // the reading without timestamp sorts first
        assertEquals(0, deltas.get(2).quantidadeInicial());
        assertEquals(2, deltas.get(0).quantidadeInicial());
        assertEquals(5, deltas.get(1).quantidadeInicial());
        assertAmount("0", deltas.get(1).valorEstoqueFinal());
    }

    @Test
    void joinsDistributionLinesToHeaders() {
        InMemorySnapshotReader reader = new InMemorySnapshotReader().with("distribuicao_interna",
                row("id", 50L, "from_store_id", 1L, "to_store_id", 2L, "distribution_date", "2024-02-10", "status", "DELIVERED",
                        "items", List.of(row("product_id", 7L, "quantity", 3), row("product_id", 8L, "quantity", 1))),
                row("id", 51L, "from_store_id", 2L, "to_store_id", 3L, "distribution_date", "2024-02-11", "status", "PENDING",
                        "items", List.of()));

        List<DistributionLine> lines = builder(reader).buildDistributions();

        assertEquals(2, lines.size());
        DistributionLine second = lines.get(1);
        assertEquals(50L, second.idDistribuicao());
        assertEquals(2, second.numeroItem());
        assertEquals(1L, second.idLojaOrigem());
        assertEquals(2L, second.idLojaDestino());
        assertEquals(20240210, second.idTempo());
        assertEquals(8L, second.idProduto());
        assertEquals(1, second.quantidade());
        assertEquals("DELIVERED", second.status());
    }

    @Test
    void distributionLineWithoutHeaderFails() {
        InMemorySnapshotReader reader = new InMemorySnapshotReader().with("distribuicao_interna",
                row("id", null, "status", "PENDING", "items", List.of(row("product_id", 7L, "quantity", 3))));

        assertThrows(TransformException.class, () -> builder(reader).buildDistributions());
    }

    @Test
    void missingFactSourceFails() {
        FactBuilder builder = builder(new InMemorySnapshotReader());

        assertThrows(MissingSourceException.class, builder::buildSales);
        assertThrows(MissingSourceException.class, builder::buildInventory);
        assertThrows(MissingSourceException.class, builder::buildDistributions);
    }

    @Test
    void emptySnapshotsYieldEmptyFacts() {
        InMemorySnapshotReader reader = new InMemorySnapshotReader()
                .with("vendas")
                .with("estoque")
                .with("distribuicao_interna");
        FactBuilder builder = builder(reader);

        assertTrue(builder.buildSales().isEmpty());
        assertTrue(builder.buildInventory().isEmpty());
        assertTrue(builder.buildDistributions().isEmpty());
    }
}
