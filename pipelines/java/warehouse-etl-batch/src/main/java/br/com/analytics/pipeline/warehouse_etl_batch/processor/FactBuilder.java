package br.com.analytics.pipeline.warehouse_etl_batch.processor;

import br.com.analytics.pipeline.warehouse_etl_batch.exception.TransformException;
import br.com.analytics.pipeline.warehouse_etl_batch.model.DistributionLine;
import br.com.analytics.pipeline.warehouse_etl_batch.model.InventorySnapshotDelta;
import br.com.analytics.pipeline.warehouse_etl_batch.model.RawRecord;
import br.com.analytics.pipeline.warehouse_etl_batch.model.RawSnapshot;
import br.com.analytics.pipeline.warehouse_etl_batch.model.SalesLine;
import br.com.analytics.pipeline.warehouse_etl_batch.reader.SnapshotReader;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds the sales, inventory and distribution facts from raw snapshots.
 */
public class FactBuilder {

    private static final Logger log = LoggerFactory.getLogger(FactBuilder.class);

    public static final String SALES = "vendas";
    public static final String INVENTORY = "estoque";
    public static final String DISTRIBUTIONS = "distribuicao_interna";
    public static final String PRODUCTS = "produtos";

    static final int MARGIN_SCALE = 4;

    private final SnapshotReader reader;
    private final String itemCostField;
    private final Clock clock;

    public FactBuilder(SnapshotReader reader, String itemCostField, Clock clock) {
        this.reader = reader;
        this.itemCostField = itemCostField;
        this.clock = clock;
    }

    /**
     * Explodes every sale into one row per line item. Missing item prices and costs fall back to
     * the product's sale and cost price.
     */
    public List<SalesLine> buildSales() {
        RawSnapshot sales = reader.read(SALES);
        Map<Long, RawRecord> products = indexProducts();
        LocalDateTime loadedAt = LocalDateTime.now(clock);

        List<SalesLine> lines = new ArrayList<>();
        for (RawRecord sale : sales.records()) {
            Long saleId = sale.getLong("id");
            Integer timeKey = TemporalValues.toTimeKey(sale.get("sale_date"));
            List<RawRecord> items = sale.getItems("items");
            for (int i = 0; i < items.size(); i++) {
                RawRecord item = items.get(i);
                Long productId = item.getLong("product_id");
                RawRecord product = productId == null ? null : products.get(productId);

                Integer quantity = item.getInteger("quantity");
                BigDecimal unitPrice = coalesce(item.getDecimal("unit_price"), product, "sale_price");
                BigDecimal unitCost = coalesce(item.getDecimal(itemCostField), product, "cost_price");
                BigDecimal total = multiply(quantity, unitPrice);
                BigDecimal totalCost = multiply(quantity, unitCost);
                BigDecimal profit = total == null || totalCost == null ? null : total.subtract(totalCost);

                lines.add(new SalesLine(
                        saleId,
                        i + 1,
                        timeKey,
                        sale.getLong("store_id"),
                        sale.getLong("client_id"),
                        productId,
                        quantity,
                        unitPrice,
                        unitCost,
                        total,
                        totalCost,
                        profit,
                        margin(profit, total),
                        loadedAt
                ));
            }
        }

        log.info("Built {} sales lines from {} sales", lines.size(), sales.size());
        return lines;
    }

    static @Nullable BigDecimal margin(@Nullable BigDecimal profit, @Nullable BigDecimal total) {
        if (profit == null || total == null || total.signum() <= 0) {
            return null;
        }
        return profit.divide(total, MARGIN_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Turns inventory readings into deltas. Readings are grouped per store and product and ordered by
     * update time; each reading's initial quantity is the previous reading's quantity, or zero for the first.
     * Rows come back in input order.
     */
    public List<InventorySnapshotDelta> buildInventory() {
        RawSnapshot inventory = reader.read(INVENTORY);
        Map<Long, RawRecord> products = indexProducts();
        LocalDateTime loadedAt = LocalDateTime.now(clock);

        List<RawRecord> readings = inventory.records();
        LocalDateTime[] updatedAt = new LocalDateTime[readings.size()];
        Map<StockKey, List<Integer>> partitions = new LinkedHashMap<>();
        for (int i = 0; i < readings.size(); i++) {
            RawRecord reading = readings.get(i);
            updatedAt[i] = TemporalValues.toDateTime(reading.get("updated_at")).orElse(null);
            StockKey key = new StockKey(reading.getLong("store_id"), reading.getLong("product_id"));
            partitions.computeIfAbsent(key, k -> new ArrayList<>()).add(i);
        }

        Comparator<Integer> byUpdateTime = Comparator.comparing(
                (Integer index) -> updatedAt[index],
                Comparator.nullsFirst(Comparator.<LocalDateTime>naturalOrder()));

        InventorySnapshotDelta[] deltas = new InventorySnapshotDelta[readings.size()];
        for (Map.Entry<StockKey, List<Integer>> partition : partitions.entrySet()) {
            List<Integer> ordered = partition.getValue();
            // List.sort is stable: readings with equal timestamps keep their input order
            ordered.sort(byUpdateTime);

            BigDecimal unitCost = unitCost(products, partition.getKey().productId());
            int previous = 0;
            for (Integer index : ordered) {
                RawRecord reading = readings.get(index);
                Integer quantity = reading.getInteger("quantity");
                int current = quantity == null ? 0 : quantity;
                int delta = current - previous;
                deltas[index] = new InventorySnapshotDelta(
                        reading.getLong("id"),
                        TemporalValues.toTimeKey(reading.get("updated_at")),
                        partition.getKey().storeId(),
                        partition.getKey().productId(),
                        previous,
                        current,
                        delta,
                        Math.max(delta, 0),
                        Math.max(-delta, 0),
                        unitCost.multiply(BigDecimal.valueOf(previous)),
                        unitCost.multiply(BigDecimal.valueOf(current)),
                        loadedAt
                );
                previous = current;
            }
        }

        log.info("Built {} inventory deltas across {} store/product pairs", deltas.length, partitions.size());
        return Arrays.asList(deltas);
    }

    private static BigDecimal unitCost(Map<Long, RawRecord> products, @Nullable Long productId) {
        RawRecord product = productId == null ? null : products.get(productId);
        BigDecimal cost = product == null ? null : product.getDecimal("cost_price");
        return cost == null ? BigDecimal.ZERO : cost;
    }

    /**
     * Joins each distribution line item to its distribution header.
     *
     * @throws TransformException when a line has no matching header
     */
    public List<DistributionLine> buildDistributions() {
        RawSnapshot distributions = reader.read(DISTRIBUTIONS);
        LocalDateTime loadedAt = LocalDateTime.now(clock);

        Map<Long, DistributionHeader> headers = new HashMap<>();
        List<DistributionItem> items = new ArrayList<>();
        for (RawRecord record : distributions.records()) {
            Long distributionId = record.getLong("id");
            if (distributionId == null) {
                log.warn("Distribution record without id has no header: {}", record);
            } else {
                headers.put(distributionId, new DistributionHeader(
                        record.getLong("from_store_id"),
                        record.getLong("to_store_id"),
                        TemporalValues.toTimeKey(record.get("distribution_date")),
                        record.getString("status")
                ));
            }
            List<RawRecord> lineItems = record.getItems("items");
            for (int i = 0; i < lineItems.size(); i++) {
                RawRecord item = lineItems.get(i);
                items.add(new DistributionItem(distributionId, i + 1, item.getLong("product_id"), item.getInteger("quantity")));
            }
        }

        List<DistributionLine> lines = new ArrayList<>(items.size());
        for (DistributionItem item : items) {
            DistributionHeader header = item.distributionId() == null ? null : headers.get(item.distributionId());
            if (header == null) {
                throw new TransformException("Distribution line " + item.lineNumber()
                        + " references unknown distribution " + item.distributionId());
            }
            lines.add(new DistributionLine(
                    item.distributionId(),
                    item.lineNumber(),
                    header.fromStoreId(),
                    header.toStoreId(),
                    header.timeKey(),
                    item.productId(),
                    item.quantity(),
                    header.status(),
                    loadedAt
            ));
        }

        log.info("Built {} distribution lines from {} distributions", lines.size(), headers.size());
        return lines;
    }

    private Map<Long, RawRecord> indexProducts() {
        Optional<RawSnapshot> products = reader.find(PRODUCTS);
        if (products.isEmpty()) {
            log.warn("No '{}' snapshot, product prices and costs are not available as fallback", PRODUCTS);
            return Map.of();
        }
        Map<Long, RawRecord> byId = new HashMap<>();
        for (RawRecord product : products.get().records()) {
            Long id = product.getLong("id");
            if (id != null) {
                byId.put(id, product);
            }
        }
        return byId;
    }

    private static @Nullable BigDecimal coalesce(@Nullable BigDecimal value, @Nullable RawRecord product, String productField) {
        if (value != null) {
            return value;
        }
        return product == null ? null : product.getDecimal(productField);
    }

    private static @Nullable BigDecimal multiply(@Nullable Integer quantity, @Nullable BigDecimal amount) {
        if (quantity == null || amount == null) {
            return null;
        }
        return amount.multiply(BigDecimal.valueOf(quantity));
    }

    private record StockKey(@Nullable Long storeId, @Nullable Long productId) {
    }

    private record DistributionHeader(@Nullable Long fromStoreId, @Nullable Long toStoreId,
                                      @Nullable Integer timeKey, @Nullable String status) {
    }

    private record DistributionItem(@Nullable Long distributionId, int lineNumber,
                                    @Nullable Long productId, @Nullable Integer quantity) {
    }
}
