package br.com.analytics.pipeline.warehouse_etl_batch.processor;

import br.com.analytics.pipeline.warehouse_etl_batch.config.WarehouseEtlProperties;
import br.com.analytics.pipeline.warehouse_etl_batch.exception.ValidationException;
import br.com.analytics.pipeline.warehouse_etl_batch.model.CalendarDay;
import br.com.analytics.pipeline.warehouse_etl_batch.model.ClientDimension;
import br.com.analytics.pipeline.warehouse_etl_batch.model.ProductDimension;
import br.com.analytics.pipeline.warehouse_etl_batch.model.RawRecord;
import br.com.analytics.pipeline.warehouse_etl_batch.model.RawSnapshot;
import br.com.analytics.pipeline.warehouse_etl_batch.model.StoreDimension;
import br.com.analytics.pipeline.warehouse_etl_batch.reader.SnapshotReader;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds the client, product, store and calendar dimensions from raw snapshots.
 * Every build stamps its rows with a single load timestamp taken from the injected clock.
 */
public class DimensionBuilder {

    private static final Logger log = LoggerFactory.getLogger(DimensionBuilder.class);

    public static final String CLIENTS = "clientes";
    public static final String PRODUCTS = "produtos";
    public static final String CATEGORIES = "categorias";
    public static final String STORES = "lojas";

    static final String INDIVIDUAL = "Pessoa Física";
    static final String COMPANY = "Pessoa Jurídica";
    static final String UNCLASSIFIED = "Não Classificado";

    private final SnapshotReader reader;
    private final WarehouseEtlProperties.Calendar calendar;
    private final Clock clock;

    public DimensionBuilder(SnapshotReader reader, WarehouseEtlProperties.Calendar calendar, Clock clock) {
        this.reader = reader;
        this.calendar = calendar;
        this.clock = clock;
    }

    public List<ClientDimension> buildClients() {
        RawSnapshot snapshot = reader.read(CLIENTS);
        LocalDateTime loadedAt = LocalDateTime.now(clock);

        Map<ClientKey, ClientDimension> clients = new LinkedHashMap<>();
        for (RawRecord record : snapshot.records()) {
            String document = record.getString("cpf_cnpj");
            ClientDimension client = new ClientDimension(
                    record.getLong("id"),
                    record.getString("name"),
                    document,
                    record.getString("email"),
                    record.getString("phone"),
                    record.getString("address"),
                    classifyDocument(document),
                    loadedAt
            );
            ClientKey key = new ClientKey(client.idCliente(), document);
            // re-insert so the surviving row takes the position of its last occurrence
            clients.remove(key);
            clients.put(key, client);
        }

        log.info("Built {} client rows from {} raw records", clients.size(), snapshot.size());
        return new ArrayList<>(clients.values());
    }

    /**
     * CPF documents have 11 characters and CNPJ documents 14. The raw value is measured as-is.
     */
    public static String classifyDocument(@Nullable String document) {
        if (document == null) {
            return UNCLASSIFIED;
        }
        return switch (document.length()) {
            case 11 -> INDIVIDUAL;
            case 14 -> COMPANY;
            default -> UNCLASSIFIED;
        };
    }

    public List<ProductDimension> buildProducts() {
        RawSnapshot products = reader.read(PRODUCTS);
        Optional<RawSnapshot> categories = reader.find(CATEGORIES);
        if (categories.isEmpty()) {
            log.warn("No '{}' snapshot, products are built without category attributes", CATEGORIES);
        }
        Map<Long, List<RawRecord>> categoriesById = groupById(categories);
        LocalDateTime loadedAt = LocalDateTime.now(clock);

        List<ProductDimension> rows = new ArrayList<>(products.size());
        for (RawRecord product : products.records()) {
            Long categoryId = product.getLong("category_id");
            List<RawRecord> matches = categoryId == null ? List.of() : categoriesById.getOrDefault(categoryId, List.of());
            if (matches.isEmpty()) {
                rows.add(toProduct(product, categoryId, null, loadedAt));
            } else {
                for (RawRecord category : matches) {
                    rows.add(toProduct(product, categoryId, category, loadedAt));
                }
            }
        }

        log.info("Built {} product rows from {} raw records", rows.size(), products.size());
        return rows;
    }

    private ProductDimension toProduct(RawRecord product, @Nullable Long categoryId, @Nullable RawRecord category,
                                       LocalDateTime loadedAt) {
        return new ProductDimension(
                product.getLong("id"),
                product.getString("name"),
                product.getString("description"),
                categoryId,
                product.getDecimal("sale_price"),
                product.getDecimal("cost_price"),
                product.getBoolean("active"),
                category == null ? null : category.getString("name"),
                category == null ? null : category.getString("description"),
                loadedAt
        );
    }

    private static Map<Long, List<RawRecord>> groupById(Optional<RawSnapshot> snapshot) {
        Map<Long, List<RawRecord>> grouped = new LinkedHashMap<>();
        snapshot.ifPresent(s -> {
            for (RawRecord record : s.records()) {
                Long id = record.getLong("id");
                if (id != null) {
                    grouped.computeIfAbsent(id, k -> new ArrayList<>()).add(record);
                }
            }
        });
        return grouped;
    }

    public List<StoreDimension> buildStores() {
        RawSnapshot snapshot = reader.read(STORES);
        LocalDateTime loadedAt = LocalDateTime.now(clock);

        Map<Long, StoreDimension> stores = new LinkedHashMap<>();
        for (RawRecord record : snapshot.records()) {
            StoreDimension store = new StoreDimension(
                    record.getLong("id"),
                    record.getString("name"),
                    record.getString("address"),
                    loadedAt
            );
            stores.remove(store.idLoja());
            stores.put(store.idLoja(), store);
        }

        log.info("Built {} store rows from {} raw records", stores.size(), snapshot.size());
        return new ArrayList<>(stores.values());
    }

    /**
     * One row per day between the earliest and latest date found in the configured temporal columns.
     * Entities or columns that are missing are skipped, as are values that do not parse.
     */
    public List<CalendarDay> buildCalendar() {
        LocalDate earliest = null;
        LocalDate latest = null;
        int scanned = 0;

        for (Map.Entry<String, List<String>> source : calendar.temporalColumns().entrySet()) {
            Optional<RawSnapshot> snapshot = reader.find(source.getKey());
            if (snapshot.isEmpty()) {
                continue;
            }
            for (RawRecord record : snapshot.get().records()) {
                for (String column : source.getValue()) {
                    Optional<LocalDate> date = TemporalValues.toDate(record.get(column));
                    if (date.isEmpty()) {
                        continue;
                    }
                    scanned++;
                    LocalDate day = date.get();
                    if (earliest == null || day.isBefore(earliest)) {
                        earliest = day;
                    }
                    if (latest == null || day.isAfter(latest)) {
                        latest = day;
                    }
                }
            }
        }

        if (earliest == null) {
            earliest = calendar.fallbackStart();
            latest = calendar.fallbackEnd() != null ? calendar.fallbackEnd() : LocalDate.now(clock);
            log.warn("No readable dates in temporal columns, using fallback calendar {} to {}", earliest, latest);
        }
        if (latest.isBefore(earliest)) {
            throw new ValidationException("Calendar range is inverted: " + earliest + " to " + latest);
        }

        List<CalendarDay> days = new ArrayList<>();
        for (LocalDate day = earliest; !day.isAfter(latest); day = day.plusDays(1)) {
            days.add(CalendarDay.of(day));
        }

        log.info("Built {} calendar days from {} to {} ({} dates scanned)", days.size(), earliest, latest, scanned);
        return days;
    }

    private record ClientKey(@Nullable Long id, @Nullable String document) {
    }
}
