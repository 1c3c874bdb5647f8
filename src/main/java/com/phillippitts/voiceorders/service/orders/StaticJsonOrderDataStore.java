package com.phillippitts.voiceorders.service.orders;

import com.phillippitts.voiceorders.domain.order.OrderItemRecord;
import com.phillippitts.voiceorders.domain.order.OrderLine;
import com.phillippitts.voiceorders.domain.order.OrderRecord;
import com.phillippitts.voiceorders.domain.order.OrderStatus;
import com.phillippitts.voiceorders.domain.order.ProductRecord;
import com.phillippitts.voiceorders.exception.OrderSnapshotException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.core.io.Resource;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.NoSuchFileException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Order store backed by a static JSON snapshot.
 *
 * <p>Snapshot layout:
 * <pre>
 * {
 *   "products":    [{"id", "name", "description", "price", "stock_quantity", "sku"}],
 *   "orders":      [{"id", "customer_id", "order_date", "total_amount", "status"}],
 *   "order_items": [{"order_id", "product_id", "quantity", "unit_price"}]
 * }
 * </pre>
 *
 * <p>{@link #load(Resource)} never throws: a missing or malformed snapshot yields an empty store
 * whose {@link #status()} is {@link SnapshotStatus#MISSING} or {@link SnapshotStatus#INVALID}, so the
 * failure shows up in health checks instead of looking like an empty order book.
 */
public final class StaticJsonOrderDataStore implements OrderDataStore {

    private static final Logger LOG = LogManager.getLogger(StaticJsonOrderDataStore.class);

    private final Map<Long, ProductRecord> products;
    private final Map<Long, OrderRecord> orders;
    private final Map<Long, List<OrderItemRecord>> itemsByOrder;
    private final SnapshotStatus status;

    private StaticJsonOrderDataStore(Map<Long, ProductRecord> products,
                                     Map<Long, OrderRecord> orders,
                                     Map<Long, List<OrderItemRecord>> itemsByOrder,
                                     SnapshotStatus status) {
        this.products = products;
        this.orders = orders;
        this.itemsByOrder = itemsByOrder;
        this.status = status;
    }

    /**
     * Loads the snapshot from a Spring resource, recording the outcome in {@link #status()}.
     */
    public static StaticJsonOrderDataStore load(Resource resource) {
        try {
            StaticJsonOrderDataStore store = parse(read(resource));
            LOG.info("Order snapshot loaded from {}: orders={}, products={}",
                    resource.getDescription(), store.orders.size(), store.products.size());
            return store;
        } catch (OrderSnapshotException e) {
            LOG.error("Order snapshot unavailable ({}): {}", e.getStatus().database(), e.getMessage());
            return empty(e.getStatus());
        }
    }

    /**
     * Parses snapshot JSON.
     *
     * @throws OrderSnapshotException with status {@link SnapshotStatus#INVALID} if the document is malformed
     */
    public static StaticJsonOrderDataStore parse(String json) {
        try {
            JSONObject root = new JSONObject(json);

            Map<Long, ProductRecord> products = new LinkedHashMap<>();
            for (JSONObject p : objects(root, "products")) {
                ProductRecord product = new ProductRecord(
                        p.getLong("id"),
                        p.getString("name"),
                        p.isNull("description") ? null : p.optString("description", null),
                        p.getBigDecimal("price"),
                        p.optInt("stock_quantity", 0),
                        p.getString("sku"));
                products.put(product.id(), product);
            }

            Map<Long, OrderRecord> orders = new LinkedHashMap<>();
            for (JSONObject o : objects(root, "orders")) {
                OrderRecord order = new OrderRecord(
                        o.getLong("id"),
                        o.getLong("customer_id"),
                        parseTimestamp(o.getString("order_date")),
                        o.getBigDecimal("total_amount"),
                        OrderStatus.fromValue(o.getString("status")));
                orders.put(order.id(), order);
            }

            Map<Long, List<OrderItemRecord>> itemsByOrder = new LinkedHashMap<>();
            for (JSONObject i : objects(root, "order_items")) {
                OrderItemRecord item = new OrderItemRecord(
                        i.getLong("order_id"),
                        i.getLong("product_id"),
                        i.getInt("quantity"),
                        i.getBigDecimal("unit_price"));
                itemsByOrder.computeIfAbsent(item.orderId(), k -> new ArrayList<>()).add(item);
            }
            itemsByOrder.replaceAll((k, v) -> List.copyOf(v));

            return new StaticJsonOrderDataStore(Collections.unmodifiableMap(products),
                    Collections.unmodifiableMap(orders),
                    Collections.unmodifiableMap(itemsByOrder),
                    SnapshotStatus.LOADED);
        } catch (JSONException | IllegalArgumentException | DateTimeParseException e) {
            throw new OrderSnapshotException(SnapshotStatus.INVALID, "Malformed order snapshot: " + e.getMessage(), e);
        }
    }

    static StaticJsonOrderDataStore empty(SnapshotStatus status) {
        return new StaticJsonOrderDataStore(Map.of(), Map.of(), Map.of(), status);
    }

    @Override
    public Optional<OrderRecord> getOrder(long orderId) {
        return Optional.ofNullable(orders.get(orderId));
    }

    @Override
    public List<OrderLine> getItems(long orderId) {
        List<OrderItemRecord> items = itemsByOrder.getOrDefault(orderId, List.of());
        List<OrderLine> lines = new ArrayList<>(items.size());
        for (OrderItemRecord item : items) {
            ProductRecord product = products.get(item.productId());
            if (product == null) {
                LOG.debug("Skipping line of order {}: product {} not in snapshot", orderId, item.productId());
                continue;
            }
            lines.add(new OrderLine(product, item.quantity(), item.unitPrice()));
        }
        return List.copyOf(lines);
    }

    @Override
    public SnapshotStatus status() {
        return status;
    }

    private static String read(Resource resource) {
        if (resource == null || !resource.exists()) {
            throw new OrderSnapshotException(SnapshotStatus.MISSING,
                    "Order snapshot not found: " + (resource == null ? "none" : resource.getDescription()));
        }
        try (InputStream in = resource.getInputStream()) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (FileNotFoundException | NoSuchFileException e) {
            throw new OrderSnapshotException(SnapshotStatus.MISSING, "Order snapshot not found: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new OrderSnapshotException(SnapshotStatus.INVALID, "Order snapshot unreadable: " + e.getMessage(), e);
        }
    }

    private static List<JSONObject> objects(JSONObject root, String key) {
        JSONArray array = root.optJSONArray(key);
        if (array == null) {
            if (root.has(key)) {
                throw new OrderSnapshotException(SnapshotStatus.INVALID, "'" + key + "' must be an array");
            }
            return List.of();
        }
        List<JSONObject> result = new ArrayList<>(array.length());
        for (int i = 0; i < array.length(); i++) {
            result.add(array.getJSONObject(i));
        }
        return result;
    }

    /**
     * Accepts ISO date-times with or without offset, a space instead of {@code T}, or a bare date.
     */
    static LocalDateTime parseTimestamp(String value) {
        String text = value.trim().replace(' ', 'T');
        if (text.length() == 10) {
            return LocalDate.parse(text).atStartOfDay();
        }
        try {
            return LocalDateTime.parse(text);
        } catch (DateTimeParseException e) {
            return OffsetDateTime.parse(text).toLocalDateTime();
        }
    }
}
