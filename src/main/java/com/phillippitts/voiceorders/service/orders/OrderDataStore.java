package com.phillippitts.voiceorders.service.orders;

import com.phillippitts.voiceorders.domain.order.OrderLine;
import com.phillippitts.voiceorders.domain.order.OrderRecord;

import java.util.List;
import java.util.Optional;

/**
 * Read-only lookup of orders and their lines.
 *
 * <p>The data is loaded once at startup and never changes for the lifetime of the process.
 */
public interface OrderDataStore {

    Optional<OrderRecord> getOrder(long orderId);

    /**
     * Returns the lines of an order in snapshot order, resolved against their products.
     * Lines whose product is missing from the snapshot are left out.
     */
    List<OrderLine> getItems(long orderId);

    /**
     * How loading the backing snapshot went.
     */
    SnapshotStatus status();
}
