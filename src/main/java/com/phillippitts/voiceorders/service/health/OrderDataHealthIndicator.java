package com.phillippitts.voiceorders.service.health;

import com.phillippitts.voiceorders.service.orders.OrderDataStore;
import com.phillippitts.voiceorders.service.orders.SnapshotStatus;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the order snapshot.
 *
 * <p>UP only when the snapshot loaded; a missing or malformed snapshot is reported DOWN with
 * the {@code database} detail set to {@code missing} or {@code invalid}.
 *
 * <p>Exposed via /actuator/health as {@code orderData}.
 */
@Component("orderData")
public class OrderDataHealthIndicator implements HealthIndicator {

    private final OrderDataStore store;

    public OrderDataHealthIndicator(OrderDataStore store) {
        this.store = store;
    }

    @Override
    public Health health() {
        SnapshotStatus status = store.status();
        Health.Builder builder = status.isHealthy() ? Health.up() : Health.down();
        return builder
                .withDetail("database", status.database())
                .withDetail("message", status.message())
                .build();
    }
}
