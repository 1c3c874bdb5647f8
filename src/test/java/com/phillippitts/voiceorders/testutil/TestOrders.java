package com.phillippitts.voiceorders.testutil;

import com.phillippitts.voiceorders.service.orders.StaticJsonOrderDataStore;
import org.springframework.core.io.ClassPathResource;

/**
 * Loads the order snapshot fixture from {@code src/test/resources/data/orders-fixture.json}.
 *
 * <p>Fixture contents: order 1003 (shipped, total 158.99) with one Wireless Headphones at 129.99
 * and two USB-C Charging Cables at 14.50; order 1004 (pending) with no lines; order 1005
 * (cancelled) with one line referencing a product that is not in the snapshot.
 */
public final class TestOrders {

    private TestOrders() {}

    public static StaticJsonOrderDataStore fixture() {
        return StaticJsonOrderDataStore.load(new ClassPathResource("data/orders-fixture.json"));
    }
}
