package org.nowstart.scalper.data.model;

import java.time.Instant;
import java.util.List;

public record OrderStoreDocument(
        String version,
        Instant savedAt,
        List<OrderRecord> orders
) {
}
