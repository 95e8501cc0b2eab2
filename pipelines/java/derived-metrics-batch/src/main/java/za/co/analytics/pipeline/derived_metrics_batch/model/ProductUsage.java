package za.co.analytics.pipeline.derived_metrics_batch.model;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

public record ProductUsage(
        Integer pharmacyId,
        Long productId,
        Map<UsageWindow, BigDecimal> averages,
        OffsetDateTime lastRecalc
) {

    public ProductUsage {
        averages = Collections.unmodifiableMap(new TreeMap<>(averages));
    }

    public UsageKey key() {
        return new UsageKey(pharmacyId, productId);
    }

    public BigDecimal averageFor(UsageWindow window) {
        BigDecimal average = averages.get(window);
        if (average == null) {
            throw new IllegalArgumentException("No average computed for the " + window.days() + "-day window");
        }
        return average;
    }

    public BigDecimal averageFor(int days) {
        return averageFor(new UsageWindow(days));
    }
}
