package za.co.analytics.pipeline.derived_metrics_batch.model;

import java.math.BigDecimal;
import java.time.LocalDate;

public record FactActivity(
        Integer pharmacyId,
        Long productId,
        LocalDate businessDate,
        BigDecimal qtySold
) {

    public UsageKey key() {
        return new UsageKey(pharmacyId, productId);
    }
}
