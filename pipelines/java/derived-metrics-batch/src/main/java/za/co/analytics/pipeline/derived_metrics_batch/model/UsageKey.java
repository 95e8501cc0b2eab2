package za.co.analytics.pipeline.derived_metrics_batch.model;

public record UsageKey(
        Integer pharmacyId,
        Long productId
) {
}
