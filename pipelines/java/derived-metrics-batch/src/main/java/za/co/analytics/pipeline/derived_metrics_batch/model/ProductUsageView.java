package za.co.analytics.pipeline.derived_metrics_batch.model;

import org.jspecify.annotations.Nullable;

/**
 * A summary row joined with the product master data, as shown in usage reports.
 */
public record ProductUsageView(
        String productCode,
        @Nullable String description,
        ProductUsage usage
) {
}
