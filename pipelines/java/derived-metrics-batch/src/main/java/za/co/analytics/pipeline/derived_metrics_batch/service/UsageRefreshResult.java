package za.co.analytics.pipeline.derived_metrics_batch.service;

import za.co.analytics.pipeline.derived_metrics_batch.model.ProductUsage;
import za.co.analytics.pipeline.derived_metrics_batch.model.UsageScope;
import org.jspecify.annotations.Nullable;

import java.util.Optional;

/**
 * Outcome of one usage recompute.
 *
 * @param summaryRowCount summary rows present in the store once the run finished
 * @param refreshedUsage  for a single-key scope, the key's summary; {@code null} when the key
 *                        had no qualifying sales in the lookback window, or for the ALL scope
 */
public record UsageRefreshResult(
        UsageScope scope,
        long summaryRowCount,
        @Nullable ProductUsage refreshedUsage
) {

    public Optional<ProductUsage> refreshed() {
        return Optional.ofNullable(refreshedUsage);
    }
}
