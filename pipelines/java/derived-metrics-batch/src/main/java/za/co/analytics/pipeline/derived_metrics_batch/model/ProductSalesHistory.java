package za.co.analytics.pipeline.derived_metrics_batch.model;

import java.util.List;

/**
 * All qualifying fact rows of one (pharmacy, product) inside the lookback window.
 */
public record ProductSalesHistory(
        UsageKey key,
        List<FactActivity> sales
) {

    public ProductSalesHistory {
        sales = List.copyOf(sales);
    }
}
