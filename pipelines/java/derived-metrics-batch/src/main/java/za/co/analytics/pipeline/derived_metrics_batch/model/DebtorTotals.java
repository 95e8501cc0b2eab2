package za.co.analytics.pipeline.derived_metrics_batch.model;

import java.math.BigDecimal;

/**
 * Store-wide figures over all imported debtor accounts.
 */
public record DebtorTotals(
        long pharmacyCount,
        long accountCount,
        BigDecimal totalOutstanding
) {

    public static DebtorTotals empty() {
        return new DebtorTotals(0, 0, BigDecimal.ZERO);
    }
}
