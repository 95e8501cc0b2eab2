package za.co.analytics.pipeline.derived_metrics_batch.processor;

import za.co.analytics.pipeline.derived_metrics_batch.model.FactActivity;
import za.co.analytics.pipeline.derived_metrics_batch.model.ProductSalesHistory;
import za.co.analytics.pipeline.derived_metrics_batch.model.ProductUsage;
import za.co.analytics.pipeline.derived_metrics_batch.model.UsageWindow;
import za.co.analytics.pipeline.derived_metrics_batch.model.UsageWindows;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Trailing average daily quantity per window: the quantity sold inside the window
 * divided by the window length in days (not by the number of days with sales),
 * rounded half-up to the configured scale.
 *
 * <p>This is the only place the averages are computed; full and single-key
 * recomputes both go through it.
 */
public class UsageAverageCalculator {

    private final UsageWindows usageWindows;

    public UsageAverageCalculator(UsageWindows usageWindows) {
        this.usageWindows = usageWindows;
    }

    /**
     * @return the averages, or empty when the history holds no qualifying sale
     *         inside the lookback window (such keys are never written)
     */
    public Optional<ProductUsage> calculate(ProductSalesHistory history,
                                            LocalDate processingDate,
                                            OffsetDateTime calculatedAt) {
        UsageWindow lookback = usageWindows.lookback();
        long daysWithSales = history.sales().stream()
                .filter(sale -> isQualifying(sale, lookback, processingDate))
                .map(FactActivity::businessDate)
                .distinct()
                .count();
        if (daysWithSales < 1) {
            return Optional.empty();
        }

        Map<UsageWindow, BigDecimal> averages = new HashMap<>();
        for (UsageWindow window : usageWindows.windows()) {
            BigDecimal sold = history.sales().stream()
                    .filter(sale -> isQualifying(sale, window, processingDate))
                    .map(FactActivity::qtySold)
                    .reduce(BigDecimal.ZERO, BigDecimal::add);
            averages.put(window, sold.divide(BigDecimal.valueOf(window.days()), usageWindows.scale(), RoundingMode.HALF_UP));
        }

        return Optional.of(new ProductUsage(
                history.key().pharmacyId(),
                history.key().productId(),
                averages,
                calculatedAt
        ));
    }

    private static boolean isQualifying(FactActivity sale, UsageWindow window, LocalDate processingDate) {
        return sale.qtySold() != null
                && sale.qtySold().signum() > 0
                && window.contains(sale.businessDate(), processingDate);
    }
}
