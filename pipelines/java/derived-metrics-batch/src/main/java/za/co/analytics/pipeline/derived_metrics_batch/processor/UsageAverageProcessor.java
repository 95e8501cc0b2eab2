package za.co.analytics.pipeline.derived_metrics_batch.processor;

import za.co.analytics.pipeline.derived_metrics_batch.exception.StoreOperationException;
import za.co.analytics.pipeline.derived_metrics_batch.model.ProductSalesHistory;
import za.co.analytics.pipeline.derived_metrics_batch.model.ProductUsage;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.infrastructure.item.ItemProcessor;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;

/**
 * Turns a key's sales history into its usage summary. Returns {@code null} (filters the
 * item) for keys without qualifying sales, and aborts the run once the execution time
 * allowance is spent.
 */
public class UsageAverageProcessor implements ItemProcessor<ProductSalesHistory, ProductUsage> {

    private static final Logger log = LoggerFactory.getLogger(UsageAverageProcessor.class);

    private final UsageAverageCalculator calculator;
    private final LocalDate processingDate;
    private final Instant deadline;
    private final Clock clock;

    public UsageAverageProcessor(UsageAverageCalculator calculator,
                                 LocalDate processingDate,
                                 Instant deadline,
                                 Clock clock) {
        this.calculator = calculator;
        this.processingDate = processingDate;
        this.deadline = deadline;
        this.clock = clock;
    }

    @Override
    public @Nullable ProductUsage process(ProductSalesHistory history) throws Exception {
        Instant now = clock.instant();
        if (now.isAfter(deadline)) {
            throw new StoreOperationException("Usage recompute exceeded its execution time allowance (deadline "
                    + deadline + "); aborting at pharmacy " + history.key().pharmacyId()
                    + " / product " + history.key().productId());
        }

        ProductUsage usage = calculator.calculate(history, processingDate, OffsetDateTime.now(clock)).orElse(null);
        if (usage == null) {
            log.debug("No qualifying sales for pharmacy {} / product {}; summary left untouched",
                    history.key().pharmacyId(), history.key().productId());
        }
        return usage;
    }
}
