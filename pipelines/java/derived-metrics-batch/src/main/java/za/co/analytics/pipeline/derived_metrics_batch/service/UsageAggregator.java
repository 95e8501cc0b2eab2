package za.co.analytics.pipeline.derived_metrics_batch.service;

import za.co.analytics.pipeline.derived_metrics_batch.config.UsageRefreshBatchConfig;
import za.co.analytics.pipeline.derived_metrics_batch.exception.DataUnavailableException;
import za.co.analytics.pipeline.derived_metrics_batch.exception.DerivedMetricsException;
import za.co.analytics.pipeline.derived_metrics_batch.exception.StoreOperationException;
import za.co.analytics.pipeline.derived_metrics_batch.model.ProductUsage;
import za.co.analytics.pipeline.derived_metrics_batch.model.UsageKey;
import za.co.analytics.pipeline.derived_metrics_batch.model.UsageScope;
import za.co.analytics.pipeline.derived_metrics_batch.repository.ProductRepository;
import za.co.analytics.pipeline.derived_metrics_batch.repository.ProductUsageRepository;
import za.co.analytics.pipeline.derived_metrics_batch.tasklet.UsageSummaryCountTasklet;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.core.BatchStatus;
import org.springframework.batch.core.job.Job;
import org.springframework.batch.core.job.JobExecution;
import org.springframework.batch.core.job.parameters.JobParameters;
import org.springframework.batch.core.job.parameters.JobParametersBuilder;
import org.springframework.batch.core.launch.JobOperator;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Recomputes trailing usage averages for every (pharmacy, product) or for one key.
 * Both scopes run the same job, so they share reader, calculator and writer.
 *
 * <p>A run commits chunk by chunk. If it aborts, keys merged so far keep their new
 * values and the rest keep their previous ones; re-running the whole scope is safe.
 */
@Service
public class UsageAggregator {

    private static final Logger log = LoggerFactory.getLogger(UsageAggregator.class);

    private final JobOperator jobOperator;
    private final Job usageRefreshJob;
    private final ProductRepository productRepository;
    private final ProductUsageRepository productUsageRepository;
    private final Clock clock;

    public UsageAggregator(JobOperator jobOperator,
                           @Qualifier(UsageRefreshBatchConfig.JOB_NAME) Job usageRefreshJob,
                           ProductRepository productRepository,
                           ProductUsageRepository productUsageRepository,
                           Clock clock) {
        this.jobOperator = jobOperator;
        this.usageRefreshJob = usageRefreshJob;
        this.productRepository = productRepository;
        this.productUsageRepository = productUsageRepository;
        this.clock = clock;
    }

    /**
     * @return the number of summary rows present after the refresh
     */
    public long refreshAll() {
        return refresh(UsageScope.all()).summaryRowCount();
    }

    /**
     * @return the refreshed summary, empty when the product sold nothing in the lookback window
     * @throws DataUnavailableException when the product code is unknown
     */
    public Optional<ProductUsage> refreshProduct(int pharmacyId, String productCode) {
        return refresh(UsageScope.product(pharmacyId, productCode)).refreshed();
    }

    public UsageRefreshResult refresh(UsageScope scope) {
        try {
            UsageKey key = resolve(scope);
            LocalDate processingDate = LocalDate.now(clock);
            log.info("Refreshing product usage averages for {} as of {}", scope, processingDate);

            JobExecution execution = launch(jobParameters(key, processingDate));
            long summaryRows = execution.getExecutionContext()
                    .getLong(UsageSummaryCountTasklet.SUMMARY_ROW_COUNT_KEY, 0L);

            if (key == null) {
                log.info("Refreshed usage averages; {} summary records present", summaryRows);
                return new UsageRefreshResult(scope, summaryRows, null);
            }

            ProductUsage refreshed = productUsageRepository.findByKey(key).orElse(null);
            if (refreshed == null) {
                log.warn("No usage data found for {}: no qualifying sales in the lookback window", scope);
            }
            return new UsageRefreshResult(scope, summaryRows, refreshed);
        } catch (DataAccessException e) {
            throw new StoreOperationException("Usage refresh for " + scope + " failed: " + e.getMessage(), e);
        }
    }

    private @Nullable UsageKey resolve(UsageScope scope) {
        if (scope.isAll()) {
            return null;
        }
        Long productId = productRepository.findIdByCode(scope.productCode())
                .orElseThrow(() -> new DataUnavailableException("Product", scope.productCode()));
        return new UsageKey(scope.pharmacyId(), productId);
    }

    private JobParameters jobParameters(@Nullable UsageKey key, LocalDate processingDate) {
        JobParametersBuilder builder = new JobParametersBuilder()
                .addString(UsageRefreshBatchConfig.PARAM_PROCESSING_DATE, processingDate.toString())
                .addLong(UsageRefreshBatchConfig.PARAM_REQUESTED_AT, clock.millis());
        if (key != null) {
            builder.addLong(UsageRefreshBatchConfig.PARAM_PHARMACY_ID, key.pharmacyId().longValue())
                    .addLong(UsageRefreshBatchConfig.PARAM_PRODUCT_ID, key.productId());
        }
        return builder.toJobParameters();
    }

    private JobExecution launch(JobParameters parameters) {
        JobExecution execution;
        try {
            execution = jobOperator.start(usageRefreshJob, parameters);
        } catch (Exception e) {
            throw new StoreOperationException("Could not launch " + UsageRefreshBatchConfig.JOB_NAME, e);
        }

        if (execution.getStatus() != BatchStatus.COMPLETED) {
            List<Throwable> failures = execution.getAllFailureExceptions();
            Throwable cause = failures.isEmpty() ? null : failures.get(0);
            if (cause instanceof DerivedMetricsException) {
                throw (DerivedMetricsException) cause;
            }
            throw new StoreOperationException(UsageRefreshBatchConfig.JOB_NAME + " ended with status "
                    + execution.getStatus() + (cause != null ? ": " + cause.getMessage() : ""), cause);
        }
        return execution;
    }
}
