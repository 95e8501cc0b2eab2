package za.co.analytics.pipeline.derived_metrics_batch.config;

import za.co.analytics.pipeline.derived_metrics_batch.model.FactActivity;
import za.co.analytics.pipeline.derived_metrics_batch.model.ProductSalesHistory;
import za.co.analytics.pipeline.derived_metrics_batch.model.ProductUsage;
import za.co.analytics.pipeline.derived_metrics_batch.model.UsageWindows;
import za.co.analytics.pipeline.derived_metrics_batch.processor.UsageAverageCalculator;
import za.co.analytics.pipeline.derived_metrics_batch.processor.UsageAverageProcessor;
import za.co.analytics.pipeline.derived_metrics_batch.reader.FactActivityRowMapper;
import za.co.analytics.pipeline.derived_metrics_batch.reader.ProductSalesHistoryReader;
import za.co.analytics.pipeline.derived_metrics_batch.repository.ProductUsageRepository;
import za.co.analytics.pipeline.derived_metrics_batch.tasklet.UsageSummaryCountTasklet;
import za.co.analytics.pipeline.derived_metrics_batch.writer.ProductUsageWriter;
import org.jspecify.annotations.Nullable;
import org.springframework.batch.core.configuration.annotation.EnableBatchProcessing;
import org.springframework.batch.core.configuration.annotation.EnableJdbcJobRepository;
import org.springframework.batch.core.configuration.annotation.StepScope;
import org.springframework.batch.core.job.Job;
import org.springframework.batch.core.job.builder.JobBuilder;
import org.springframework.batch.core.repository.JobRepository;
import org.springframework.batch.core.step.Step;
import org.springframework.batch.core.step.builder.StepBuilder;
import org.springframework.batch.infrastructure.item.database.JdbcCursorItemReader;
import org.springframework.batch.infrastructure.item.database.builder.JdbcCursorItemReaderBuilder;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

@Configuration
@EnableBatchProcessing
@EnableJdbcJobRepository(dataSourceRef = "batchDataSource", transactionManagerRef = "batchTransactionManager")
public class UsageRefreshBatchConfig {

    public static final String JOB_NAME = "usageRefreshJob";
    public static final String PARAM_PROCESSING_DATE = "processingDate";
    public static final String PARAM_REQUESTED_AT = "requestedAt";
    public static final String PARAM_PHARMACY_ID = "pharmacyId";
    public static final String PARAM_PRODUCT_ID = "productId";
    public static final String REFRESH_STEP_NAME = "usageRefreshStep";

    private static final String QUALIFYING_SALES_QUERY =
                    "SELECT " +
                    "f.pharmacy_id AS pharmacyId, f.product_id AS productId, " +
                    "f.business_date AS businessDate, f.qty_sold AS qtySold " +
                    "FROM pharma.fact_stock_activity f " +
                    "WHERE f.business_date BETWEEN ? AND ? " +
                    "AND f.qty_sold > 0 ";

    private static final String SINGLE_KEY_FILTER =
                    "AND f.pharmacy_id = ? AND f.product_id = ? ";

    private static final String KEY_ORDER =
                    "ORDER BY f.pharmacy_id, f.product_id, f.business_date";

    private final JobRepository jobRepository;
    private final PlatformTransactionManager transactionManager;
    private final DerivedMetricsProperties properties;

    public UsageRefreshBatchConfig(JobRepository jobRepository,
                                   @Qualifier("transactionManager") PlatformTransactionManager transactionManager,
                                   DerivedMetricsProperties properties) {
        this.jobRepository = jobRepository;
        this.transactionManager = transactionManager;
        this.properties = properties;
    }

    @Bean
    @StepScope
    public ProductSalesHistoryReader productSalesHistoryReader(
            @Qualifier("appDataSource") DataSource appDataSource,
            UsageWindows usageWindows,
            @Value("#{jobParameters['" + PARAM_PROCESSING_DATE + "']}") String processingDate,
            @Value("#{jobParameters['" + PARAM_PHARMACY_ID + "']}") @Nullable Long pharmacyId,
            @Value("#{jobParameters['" + PARAM_PRODUCT_ID + "']}") @Nullable Long productId
    ) {
        LocalDate today = LocalDate.parse(processingDate);
        List<Object> arguments = new ArrayList<>(List.of(usageWindows.lookbackStart(today), today));
        String sql = QUALIFYING_SALES_QUERY;
        if (pharmacyId != null && productId != null) {
            sql += SINGLE_KEY_FILTER;
            arguments.add(pharmacyId.intValue());
            arguments.add(productId);
        }

        JdbcCursorItemReader<FactActivity> cursorReader = new JdbcCursorItemReaderBuilder<FactActivity>()
                .name("factActivityReader")
                .dataSource(appDataSource)
                .sql(sql + KEY_ORDER)
                .rowMapper(new FactActivityRowMapper())
                .fetchSize(1000)
                .queryTimeout(Math.toIntExact(properties.usage().executionTimeout().toSeconds()))
                .queryArguments(arguments)
                .saveState(false)
                .build();

        return new ProductSalesHistoryReader(cursorReader);
    }

    @Bean
    public UsageAverageCalculator usageAverageCalculator(UsageWindows usageWindows) {
        return new UsageAverageCalculator(usageWindows);
    }

    @Bean
    @StepScope
    public UsageAverageProcessor usageAverageProcessor(
            UsageAverageCalculator usageAverageCalculator,
            Clock clock,
            @Value("#{jobParameters['" + PARAM_PROCESSING_DATE + "']}") String processingDate,
            @Value("#{jobParameters['" + PARAM_REQUESTED_AT + "']}") Long requestedAt
    ) {
        Instant deadline = Instant.ofEpochMilli(requestedAt).plus(properties.usage().executionTimeout());
        return new UsageAverageProcessor(usageAverageCalculator, LocalDate.parse(processingDate), deadline, clock);
    }

    @Bean
    public ProductUsageWriter productUsageWriter(
            @Qualifier("appDataSource") DataSource appDataSource,
            UsageWindows usageWindows
    ) {
        return new ProductUsageWriter(appDataSource, usageWindows);
    }

    @Bean
    public Step usageRefreshStep(
            ProductSalesHistoryReader productSalesHistoryReader,
            UsageAverageProcessor usageAverageProcessor,
            ProductUsageWriter productUsageWriter
    ) {
        return new StepBuilder(REFRESH_STEP_NAME, jobRepository)
                .<ProductSalesHistory, ProductUsage>chunk(properties.usage().chunkSize())
                .transactionManager(transactionManager)
                .reader(productSalesHistoryReader)
                .processor(usageAverageProcessor)
                .writer(productUsageWriter)
                .build();
    }

    @Bean
    public Step usageSummaryCountStep(ProductUsageRepository productUsageRepository) {
        return new StepBuilder("usageSummaryCountStep", jobRepository)
                .tasklet(new UsageSummaryCountTasklet(productUsageRepository, REFRESH_STEP_NAME), transactionManager)
                .build();
    }

    @Bean
    public Job usageRefreshJob(Step usageRefreshStep, Step usageSummaryCountStep) {
        return new JobBuilder(JOB_NAME, jobRepository)
                .start(usageRefreshStep)
                .next(usageSummaryCountStep)
                .build();
    }
}
