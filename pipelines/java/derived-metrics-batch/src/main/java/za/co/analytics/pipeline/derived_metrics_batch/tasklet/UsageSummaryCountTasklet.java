package za.co.analytics.pipeline.derived_metrics_batch.tasklet;

import za.co.analytics.pipeline.derived_metrics_batch.repository.ProductUsageRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.core.job.JobExecution;
import org.springframework.batch.core.scope.context.ChunkContext;
import org.springframework.batch.core.step.StepContribution;
import org.springframework.batch.core.step.StepExecution;
import org.springframework.batch.core.step.tasklet.Tasklet;
import org.springframework.batch.infrastructure.repeat.RepeatStatus;

/**
 * Counts the summary rows present after the merge step and publishes the figure in
 * the job execution context under {@link #SUMMARY_ROW_COUNT_KEY}. Also reports how
 * many keys the merge step read, skipped for lack of qualifying sales, and wrote.
 */
public class UsageSummaryCountTasklet implements Tasklet {

    public static final String SUMMARY_ROW_COUNT_KEY = "summaryRowCount";

    private static final Logger log = LoggerFactory.getLogger(UsageSummaryCountTasklet.class);

    private final ProductUsageRepository productUsageRepository;
    private final String mergeStepName;

    public UsageSummaryCountTasklet(ProductUsageRepository productUsageRepository, String mergeStepName) {
        this.productUsageRepository = productUsageRepository;
        this.mergeStepName = mergeStepName;
    }

    @Override
    public RepeatStatus execute(StepContribution contribution, ChunkContext chunkContext) throws Exception {
        JobExecution jobExecution = chunkContext.getStepContext().getStepExecution().getJobExecution();

        for (StepExecution stepExecution : jobExecution.getStepExecutions()) {
            if (mergeStepName.equals(stepExecution.getStepName())) {
                log.info("Usage merge: {} keys read, {} without qualifying sales, {} summaries written",
                        stepExecution.getReadCount(), stepExecution.getFilterCount(), stepExecution.getWriteCount());
            }
        }

        long summaryRows = productUsageRepository.countAll();
        jobExecution.getExecutionContext().putLong(SUMMARY_ROW_COUNT_KEY, summaryRows);

        log.info("{} product usage records present after refresh", summaryRows);
        return RepeatStatus.FINISHED;
    }
}
