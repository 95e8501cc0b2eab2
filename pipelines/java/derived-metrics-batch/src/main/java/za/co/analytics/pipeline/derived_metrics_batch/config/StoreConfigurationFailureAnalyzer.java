package za.co.analytics.pipeline.derived_metrics_batch.config;

import za.co.analytics.pipeline.derived_metrics_batch.exception.StoreConfigurationException;
import org.springframework.boot.diagnostics.AbstractFailureAnalyzer;
import org.springframework.boot.diagnostics.FailureAnalysis;

/**
 * Reports a missing or malformed store location as a startup failure with a fix hint
 * instead of a bean creation stack trace.
 */
public class StoreConfigurationFailureAnalyzer extends AbstractFailureAnalyzer<StoreConfigurationException> {

    @Override
    protected FailureAnalysis analyze(Throwable rootFailure, StoreConfigurationException cause) {
        return new FailureAnalysis(
                cause.getMessage(),
                "Export DATABASE_URL (and DATABASE_USERNAME / DATABASE_PASSWORD) or set '"
                        + cause.getProperty() + "' in application.yml.",
                cause);
    }
}
