package za.co.analytics.pipeline.derived_metrics_batch.exception;

import org.springframework.boot.ExitCodeGenerator;

/**
 * Base type for every failure raised by the derived metrics pipelines.
 * Each subtype maps to its own non-zero process exit status.
 */
public abstract class DerivedMetricsException extends RuntimeException implements ExitCodeGenerator {

    protected DerivedMetricsException(String message) {
        super(message);
    }

    protected DerivedMetricsException(String message, Throwable cause) {
        super(message, cause);
    }
}
