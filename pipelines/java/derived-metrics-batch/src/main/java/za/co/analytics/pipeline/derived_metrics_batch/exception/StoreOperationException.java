package za.co.analytics.pipeline.derived_metrics_batch.exception;

/**
 * Thrown when a store operation fails midway: lost connection, timeout, constraint
 * violation or an aborted job. Never retried inside the pipeline.
 */
public class StoreOperationException extends DerivedMetricsException {

    public StoreOperationException(String message) {
        super(message);
    }

    public StoreOperationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public int getExitCode() {
        return 4;
    }
}
