package za.co.analytics.pipeline.derived_metrics_batch.exception;

/**
 * Thrown when a requested entity (product, pharmacy) does not exist in the store.
 */
public class DataUnavailableException extends DerivedMetricsException {

    public DataUnavailableException(String entityType, String entityId) {
        super(String.format("%s %s not found", entityType, entityId));
    }

    @Override
    public int getExitCode() {
        return 3;
    }
}
