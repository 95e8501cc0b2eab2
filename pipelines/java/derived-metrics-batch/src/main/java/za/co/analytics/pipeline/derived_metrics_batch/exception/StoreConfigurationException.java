package za.co.analytics.pipeline.derived_metrics_batch.exception;

/**
 * Thrown when the store location or its credentials are missing or invalid.
 */
public class StoreConfigurationException extends DerivedMetricsException {

    private final String property;

    public StoreConfigurationException(String property, String message) {
        super(message);
        this.property = property;
    }

    public String getProperty() {
        return property;
    }

    @Override
    public int getExitCode() {
        return 2;
    }
}
