package za.co.analytics.pipeline.derived_metrics_batch.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;
import java.util.List;

@ConfigurationProperties(prefix = "derived-metrics")
public record DerivedMetricsProperties(
        @DefaultValue Usage usage,
        @DefaultValue Coverage coverage,
        @DefaultValue Reconciliation reconciliation
) {

    /**
     * @param windows          trailing window lengths in days; the widest one is the lookback window
     * @param scale            fractional digits kept on every average
     * @param executionTimeout total time a recompute may take before it is aborted
     * @param chunkSize        summary rows merged per transaction
     */
    public record Usage(
            @DefaultValue({"30", "90", "180"}) List<Integer> windows,
            @DefaultValue("3") int scale,
            @DefaultValue("5m") Duration executionTimeout,
            @DefaultValue("500") int chunkSize
    ) {
    }

    public record Coverage(
            @DefaultValue("30") int defaultDaysBack
    ) {
    }

    public record Reconciliation(
            @DefaultValue("5") int problematicLimit
    ) {
    }
}
