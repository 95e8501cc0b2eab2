package za.co.analytics.pipeline.derived_metrics_batch.config;

import za.co.analytics.pipeline.derived_metrics_batch.exception.StoreConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.diagnostics.FailureAnalysis;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("StoreConfigurationFailureAnalyzer Unit Tests")
class StoreConfigurationFailureAnalyzerTest {

    @Test
    @DisplayName("analyze - wrapped configuration error yields a fix hint naming the property")
    void analyze_WrappedCause() {
        StoreConfigurationException cause = new StoreConfigurationException(
                DataSourceConfig.URL_PROPERTY, "No store location configured");

        FailureAnalysis analysis = new StoreConfigurationFailureAnalyzer()
                .analyze(new IllegalStateException("bean creation failed", cause));

        assertThat(analysis).isNotNull();
        assertThat(analysis.getDescription()).isEqualTo("No store location configured");
        assertThat(analysis.getAction()).contains("DATABASE_URL").contains(DataSourceConfig.URL_PROPERTY);
    }

    @Test
    @DisplayName("analyze - unrelated failures are left alone")
    void analyze_UnrelatedFailure() {
        assertThat(new StoreConfigurationFailureAnalyzer().analyze(new IllegalStateException("boom"))).isNull();
    }
}
