package za.co.analytics.pipeline.derived_metrics_batch.config;

import za.co.analytics.pipeline.derived_metrics_batch.model.UsageWindows;
import za.co.analytics.pipeline.derived_metrics_batch.runner.ReportPrinter;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(DerivedMetricsProperties.class)
public class DerivedMetricsConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public UsageWindows usageWindows(DerivedMetricsProperties properties) {
        return UsageWindows.ofDays(properties.usage().windows(), properties.usage().scale());
    }

    @Bean
    public ReportPrinter reportPrinter() {
        return new ReportPrinter(System.out);
    }
}
